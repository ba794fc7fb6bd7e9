package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.decl.ImportDecl;
import com.psrlang.compiler.ast.decl.ImportSpecifier;
import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.ast.decl.VariableDeclarator;
import com.psrlang.compiler.ast.expr.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 收集信号访问器
 *
 * <p>由信号创建函数初始化的绑定：数组解构的第一个元素是 getter，第二个是 setter；
 * 普通标识符绑定本身就是访问器。访问器按名称识别，被同名局部变量遮蔽时仍视为信号。</p>
 */
public final class SignalCollector {

    private static final Logger LOG = Logger.getLogger(SignalCollector.class.getName());

    public static final Set<String> DEFAULT_CREATORS = Collections.unmodifiableSet(new LinkedHashSet<String>(
            Arrays.asList("signal", "createSignal", "useState", "createMemo",
                    "createComputed", "createResource", "createEffect")));

    private final List<String> runtimeModules;

    public SignalCollector(List<String> runtimeModules) {
        this.runtimeModules = runtimeModules;
    }

    public SignalInfo collect(Program program, final SymbolTable table) {
        final Set<String> creators = new LinkedHashSet<String>(DEFAULT_CREATORS);
        for (AstNode statement : program.getBody()) {
            if (statement instanceof ImportDecl) {
                collectAliases((ImportDecl) statement, creators);
            }
        }

        final Set<String> accessors = new LinkedHashSet<String>();
        final Set<String> setters = new LinkedHashSet<String>();
        final Map<String, String> valueTypes = new LinkedHashMap<String, String>();
        AstWalker.walk(program, new AstWalker.NodeFilter() {
            @Override
            public boolean enter(AstNode node) {
                if (node instanceof VariableDeclarator) {
                    VariableDeclarator declarator = (VariableDeclarator) node;
                    if (isCreatorCall(declarator.getInit(), creators)) {
                        bind(declarator, table, accessors, setters, valueTypes);
                    }
                }
                return true;
            }
        });

        if (!accessors.isEmpty()) {
            LOG.fine("Signal accessors: " + accessors);
        }
        return new SignalInfo(accessors, setters, creators, valueTypes);
    }

    /** import { createSignal as cs } from '<runtime>' 使 cs 成为创建函数 */
    private void collectAliases(ImportDecl decl, Set<String> creators) {
        if (!isRuntimeModule(decl.getSource()) || decl.isTypeOnly()) {
            return;
        }
        for (ImportSpecifier specifier : decl.getSpecifiers()) {
            if (!specifier.isTypeOnly() && DEFAULT_CREATORS.contains(specifier.getImported())) {
                creators.add(specifier.getLocal());
            }
        }
    }

    public boolean isRuntimeModule(String source) {
        if (source == null) return false;
        for (String module : runtimeModules) {
            if (source.equals(module) || source.startsWith(module + "/")) {
                return true;
            }
        }
        return false;
    }

    static boolean isCreatorCall(Expression init, Set<String> creators) {
        Expression expr = unwrap(init);
        if (!(expr instanceof CallExpr)) return false;
        String callee = ((CallExpr) expr).getCalleeName();
        return callee != null && creators.contains(callee);
    }

    private static Expression unwrap(Expression expr) {
        while (true) {
            if (expr instanceof ParenExpr) {
                expr = ((ParenExpr) expr).getExpression();
            } else if (expr instanceof TypeAssertionExpr) {
                expr = ((TypeAssertionExpr) expr).getExpression();
            } else if (expr instanceof NonNullExpr) {
                expr = ((NonNullExpr) expr).getExpression();
            } else if (expr instanceof AwaitExpr) {
                expr = ((AwaitExpr) expr).getArgument();
            } else {
                return expr;
            }
        }
    }

    private static void bind(VariableDeclarator declarator, SymbolTable table,
                             Set<String> accessors, Set<String> setters, Map<String, String> valueTypes) {
        Expression target = declarator.getTarget();
        String valueType = valueType((CallExpr) unwrap(declarator.getInit()));
        if (target instanceof Identifier) {
            String name = ((Identifier) target).getName();
            accessors.add(name);
            markSignal(table, name, declarator, valueType);
            putValueType(valueTypes, name, valueType);
        } else if (target instanceof ArrayLiteral) {
            List<Expression> elements = ((ArrayLiteral) target).getElements();
            if (!elements.isEmpty()) {
                boolean simple = elements.get(0) instanceof Identifier;
                for (Identifier id : Patterns.boundIdentifiers(elements.get(0))) {
                    accessors.add(id.getName());
                    markSignal(table, id.getName(), declarator, simple ? valueType : null);
                    if (simple) {
                        putValueType(valueTypes, id.getName(), valueType);
                    }
                }
            }
            if (elements.size() > 1) {
                setters.addAll(Patterns.boundNames(elements.get(1)));
            }
        }
    }

    /** createSignal<number>(...) 取类型实参，否则按第一个实参推断；实参为计算函数时无法推断 */
    static String valueType(CallExpr creation) {
        if (!creation.getTypeArgs().isEmpty()) {
            return creation.getTypeArgs().get(0).getText();
        }
        if (creation.getArguments().isEmpty()) {
            return null;
        }
        Expression first = creation.getArguments().get(0);
        if (first instanceof ArrowFunction || first instanceof FunctionExpr) {
            return null;
        }
        return ScopeBuilder.inferType(first);
    }

    /** 同名访问器的类型不一致时不记录 */
    private static void putValueType(Map<String, String> valueTypes, String name, String type) {
        if (valueTypes.containsKey(name) && !equal(valueTypes.get(name), type)) {
            valueTypes.put(name, null);
        } else {
            valueTypes.put(name, type);
        }
    }

    private static boolean equal(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    private static void markSignal(SymbolTable table, String name, VariableDeclarator declarator, String valueType) {
        if (table == null) return;
        for (Symbol symbol : table.lookupAll(name)) {
            if (symbol.getDeclaration() == declarator) {
                symbol.setSignal(true);
                if (valueType != null && symbol.getInferredType() == null) {
                    symbol.setInferredType("() => " + valueType);
                }
            }
        }
    }
}
