package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.decl.*;
import com.psrlang.compiler.ast.expr.*;
import com.psrlang.compiler.ast.jsx.JsxElement;
import com.psrlang.compiler.ast.jsx.JsxFragment;
import com.psrlang.compiler.ast.stmt.*;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.lexer.Lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 作用域构建：遍历 AST，为函数、组件、类和块建立作用域并登记声明
 *
 * <p>函数体与函数共用一个作用域；顶层声明登记在 MODULE 作用域中，
 * 后续阶段在整棵树构建完成后再解析名称，因此声明顺序不影响解析结果。
 * 遍历中记录的标识符引用也在构建完成后统一解析，被引用的符号标记为已使用。</p>
 */
public final class ScopeBuilder {

    private static final Logger LOG = Logger.getLogger(ScopeBuilder.class.getName());

    private final SymbolTable table = new SymbolTable();
    private final List<Reference> references = new ArrayList<Reference>();
    private Scope current;

    /**
     * 值位置上的名称引用及其所在作用域
     */
    private static final class Reference {
        final Scope scope;
        final String name;

        Reference(Scope scope, String name) {
            this.scope = scope;
            this.name = name;
        }
    }

    public SymbolTable build(Program program) {
        current = table.getGlobalScope();
        enter(Scope.ScopeType.MODULE, program);
        visitStatements(program.getBody());
        exit();
        markUsed();
        LOG.fine("Scopes built for " + program.getLocation().getFile());
        return table;
    }

    private void markUsed() {
        int resolved = 0;
        for (Reference reference : references) {
            Symbol symbol = reference.scope.resolve(reference.name);
            if (symbol != null) {
                symbol.markUsed();
                resolved++;
            }
        }
        LOG.finer("Resolved " + resolved + " of " + references.size() + " reference(s)");
        references.clear();
    }

    private void reference(String name) {
        references.add(new Reference(current, name));
    }

    // ============ 作用域管理 ============

    private Scope enter(Scope.ScopeType type, AstNode node) {
        Scope scope = new Scope(type, current, node);
        current.addChild(scope);
        table.mapNodeToScope(node, scope);
        current = scope;
        return scope;
    }

    private void exit() {
        current = current.getParent();
    }

    private Symbol define(String name, SymbolKind kind, AstNode declaration) {
        if (name == null) return null;
        return table.define(current, new Symbol(name, kind, declaration.getLocation(), declaration));
    }

    // ============ 遍历 ============

    private void visitStatements(List<? extends AstNode> statements) {
        if (statements == null) return;
        for (AstNode statement : statements) {
            visit(statement);
        }
    }

    private void visitChildren(AstNode node) {
        for (AstNode child : node.getChildren()) {
            visit(child);
        }
    }

    private void visitChildrenExcept(AstNode node, AstNode skipped) {
        for (AstNode child : node.getChildren()) {
            if (child != skipped) visit(child);
        }
    }

    private void visit(AstNode node) {
        if (node == null) return;

        if (node instanceof Identifier) {
            reference(((Identifier) node).getName());
        } else if (node instanceof ImportDecl) {
            visitImport((ImportDecl) node);
        } else if (node instanceof ExportDecl && ((ExportDecl) node).getSource() == null) {
            ExportDecl export = (ExportDecl) node;
            for (ExportSpecifier specifier : export.getSpecifiers()) {
                reference(specifier.getLocal());
            }
            visit(export.getDeclaration());
            visit(export.getExpression());
        } else if (node instanceof ObjectProperty) {
            ObjectProperty property = (ObjectProperty) node;
            if (property.isComputed()) visit(property.getKey());
            visit(property.getValue());
        } else if (node instanceof MethodMember) {
            MethodMember method = (MethodMember) node;
            if (method.isComputed()) visit(method.getKey());
            visitChildrenExcept(method, method.getKey());
        } else if (node instanceof PropertyMember) {
            PropertyMember property = (PropertyMember) node;
            if (property.isComputed()) visit(property.getKey());
            visitChildrenExcept(property, property.getKey());
        } else if (node instanceof JsxElement) {
            JsxElement element = (JsxElement) node;
            if (element.isComponentTag()) {
                String tag = element.getTagName();
                int dot = tag.indexOf('.');
                reference(dot >= 0 ? tag.substring(0, dot) : tag);
            }
            visitChildren(element);
        } else if (node instanceof VariableDecl) {
            visitVariableDecl((VariableDecl) node);
        } else if (node instanceof ComponentDecl) {
            ComponentDecl component = (ComponentDecl) node;
            define(component.getName(), SymbolKind.COMPONENT, component);
            enter(Scope.ScopeType.COMPONENT, component);
            defineParams(component.getParams());
            visitStatements(component.getBody().getStatements());
            exit();
        } else if (node instanceof FunctionDecl) {
            FunctionDecl function = (FunctionDecl) node;
            define(function.getName(), SymbolKind.FUNCTION, function);
            enter(Scope.ScopeType.FUNCTION, function);
            defineParams(function.getParams());
            if (function.getBody() != null) {
                visitStatements(function.getBody().getStatements());
            }
            exit();
        } else if (node instanceof FunctionExpr) {
            FunctionExpr function = (FunctionExpr) node;
            enter(Scope.ScopeType.FUNCTION, function);
            // 具名函数表达式的名称只在自身内部可见
            define(function.getName(), SymbolKind.FUNCTION, function);
            defineParams(function.getParams());
            if (function.getBody() != null) {
                visitStatements(function.getBody().getStatements());
            }
            exit();
        } else if (node instanceof ArrowFunction) {
            ArrowFunction arrow = (ArrowFunction) node;
            enter(Scope.ScopeType.FUNCTION, arrow);
            defineParams(arrow.getParams());
            if (arrow.getBody() instanceof Block) {
                visitStatements(((Block) arrow.getBody()).getStatements());
            } else {
                visit(arrow.getBody());
            }
            exit();
        } else if (node instanceof ClassDecl) {
            ClassDecl cls = (ClassDecl) node;
            define(cls.getName(), SymbolKind.CLASS, cls);
            visitClassBody(cls);
        } else if (node instanceof ClassExpr) {
            ClassDecl cls = ((ClassExpr) node).getDeclaration();
            visit(cls.getSuperClass());
            enter(Scope.ScopeType.CLASS, cls);
            define(cls.getName(), SymbolKind.CLASS, cls);
            visitStatements(cls.getMembers());
            exit();
        } else if (node instanceof InterfaceDecl) {
            define(((InterfaceDecl) node).getName(), SymbolKind.INTERFACE, node);
        } else if (node instanceof TypeAliasDecl) {
            define(((TypeAliasDecl) node).getName(), SymbolKind.TYPE_ALIAS, node);
        } else if (node instanceof EnumDecl) {
            define(((EnumDecl) node).getName(), SymbolKind.ENUM, node);
        } else if (node instanceof NamespaceDecl) {
            NamespaceDecl ns = (NamespaceDecl) node;
            if (Lexer.isIdentifier(ns.getName())) {
                define(ns.getName(), SymbolKind.NAMESPACE, ns);
            }
        } else if (node instanceof Block) {
            enter(Scope.ScopeType.BLOCK, node);
            visitStatements(((Block) node).getStatements());
            exit();
        } else if (node instanceof ForStmt || node instanceof ForInStmt) {
            enter(Scope.ScopeType.BLOCK, node);
            visitChildren(node);
            exit();
        } else if (node instanceof CatchClause) {
            CatchClause clause = (CatchClause) node;
            enter(Scope.ScopeType.BLOCK, clause);
            if (clause.getParam() != null) {
                for (Identifier id : Patterns.boundIdentifiers(clause.getParam())) {
                    define(id.getName(), SymbolKind.VARIABLE, id);
                }
            }
            visitStatements(clause.getBody().getStatements());
            exit();
        } else if (node instanceof TypeNode) {
            // 类型不引入值绑定
        } else {
            visitChildren(node);
        }
    }

    private void visitImport(ImportDecl node) {
        if (node.getDefaultBinding() != null) {
            define(node.getDefaultBinding(), SymbolKind.IMPORT, node);
        }
        if (node.getNamespaceBinding() != null) {
            define(node.getNamespaceBinding(), SymbolKind.IMPORT, node);
        }
        for (ImportSpecifier specifier : node.getSpecifiers()) {
            Symbol symbol = define(specifier.getLocal(), SymbolKind.IMPORT, specifier);
            if (symbol != null) {
                symbol.setInferredType(node.getSource());
            }
        }
    }

    private void visitVariableDecl(VariableDecl node) {
        SymbolKind kind = node.isConst() ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
        for (VariableDeclarator declarator : node.getDeclarators()) {
            String inferred = declarator.getType() != null
                    ? declarator.getType().getText()
                    : inferType(declarator.getInit());
            boolean simple = declarator.getTarget() instanceof Identifier;
            for (Identifier id : Patterns.boundIdentifiers(declarator.getTarget())) {
                Symbol symbol = define(id.getName(), kind, declarator);
                if (symbol != null && simple) {
                    symbol.setInferredType(inferred);
                }
            }
            visitStatements(Patterns.defaultValues(declarator.getTarget()));
            visit(declarator.getInit());
        }
    }

    private void defineParams(List<Parameter> params) {
        for (Parameter param : params) {
            for (Identifier id : Patterns.boundIdentifiers(param.getPattern())) {
                Symbol symbol = define(id.getName(), SymbolKind.PARAMETER, param);
                if (symbol != null && param.getType() != null && param.getPattern() instanceof Identifier) {
                    symbol.setInferredType(param.getType().getText());
                }
            }
            visitStatements(Patterns.defaultValues(param.getPattern()));
            visit(param.getInitializer());
            visitStatements(param.getDecorators());
        }
    }

    private void visitClassBody(ClassDecl cls) {
        visitStatements(cls.getDecorators());
        visit(cls.getSuperClass());
        enter(Scope.ScopeType.CLASS, cls);
        visitStatements(cls.getMembers());
        exit();
    }

    /** 由初始值推断的类型名，无法判断时为 null */
    static String inferType(Expression init) {
        if (init == null) return null;
        if (init instanceof Literal) {
            switch (((Literal) init).getKind()) {
                case NUMBER: return "number";
                case BIGINT: return "bigint";
                case STRING: return "string";
                case BOOLEAN: return "boolean";
                case NULL: return "null";
                case REGEX: return "RegExp";
                default: return null;
            }
        }
        if (init instanceof TemplateLiteral) return "string";
        if (init instanceof JsxElement || init instanceof JsxFragment) return "HTMLElement";
        if (init instanceof ArrowFunction || init instanceof FunctionExpr) return "Function";
        if (init instanceof ArrayLiteral) return "any[]";
        if (init instanceof ObjectLiteral) return "object";
        if (init instanceof NewExpr && ((NewExpr) init).getCallee() instanceof Identifier) {
            return ((Identifier) ((NewExpr) init).getCallee()).getName();
        }
        return null;
    }
}
