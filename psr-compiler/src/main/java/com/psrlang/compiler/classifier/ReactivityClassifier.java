package com.psrlang.compiler.classifier;

import com.psrlang.compiler.analysis.AstWalker;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.expr.*;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 响应式分类：决定 JSX 属性和子表达式按哪种方式发射
 *
 * <p>规则按顺序匹配：JSX、列表映射、条件、事件属性、调用表达式，其余为静态。
 * 嵌套函数之外的任何调用都可能读取信号（例如经 props 传入的 getter），因此都是动态的；
 * 已知的信号访问器名称记为依赖。没有类型检查器，可空性只参考信号的声明类型。</p>
 */
public final class ReactivityClassifier {

    private static final Set<String> NULLISH_TYPES = new HashSet<String>(
            Arrays.asList("null", "undefined", "void", "any", "unknown", "never"));

    public Classification classify(Expression expression, ClassificationContext context) {
        Expression expr = unwrapParens(expression);
        List<String> deps = new ArrayList<String>();
        boolean calls = scanCalls(expr, context, deps);
        boolean nullable = isNullable(expr, context);
        Complexity complexity = Complexity.ofNodeCount(AstWalker.countNodes(expr));

        if (AstWalker.isJsx(expr)) {
            return new Classification(Category.STATIC, deps, false, complexity, "JSX element");
        }
        if (isListMapping(expr)) {
            String method = ((MemberExpr) ((CallExpr) expr).getCallee()).getProperty();
            return new Classification(Category.LOOP, deps, nullable, complexity, "List rendering with ." + method + "()");
        }
        if (isConditional(expr)) {
            boolean jsxBranches = AstWalker.containsJsx(expr, false);
            if (calls || jsxBranches) {
                String reason;
                if (!deps.isEmpty()) {
                    reason = "Conditional reading signals " + deps;
                } else if (calls) {
                    reason = "Conditional with call expressions";
                } else {
                    reason = "Conditional with JSX branches";
                }
                return new Classification(Category.CONDITIONAL, deps, nullable, complexity, reason);
            }
        }
        if (calls) {
            return new Classification(Category.DYNAMIC, deps, nullable, complexity,
                    deps.isEmpty() ? "Calls a function" : "Reads signals " + deps);
        }
        return new Classification(Category.STATIC, deps, nullable, complexity, "No signal reads");
    }

    /**
     * 属性分类；value 为 null 表示布尔属性
     */
    public Classification classifyAttribute(String name, Expression value, ClassificationContext context) {
        if (DomEvents.isEventAttribute(name)) {
            List<String> deps = new ArrayList<String>();
            int nodes = value != null ? AstWalker.countNodes(value) : 0;
            return new Classification(Category.EVENT, deps, false, Complexity.ofNodeCount(nodes),
                    "Event handler for '" + DomEvents.eventName(name) + "'");
        }
        if (value == null) {
            List<String> deps = new ArrayList<String>();
            return new Classification(Category.STATIC, deps, false, Complexity.LOW, "Boolean attribute");
        }
        return classify(value, context);
    }

    // ============ 规则 ============

    private static Expression unwrapParens(Expression expr) {
        while (expr instanceof ParenExpr) {
            expr = ((ParenExpr) expr).getExpression();
        }
        return expr;
    }

    static boolean isListMapping(Expression expr) {
        if (!(expr instanceof CallExpr)) return false;
        Expression callee = ((CallExpr) expr).getCallee();
        if (!(callee instanceof MemberExpr)) return false;
        String property = ((MemberExpr) callee).getProperty();
        return "map".equals(property) || "flatMap".equals(property);
    }

    static boolean isConditional(Expression expr) {
        return expr instanceof ConditionalExpr
                || (expr instanceof BinaryExpr && ((BinaryExpr) expr).getOperator().isLogical());
    }

    /**
     * 把读取的信号访问器收集到 out，返回是否存在任何调用；
     * 不进入嵌套函数（延迟执行）和 JSX（由元素自身处理）
     */
    private static boolean scanCalls(final Expression root, final ClassificationContext context, List<String> out) {
        final Set<String> deps = new LinkedHashSet<String>();
        final boolean[] calls = new boolean[1];
        AstWalker.walk(root, new AstWalker.NodeFilter() {
            @Override
            public boolean enter(AstNode node) {
                if (node != root && (AstWalker.isFunctionBoundary(node) || AstWalker.isJsx(node))) {
                    return false;
                }
                if (node instanceof TypeNode) {
                    return false;
                }
                if (node instanceof CallExpr) {
                    calls[0] = true;
                    String callee = ((CallExpr) node).getCalleeName();
                    if (callee != null && context.isSignalAccessor(callee)) {
                        deps.add(callee);
                    }
                }
                return true;
            }
        });
        out.addAll(deps);
        return calls[0];
    }

    /**
     * 字面量（null 除外）、模板字符串、JSX、非逻辑二元运算和算术一元运算的结果不为空；
     * 读取声明类型不含 null/undefined 的信号也不为空，其余一律视为可空
     */
    static boolean isNullable(Expression expr, ClassificationContext context) {
        if (expr instanceof CallExpr && ((CallExpr) expr).getArguments().isEmpty()) {
            String callee = ((CallExpr) expr).getCalleeName();
            if (callee != null && context.isSignalAccessor(callee)) {
                return !isNonNullType(context.getSignals().getValueType(callee));
            }
            if (callee != null) {
                return !isNonNullType(returnType(context.typeOf(callee)));
            }
        }
        if (expr instanceof Identifier) {
            return !isNonNullType(context.typeOf(((Identifier) expr).getName()));
        }
        if (expr instanceof Literal) {
            return ((Literal) expr).getKind() == Literal.LiteralKind.NULL;
        }
        if (expr instanceof TemplateLiteral || AstWalker.isJsx(expr)) {
            return false;
        }
        if (expr instanceof BinaryExpr) {
            return ((BinaryExpr) expr).getOperator().isLogical();
        }
        if (expr instanceof UnaryExpr) {
            String op = ((UnaryExpr) expr).getOperator();
            return !(op.equals("+") || op.equals("-") || op.equals("!") || op.equals("~") || op.equals("typeof"));
        }
        return true;
    }

    /** 无参函数类型 {@code () => T} 的返回类型，其他形式返回 null */
    static String returnType(String functionType) {
        if (functionType == null) return null;
        String t = functionType.trim();
        if (!t.startsWith("()")) return null;
        t = t.substring(2).trim();
        return t.startsWith("=>") ? t.substring(2).trim() : null;
    }

    /** 联合类型的每一项都不是 null、undefined 或不确定的类型 */
    static boolean isNonNullType(String type) {
        if (type == null || type.trim().isEmpty()) return false;
        for (String part : type.split("\\|")) {
            String t = part.trim();
            if (t.isEmpty() || NULLISH_TYPES.contains(t)) {
                return false;
            }
        }
        return true;
    }
}
