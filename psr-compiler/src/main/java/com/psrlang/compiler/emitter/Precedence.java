package com.psrlang.compiler.emitter;

import com.psrlang.compiler.ast.expr.*;
import com.psrlang.compiler.ir.expr.ArrowFunctionIR;
import com.psrlang.compiler.ir.expr.CallIR;
import com.psrlang.compiler.ir.expr.RegistryExecuteIR;
import com.psrlang.compiler.ir.jsx.ComponentCallIR;
import com.psrlang.compiler.ir.jsx.ElementIR;
import com.psrlang.compiler.ir.jsx.ExpressionChildIR;
import com.psrlang.compiler.ir.jsx.FragmentIR;

/**
 * 表达式优先级，数值越大结合越紧
 *
 * <p>二元运算符的优先级为 {@link BinaryExpr.BinaryOp#getPrecedence()} 加上 {@link #BINARY_BASE}。</p>
 */
final class Precedence {

    static final int SEQUENCE = 0;
    static final int ASSIGNMENT = 1;
    static final int CONDITIONAL = 2;
    static final int BINARY_BASE = 2;
    /** as / satisfies 与关系运算符同级 */
    static final int ASSERTION = BINARY_BASE + 7;
    static final int UNARY = 14;
    static final int POSTFIX = 15;
    static final int CALL = 16;
    static final int PRIMARY = 17;

    private Precedence() {
    }

    static int of(Expression expr) {
        if (expr instanceof SequenceExpr) return SEQUENCE;
        if (expr instanceof AssignExpr || expr instanceof ArrowFunction || expr instanceof ArrowFunctionIR
                || expr instanceof YieldExpr || expr instanceof SpreadElement) {
            return ASSIGNMENT;
        }
        if (expr instanceof ConditionalExpr) return CONDITIONAL;
        if (expr instanceof BinaryExpr) return binary(((BinaryExpr) expr).getOperator());
        if (expr instanceof TypeAssertionExpr) return ASSERTION;
        if (expr instanceof UnaryExpr || expr instanceof AwaitExpr) return UNARY;
        if (expr instanceof UpdateExpr) return ((UpdateExpr) expr).isPrefix() ? UNARY : POSTFIX;
        if (expr instanceof CallExpr || expr instanceof CallIR || expr instanceof RegistryExecuteIR
                || expr instanceof NewExpr
                || expr instanceof MemberExpr || expr instanceof IndexExpr || expr instanceof NonNullExpr
                || expr instanceof TaggedTemplateExpr || expr instanceof MetaProperty
                || expr instanceof ComponentCallIR || expr instanceof ElementIR || expr instanceof FragmentIR) {
            return CALL;
        }
        if (expr instanceof ExpressionChildIR) return of(((ExpressionChildIR) expr).getExpression());
        return PRIMARY;
    }

    static int binary(BinaryExpr.BinaryOp op) {
        return BINARY_BASE + op.getPrecedence();
    }

    /**
     * 表达式最左侧的子表达式，用于判断语句或箭头函数体是否以 { / function / class 开头
     */
    static Expression leftmost(Expression expr) {
        Expression current = expr;
        while (true) {
            Expression next = null;
            if (current instanceof BinaryExpr) next = ((BinaryExpr) current).getLeft();
            else if (current instanceof CallExpr) next = ((CallExpr) current).getCallee();
            else if (current instanceof CallIR) next = ((CallIR) current).getCallee();
            else if (current instanceof MemberExpr) next = ((MemberExpr) current).getObject();
            else if (current instanceof IndexExpr) next = ((IndexExpr) current).getObject();
            else if (current instanceof AssignExpr) next = ((AssignExpr) current).getTarget();
            else if (current instanceof ConditionalExpr) next = ((ConditionalExpr) current).getCondition();
            else if (current instanceof SequenceExpr) next = ((SequenceExpr) current).getExpressions().get(0);
            else if (current instanceof TaggedTemplateExpr) next = ((TaggedTemplateExpr) current).getTag();
            else if (current instanceof NonNullExpr) next = ((NonNullExpr) current).getExpression();
            else if (current instanceof TypeAssertionExpr) next = ((TypeAssertionExpr) current).getExpression();
            else if (current instanceof UpdateExpr && !((UpdateExpr) current).isPrefix()) {
                next = ((UpdateExpr) current).getOperand();
            }
            if (next == null) return current;
            current = next;
        }
    }
}
