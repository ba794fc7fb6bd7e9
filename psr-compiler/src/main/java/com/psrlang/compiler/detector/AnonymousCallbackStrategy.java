package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.expr.*;

/**
 * 作为实参、数组元素或对象属性值的匿名箭头函数不是组件定义
 */
public final class AnonymousCallbackStrategy implements SuppressionStrategy {

    @Override
    public String getName() {
        return "AnonymousCallback";
    }

    @Override
    public int getPriority() {
        return 0;
    }

    @Override
    public boolean suppresses(FunctionLike function, DetectionContext context) {
        if (!(function instanceof ArrowFunction)) {
            return false;
        }
        AstNode node = (AstNode) function;
        AstNode parent = context.getParent(node);
        while (parent instanceof ParenExpr) {
            parent = context.getParent(parent);
        }
        if (parent instanceof CallExpr) {
            // 立即调用的箭头函数是被调用者而不是回调
            return JsxReturns.unwrap(((CallExpr) parent).getCallee()) != node;
        }
        return parent instanceof NewExpr
                || parent instanceof ArrayLiteral
                || parent instanceof ObjectProperty;
    }

    @Override
    public String getReason() {
        return "Anonymous arrow function used as a callback argument";
    }
}
