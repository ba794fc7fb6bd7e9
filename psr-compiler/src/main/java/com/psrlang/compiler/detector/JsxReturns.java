package com.psrlang.compiler.detector;

import com.psrlang.compiler.analysis.AstWalker;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.NonNullExpr;
import com.psrlang.compiler.ast.expr.ParenExpr;
import com.psrlang.compiler.ast.expr.TypeAssertionExpr;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 检测策略共用的函数体查询
 */
final class JsxReturns {

    private JsxReturns() {
    }

    /** 去掉括号、as/satisfies 断言和非空断言 */
    static Expression unwrap(Expression expr) {
        while (true) {
            if (expr instanceof ParenExpr) {
                expr = ((ParenExpr) expr).getExpression();
            } else if (expr instanceof TypeAssertionExpr) {
                expr = ((TypeAssertionExpr) expr).getExpression();
            } else if (expr instanceof NonNullExpr) {
                expr = ((NonNullExpr) expr).getExpression();
            } else {
                return expr;
            }
        }
    }

    static boolean isJsx(Expression expr) {
        return AstWalker.isJsx(unwrap(expr));
    }

    /** 函数体的顶层语句，表达式体或没有函数体时为空 */
    static List<Statement> statements(FunctionLike function) {
        AstNode body = function.getBody();
        if (body instanceof Block) {
            return ((Block) body).getStatements();
        }
        return Collections.<Statement>emptyList();
    }

    /** 箭头函数的表达式体，否则为 null */
    static Expression expressionBody(FunctionLike function) {
        AstNode body = function.getBody();
        return body instanceof Expression ? (Expression) body : null;
    }

    /** 表达式中是否有 JSX，不进入嵌套函数 */
    static boolean containsJsx(AstNode node) {
        return node != null && AstWalker.containsJsx(node, false);
    }
}
