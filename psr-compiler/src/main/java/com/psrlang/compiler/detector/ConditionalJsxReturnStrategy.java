package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.expr.BinaryExpr;
import com.psrlang.compiler.ast.expr.ConditionalExpr;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.stmt.*;

/**
 * 条件返回 JSX：?:、&amp;&amp;、||，或 if/switch 分支中返回 JSX
 */
public final class ConditionalJsxReturnStrategy implements DetectionStrategy {

    @Override
    public String getName() {
        return "ConditionalJsxReturn";
    }

    @Override
    public int getPriority() {
        return 2;
    }

    @Override
    public DetectionResult detect(FunctionLike function, DetectionContext context) {
        Expression body = JsxReturns.expressionBody(function);
        boolean matched;
        if (body != null) {
            matched = isConditionalJsx(body);
        } else {
            matched = false;
            for (Statement statement : JsxReturns.statements(function)) {
                if (statement instanceof ReturnStmt && isConditionalJsx(((ReturnStmt) statement).getValue())) {
                    matched = true;
                } else if (statement instanceof IfStmt || statement instanceof SwitchStmt) {
                    matched = returnsJsx(statement);
                }
                if (matched) break;
            }
        }
        if (!matched) {
            return DetectionResult.negative(getName(), "No conditional JSX return");
        }
        return DetectionResult.positive(getName(), Confidence.HIGH,
                "Function has a conditional JSX return", context.nameOf(function));
    }

    private static boolean isConditionalJsx(Expression expr) {
        Expression unwrapped = JsxReturns.unwrap(expr);
        return (unwrapped instanceof ConditionalExpr || unwrapped instanceof BinaryExpr)
                && JsxReturns.containsJsx(unwrapped);
    }

    /** 分支中是否有返回 JSX 的 return 语句 */
    private static boolean returnsJsx(Statement statement) {
        if (statement instanceof ReturnStmt) {
            return JsxReturns.containsJsx(((ReturnStmt) statement).getValue());
        }
        if (statement instanceof Block) {
            for (Statement s : ((Block) statement).getStatements()) {
                if (returnsJsx(s)) return true;
            }
            return false;
        }
        if (statement instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) statement;
            return returnsJsx(ifStmt.getThenBranch())
                    || (ifStmt.getElseBranch() != null && returnsJsx(ifStmt.getElseBranch()));
        }
        if (statement instanceof SwitchStmt) {
            for (SwitchCase switchCase : ((SwitchStmt) statement).getCases()) {
                for (Statement s : switchCase.getConsequent()) {
                    if (returnsJsx(s)) return true;
                }
            }
        }
        return false;
    }
}
