package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.stmt.ReturnStmt;
import com.psrlang.compiler.ast.stmt.Statement;

/**
 * 直接返回 JSX：() =&gt; &lt;div/&gt; 或 return (&lt;div/&gt;)
 */
public final class DirectJsxReturnStrategy implements DetectionStrategy {

    @Override
    public String getName() {
        return "DirectJsxReturn";
    }

    @Override
    public int getPriority() {
        return 2;
    }

    @Override
    public DetectionResult detect(FunctionLike function, DetectionContext context) {
        Expression body = JsxReturns.expressionBody(function);
        if (body != null && JsxReturns.isJsx(body)) {
            return DetectionResult.positive(getName(), Confidence.HIGH,
                    "Arrow function body is JSX", context.nameOf(function));
        }
        for (Statement statement : JsxReturns.statements(function)) {
            if (statement instanceof ReturnStmt && JsxReturns.isJsx(((ReturnStmt) statement).getValue())) {
                return DetectionResult.positive(getName(), Confidence.HIGH,
                        "Function has a direct JSX return", context.nameOf(function));
            }
        }
        return DetectionResult.negative(getName(), "No direct JSX return");
    }
}
