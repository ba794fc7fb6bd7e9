package com.psrlang.compiler.detector;

import com.psrlang.compiler.analysis.AstWalker;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.FunctionLike;

/**
 * 函数体任意位置出现 JSX（包括嵌套回调）
 */
public final class HasJsxInBodyStrategy implements DetectionStrategy {

    @Override
    public String getName() {
        return "HasJsxInBody";
    }

    @Override
    public int getPriority() {
        return 6;
    }

    @Override
    public DetectionResult detect(FunctionLike function, DetectionContext context) {
        AstNode body = function.getBody();
        if (body == null || !AstWalker.containsJsx(body, true)) {
            return DetectionResult.negative(getName(), "No JSX in body");
        }
        return DetectionResult.positive(getName(), Confidence.LOW,
                "Function body contains JSX", context.nameOf(function));
    }
}
