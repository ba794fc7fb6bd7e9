package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.type.TypeNode;

/**
 * 返回类型注解为 DOM 元素类型
 */
public final class ReturnTypeStrategy implements DetectionStrategy {

    @Override
    public String getName() {
        return "ReturnType";
    }

    @Override
    public int getPriority() {
        return 1;
    }

    @Override
    public DetectionResult detect(FunctionLike function, DetectionContext context) {
        TypeNode returnType = function.getReturnType();
        if (returnType == null || !isElementType(returnType.getText())) {
            return DetectionResult.negative(getName(), "No element return type");
        }
        return DetectionResult.positive(getName(), Confidence.HIGH,
                "Return type annotation ': " + returnType.getText() + "'", context.nameOf(function));
    }

    /**
     * HTMLElement、Element、Node、JSX.Element，或包含其中之一的联合类型（HTMLElement | null）
     */
    public static boolean isElementType(String text) {
        if (text == null) return false;
        for (String part : text.split("\\|")) {
            String type = part.trim();
            if (type.equals("HTMLElement") || type.equals("Element")
                    || type.equals("Node") || type.equals("JSX.Element")) {
                return true;
            }
        }
        return false;
    }
}
