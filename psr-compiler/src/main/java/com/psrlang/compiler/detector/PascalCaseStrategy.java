package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.FunctionLike;

/**
 * 按命名约定：PascalCase 名称
 */
public final class PascalCaseStrategy implements DetectionStrategy {

    @Override
    public String getName() {
        return "PascalCase";
    }

    @Override
    public int getPriority() {
        return 3;
    }

    @Override
    public DetectionResult detect(FunctionLike function, DetectionContext context) {
        String name = context.nameOf(function);
        if (name == null) {
            return DetectionResult.negative(getName(), "Anonymous function");
        }
        if (!isPascalCase(name)) {
            return DetectionResult.negative(getName(), "Not PascalCase: " + name);
        }
        return DetectionResult.positive(getName(), Confidence.MEDIUM, "PascalCase name: " + name, name);
    }

    /**
     * 首字母大写；不以下划线或数字开头；多于一个字符时不能全大写（常量命名）
     */
    public static boolean isPascalCase(String name) {
        if (name == null || name.isEmpty()) return false;
        char first = name.charAt(0);
        if (first == '_' || Character.isDigit(first)) return false;
        if (!Character.isUpperCase(first)) return false;
        if (name.length() == 1) return true;
        return !name.equals(name.toUpperCase());
    }
}
