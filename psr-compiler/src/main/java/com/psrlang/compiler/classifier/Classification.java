package com.psrlang.compiler.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分类结果（不可变）
 */
public final class Classification {
    private final Category category;
    private final String emissionStrategy;
    private final List<String> dependencies;   // 读取的信号访问器，首次出现顺序
    private final boolean nullable;
    private final Complexity complexity;
    private final String reason;

    public Classification(Category category, List<String> dependencies, boolean nullable,
                          Complexity complexity, String reason) {
        this.category = category;
        this.emissionStrategy = category.getEmissionStrategy();
        this.dependencies = Collections.unmodifiableList(new ArrayList<String>(dependencies));
        this.nullable = nullable;
        this.complexity = complexity;
        this.reason = reason;
    }

    public Category getCategory() { return category; }
    public String getEmissionStrategy() { return emissionStrategy; }
    public List<String> getDependencies() { return dependencies; }
    public boolean isNullable() { return nullable; }
    public Complexity getComplexity() { return complexity; }
    public String getReason() { return reason; }

    public boolean is(Category c) {
        return category == c;
    }

    /** 运行时需要重新求值（DYNAMIC、CONDITIONAL、LOOP） */
    public boolean isReactive() {
        return category == Category.DYNAMIC || category == Category.CONDITIONAL || category == Category.LOOP;
    }

    @Override
    public String toString() {
        return category + "(" + emissionStrategy + ") deps=" + dependencies + " " + complexity
                + (nullable ? " nullable" : "") + ": " + reason;
    }
}
