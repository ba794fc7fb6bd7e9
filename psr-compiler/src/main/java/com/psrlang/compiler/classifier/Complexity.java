package com.psrlang.compiler.classifier;

/**
 * 按节点数估计的表达式复杂度
 */
public enum Complexity {
    LOW,
    MEDIUM,
    HIGH;

    /** 少于 5 个节点为 LOW，少于 15 个为 MEDIUM */
    public static Complexity ofNodeCount(int nodes) {
        if (nodes < 5) return LOW;
        if (nodes < 15) return MEDIUM;
        return HIGH;
    }
}
