package com.psrlang.compiler.classifier;

/**
 * 表达式的响应式类别
 */
public enum Category {
    /** 只求值一次 */
    STATIC("direct-assignment"),
    /** 读取信号，通过 $REGISTRY.wire 保持同步 */
    DYNAMIC("registry-wire"),
    /** 事件属性 */
    EVENT("add-event-listener"),
    /** 依赖信号的条件分支 */
    CONDITIONAL("show-component"),
    /** 列表渲染 */
    LOOP("for-component");

    private final String emissionStrategy;

    Category(String emissionStrategy) {
        this.emissionStrategy = emissionStrategy;
    }

    /** 默认的发射策略名 */
    public String getEmissionStrategy() {
        return emissionStrategy;
    }
}
