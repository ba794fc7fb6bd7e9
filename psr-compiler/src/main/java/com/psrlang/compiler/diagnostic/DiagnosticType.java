package com.psrlang.compiler.diagnostic;

/**
 * 诊断级别
 */
public enum DiagnosticType {
    INFO("info"),
    WARNING("warning"),
    ERROR("error");

    private final String id;

    DiagnosticType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
