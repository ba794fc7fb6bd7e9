package com.psrlang.compiler.diagnostic;

/**
 * 编译阶段（诊断归属）
 */
public enum Phase {
    LEXER("lexer"),
    PARSER("parser"),
    DETECTOR("detector"),
    ANALYZER("analyzer"),
    EMITTER("emitter"),
    PIPELINE("pipeline");

    private final String id;

    Phase(String id) {
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
