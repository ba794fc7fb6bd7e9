package com.psrlang.compiler.lexer;

/**
 * 词法分析配置
 */
public final class LexerOptions {
    private LexerMode mode = LexerMode.STRICT;
    private int maxErrors = 100;
    private int maxRecoveryAttempts = 1000;

    public static LexerOptions defaults() {
        return new LexerOptions();
    }

    public LexerMode getMode() {
        return mode;
    }

    public LexerOptions setMode(LexerMode mode) {
        this.mode = mode;
        return this;
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public LexerOptions setMaxErrors(int maxErrors) {
        this.maxErrors = maxErrors;
        return this;
    }

    public int getMaxRecoveryAttempts() {
        return maxRecoveryAttempts;
    }

    public LexerOptions setMaxRecoveryAttempts(int maxRecoveryAttempts) {
        this.maxRecoveryAttempts = maxRecoveryAttempts;
        return this;
    }
}
