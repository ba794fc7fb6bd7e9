package com.psrlang.compiler;

import com.psrlang.compiler.emitter.EmitterConfig;
import com.psrlang.compiler.ir.builder.DepthGuard;
import com.psrlang.compiler.lexer.LexerMode;
import com.psrlang.compiler.lexer.LexerOptions;

/**
 * 单次转换的配置
 */
public final class CompilerConfig {

    private boolean debug;
    private boolean strict;
    private String fileName = "<input>";
    private boolean collectErrors;
    private LexerMode lexerMode = LexerMode.STRICT;
    private int maxDepth = DepthGuard.DEFAULT_MAX_DEPTH;
    private EmitterConfig emitter = EmitterConfig.defaults();

    public static CompilerConfig defaults() {
        return new CompilerConfig();
    }

    /** 调试模式：记录各阶段耗时并输出检测报告 */
    public boolean isDebug() {
        return debug;
    }

    public CompilerConfig setDebug(boolean debug) {
        this.debug = debug;
        return this;
    }

    /** 严格模式：检测器警告视为错误 */
    public boolean isStrict() {
        return strict;
    }

    public CompilerConfig setStrict(boolean strict) {
        this.strict = strict;
        return this;
    }

    public String getFileName() {
        return fileName;
    }

    public CompilerConfig setFileName(String fileName) {
        this.fileName = fileName;
        return this;
    }

    /** 收集全部语法错误而不是在第一个错误处停止 */
    public boolean isCollectErrors() {
        return collectErrors;
    }

    public CompilerConfig setCollectErrors(boolean collectErrors) {
        this.collectErrors = collectErrors;
        return this;
    }

    public LexerMode getLexerMode() {
        return lexerMode;
    }

    public CompilerConfig setLexerMode(LexerMode lexerMode) {
        this.lexerMode = lexerMode;
        return this;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /** IR 构建和发射共用的递归深度上限 */
    public CompilerConfig setMaxDepth(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.emitter.setMaxDepth(maxDepth);
        return this;
    }

    public EmitterConfig getEmitter() {
        return emitter;
    }

    public CompilerConfig setEmitter(EmitterConfig emitter) {
        this.emitter = emitter;
        return this;
    }

    LexerOptions lexerOptions() {
        return LexerOptions.defaults().setMode(lexerMode);
    }
}
