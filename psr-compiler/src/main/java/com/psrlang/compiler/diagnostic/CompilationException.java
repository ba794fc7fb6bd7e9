package com.psrlang.compiler.diagnostic;

/**
 * 编译异常基类：携带阶段与源码位置
 */
public class CompilationException extends RuntimeException {
    private final Phase phase;
    private final int line;
    private final int column;

    public CompilationException(Phase phase, String message, int line, int column) {
        super(message);
        this.phase = phase;
        this.line = line;
        this.column = column;
    }

    public CompilationException(Phase phase, String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.line = line;
        this.column = column;
    }

    public Phase getPhase() {
        return phase;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 转换为错误诊断 */
    public Diagnostic toDiagnostic() {
        return Diagnostic.error(getMessage(), phase, line, column);
    }
}
