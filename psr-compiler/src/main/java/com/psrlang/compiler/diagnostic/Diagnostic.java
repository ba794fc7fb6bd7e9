package com.psrlang.compiler.diagnostic;

/**
 * 编译诊断信息
 */
public final class Diagnostic {
    private final DiagnosticType type;
    private final String message;
    private final Phase phase;
    private final int line;     // 0 表示未知
    private final int column;

    public Diagnostic(DiagnosticType type, String message, Phase phase, int line, int column) {
        this.type = type;
        this.message = message;
        this.phase = phase;
        this.line = line;
        this.column = column;
    }

    public static Diagnostic info(String message, Phase phase) {
        return new Diagnostic(DiagnosticType.INFO, message, phase, 0, 0);
    }

    public static Diagnostic warning(String message, Phase phase, int line, int column) {
        return new Diagnostic(DiagnosticType.WARNING, message, phase, line, column);
    }

    public static Diagnostic error(String message, Phase phase, int line, int column) {
        return new Diagnostic(DiagnosticType.ERROR, message, phase, line, column);
    }

    public DiagnosticType getType() {
        return type;
    }

    public String getMessage() {
        return message;
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

    public boolean hasLocation() {
        return line > 0;
    }

    public boolean isError() {
        return type == DiagnosticType.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(type).append("] ").append(phase);
        if (hasLocation()) {
            sb.append(' ').append(line).append(':').append(column);
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
