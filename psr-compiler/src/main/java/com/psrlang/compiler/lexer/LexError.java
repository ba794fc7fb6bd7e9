package com.psrlang.compiler.lexer;

/**
 * 恢复模式下收集的词法错误
 */
public final class LexError {
    private final String message;
    private final int line;
    private final int column;
    private final int offset;

    public LexError(String message, int line, int column, int offset) {
        this.message = message;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return line + ":" + column + " " + message;
    }
}
