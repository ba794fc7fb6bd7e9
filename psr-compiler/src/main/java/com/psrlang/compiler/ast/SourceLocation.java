package com.psrlang.compiler.ast;

/**
 * 源码位置信息（起止范围）
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int endLine;
    private final int endColumn;
    private final int endOffset;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0, 0, 0);

    public SourceLocation(String file, int line, int column, int offset,
                          int endLine, int endColumn, int endOffset) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.endOffset = endOffset;
    }

    public String getFile() {
        return file;
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

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getLength() {
        return endOffset - offset;
    }

    /** 两个位置合并为覆盖二者的范围 */
    public SourceLocation to(SourceLocation end) {
        if (end == null || end == UNKNOWN) return this;
        return new SourceLocation(file, line, column, offset, end.endLine, end.endColumn, end.endOffset);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
