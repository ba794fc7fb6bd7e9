package com.psrlang.compiler.emitter;

/**
 * 输出缓冲区，跟踪缩进层级
 */
public final class CodeWriter {

    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public CodeWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public CodeWriter append(String text) {
        if (text == null || text.isEmpty()) return this;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
        return this;
    }

    public CodeWriter newLine() {
        output.append('\n');
        atLineStart = true;
        return this;
    }

    /** 一整行 */
    public CodeWriter line(String text) {
        return append(text).newLine();
    }

    /**
     * 追加多行文本，每行按当前缩进重新对齐
     */
    public CodeWriter appendLines(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) newLine();
            append(lines[i]);
        }
        return this;
    }

    /**
     * 空行，避免连续多个空行
     */
    public void blankLine() {
        int len = output.length();
        if (len == 0) return;
        if (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n') {
            return;
        }
        if (output.charAt(len - 1) != '\n') {
            output.append('\n');
        }
        output.append('\n');
        atLineStart = true;
    }

    public boolean isAtLineStart() {
        return atLineStart;
    }

    public String getOutput() {
        return output.toString();
    }
}
