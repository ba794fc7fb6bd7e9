package com.psrlang.compiler.lexer;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;
    private final int endOffset;
    private final boolean newlineBefore;

    public Token(TokenType type, String lexeme, Object literal, int line, int column,
                 int offset, int endOffset, boolean newlineBefore) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.endOffset = endOffset;
        this.newlineBefore = newlineBefore;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 起始偏移（含） */
    public int getOffset() {
        return offset;
    }

    /** 结束偏移（不含） */
    public int getEndOffset() {
        return endOffset;
    }

    /** 与前一个 token 之间是否有换行（用于 ASI） */
    public boolean isNewlineBefore() {
        return newlineBefore;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, lexeme, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, line, column);
    }
}
