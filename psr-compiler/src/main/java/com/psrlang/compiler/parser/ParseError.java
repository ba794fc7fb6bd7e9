package com.psrlang.compiler.parser;

import com.psrlang.compiler.diagnostic.Diagnostic;
import com.psrlang.compiler.lexer.Token;

/**
 * 容错解析中收集的语法错误
 *
 * <p>保留原始的 {@link ParseException}，位置和期望的 token 都从它读取。</p>
 */
public final class ParseError {
    private final ParseException cause;

    ParseError(ParseException cause) {
        this.cause = cause;
    }

    public String getMessage() {
        return cause.getMessage();
    }

    /** 期望的 token 描述，没有时为 null */
    public String getExpected() {
        return cause.getExpected();
    }

    public Token getToken() {
        return cause.getToken();
    }

    public int getLine() {
        return cause.getLine();
    }

    public int getColumn() {
        return cause.getColumn();
    }

    public Diagnostic toDiagnostic() {
        return cause.toDiagnostic();
    }

    @Override
    public String toString() {
        return getLine() + ":" + getColumn() + ": " + getMessage();
    }
}
