package com.psrlang.compiler.parser;

import com.psrlang.compiler.diagnostic.CompilationException;
import com.psrlang.compiler.diagnostic.Phase;
import com.psrlang.compiler.lexer.Token;

/**
 * 解析异常
 */
public class ParseException extends CompilationException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(Phase.PARSER, message,
                token != null ? token.getLine() : 0,
                token != null ? token.getColumn() : 0);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 不带位置后缀的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found '").append(token.getLexeme()).append("')");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
