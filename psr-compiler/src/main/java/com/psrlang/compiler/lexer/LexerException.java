package com.psrlang.compiler.lexer;

import com.psrlang.compiler.diagnostic.CompilationException;
import com.psrlang.compiler.diagnostic.Phase;

/**
 * 词法错误
 */
public class LexerException extends CompilationException {
    private final String fileName;

    public LexerException(String message, String fileName, int line, int column) {
        super(Phase.LEXER, message, line, column);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    @Override
    public String getMessage() {
        return String.format("[%s:%d:%d] Lexer error: %s",
                fileName, getLine(), getColumn(), super.getMessage());
    }
}
