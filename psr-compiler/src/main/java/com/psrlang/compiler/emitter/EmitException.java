package com.psrlang.compiler.emitter;

import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.diagnostic.CompilationException;
import com.psrlang.compiler.diagnostic.Phase;

/**
 * 代码发射失败
 */
public class EmitException extends CompilationException {

    public EmitException(String message, SourceLocation location) {
        super(Phase.EMITTER, message,
                location != null ? location.getLine() : 0,
                location != null ? location.getColumn() : 0);
    }
}
