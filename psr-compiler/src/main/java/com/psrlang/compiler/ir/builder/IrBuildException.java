package com.psrlang.compiler.ir.builder;

import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.diagnostic.CompilationException;
import com.psrlang.compiler.diagnostic.Phase;

/**
 * IR 构建期间的结构性错误（组件参数不合法、无法解析的标签、组件重名等）
 */
public class IrBuildException extends CompilationException {

    public IrBuildException(String message, SourceLocation location) {
        this(Phase.ANALYZER, message, location);
    }

    protected IrBuildException(Phase phase, String message, SourceLocation location) {
        super(phase, message, location.getLine(), location.getColumn());
    }
}
