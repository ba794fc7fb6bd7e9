package com.psrlang.compiler.ir.builder;

import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.diagnostic.Phase;

/**
 * 语法树嵌套超过配置的深度上限
 */
public class RecursionLimitException extends IrBuildException {

    private final int limit;

    public RecursionLimitException(Phase phase, int limit, SourceLocation location) {
        super(phase, "Maximum nesting depth of " + limit + " exceeded", location);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
