package com.psrlang.compiler.ir.builder;

import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.diagnostic.Phase;

/**
 * 显式的递归深度计数，超过上限时抛出 {@link RecursionLimitException}
 */
public final class DepthGuard {

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final int maxDepth;
    private final Phase phase;
    private int depth;

    public DepthGuard(int maxDepth, Phase phase) {
        this.maxDepth = maxDepth;
        this.phase = phase;
    }

    public void enter(SourceLocation location) {
        depth++;
        if (depth > maxDepth) {
            depth = 0;
            throw new RecursionLimitException(phase, maxDepth, location);
        }
    }

    public void exit() {
        if (depth > 0) depth--;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
