package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.FunctionLike;

/**
 * 否定策略：命中时函数一定不是组件，后续策略不再运行
 */
public interface SuppressionStrategy {

    String getName();

    int getPriority();

    boolean suppresses(FunctionLike function, DetectionContext context);

    /** 命中时记录的原因 */
    String getReason();
}
