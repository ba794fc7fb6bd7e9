package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.FunctionLike;

/**
 * 组件检测策略，数值越小优先级越高
 */
public interface DetectionStrategy {

    String getName();

    int getPriority();

    /**
     * 检测函数是否为组件；未命中时返回 isComponent() 为 false 的结果
     */
    DetectionResult detect(FunctionLike function, DetectionContext context);
}
