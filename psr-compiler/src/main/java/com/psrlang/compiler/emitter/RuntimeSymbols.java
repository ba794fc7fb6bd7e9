package com.psrlang.compiler.emitter;

/**
 * 生成代码引用的运行时符号
 */
public final class RuntimeSymbols {

    public static final String REGISTRY = "$REGISTRY";
    public static final String T_ELEMENT = "t_element";
    public static final String CREATE_SIGNAL = "createSignal";
    public static final String CREATE_EFFECT = "createEffect";

    /** 无绑定时改写为 createSignal 的简写 */
    public static final String SIGNAL_SHORTHAND = "signal";

    private RuntimeSymbols() {
    }
}
