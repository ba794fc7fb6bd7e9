package com.psrlang.compiler.classifier;

import com.psrlang.compiler.analysis.SignalInfo;

/**
 * 分类上下文
 */
public final class ClassificationContext {

    /**
     * 按名称查询当前作用域中绑定的类型文本
     */
    public interface TypeLookup {
        /** 无类型信息时返回 null */
        String typeOf(String name);
    }

    private final SignalInfo signals;
    private final TypeLookup types;

    public ClassificationContext(SignalInfo signals) {
        this(signals, null);
    }

    public ClassificationContext(SignalInfo signals, TypeLookup types) {
        this.signals = signals != null ? signals : SignalInfo.empty();
        this.types = types;
    }

    public SignalInfo getSignals() {
        return signals;
    }

    public boolean isSignalAccessor(String name) {
        return signals.isAccessor(name);
    }

    public String typeOf(String name) {
        return types != null ? types.typeOf(name) : null;
    }
}
