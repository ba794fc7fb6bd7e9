package com.psrlang.compiler.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 编译单元中的信号名称：访问器、setter 和可用的信号创建函数
 */
public final class SignalInfo {

    private final Set<String> accessors;
    private final Set<String> setters;
    private final Set<String> creators;
    private final Map<String, String> valueTypes;

    public SignalInfo(Set<String> accessors, Set<String> setters, Set<String> creators) {
        this(accessors, setters, creators, Collections.<String, String>emptyMap());
    }

    public SignalInfo(Set<String> accessors, Set<String> setters, Set<String> creators,
                      Map<String, String> valueTypes) {
        this.accessors = Collections.unmodifiableSet(new LinkedHashSet<String>(accessors));
        this.setters = Collections.unmodifiableSet(new LinkedHashSet<String>(setters));
        this.creators = Collections.unmodifiableSet(new LinkedHashSet<String>(creators));
        this.valueTypes = Collections.unmodifiableMap(new LinkedHashMap<String, String>(valueTypes));
    }

    public static SignalInfo empty() {
        return new SignalInfo(Collections.<String>emptySet(), Collections.<String>emptySet(),
                SignalCollector.DEFAULT_CREATORS);
    }

    /** 访问器名称，调用 name() 读取信号值 */
    public Set<String> getAccessors() { return accessors; }
    public Set<String> getSetters() { return setters; }
    /** 内置创建函数名加上从运行时模块导入的别名 */
    public Set<String> getCreators() { return creators; }

    public boolean isAccessor(String name) {
        return accessors.contains(name);
    }

    public boolean isCreator(String name) {
        return creators.contains(name);
    }

    /** 访问器返回值的类型：创建函数的类型实参，或由初始值推断；未知时为 null */
    public String getValueType(String accessor) {
        return valueTypes.get(accessor);
    }

    @Override
    public String toString() {
        return "SignalInfo{accessors=" + accessors + ", setters=" + setters + "}";
    }
}
