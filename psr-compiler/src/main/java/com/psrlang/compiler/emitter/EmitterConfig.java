package com.psrlang.compiler.emitter;

import com.psrlang.compiler.ir.builder.DepthGuard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 发射器配置
 */
public final class EmitterConfig {

    /** 运行时模块默认路径 */
    public static final String DEFAULT_RUNTIME_MODULE = "@pulsar-framework/pulsar.dev";

    private String indent = "  ";
    private ModuleFormat moduleFormat = ModuleFormat.ESM;
    private String runtimeModule = DEFAULT_RUNTIME_MODULE;
    private final List<String> extraRuntimeModules = new ArrayList<String>();
    private boolean asciiOnly;
    private int maxDepth = DepthGuard.DEFAULT_MAX_DEPTH;

    public static EmitterConfig defaults() {
        return new EmitterConfig();
    }

    public String getIndent() {
        return indent;
    }

    public EmitterConfig setIndent(String indent) {
        this.indent = indent;
        return this;
    }

    public ModuleFormat getModuleFormat() {
        return moduleFormat;
    }

    public EmitterConfig setModuleFormat(ModuleFormat moduleFormat) {
        this.moduleFormat = moduleFormat;
        return this;
    }

    /** 运行时符号（$REGISTRY、t_element、信号原语）的导入来源 */
    public String getRuntimeModule() {
        return runtimeModule;
    }

    public EmitterConfig setRuntimeModule(String runtimeModule) {
        this.runtimeModule = runtimeModule;
        return this;
    }

    /**
     * 识别为运行时的全部模块：主模块在前，其后是额外登记的别名路径
     */
    public List<String> getRuntimeModules() {
        List<String> modules = new ArrayList<String>();
        modules.add(runtimeModule);
        for (String extra : extraRuntimeModules) {
            if (!modules.contains(extra)) modules.add(extra);
        }
        return Collections.unmodifiableList(modules);
    }

    public EmitterConfig addRuntimeModule(String module) {
        extraRuntimeModules.add(module);
        return this;
    }

    public boolean isAsciiOnly() {
        return asciiOnly;
    }

    public EmitterConfig setAsciiOnly(boolean asciiOnly) {
        this.asciiOnly = asciiOnly;
        return this;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public EmitterConfig setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
        return this;
    }
}
