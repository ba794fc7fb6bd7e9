package com.psrlang.compiler.emitter;

/**
 * 导入语句的模块格式
 */
public enum ModuleFormat {
    /** import ... from '...' */
    ESM,
    /** const ... = require('...') */
    CJS
}
