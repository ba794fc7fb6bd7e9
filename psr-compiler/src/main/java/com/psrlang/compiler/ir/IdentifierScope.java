package com.psrlang.compiler.ir;

/**
 * 标识符引用的绑定来源
 */
public enum IdentifierScope {
    /** 本文件中声明的变量、函数、类或组件 */
    LOCAL,
    PARAMETER,
    /** 未在本文件中声明（宿主环境全局） */
    GLOBAL,
    IMPORTED
}
