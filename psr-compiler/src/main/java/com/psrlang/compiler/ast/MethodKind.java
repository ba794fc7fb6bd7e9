package com.psrlang.compiler.ast;

/**
 * 方法种类（类成员与对象字面量共用）
 */
public enum MethodKind {
    METHOD,
    GETTER,
    SETTER,
    CONSTRUCTOR
}
