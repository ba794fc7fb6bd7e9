package com.psrlang.compiler.ast;

/**
 * 声明与类成员修饰符
 */
public enum Modifier {
    DECLARE("declare"),
    ABSTRACT("abstract"),
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected"),
    STATIC("static"),
    OVERRIDE("override"),
    READONLY("readonly"),
    ASYNC("async"),
    ACCESSOR("accessor");

    private final String keyword;

    Modifier(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
