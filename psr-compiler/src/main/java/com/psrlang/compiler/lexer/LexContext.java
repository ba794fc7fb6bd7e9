package com.psrlang.compiler.lexer;

/**
 * 词法上下文栈帧
 *
 * <p>模板插值、JSX 标签/子节点/表达式以及泛型尖括号各自压入一帧；
 * depth 对插值/表达式帧是花括号深度，对泛型帧是尖括号深度。</p>
 */
final class LexContext {

    enum Kind {
        TEMPLATE_EXPR,  // `...${ 此处 }...`
        JSX_TAG,        // <tag 此处>
        JSX_CHILDREN,   // <tag>此处</tag>
        JSX_EXPR,       // {此处}（位于 JSX 内）
        GENERIC         // Foo<此处>
    }

    final Kind kind;
    final boolean closingTag;
    int depth;

    LexContext(Kind kind, boolean closingTag, int depth) {
        this.kind = kind;
        this.closingTag = closingTag;
        this.depth = depth;
    }

    static LexContext of(Kind kind) {
        return new LexContext(kind, false, 0);
    }

    boolean is(Kind kind) {
        return this.kind == kind;
    }

    @Override
    public String toString() {
        return kind + (closingTag ? "(closing)" : "") + "#" + depth;
    }
}
