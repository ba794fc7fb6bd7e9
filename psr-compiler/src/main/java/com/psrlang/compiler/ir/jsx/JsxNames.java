package com.psrlang.compiler.ir.jsx;

/**
 * JSX 属性名与 DOM 属性名的对应
 */
public final class JsxNames {

    /** 元素引用属性 */
    public static final String REF = "ref";

    private JsxNames() {
    }

    /**
     * 写入元素对象时使用的属性名：class → className，for → htmlFor，其余不变
     */
    public static String domProperty(String attribute) {
        if ("class".equals(attribute)) return "className";
        if ("for".equals(attribute)) return "htmlFor";
        return attribute;
    }
}
