package com.psrlang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    VARIABLE,           // var/let
    CONSTANT,           // const
    PARAMETER,          // 函数或组件参数
    FUNCTION,           // function 声明
    COMPONENT,          // component 声明
    CLASS,              // class 声明
    INTERFACE,          // interface 声明
    TYPE_ALIAS,         // type 别名
    ENUM,               // enum 声明
    NAMESPACE,          // namespace / module
    IMPORT              // 导入的绑定
}
