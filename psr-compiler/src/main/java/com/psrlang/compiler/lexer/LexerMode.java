package com.psrlang.compiler.lexer;

/**
 * 词法错误处理模式
 */
public enum LexerMode {
    /** 遇到第一个错误即抛出 LexerException */
    STRICT,
    /** 记录错误、输出 ERROR token、跳过当前字符后继续 */
    COLLECT,
    /** 记录错误、输出 ERROR token、跳过整个出错区域后继续 */
    RESILIENT
}
