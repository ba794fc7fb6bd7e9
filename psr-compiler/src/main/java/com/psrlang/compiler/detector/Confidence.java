package com.psrlang.compiler.detector;

/**
 * 检测置信度
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH
}
