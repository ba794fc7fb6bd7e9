package com.psrlang.compiler.emitter;

import com.psrlang.compiler.diagnostic.Phase;
import com.psrlang.compiler.ir.builder.DepthGuard;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 一次发射的上下文：输出缓冲、导入注册表、深度计数和临时变量编号
 */
final class EmitContext {

    final CodeWriter out;
    final EmitterConfig config;
    final ImportRegistry imports;
    final DepthGuard depth;

    private final Deque<String> elements = new ArrayDeque<String>();
    private int tempCounter;

    EmitContext(EmitterConfig config, ImportRegistry imports) {
        this.config = config;
        this.imports = imports;
        this.out = new CodeWriter(config.getIndent());
        this.depth = new DepthGuard(config.getMaxDepth(), Phase.EMITTER);
    }

    /** 新的临时变量名，如 _el0、_txt1 */
    String temp(String prefix) {
        return "_" + prefix + (tempCounter++);
    }

    /** 引用运行时符号，登记到运行时模块的导入中 */
    String runtime(String symbol) {
        imports.addNamed(config.getRuntimeModule(), symbol);
        return symbol;
    }

    void pushElement(String variable) {
        elements.push(variable);
    }

    void popElement() {
        elements.pop();
    }

    /** 正在构建的元素变量，不在元素内时为 null */
    String currentElement() {
        return elements.peek();
    }

    String quote(String value) {
        return "'" + StringEscapes.escape(value, '\'', config.isAsciiOnly()) + "'";
    }
}
