package com.psrlang.compiler.parser;

import com.psrlang.compiler.ast.decl.Program;

import java.util.List;

/**
 * 容错解析的结果：部分 AST 和收集到的错误列表
 *
 * <p>错误列表非空时调用方不得继续使用该 AST 进入后续阶段。</p>
 */
public final class ParseResult {
    private final Program program;
    private final List<ParseError> errors;

    public ParseResult(Program program, List<ParseError> errors) {
        this.program = program;
        this.errors = errors;
    }

    public Program getProgram() {
        return program;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
