package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字面量
 */
public class Literal extends Expression {
    private final LiteralKind kind;
    private final Object value;
    private final String raw;  // 原始源码文本

    public Literal(SourceLocation location, LiteralKind kind, Object value, String raw) {
        super(location);
        this.kind = kind;
        this.value = value;
        this.raw = raw;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public String getRaw() {
        return raw;
    }

    public boolean isString() {
        return kind == LiteralKind.STRING;
    }

    /**
     * 字面量种类
     */
    public enum LiteralKind {
        NUMBER,
        BIGINT,
        STRING,
        BOOLEAN,
        NULL,
        REGEX
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
