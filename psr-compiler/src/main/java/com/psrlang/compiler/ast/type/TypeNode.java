package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

/**
 * 类型注解基类
 *
 * <p>类型只影响检测与输出，不参与类型检查；每个节点保留其规范化的源码文本，
 * 发射阶段直接输出该文本。</p>
 */
public abstract class TypeNode extends AstNode {
    protected final String text;

    protected TypeNode(SourceLocation location, String text) {
        super(location);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeNode(this, context);
    }

    @Override
    public String toString() {
        return text;
    }
}
