package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 括号类型
 */
public class ParenthesizedType extends TypeNode {
    private final TypeNode inner;

    public ParenthesizedType(SourceLocation location, String text, TypeNode inner) {
        super(location, text);
        this.inner = inner;
    }

    public TypeNode getInner() {
        return inner;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(inner);
    }
}
