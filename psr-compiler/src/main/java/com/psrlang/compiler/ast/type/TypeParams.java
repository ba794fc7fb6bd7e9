package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 类型参数列表：<T, U extends X = Y>
 */
public class TypeParams extends AstNode {
    private final List<TypeParameter> params;
    private final String text;

    public TypeParams(SourceLocation location, List<TypeParameter> params, String text) {
        super(location);
        this.params = params;
        this.text = text;
    }

    public List<TypeParameter> getParams() {
        return params;
    }

    public String getText() {
        return text;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(params);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeParams(this, context);
    }
}
