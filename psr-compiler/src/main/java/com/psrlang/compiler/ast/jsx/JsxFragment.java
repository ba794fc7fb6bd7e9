package com.psrlang.compiler.ast.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * JSX 片段：<>...</>
 */
public class JsxFragment extends Expression {
    private final List<Expression> children;

    public JsxFragment(SourceLocation location, List<Expression> children) {
        super(location);
        this.children = children;
    }

    public List<Expression> getJsxChildren() {
        return children;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(children);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJsxFragment(this, context);
    }
}
