package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 逗号表达式
 */
public class SequenceExpr extends Expression {
    private final List<Expression> expressions;

    public SequenceExpr(SourceLocation location, List<Expression> expressions) {
        super(location);
        this.expressions = expressions;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expressions);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSequenceExpr(this, context);
    }
}
