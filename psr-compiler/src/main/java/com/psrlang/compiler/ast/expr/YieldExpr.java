package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * yield 表达式
 */
public class YieldExpr extends Expression {
    private final Expression argument;
    private final boolean delegate;

    public YieldExpr(SourceLocation location, Expression argument, boolean delegate) {
        super(location);
        this.argument = argument;
        this.delegate = delegate;
    }

    public Expression getArgument() {
        return argument;
    }

    public boolean isDelegate() {
        return delegate;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(argument);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitYieldExpr(this, context);
    }
}
