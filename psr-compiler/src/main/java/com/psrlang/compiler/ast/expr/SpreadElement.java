package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 展开：...expr
 */
public class SpreadElement extends Expression {
    private final Expression argument;

    public SpreadElement(SourceLocation location, Expression argument) {
        super(location);
        this.argument = argument;
    }

    public Expression getArgument() {
        return argument;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(argument);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSpreadElement(this, context);
    }
}
