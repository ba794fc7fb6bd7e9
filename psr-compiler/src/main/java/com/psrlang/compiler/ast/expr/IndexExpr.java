package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 下标访问：obj[index] / obj?.[index]
 */
public class IndexExpr extends Expression {
    private final Expression object;
    private final Expression index;
    private final boolean optional;

    public IndexExpr(SourceLocation location, Expression object, Expression index, boolean optional) {
        super(location);
        this.object = object;
        this.index = index;
        this.optional = optional;
    }

    public Expression getObject() {
        return object;
    }

    public Expression getIndex() {
        return index;
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(object, index);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
