package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 装饰器：@expr
 */
public class Decorator extends AstNode {
    private final Expression expression;

    public Decorator(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDecorator(this, context);
    }
}
