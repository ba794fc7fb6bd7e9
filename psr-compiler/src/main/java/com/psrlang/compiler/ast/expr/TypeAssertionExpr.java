package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * 类型断言：expr as T / expr satisfies T / <T>expr
 */
public class TypeAssertionExpr extends Expression {
    private final Expression expression;
    private final String keyword;
    private final TypeNode type;

    public TypeAssertionExpr(SourceLocation location, Expression expression, String keyword, TypeNode type) {
        super(location);
        this.expression = expression;
        this.keyword = keyword;
        this.type = type;
    }

    public Expression getExpression() {
        return expression;
    }

    public String getKeyword() {
        return keyword;
    }

    public TypeNode getType() {
        return type;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression, type);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAssertionExpr(this, context);
    }
}
