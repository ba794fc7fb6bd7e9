package com.psrlang.compiler.ast.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * JSX 表达式容器：{expr}，{} 时表达式为 null
 */
public class JsxExpressionContainer extends Expression {
    private final Expression expression;

    public JsxExpressionContainer(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isEmpty() {
        return expression == null;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJsxExpressionContainer(this, context);
    }
}
