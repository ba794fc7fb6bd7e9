package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 一元表达式（! - + ~ typeof void delete）
 */
public class UnaryExpr extends Expression {
    private final String operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, String operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(operand);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }
}
