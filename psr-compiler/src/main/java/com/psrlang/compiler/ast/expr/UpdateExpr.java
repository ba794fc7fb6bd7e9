package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 自增自减表达式
 */
public class UpdateExpr extends Expression {
    private final String operator;
    private final boolean prefix;
    private final Expression operand;

    public UpdateExpr(SourceLocation location, String operator, boolean prefix, Expression operand) {
        super(location);
        this.operator = operator;
        this.prefix = prefix;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public boolean isPrefix() {
        return prefix;
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
        return visitor.visitUpdateExpr(this, context);
    }
}
