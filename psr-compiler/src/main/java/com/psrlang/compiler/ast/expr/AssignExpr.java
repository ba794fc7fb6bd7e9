package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 赋值表达式（含复合赋值）
 */
public class AssignExpr extends Expression {
    private final String operator;
    private final Expression target;
    private final Expression value;

    public AssignExpr(SourceLocation location, String operator, Expression target, Expression value) {
        super(location);
        this.operator = operator;
        this.target = target;
        this.value = value;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(target, value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }
}
