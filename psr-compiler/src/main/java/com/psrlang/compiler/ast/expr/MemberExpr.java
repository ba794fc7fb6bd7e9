package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 成员访问：obj.name / obj?.name
 */
public class MemberExpr extends Expression {
    private final Expression object;
    private final String property;
    private final boolean optional;

    public MemberExpr(SourceLocation location, Expression object, String property, boolean optional) {
        super(location);
        this.object = object;
        this.property = property;
        this.optional = optional;
    }

    public Expression getObject() {
        return object;
    }

    public String getProperty() {
        return property;
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(object);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
