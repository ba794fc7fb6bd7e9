package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 对象字面量
 */
public class ObjectLiteral extends Expression {
    private final List<ObjectProperty> properties;

    public ObjectLiteral(SourceLocation location, List<ObjectProperty> properties) {
        super(location);
        this.properties = properties;
    }

    public List<ObjectProperty> getProperties() {
        return properties;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(properties);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectLiteral(this, context);
    }
}
