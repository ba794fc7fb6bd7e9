package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 类型参数
 */
public class TypeParameter extends AstNode {
    private final String name;
    private final TypeNode constraint;
    private final TypeNode defaultType;

    public TypeParameter(SourceLocation location, String name, TypeNode constraint, TypeNode defaultType) {
        super(location);
        this.name = name;
        this.constraint = constraint;
        this.defaultType = defaultType;
    }

    public String getName() {
        return name;
    }

    public TypeNode getConstraint() {
        return constraint;
    }

    public TypeNode getDefaultType() {
        return defaultType;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(constraint, defaultType);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeParameter(this, context);
    }
}
