package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 元属性：new.target / import.meta
 */
public class MetaProperty extends Expression {
    private final String meta;
    private final String property;

    public MetaProperty(SourceLocation location, String meta, String property) {
        super(location);
        this.meta = meta;
        this.property = property;
    }

    public String getMeta() {
        return meta;
    }

    public String getProperty() {
        return property;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMetaProperty(this, context);
    }
}
