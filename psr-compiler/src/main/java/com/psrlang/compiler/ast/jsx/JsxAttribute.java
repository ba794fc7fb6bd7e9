package com.psrlang.compiler.ast.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * JSX 属性
 */
public class JsxAttribute extends AstNode {
    private final String name;
    private final AstNode value;  // null / Literal / JsxExpressionContainer / JsxElement

    public JsxAttribute(SourceLocation location, String name, AstNode value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public AstNode getValue() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJsxAttribute(this, context);
    }
}
