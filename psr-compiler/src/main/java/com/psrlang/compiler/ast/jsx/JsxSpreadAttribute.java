package com.psrlang.compiler.ast.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * JSX 展开属性：{...props}
 */
public class JsxSpreadAttribute extends AstNode {
    private final Expression argument;

    public JsxSpreadAttribute(SourceLocation location, Expression argument) {
        super(location);
        this.argument = argument;
    }

    public Expression getArgument() {
        return argument;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(argument);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJsxSpreadAttribute(this, context);
    }
}
