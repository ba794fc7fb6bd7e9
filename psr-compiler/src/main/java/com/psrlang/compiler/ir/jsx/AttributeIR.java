package com.psrlang.compiler.ir.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.classifier.Classification;
import com.psrlang.compiler.ir.IrNode;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 元素属性或组件属性；展开属性 {...rest} 的 name 为 null
 */
public class AttributeIR extends AstNode implements IrNode {

    private final String name;
    private final Expression value;           // null 表示布尔属性
    private final Classification classification;
    private final boolean spread;

    public AttributeIR(SourceLocation location, String name, Expression value,
                       Classification classification, boolean spread) {
        super(location);
        this.name = name;
        this.value = value;
        this.classification = classification;
        this.spread = spread;
    }

    public static AttributeIR spread(SourceLocation location, Expression argument, Classification classification) {
        return new AttributeIR(location, null, argument, classification, true);
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public Classification getClassification() {
        return classification;
    }

    public boolean isSpread() {
        return spread;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(value);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitAttribute(this, context);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
