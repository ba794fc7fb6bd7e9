package com.psrlang.compiler.ir.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ir.IrNode;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 读取信号的属性，发射为 $REGISTRY.wire(el, property, () =&gt; expression)
 */
public class SignalBindingIR extends AstNode implements IrNode {

    private final String attribute;     // 源码中的属性名
    private final String property;      // DOM 属性名（class -&gt; className）
    private final Expression expression;
    private final List<String> dependencies;

    public SignalBindingIR(SourceLocation location, String attribute, String property,
                           Expression expression, List<String> dependencies) {
        super(location);
        this.attribute = attribute;
        this.property = property;
        this.expression = expression;
        this.dependencies = dependencies;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getProperty() {
        return property;
    }

    public Expression getExpression() {
        return expression;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitSignalBinding(this, context);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
