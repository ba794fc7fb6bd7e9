package com.psrlang.compiler.ir.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 大写或成员标签 &lt;Foo /&gt;、&lt;Ui.Button /&gt;，发射为以属性对象调用组件
 */
public class ComponentCallIR extends IrExpr {

    private final String tag;
    private final Expression callee;
    private final List<AttributeIR> props;
    private final List<Expression> children;
    private final boolean deferredChildren;  // Provider：children 以 () => ... 传入

    public ComponentCallIR(SourceLocation location, String tag, Expression callee,
                           List<AttributeIR> props, List<Expression> children) {
        this(location, tag, callee, props, children, false);
    }

    public ComponentCallIR(SourceLocation location, String tag, Expression callee,
                           List<AttributeIR> props, List<Expression> children, boolean deferredChildren) {
        super(location);
        this.tag = tag;
        this.callee = callee;
        this.props = props;
        this.children = children;
        this.deferredChildren = deferredChildren;
    }

    public String getTag() {
        return tag;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<AttributeIR> getProps() {
        return props;
    }

    public List<Expression> getJsxChildren() {
        return children;
    }

    public boolean hasDeferredChildren() {
        return deferredChildren;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(callee, props, children);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitComponentCall(this, context);
    }
}
