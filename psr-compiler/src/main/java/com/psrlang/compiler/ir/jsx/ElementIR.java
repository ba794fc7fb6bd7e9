package com.psrlang.compiler.ir.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 原生 HTML 元素
 *
 * <p>静态属性在 attributes 中，读取信号的属性在 bindings 中，事件属性在 events 中。</p>
 */
public class ElementIR extends IrExpr {

    private final String tag;
    private final List<AttributeIR> attributes;
    private final List<EventHandlerIR> events;
    private final List<SignalBindingIR> bindings;
    private final Expression ref;           // ref={...}，没有时为 null
    private final List<Expression> children;
    private final boolean isStatic;

    public ElementIR(SourceLocation location, String tag, List<AttributeIR> attributes,
                     List<EventHandlerIR> events, List<SignalBindingIR> bindings, Expression ref,
                     List<Expression> children, boolean isStatic) {
        super(location);
        this.tag = tag;
        this.attributes = attributes;
        this.events = events;
        this.bindings = bindings;
        this.ref = ref;
        this.children = children;
        this.isStatic = isStatic;
    }

    public String getTag() {
        return tag;
    }

    public List<AttributeIR> getAttributes() {
        return attributes;
    }

    public List<EventHandlerIR> getEvents() {
        return events;
    }

    public List<SignalBindingIR> getBindings() {
        return bindings;
    }

    public Expression getRef() {
        return ref;
    }

    /** TextIR、ExpressionChildIR、ElementIR、FragmentIR 或 ComponentCallIR */
    public List<Expression> getJsxChildren() {
        return children;
    }

    /** 没有动态属性、事件、信号绑定和 ref，且所有子节点都是静态的 */
    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(attributes, events, bindings, ref, children);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitElement(this, context);
    }
}
