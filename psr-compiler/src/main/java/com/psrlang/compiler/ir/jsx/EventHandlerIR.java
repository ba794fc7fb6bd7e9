package com.psrlang.compiler.ir.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ir.IrNode;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 事件属性，发射为 el.addEventListener(eventName, handler)
 */
public class EventHandlerIR extends AstNode implements IrNode {

    private final String attribute;   // onClick
    private final String eventName;   // click
    private final Expression handler;

    public EventHandlerIR(SourceLocation location, String attribute, Expression handler) {
        super(location);
        this.attribute = attribute;
        this.eventName = attribute.substring(2).toLowerCase();
        this.handler = handler;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getEventName() {
        return eventName;
    }

    public Expression getHandler() {
        return handler;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(handler);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitEventHandler(this, context);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
