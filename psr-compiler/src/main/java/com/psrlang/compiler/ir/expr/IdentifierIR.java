package com.psrlang.compiler.ir.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ir.IdentifierScope;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 表达式位置的标识符引用
 */
public class IdentifierIR extends IrExpr {

    private final String name;
    private final IdentifierScope scope;
    private final boolean signalAccessor;

    public IdentifierIR(SourceLocation location, String name, IdentifierScope scope, boolean signalAccessor) {
        super(location);
        this.name = name;
        this.scope = scope;
        this.signalAccessor = signalAccessor;
    }

    public String getName() {
        return name;
    }

    public IdentifierScope getScope() {
        return scope;
    }

    /** 本文件没有该名称的绑定 */
    public boolean isUnbound() {
        return scope == IdentifierScope.GLOBAL;
    }

    public boolean isSignalAccessor() {
        return signalAccessor;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.<AstNode>emptyList();
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
