package com.psrlang.compiler.ir;

import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

/**
 * IR 表达式基类，同时也是 AST Expression
 */
public abstract class IrExpr extends Expression implements IrNode {

    protected IrExpr(SourceLocation location) {
        super(location);
    }

    /**
     * AST visitor 不处理 IR 节点，返回 null
     */
    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
