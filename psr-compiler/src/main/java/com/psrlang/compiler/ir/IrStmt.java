package com.psrlang.compiler.ir;

import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.stmt.Statement;

/**
 * IR 语句基类，同时也是 AST Statement
 */
public abstract class IrStmt extends Statement implements IrNode {

    protected IrStmt(SourceLocation location) {
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
