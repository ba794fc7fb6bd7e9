package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * try 语句
 */
public class TryStmt extends Statement {
    private final Block block;
    private final CatchClause handler;
    private final Block finalizer;

    public TryStmt(SourceLocation location, Block block, CatchClause handler, Block finalizer) {
        super(location);
        this.block = block;
        this.handler = handler;
        this.finalizer = finalizer;
    }

    public Block getBlock() {
        return block;
    }

    public CatchClause getHandler() {
        return handler;
    }

    public Block getFinalizer() {
        return finalizer;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(block, handler, finalizer);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTryStmt(this, context);
    }
}
