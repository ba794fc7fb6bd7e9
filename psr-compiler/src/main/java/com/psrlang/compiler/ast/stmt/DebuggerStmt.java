package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * debugger 语句
 */
public class DebuggerStmt extends Statement {
    public DebuggerStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDebuggerStmt(this, context);
    }
}
