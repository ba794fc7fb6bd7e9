package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * for-in / for-of / for await 循环
 */
public class ForInStmt extends Statement {
    private final AstNode left;  // VariableDecl 或赋值目标
    private final Expression right;
    private final Statement body;
    private final boolean of;
    private final boolean await;

    public ForInStmt(SourceLocation location, AstNode left, Expression right, Statement body, boolean of,
                     boolean await) {
        super(location);
        this.left = left;
        this.right = right;
        this.body = body;
        this.of = of;
        this.await = await;
    }

    public AstNode getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public Statement getBody() {
        return body;
    }

    public boolean isOf() {
        return of;
    }

    public boolean isAwait() {
        return await;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(left, right, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForInStmt(this, context);
    }
}
