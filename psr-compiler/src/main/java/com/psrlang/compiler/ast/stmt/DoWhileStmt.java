package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * do-while 循环
 */
public class DoWhileStmt extends Statement {
    private final Statement body;
    private final Expression condition;

    public DoWhileStmt(SourceLocation location, Statement body, Expression condition) {
        super(location);
        this.body = body;
        this.condition = condition;
    }

    public Statement getBody() {
        return body;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(body, condition);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDoWhileStmt(this, context);
    }
}
