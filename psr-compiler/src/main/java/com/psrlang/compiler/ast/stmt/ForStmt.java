package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * C 风格 for 循环
 */
public class ForStmt extends Statement {
    private final AstNode init;  // VariableDecl 或 Expression
    private final Expression test;
    private final Expression update;
    private final Statement body;

    public ForStmt(SourceLocation location, AstNode init, Expression test, Expression update,
                   Statement body) {
        super(location);
        this.init = init;
        this.test = test;
        this.update = update;
        this.body = body;
    }

    public AstNode getInit() {
        return init;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getUpdate() {
        return update;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(init, test, update, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
