package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * case / default 分支
 */
public class SwitchCase extends AstNode {
    private final Expression test;  // default 分支为 null
    private final List<Statement> consequent;

    public SwitchCase(SourceLocation location, Expression test, List<Statement> consequent) {
        super(location);
        this.test = test;
        this.consequent = consequent;
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getConsequent() {
        return consequent;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(test, consequent);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchCase(this, context);
    }
}
