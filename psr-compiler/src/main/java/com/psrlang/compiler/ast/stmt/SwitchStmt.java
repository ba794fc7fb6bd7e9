package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * switch 语句
 */
public class SwitchStmt extends Statement {
    private final Expression discriminant;
    private final List<SwitchCase> cases;

    public SwitchStmt(SourceLocation location, Expression discriminant, List<SwitchCase> cases) {
        super(location);
        this.discriminant = discriminant;
        this.cases = cases;
    }

    public Expression getDiscriminant() {
        return discriminant;
    }

    public List<SwitchCase> getCases() {
        return cases;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(discriminant, cases);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchStmt(this, context);
    }
}
