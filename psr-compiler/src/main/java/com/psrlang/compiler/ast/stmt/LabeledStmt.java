package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 带标签语句
 */
public class LabeledStmt extends Statement {
    private final String label;
    private final Statement body;

    public LabeledStmt(SourceLocation location, String label, Statement body) {
        super(location);
        this.label = label;
        this.body = body;
    }

    public String getLabel() {
        return label;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLabeledStmt(this, context);
    }
}
