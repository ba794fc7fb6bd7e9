package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 变量声明（var / let / const）
 */
public class VariableDecl extends Statement {
    private final String kind;
    private final List<VariableDeclarator> declarators;
    private final boolean declare;

    public VariableDecl(SourceLocation location, String kind, List<VariableDeclarator> declarators,
                        boolean declare) {
        super(location);
        this.kind = kind;
        this.declarators = declarators;
        this.declare = declare;
    }

    public String getKind() {
        return kind;
    }

    public List<VariableDeclarator> getDeclarators() {
        return declarators;
    }

    public boolean isDeclare() {
        return declare;
    }

    public boolean isConst() {
        return "const".equals(kind);
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(declarators);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableDecl(this, context);
    }
}
