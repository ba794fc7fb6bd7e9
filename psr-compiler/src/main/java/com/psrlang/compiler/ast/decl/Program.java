package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 程序（单个源文件）
 */
public class Program extends AstNode {
    private final List<Statement> body;

    public Program(SourceLocation location, List<Statement> body) {
        super(location);
        this.body = body;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
