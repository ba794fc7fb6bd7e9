package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 命名空间 / 模块声明
 */
public class NamespaceDecl extends Declaration {
    private final String keyword;  // namespace / module / global
    private final List<Statement> body;  // declare module 'x'; 时为 null

    public NamespaceDecl(SourceLocation location, String name, List<Modifier> modifiers, String keyword,
                         List<Statement> body) {
        super(location, name, modifiers);
        this.keyword = keyword;
        this.body = body;
    }

    public String getKeyword() {
        return keyword;
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
        return visitor.visitNamespaceDecl(this, context);
    }
}
