package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 静态初始化块：static { ... }
 */
public class StaticBlockMember extends ClassMember {
    private final Block body;

    public StaticBlockMember(SourceLocation location, List<Modifier> modifiers, List<Decorator> decorators,
                             Block body) {
        super(location, modifiers, decorators);
        this.body = body;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStaticBlockMember(this, context);
    }
}
