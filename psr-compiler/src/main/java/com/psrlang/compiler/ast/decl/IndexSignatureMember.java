package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 类索引签名：[key: string]: T
 */
public class IndexSignatureMember extends ClassMember {
    private final String text;

    public IndexSignatureMember(SourceLocation location, List<Modifier> modifiers,
                                List<Decorator> decorators, String text) {
        super(location, modifiers, decorators);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexSignatureMember(this, context);
    }
}
