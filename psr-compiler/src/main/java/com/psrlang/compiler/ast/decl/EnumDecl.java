package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 枚举声明
 */
public class EnumDecl extends Declaration {
    private final boolean constEnum;
    private final List<EnumMember> members;

    public EnumDecl(SourceLocation location, String name, List<Modifier> modifiers, boolean constEnum,
                    List<EnumMember> members) {
        super(location, name, modifiers);
        this.constEnum = constEnum;
        this.members = members;
    }

    public boolean isConstEnum() {
        return constEnum;
    }

    public List<EnumMember> getMembers() {
        return members;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(members);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }
}
