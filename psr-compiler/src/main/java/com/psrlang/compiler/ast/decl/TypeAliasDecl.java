package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;

import java.util.List;

/**
 * 类型别名声明
 */
public class TypeAliasDecl extends Declaration {
    private final TypeParams typeParams;
    private final TypeNode type;

    public TypeAliasDecl(SourceLocation location, String name, List<Modifier> modifiers,
                         TypeParams typeParams, TypeNode type) {
        super(location, name, modifiers);
        this.typeParams = typeParams;
        this.type = type;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public TypeNode getType() {
        return type;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, type);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAliasDecl(this, context);
    }
}
