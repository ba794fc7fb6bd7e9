package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.type.ObjectTypeNode;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;

import java.util.List;

/**
 * 接口声明
 */
public class InterfaceDecl extends Declaration {
    private final TypeParams typeParams;
    private final List<TypeNode> extendsTypes;
    private final ObjectTypeNode body;

    public InterfaceDecl(SourceLocation location, String name, List<Modifier> modifiers,
                         TypeParams typeParams, List<TypeNode> extendsTypes, ObjectTypeNode body) {
        super(location, name, modifiers);
        this.typeParams = typeParams;
        this.extendsTypes = extendsTypes;
        this.body = body;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public List<TypeNode> getExtendsTypes() {
        return extendsTypes;
    }

    public ObjectTypeNode getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, extendsTypes, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInterfaceDecl(this, context);
    }
}
