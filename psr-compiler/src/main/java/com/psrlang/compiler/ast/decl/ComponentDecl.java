package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;

import java.util.List;

/**
 * 组件声明：component Name(props) { ... }
 */
public class ComponentDecl extends Declaration implements FunctionLike {
    private final TypeParams typeParams;
    private final List<Parameter> params;
    private TypeNode returnType;
    private final Block body;

    public ComponentDecl(SourceLocation location, String name, List<Modifier> modifiers,
                         TypeParams typeParams, List<Parameter> params, TypeNode returnType, Block body) {
        super(location, name, modifiers);
        this.typeParams = typeParams;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    public void setReturnType(TypeNode returnType) {
        this.returnType = returnType;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public boolean isAsync() {
        return false;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, params, returnType, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComponentDecl(this, context);
    }
}
