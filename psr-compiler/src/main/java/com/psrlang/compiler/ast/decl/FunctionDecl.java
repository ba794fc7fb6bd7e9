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
 * 函数声明
 */
public class FunctionDecl extends Declaration implements FunctionLike {
    private final TypeParams typeParams;
    private final List<Parameter> params;
    private TypeNode returnType;
    private final Block body;
    private final boolean async;
    private final boolean generator;

    public FunctionDecl(SourceLocation location, String name, List<Modifier> modifiers,
                        TypeParams typeParams, List<Parameter> params, TypeNode returnType, Block body,
                        boolean async, boolean generator) {
        super(location, name, modifiers);
        this.typeParams = typeParams;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
        this.async = async;
        this.generator = generator;
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

    public boolean isAsync() {
        return async;
    }

    public boolean isGenerator() {
        return generator;
    }

    /** 重载签名或 declare function 没有函数体 */
    public boolean isSignatureOnly() {
        return body == null;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, params, returnType, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
