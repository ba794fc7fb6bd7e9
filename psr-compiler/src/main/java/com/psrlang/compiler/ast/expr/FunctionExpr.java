package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.decl.Parameter;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;

import java.util.List;

/**
 * 函数表达式（也用于方法体）
 */
public class FunctionExpr extends Expression implements FunctionLike {
    private final String name;
    private final TypeParams typeParams;
    private final List<Parameter> params;
    private TypeNode returnType;
    private final Block body;
    private final boolean async;
    private final boolean generator;

    public FunctionExpr(SourceLocation location, String name, TypeParams typeParams, List<Parameter> params,
                        TypeNode returnType, Block body, boolean async, boolean generator) {
        super(location);
        this.name = name;
        this.typeParams = typeParams;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
        this.async = async;
        this.generator = generator;
    }

    public String getName() {
        return name;
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

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, params, returnType, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionExpr(this, context);
    }
}
