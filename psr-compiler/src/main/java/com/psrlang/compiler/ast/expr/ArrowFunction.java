package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.decl.Parameter;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;

import java.util.List;

/**
 * 箭头函数
 */
public class ArrowFunction extends Expression implements FunctionLike {
    private final TypeParams typeParams;
    private final List<Parameter> params;
    private TypeNode returnType;
    private final AstNode body;  // Block 或 Expression
    private final boolean async;

    public ArrowFunction(SourceLocation location, TypeParams typeParams, List<Parameter> params,
                         TypeNode returnType, AstNode body, boolean async) {
        super(location);
        this.typeParams = typeParams;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
        this.async = async;
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

    public AstNode getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public String getName() {
        return null;
    }

    public boolean hasExpressionBody() {
        return body instanceof Expression;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, params, returnType, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrowFunction(this, context);
    }
}
