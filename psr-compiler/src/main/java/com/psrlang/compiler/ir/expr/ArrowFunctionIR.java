package com.psrlang.compiler.ir.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.decl.Parameter;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 箭头函数
 */
public class ArrowFunctionIR extends IrExpr {

    private final TypeParams typeParams;
    private final List<Parameter> params;
    private final TypeNode returnType;
    private final AstNode body;               // Block 或 Expression
    private final boolean async;
    private final List<String> captures;      // 引用的外层绑定
    private final boolean pure;               // 不调用函数，也不修改捕获的变量

    public ArrowFunctionIR(SourceLocation location, TypeParams typeParams, List<Parameter> params,
                           TypeNode returnType, AstNode body, boolean async,
                           List<String> captures, boolean pure) {
        super(location);
        this.typeParams = typeParams;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
        this.async = async;
        this.captures = captures;
        this.pure = pure;
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

    public AstNode getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    public List<String> getCaptures() {
        return captures;
    }

    public boolean isPure() {
        return pure;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, params, returnType, body);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitArrowFunction(this, context);
    }
}
