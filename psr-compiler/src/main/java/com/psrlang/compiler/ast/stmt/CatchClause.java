package com.psrlang.compiler.ast.stmt;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * catch 子句，参数可省略
 */
public class CatchClause extends AstNode {
    private final Expression param;
    private final TypeNode paramType;
    private final Block body;

    public CatchClause(SourceLocation location, Expression param, TypeNode paramType, Block body) {
        super(location);
        this.param = param;
        this.paramType = paramType;
        this.body = body;
    }

    public Expression getParam() {
        return param;
    }

    public TypeNode getParamType() {
        return paramType;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(param, paramType, body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCatchClause(this, context);
    }
}
