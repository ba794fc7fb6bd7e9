package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * new 表达式
 */
public class NewExpr extends Expression {
    private final Expression callee;
    private final List<TypeNode> typeArgs;
    private final List<Expression> arguments;  // new Foo 无括号时为 null

    public NewExpr(SourceLocation location, Expression callee, List<TypeNode> typeArgs,
                   List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.typeArgs = typeArgs;
        this.arguments = arguments;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<TypeNode> getTypeArgs() {
        return typeArgs;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(callee, typeArgs, arguments);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNewExpr(this, context);
    }
}
