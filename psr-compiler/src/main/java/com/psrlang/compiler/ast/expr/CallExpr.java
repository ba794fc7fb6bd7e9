package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * 函数调用
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<TypeNode> typeArgs;
    private final List<Expression> arguments;
    private final boolean optional;  // f?.()

    public CallExpr(SourceLocation location, Expression callee, List<TypeNode> typeArgs,
                    List<Expression> arguments, boolean optional) {
        super(location);
        this.callee = callee;
        this.typeArgs = typeArgs;
        this.arguments = arguments;
        this.optional = optional;
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

    public boolean isOptional() {
        return optional;
    }

    /** 被调用者为简单标识符时返回其名称 */
    public String getCalleeName() {
        return callee instanceof Identifier ? ((Identifier) callee).getName() : null;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(callee, typeArgs, arguments);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
