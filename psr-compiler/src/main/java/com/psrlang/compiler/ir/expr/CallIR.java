package com.psrlang.compiler.ir.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 函数调用
 */
public class CallIR extends IrExpr {

    private final Expression callee;
    private final List<TypeNode> typeArgs;
    private final List<Expression> arguments;
    private final boolean optional;          // a?.()
    private final boolean signalCreation;    // 调用信号创建函数

    public CallIR(SourceLocation location, Expression callee, List<TypeNode> typeArgs,
                  List<Expression> arguments, boolean optional, boolean signalCreation) {
        super(location);
        this.callee = callee;
        this.typeArgs = typeArgs;
        this.arguments = arguments;
        this.optional = optional;
        this.signalCreation = signalCreation;
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

    public boolean isSignalCreation() {
        return signalCreation;
    }

    /** 被调用者为标识符时返回其名称 */
    public String getCalleeName() {
        return callee instanceof IdentifierIR ? ((IdentifierIR) callee).getName() : null;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(callee, typeArgs, arguments);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
