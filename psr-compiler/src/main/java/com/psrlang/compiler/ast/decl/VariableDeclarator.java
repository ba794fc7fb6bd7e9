package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.Identifier;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * 单个变量声明项：target[: type][ = init]
 */
public class VariableDeclarator extends AstNode {
    private final Expression target;
    private final TypeNode type;
    private final Expression init;
    private final boolean definite;  // x!: T

    public VariableDeclarator(SourceLocation location, Expression target, TypeNode type, Expression init,
                              boolean definite) {
        super(location);
        this.target = target;
        this.type = type;
        this.init = init;
        this.definite = definite;
    }

    public Expression getTarget() {
        return target;
    }

    public TypeNode getType() {
        return type;
    }

    public Expression getInit() {
        return init;
    }

    public boolean isDefinite() {
        return definite;
    }

    /** 目标是简单标识符时返回其名称 */
    public String getSimpleName() {
        return target instanceof Identifier ? ((Identifier) target).getName() : null;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(target, type, init);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableDeclarator(this, context);
    }
}
