package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.MethodKind;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.FunctionExpr;

import java.util.List;

/**
 * 类方法成员（含构造器与访问器）
 */
public class MethodMember extends ClassMember {
    private final MethodKind kind;
    private final Expression key;
    private final boolean computed;
    private final boolean optional;
    private final FunctionExpr function;

    public MethodMember(SourceLocation location, List<Modifier> modifiers, List<Decorator> decorators,
                        MethodKind kind, Expression key, boolean computed, boolean optional,
                        FunctionExpr function) {
        super(location, modifiers, decorators);
        this.kind = kind;
        this.key = key;
        this.computed = computed;
        this.optional = optional;
        this.function = function;
    }

    public MethodKind getKind() {
        return kind;
    }

    public Expression getKey() {
        return key;
    }

    public boolean isComputed() {
        return computed;
    }

    public boolean isOptional() {
        return optional;
    }

    public FunctionExpr getFunction() {
        return function;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(key, function);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodMember(this, context);
    }
}
