package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * 类属性成员
 */
public class PropertyMember extends ClassMember {
    private final Expression key;
    private final boolean computed;
    private final boolean optional;
    private final boolean definite;
    private final TypeNode type;
    private final Expression value;

    public PropertyMember(SourceLocation location, List<Modifier> modifiers, List<Decorator> decorators,
                          Expression key, boolean computed, boolean optional, boolean definite,
                          TypeNode type, Expression value) {
        super(location, modifiers, decorators);
        this.key = key;
        this.computed = computed;
        this.optional = optional;
        this.definite = definite;
        this.type = type;
        this.value = value;
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

    public boolean isDefinite() {
        return definite;
    }

    public TypeNode getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(key, type, value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyMember(this, context);
    }
}
