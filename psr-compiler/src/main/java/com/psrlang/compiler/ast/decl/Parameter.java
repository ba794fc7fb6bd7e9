package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.Identifier;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final Expression pattern;
    private final TypeNode type;
    private final boolean optional;
    private final Expression initializer;
    private final boolean rest;
    private final List<Modifier> modifiers;
    private final List<Decorator> decorators;

    public Parameter(SourceLocation location, Expression pattern, TypeNode type, boolean optional,
                     Expression initializer, boolean rest, List<Modifier> modifiers,
                     List<Decorator> decorators) {
        super(location);
        this.pattern = pattern;
        this.type = type;
        this.optional = optional;
        this.initializer = initializer;
        this.rest = rest;
        this.modifiers = modifiers;
        this.decorators = decorators;
    }

    public Expression getPattern() {
        return pattern;
    }

    public TypeNode getType() {
        return type;
    }

    public boolean isOptional() {
        return optional;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean isRest() {
        return rest;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public List<Decorator> getDecorators() {
        return decorators;
    }

    /** 参数是简单标识符时返回名称，解构参数返回 null */
    public String getName() {
        return pattern instanceof Identifier ? ((Identifier) pattern).getName() : null;
    }

    /** 构造器参数属性（public x: number） */
    public boolean isParameterProperty() {
        return !modifiers.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(pattern, type, initializer, decorators);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
