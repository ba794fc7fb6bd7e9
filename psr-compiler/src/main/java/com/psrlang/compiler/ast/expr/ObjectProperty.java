package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 对象字面量属性
 */
public class ObjectProperty extends AstNode {
    private final PropertyKind kind;
    private final Expression key;
    private final boolean computed;
    private final boolean shorthand;
    private final Expression value;

    public ObjectProperty(SourceLocation location, PropertyKind kind, Expression key, boolean computed,
                          boolean shorthand, Expression value) {
        super(location);
        this.kind = kind;
        this.key = key;
        this.computed = computed;
        this.shorthand = shorthand;
        this.value = value;
    }

    public PropertyKind getKind() {
        return kind;
    }

    public Expression getKey() {
        return key;
    }

    public boolean isComputed() {
        return computed;
    }

    public boolean isShorthand() {
        return shorthand;
    }

    public Expression getValue() {
        return value;
    }

    /** 非计算属性的键名（标识符或字符串/数字字面量） */
    public String getKeyName() {
        if (computed || key == null) return null;
        if (key instanceof Identifier) return ((Identifier) key).getName();
        if (key instanceof Literal) return String.valueOf(((Literal) key).getValue());
        return null;
    }

    /**
     * 属性种类
     */
    public enum PropertyKind {
        INIT,
        GET,
        SET,
        METHOD,
        SPREAD
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(key, value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectProperty(this, context);
    }
}
