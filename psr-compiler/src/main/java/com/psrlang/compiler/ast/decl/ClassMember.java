package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 类成员基类
 */
public abstract class ClassMember extends AstNode {
    protected final List<Modifier> modifiers;
    protected final List<Decorator> decorators;

    protected ClassMember(SourceLocation location, List<Modifier> modifiers, List<Decorator> decorators) {
        super(location);
        this.modifiers = modifiers != null ? modifiers : Collections.<Modifier>emptyList();
        this.decorators = decorators != null ? decorators : Collections.<Decorator>emptyList();
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public List<Decorator> getDecorators() {
        return decorators;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    public boolean isStatic() {
        return modifiers.contains(Modifier.STATIC);
    }
}
