package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 具名声明基类
 */
public abstract class Declaration extends Statement {
    protected final String name;
    protected final List<Modifier> modifiers;

    protected Declaration(SourceLocation location, String name, List<Modifier> modifiers) {
        super(location);
        this.name = name;
        this.modifiers = modifiers != null ? modifiers : Collections.<Modifier>emptyList();
    }

    public String getName() {
        return name;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    /** 环境声明（declare）不产生运行时代码 */
    public boolean isAmbient() {
        return modifiers.contains(Modifier.DECLARE);
    }
}
