package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 类型引用：Name / Name<Args> / A.B
 */
public class TypeReference extends TypeNode {
    private final String name;
    private final List<TypeNode> typeArgs;

    public TypeReference(SourceLocation location, String text, String name, List<TypeNode> typeArgs) {
        super(location, text);
        this.name = name;
        this.typeArgs = typeArgs;
    }

    public String getName() {
        return name;
    }

    public List<TypeNode> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeArgs);
    }
}
