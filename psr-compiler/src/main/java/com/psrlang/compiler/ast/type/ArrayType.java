package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组类型：T[]
 */
public class ArrayType extends TypeNode {
    private final TypeNode elementType;

    public ArrayType(SourceLocation location, String text, TypeNode elementType) {
        super(location, text);
        this.elementType = elementType;
    }

    public TypeNode getElementType() {
        return elementType;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(elementType);
    }
}
