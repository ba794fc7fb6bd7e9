package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 元组类型
 */
public class TupleType extends TypeNode {
    private final List<TypeNode> elements;

    public TupleType(SourceLocation location, String text, List<TypeNode> elements) {
        super(location, text);
        this.elements = elements;
    }

    public List<TypeNode> getElements() {
        return elements;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(elements);
    }
}
