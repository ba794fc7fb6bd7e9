package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 索引访问类型：T[K]
 */
public class IndexedAccessType extends TypeNode {
    private final TypeNode objectType;
    private final TypeNode indexType;

    public IndexedAccessType(SourceLocation location, String text, TypeNode objectType, TypeNode indexType) {
        super(location, text);
        this.objectType = objectType;
        this.indexType = indexType;
    }

    public TypeNode getObjectType() {
        return objectType;
    }

    public TypeNode getIndexType() {
        return indexType;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(objectType, indexType);
    }
}
