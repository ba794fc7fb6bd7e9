package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 联合类型
 */
public class UnionType extends TypeNode {
    private final List<TypeNode> types;

    public UnionType(SourceLocation location, String text, List<TypeNode> types) {
        super(location, text);
        this.types = types;
    }

    public List<TypeNode> getTypes() {
        return types;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(types);
    }
}
