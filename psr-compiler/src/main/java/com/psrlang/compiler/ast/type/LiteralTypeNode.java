package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字面量类型：'a' / 1 / true
 */
public class LiteralTypeNode extends TypeNode {
    public LiteralTypeNode(SourceLocation location, String text) {
        super(location, text);
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }
}
