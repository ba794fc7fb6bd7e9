package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 对象类型字面量：{ a: string; b(): void }
 */
public class ObjectTypeNode extends TypeNode {
    public ObjectTypeNode(SourceLocation location, String text) {
        super(location, text);
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }
}
