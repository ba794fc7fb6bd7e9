package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 其余类型形式（映射类型、模板字面量类型、typeof 查询、infer 等）只保留文本
 */
public class RawTypeNode extends TypeNode {
    public RawTypeNode(SourceLocation location, String text) {
        super(location, text);
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }
}
