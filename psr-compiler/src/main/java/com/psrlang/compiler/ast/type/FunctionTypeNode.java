package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数类型：(a: A) => R
 */
public class FunctionTypeNode extends TypeNode {
    private final TypeNode returnType;

    public FunctionTypeNode(SourceLocation location, String text, TypeNode returnType) {
        super(location, text);
        this.returnType = returnType;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(returnType);
    }
}
