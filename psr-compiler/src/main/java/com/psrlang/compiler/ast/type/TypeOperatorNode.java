package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 类型运算符：keyof T / readonly T[] / unique symbol
 */
public class TypeOperatorNode extends TypeNode {
    private final String operator;
    private final TypeNode type;

    public TypeOperatorNode(SourceLocation location, String text, String operator, TypeNode type) {
        super(location, text);
        this.operator = operator;
        this.type = type;
    }

    public String getOperator() {
        return operator;
    }

    public TypeNode getType() {
        return type;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(type);
    }
}
