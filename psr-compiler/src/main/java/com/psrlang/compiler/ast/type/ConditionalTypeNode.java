package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 条件类型：A extends B ? C : D
 */
public class ConditionalTypeNode extends TypeNode {
    private final TypeNode checkType;
    private final TypeNode extendsType;
    private final TypeNode trueType;
    private final TypeNode falseType;

    public ConditionalTypeNode(SourceLocation location, String text, TypeNode checkType,
                               TypeNode extendsType, TypeNode trueType, TypeNode falseType) {
        super(location, text);
        this.checkType = checkType;
        this.extendsType = extendsType;
        this.trueType = trueType;
        this.falseType = falseType;
    }

    public TypeNode getCheckType() {
        return checkType;
    }

    public TypeNode getExtendsType() {
        return extendsType;
    }

    public TypeNode getTrueType() {
        return trueType;
    }

    public TypeNode getFalseType() {
        return falseType;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(checkType, extendsType, trueType, falseType);
    }
}
