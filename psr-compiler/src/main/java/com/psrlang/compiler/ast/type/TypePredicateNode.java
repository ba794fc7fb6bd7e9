package com.psrlang.compiler.ast.type;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 类型谓词：x is T / asserts x
 */
public class TypePredicateNode extends TypeNode {
    private final String parameterName;
    private final TypeNode type;
    private final boolean asserts;

    public TypePredicateNode(SourceLocation location, String text, String parameterName, TypeNode type,
                             boolean asserts) {
        super(location, text);
        this.parameterName = parameterName;
        this.type = type;
        this.asserts = asserts;
    }

    public String getParameterName() {
        return parameterName;
    }

    public TypeNode getType() {
        return type;
    }

    public boolean isAsserts() {
        return asserts;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(type);
    }
}
