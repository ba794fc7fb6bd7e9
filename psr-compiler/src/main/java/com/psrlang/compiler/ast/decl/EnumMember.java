package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 枚举成员
 */
public class EnumMember extends AstNode {
    private final String name;
    private final Expression init;

    public EnumMember(SourceLocation location, String name, Expression init) {
        super(location);
        this.name = name;
        this.init = init;
    }

    public String getName() {
        return name;
    }

    public Expression getInit() {
        return init;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(init);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumMember(this, context);
    }
}
