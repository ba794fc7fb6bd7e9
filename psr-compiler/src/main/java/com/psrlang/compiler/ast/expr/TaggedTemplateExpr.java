package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * 带标签模板：tag`...`
 */
public class TaggedTemplateExpr extends Expression {
    private final Expression tag;
    private final List<TypeNode> typeArgs;
    private final TemplateLiteral quasi;

    public TaggedTemplateExpr(SourceLocation location, Expression tag, List<TypeNode> typeArgs,
                              TemplateLiteral quasi) {
        super(location);
        this.tag = tag;
        this.typeArgs = typeArgs;
        this.quasi = quasi;
    }

    public Expression getTag() {
        return tag;
    }

    public List<TypeNode> getTypeArgs() {
        return typeArgs;
    }

    public TemplateLiteral getQuasi() {
        return quasi;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(tag, typeArgs, quasi);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTaggedTemplateExpr(this, context);
    }
}
