package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 模板字符串
 */
public class TemplateLiteral extends Expression {
    private final List<String> rawQuasis;  // 原样文本片段
    private final List<String> cookedQuasis;
    private final List<Expression> expressions;

    public TemplateLiteral(SourceLocation location, List<String> rawQuasis, List<String> cookedQuasis,
                           List<Expression> expressions) {
        super(location);
        this.rawQuasis = rawQuasis;
        this.cookedQuasis = cookedQuasis;
        this.expressions = expressions;
    }

    public List<String> getRawQuasis() {
        return rawQuasis;
    }

    public List<String> getCookedQuasis() {
        return cookedQuasis;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expressions);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTemplateLiteral(this, context);
    }
}
