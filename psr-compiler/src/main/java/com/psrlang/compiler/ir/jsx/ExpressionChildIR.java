package com.psrlang.compiler.ir.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.classifier.Category;
import com.psrlang.compiler.classifier.Classification;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * JSX 中的 {expression} 子节点
 */
public class ExpressionChildIR extends IrExpr {

    private final Expression expression;
    private final Classification classification;
    private final boolean spread;   // {...items}

    public ExpressionChildIR(SourceLocation location, Expression expression,
                             Classification classification, boolean spread) {
        super(location);
        this.expression = expression;
        this.classification = classification;
        this.spread = spread;
    }

    public Expression getExpression() {
        return expression;
    }

    public Classification getClassification() {
        return classification;
    }

    public boolean isSpread() {
        return spread;
    }

    public boolean isStatic() {
        return classification.getCategory() == Category.STATIC;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionChild(this, context);
    }
}
