package com.psrlang.compiler.ir.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 片段 &lt;&gt;...&lt;/&gt;，发射为 DocumentFragment
 */
public class FragmentIR extends IrExpr {

    private final List<Expression> children;

    public FragmentIR(SourceLocation location, List<Expression> children) {
        super(location);
        this.children = children;
    }

    public List<Expression> getJsxChildren() {
        return children;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(children);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitFragment(this, context);
    }
}
