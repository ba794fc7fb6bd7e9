package com.psrlang.compiler.ir.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.Collections;
import java.util.List;

/**
 * JSX 文本子节点（空白已规范化，实体已解码）
 */
public class TextIR extends IrExpr {

    private final String value;

    public TextIR(SourceLocation location, String value) {
        super(location);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.<AstNode>emptyList();
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitText(this, context);
    }
}
