package com.psrlang.compiler.ast.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * JSX 文本子节点
 */
public class JsxText extends Expression {
    private final String raw;
    private final String value;  // 实体解码并按 JSX 规则折叠空白后的文本

    public JsxText(SourceLocation location, String raw, String value) {
        super(location);
        this.raw = raw;
        this.value = value;
    }

    public String getRaw() {
        return raw;
    }

    public String getValue() {
        return value;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJsxText(this, context);
    }
}
