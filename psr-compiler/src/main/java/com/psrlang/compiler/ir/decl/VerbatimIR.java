package com.psrlang.compiler.ir.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ir.IrStmt;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 原样输出的源码片段：interface、type 别名、declare 声明、重载签名、enum 和 namespace
 */
public class VerbatimIR extends IrStmt {

    private final String text;
    private final String kind;  // 来源声明种类，仅用于调试输出

    public VerbatimIR(SourceLocation location, String text, String kind) {
        super(location);
        this.text = text;
        this.kind = kind;
    }

    public String getText() {
        return text;
    }

    public String getKind() {
        return kind;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.<AstNode>emptyList();
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitVerbatim(this, context);
    }
}
