package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 导出说明符：{ local as exported }
 */
public class ExportSpecifier extends AstNode {
    private final String local;
    private final String exported;
    private final boolean typeOnly;

    public ExportSpecifier(SourceLocation location, String local, String exported, boolean typeOnly) {
        super(location);
        this.local = local;
        this.exported = exported;
        this.typeOnly = typeOnly;
    }

    public String getLocal() {
        return local;
    }

    public String getExported() {
        return exported;
    }

    public boolean isTypeOnly() {
        return typeOnly;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExportSpecifier(this, context);
    }
}
