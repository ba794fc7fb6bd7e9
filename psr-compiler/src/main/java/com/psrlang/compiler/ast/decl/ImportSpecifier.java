package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 导入说明符：{ imported as local }
 */
public class ImportSpecifier extends AstNode {
    private final String imported;
    private final String local;
    private final boolean typeOnly;

    public ImportSpecifier(SourceLocation location, String imported, String local, boolean typeOnly) {
        super(location);
        this.imported = imported;
        this.local = local;
        this.typeOnly = typeOnly;
    }

    public String getImported() {
        return imported;
    }

    public String getLocal() {
        return local;
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
        return visitor.visitImportSpecifier(this, context);
    }
}
