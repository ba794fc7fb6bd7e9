package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 导入声明
 */
public class ImportDecl extends Statement {
    private final String source;
    private final String defaultBinding;
    private final String namespaceBinding;
    private final List<ImportSpecifier> specifiers;
    private final boolean typeOnly;

    public ImportDecl(SourceLocation location, String source, String defaultBinding, String namespaceBinding,
                      List<ImportSpecifier> specifiers, boolean typeOnly) {
        super(location);
        this.source = source;
        this.defaultBinding = defaultBinding;
        this.namespaceBinding = namespaceBinding;
        this.specifiers = specifiers;
        this.typeOnly = typeOnly;
    }

    public String getSource() {
        return source;
    }

    public String getDefaultBinding() {
        return defaultBinding;
    }

    public String getNamespaceBinding() {
        return namespaceBinding;
    }

    public List<ImportSpecifier> getSpecifiers() {
        return specifiers;
    }

    public boolean isTypeOnly() {
        return typeOnly;
    }

    /** 仅导入副作用：import 'x'; */
    public boolean isSideEffectOnly() {
        return defaultBinding == null && namespaceBinding == null && specifiers.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(specifiers);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
