package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 导出声明
 */
public class ExportDecl extends Statement {
    private final ExportKind kind;
    private final Statement declaration;
    private final Expression expression;
    private final List<ExportSpecifier> specifiers;
    private final String source;
    private final String namespaceAlias;
    private final boolean typeOnly;

    public ExportDecl(SourceLocation location, ExportKind kind, Statement declaration, Expression expression,
                      List<ExportSpecifier> specifiers, String source, String namespaceAlias,
                      boolean typeOnly) {
        super(location);
        this.kind = kind;
        this.declaration = declaration;
        this.expression = expression;
        this.specifiers = specifiers;
        this.source = source;
        this.namespaceAlias = namespaceAlias;
        this.typeOnly = typeOnly;
    }

    public ExportKind getKind() {
        return kind;
    }

    public Statement getDeclaration() {
        return declaration;
    }

    public Expression getExpression() {
        return expression;
    }

    public List<ExportSpecifier> getSpecifiers() {
        return specifiers;
    }

    public String getSource() {
        return source;
    }

    public String getNamespaceAlias() {
        return namespaceAlias;
    }

    public boolean isTypeOnly() {
        return typeOnly;
    }

    /**
     * 导出形式
     */
    public enum ExportKind {
        /** export const/function/class ... */
        DECLARATION,
        /** export { a, b as c } [from 'x'] */
        NAMED,
        /** export * [as ns] from 'x' */
        ALL,
        /** export default expr */
        DEFAULT_EXPRESSION,
        /** export default function/class/component ... */
        DEFAULT_DECLARATION
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(declaration, expression, specifiers);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExportDecl(this, context);
    }
}
