package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.decl.ClassDecl;

import java.util.List;

/**
 * 类表达式
 */
public class ClassExpr extends Expression {
    private final ClassDecl declaration;

    public ClassExpr(SourceLocation location, ClassDecl declaration) {
        super(location);
        this.declaration = declaration;
    }

    public ClassDecl getDeclaration() {
        return declaration;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(declaration);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassExpr(this, context);
    }
}
