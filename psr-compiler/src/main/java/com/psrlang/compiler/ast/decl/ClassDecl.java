package com.psrlang.compiler.ast.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;

import java.util.List;

/**
 * 类声明
 */
public class ClassDecl extends Declaration {
    private final TypeParams typeParams;
    private final Expression superClass;
    private final List<TypeNode> superTypeArgs;
    private final List<TypeNode> implementsTypes;
    private final List<ClassMember> members;
    private final List<Decorator> decorators;

    public ClassDecl(SourceLocation location, String name, List<Modifier> modifiers, TypeParams typeParams,
                     Expression superClass, List<TypeNode> superTypeArgs, List<TypeNode> implementsTypes,
                     List<ClassMember> members, List<Decorator> decorators) {
        super(location, name, modifiers);
        this.typeParams = typeParams;
        this.superClass = superClass;
        this.superTypeArgs = superTypeArgs;
        this.implementsTypes = implementsTypes;
        this.members = members;
        this.decorators = decorators;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public Expression getSuperClass() {
        return superClass;
    }

    public List<TypeNode> getSuperTypeArgs() {
        return superTypeArgs;
    }

    public List<TypeNode> getImplementsTypes() {
        return implementsTypes;
    }

    public List<ClassMember> getMembers() {
        return members;
    }

    public List<Decorator> getDecorators() {
        return decorators;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, superClass, superTypeArgs, implementsTypes, members, decorators);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }
}
