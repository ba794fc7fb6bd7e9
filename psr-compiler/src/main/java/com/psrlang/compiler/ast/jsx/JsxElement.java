package com.psrlang.compiler.ast.jsx;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * JSX 元素
 */
public class JsxElement extends Expression {
    private final String tagName;
    private final List<TypeNode> typeArgs;
    private final List<AstNode> attributes;  // JsxAttribute 或 JsxSpreadAttribute
    private final List<Expression> children;
    private final boolean selfClosing;

    public JsxElement(SourceLocation location, String tagName, List<TypeNode> typeArgs,
                      List<AstNode> attributes, List<Expression> children, boolean selfClosing) {
        super(location);
        this.tagName = tagName;
        this.typeArgs = typeArgs;
        this.attributes = attributes;
        this.children = children;
        this.selfClosing = selfClosing;
    }

    public String getTagName() {
        return tagName;
    }

    public List<TypeNode> getTypeArgs() {
        return typeArgs;
    }

    public List<AstNode> getAttributes() {
        return attributes;
    }

    public List<Expression> getJsxChildren() {
        return children;
    }

    public boolean isSelfClosing() {
        return selfClosing;
    }

    /** 首字母大写或带点号的标签是组件调用 */
    public boolean isComponentTag() {
        return !tagName.isEmpty() && (Character.isUpperCase(tagName.charAt(0)) || tagName.indexOf('.') >= 0);
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeArgs, attributes, children);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitJsxElement(this, context);
    }
}
