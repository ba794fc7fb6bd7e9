package com.psrlang.compiler.ir.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.decl.Parameter;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;
import com.psrlang.compiler.ir.IrStmt;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * component 声明，发射为在注册表中执行的工厂函数
 */
public class ComponentIR extends IrStmt {

    public static final String KEY_PREFIX = "component:";

    private final String name;
    private final String registryKey;
    private final TypeParams typeParams;
    private final List<Parameter> params;
    private final TypeNode returnType;              // 源码中的返回类型，没有时为 null
    private final Block body;
    private final List<String> reactiveDependencies; // JSX 子树读取的信号，首次出现顺序
    private final boolean usesSignals;
    private final boolean hasEventHandlers;

    public ComponentIR(SourceLocation location, String name, TypeParams typeParams, List<Parameter> params,
                       TypeNode returnType, Block body, List<String> reactiveDependencies,
                       boolean usesSignals, boolean hasEventHandlers) {
        super(location);
        this.name = name;
        this.registryKey = KEY_PREFIX + name;
        this.typeParams = typeParams;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
        this.reactiveDependencies = reactiveDependencies;
        this.usesSignals = usesSignals;
        this.hasEventHandlers = hasEventHandlers;
    }

    public String getName() {
        return name;
    }

    public String getRegistryKey() {
        return registryKey;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public List<String> getReactiveDependencies() {
        return reactiveDependencies;
    }

    public boolean usesSignals() {
        return usesSignals;
    }

    public boolean hasEventHandlers() {
        return hasEventHandlers;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParams, params, returnType, body);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitComponent(this, context);
    }
}
