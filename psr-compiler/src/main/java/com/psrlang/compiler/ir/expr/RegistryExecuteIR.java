package com.psrlang.compiler.ir.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ir.IrExpr;
import com.psrlang.compiler.ir.IrVisitor;
import com.psrlang.compiler.ir.decl.ComponentIR;

import java.util.List;

/**
 * 检测为组件的函数体：$REGISTRY.execute('component:Name', () => body)
 */
public class RegistryExecuteIR extends IrExpr {

    private final String componentName;
    private final AstNode body;               // Block 或 Expression
    private final List<String> reactiveDependencies;

    public RegistryExecuteIR(SourceLocation location, String componentName, AstNode body,
                             List<String> reactiveDependencies) {
        super(location);
        this.componentName = componentName;
        this.body = body;
        this.reactiveDependencies = reactiveDependencies;
    }

    public String getComponentName() {
        return componentName;
    }

    public String getRegistryKey() {
        return ComponentIR.KEY_PREFIX + componentName;
    }

    public AstNode getBody() {
        return body;
    }

    public List<String> getReactiveDependencies() {
        return reactiveDependencies;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(body);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitRegistryExecute(this, context);
    }
}
