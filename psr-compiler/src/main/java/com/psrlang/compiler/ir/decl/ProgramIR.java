package com.psrlang.compiler.ir.decl;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.decl.ImportDecl;
import com.psrlang.compiler.ast.stmt.Statement;
import com.psrlang.compiler.ir.IrStmt;
import com.psrlang.compiler.ir.IrVisitor;

import java.util.List;

/**
 * 编译单元的 IR 根节点
 */
public class ProgramIR extends IrStmt {

    private final String fileName;
    private final List<ImportDecl> imports;      // 源码中的导入，发射时并入导入注册表
    private final List<Statement> body;          // 其余顶层语句
    private final List<ComponentIR> components;  // 所有组件（含嵌套），源码顺序
    private final boolean usesJsx;

    public ProgramIR(SourceLocation location, String fileName, List<ImportDecl> imports,
                     List<Statement> body, List<ComponentIR> components, boolean usesJsx) {
        super(location);
        this.fileName = fileName;
        this.imports = imports;
        this.body = body;
        this.components = components;
        this.usesJsx = usesJsx;
    }

    public String getFileName() {
        return fileName;
    }

    public List<ImportDecl> getImports() {
        return imports;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<ComponentIR> getComponents() {
        return components;
    }

    public boolean usesJsx() {
        return usesJsx;
    }

    /** 按名称查找组件，不存在时为 null */
    public ComponentIR findComponent(String name) {
        for (ComponentIR component : components) {
            if (component.getName().equals(name)) {
                return component;
            }
        }
        return null;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(imports, body);
    }

    @Override
    public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
