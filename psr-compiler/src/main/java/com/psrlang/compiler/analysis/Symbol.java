package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final SourceLocation location;  // 声明位置
    private final AstNode declaration;      // 声明的 AST 节点
    private String inferredType;            // 类型注解文本或由初始值推断的类型名
    private boolean used;
    private boolean signal;                 // 信号访问器（由信号创建函数初始化）

    public Symbol(String name, SymbolKind kind, SourceLocation location, AstNode declaration) {
        this.name = name;
        this.kind = kind;
        this.location = location;
        this.declaration = declaration;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public SourceLocation getLocation() { return location; }
    public AstNode getDeclaration() { return declaration; }

    public String getInferredType() { return inferredType; }
    public void setInferredType(String inferredType) { this.inferredType = inferredType; }

    public boolean isUsed() { return used; }
    public void markUsed() { this.used = true; }

    public boolean isSignal() { return signal; }
    public void setSignal(boolean signal) { this.signal = signal; }

    @Override
    public String toString() {
        return kind + " " + name + (inferredType != null ? ": " + inferredType : "");
    }
}
