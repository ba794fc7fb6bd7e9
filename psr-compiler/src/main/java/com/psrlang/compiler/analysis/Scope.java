package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 宿主环境
        MODULE,     // 文件顶层
        FUNCTION,   // 函数、方法、箭头函数
        COMPONENT,  // component 声明
        CLASS,      // class body
        BLOCK       // 块、循环、catch
    }

    private final ScopeType type;
    private final Scope parent;
    private final AstNode node;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();
    private final List<Scope> children = new ArrayList<Scope>();

    public Scope(ScopeType type, Scope parent, AstNode node) {
        this.type = type;
        this.parent = parent;
        this.node = node;
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }
    public AstNode getNode() { return node; }
    public Map<String, Symbol> getSymbols() { return symbols; }
    public List<Scope> getChildren() { return children; }

    public void addChild(Scope child) { children.add(child); }

    /**
     * 注册符号到当前作用域；同一作用域内重复声明时保留第一个（函数重载签名、var 重复声明）
     *
     * @return 作用域中的符号
     */
    public Symbol define(Symbol symbol) {
        Symbol existing = symbols.get(symbol.getName());
        if (existing != null) {
            return existing;
        }
        symbols.put(symbol.getName(), symbol);
        return symbol;
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        Symbol s = symbols.get(name);
        if (s != null) return s;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 声明所在的作用域，未找到为 null */
    public Scope findDeclaringScope(String name) {
        Scope scope = this;
        while (scope != null) {
            if (scope.symbols.containsKey(name)) return scope;
            scope = scope.parent;
        }
        return null;
    }

    /** 是否为 other 本身或其祖先 */
    public boolean encloses(Scope other) {
        Scope scope = other;
        while (scope != null) {
            if (scope == this) return true;
            scope = scope.parent;
        }
        return false;
    }

    /** 顶层作用域（GLOBAL 或 MODULE） */
    public boolean isTopLevel() {
        return type == ScopeType.GLOBAL || type == ScopeType.MODULE;
    }
}
