package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 符号表：作用域树、节点到作用域的映射和扁平的名称索引
 */
public final class SymbolTable {
    private final Scope globalScope;
    private final Map<AstNode, Scope> nodeToScope = new IdentityHashMap<AstNode, Scope>();
    private final Map<String, List<Symbol>> byName = new LinkedHashMap<String, List<Symbol>>();

    public SymbolTable() {
        this.globalScope = new Scope(Scope.ScopeType.GLOBAL, null, null);
    }

    public Scope getGlobalScope() { return globalScope; }

    /** 记录 AST 节点到作用域的映射 */
    public void mapNodeToScope(AstNode node, Scope scope) {
        nodeToScope.put(node, scope);
    }

    /** 节点引入的作用域，不引入作用域的节点返回 null */
    public Scope getScope(AstNode node) {
        return nodeToScope.get(node);
    }

    /** 在作用域中定义符号并加入名称索引 */
    public Symbol define(Scope scope, Symbol symbol) {
        Symbol defined = scope.define(symbol);
        if (defined == symbol) {
            List<Symbol> list = byName.get(symbol.getName());
            if (list == null) {
                list = new ArrayList<Symbol>();
                byName.put(symbol.getName(), list);
            }
            list.add(symbol);
        }
        return defined;
    }

    /** 所有作用域中同名的符号（声明顺序） */
    public List<Symbol> lookupAll(String name) {
        List<Symbol> list = byName.get(name);
        return list != null ? list : new ArrayList<Symbol>();
    }

    /** 获取所有指定类型的符号 */
    public List<Symbol> getAllSymbolsOfKind(SymbolKind... kinds) {
        List<Symbol> result = new ArrayList<Symbol>();
        for (List<Symbol> symbols : byName.values()) {
            for (Symbol sym : symbols) {
                for (SymbolKind kind : kinds) {
                    if (sym.getKind() == kind) {
                        result.add(sym);
                        break;
                    }
                }
            }
        }
        return result;
    }
}
