package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.AstNode;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 子节点到父节点的非持有映射，按需构建
 */
public final class ParentMap {

    private final Map<AstNode, AstNode> parents = new IdentityHashMap<AstNode, AstNode>();

    private ParentMap() {
    }

    public static ParentMap build(AstNode root) {
        final ParentMap map = new ParentMap();
        AstWalker.walk(root, new AstWalker.NodeFilter() {
            @Override
            public boolean enter(AstNode node) {
                for (AstNode child : node.getChildren()) {
                    map.parents.put(child, node);
                }
                return true;
            }
        });
        return map;
    }

    /** 父节点，根节点或不在树中时为 null */
    public AstNode getParent(AstNode node) {
        return parents.get(node);
    }

    /** 最近的指定类型祖先（不含自身） */
    public <T extends AstNode> T findAncestor(AstNode node, Class<T> type) {
        AstNode current = parents.get(node);
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = parents.get(current);
        }
        return null;
    }
}
