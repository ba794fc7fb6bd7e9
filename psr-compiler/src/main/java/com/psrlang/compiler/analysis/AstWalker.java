package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.decl.ComponentDecl;
import com.psrlang.compiler.ast.decl.FunctionDecl;
import com.psrlang.compiler.ast.expr.ArrowFunction;
import com.psrlang.compiler.ast.expr.FunctionExpr;
import com.psrlang.compiler.ast.jsx.JsxElement;
import com.psrlang.compiler.ast.jsx.JsxFragment;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 先序遍历 AST（显式栈，不受语法树深度影响）
 */
public final class AstWalker {

    /**
     * 遍历回调
     */
    public interface NodeFilter {
        /**
         * @return false 时跳过该节点的子树
         */
        boolean enter(AstNode node);
    }

    private AstWalker() {
    }

    public static void walk(AstNode root, NodeFilter filter) {
        if (root == null) return;
        Deque<AstNode> stack = new ArrayDeque<AstNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            if (!filter.enter(node)) continue;
            List<AstNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /** 函数边界：函数声明、函数表达式、箭头函数和组件声明 */
    public static boolean isFunctionBoundary(AstNode node) {
        return node instanceof FunctionDecl || node instanceof FunctionExpr
                || node instanceof ArrowFunction || node instanceof ComponentDecl;
    }

    public static boolean isJsx(AstNode node) {
        return node instanceof JsxElement || node instanceof JsxFragment;
    }

    /**
     * 子树中是否出现 JSX
     *
     * @param crossFunctions 是否进入嵌套函数内部
     */
    public static boolean containsJsx(AstNode root, final boolean crossFunctions) {
        final boolean[] found = {false};
        walk(root, new NodeFilter() {
            @Override
            public boolean enter(AstNode node) {
                if (found[0]) return false;
                if (isJsx(node)) {
                    found[0] = true;
                    return false;
                }
                return crossFunctions || node == root || !isFunctionBoundary(node);
            }
        });
        return found[0];
    }

    /** 统计子树节点数（含根） */
    public static int countNodes(AstNode root) {
        final int[] count = {0};
        walk(root, new NodeFilter() {
            @Override
            public boolean enter(AstNode node) {
                count[0]++;
                return true;
            }
        });
        return count[0];
    }
}
