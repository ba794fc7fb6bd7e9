package com.psrlang.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    /**
     * 直接子节点（按源码顺序），用于通用遍历
     */
    public abstract List<AstNode> getChildren();

    /** 收集非空子节点；参数可以是 AstNode 或 AstNode 列表 */
    protected static List<AstNode> childrenOf(Object... parts) {
        List<AstNode> result = new ArrayList<AstNode>();
        for (Object part : parts) {
            if (part instanceof AstNode) {
                result.add((AstNode) part);
            } else if (part instanceof List) {
                for (Object item : (List<?>) part) {
                    if (item instanceof AstNode) {
                        result.add((AstNode) item);
                    }
                }
            }
        }
        return result.isEmpty() ? Collections.<AstNode>emptyList() : result;
    }
}
