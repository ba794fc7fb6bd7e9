package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.expr.*;
import com.psrlang.compiler.ast.expr.ObjectProperty.PropertyKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 绑定模式工具：解构模式复用表达式节点，这里按模式语义解释它们
 */
public final class Patterns {

    private Patterns() {
    }

    /** 模式中引入的所有绑定标识符（源码顺序） */
    public static List<Identifier> boundIdentifiers(Expression pattern) {
        List<Identifier> result = new ArrayList<Identifier>();
        collect(pattern, result);
        return result;
    }

    public static List<String> boundNames(Expression pattern) {
        List<String> names = new ArrayList<String>();
        for (Identifier id : boundIdentifiers(pattern)) {
            names.add(id.getName());
        }
        return names;
    }

    private static void collect(Expression pattern, List<Identifier> out) {
        if (pattern == null) return;
        if (pattern instanceof Identifier) {
            out.add((Identifier) pattern);
        } else if (pattern instanceof AssignExpr) {
            collect(((AssignExpr) pattern).getTarget(), out);
        } else if (pattern instanceof SpreadElement) {
            collect(((SpreadElement) pattern).getArgument(), out);
        } else if (pattern instanceof ArrayLiteral) {
            for (Expression element : ((ArrayLiteral) pattern).getElements()) {
                collect(element, out);
            }
        } else if (pattern instanceof ObjectLiteral) {
            for (ObjectProperty property : ((ObjectLiteral) pattern).getProperties()) {
                if (property.getKind() == PropertyKind.INIT || property.getKind() == PropertyKind.SPREAD) {
                    collect(property.getValue(), out);
                }
            }
        }
    }

    /** 模式中的默认值表达式（{ a = 1 }、[b = f()]） */
    public static List<Expression> defaultValues(Expression pattern) {
        List<Expression> result = new ArrayList<Expression>();
        collectDefaults(pattern, result);
        return result;
    }

    private static void collectDefaults(Expression pattern, List<Expression> out) {
        if (pattern instanceof AssignExpr) {
            out.add(((AssignExpr) pattern).getValue());
            collectDefaults(((AssignExpr) pattern).getTarget(), out);
        } else if (pattern instanceof SpreadElement) {
            collectDefaults(((SpreadElement) pattern).getArgument(), out);
        } else if (pattern instanceof ArrayLiteral) {
            for (Expression element : ((ArrayLiteral) pattern).getElements()) {
                collectDefaults(element, out);
            }
        } else if (pattern instanceof ObjectLiteral) {
            for (ObjectProperty property : ((ObjectLiteral) pattern).getProperties()) {
                if (property.isComputed()) {
                    out.add(property.getKey());
                }
                collectDefaults(property.getValue(), out);
            }
        }
    }
}
