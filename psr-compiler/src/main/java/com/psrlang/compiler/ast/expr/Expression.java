package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 *
 * <p>解构模式复用表达式节点（标识符、数组/对象字面量、带默认值的赋值表达式），
 * 由解析器在确认是绑定位置后按模式语义解释。</p>
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
