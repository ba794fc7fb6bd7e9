package com.psrlang.compiler.ir;

import com.psrlang.compiler.ast.SourceLocation;

/**
 * IR 节点接口
 *
 * <p>IR 是面向发射的中间表示：JSX、组件、调用、标识符和箭头函数换成 IR 节点，
 * 其余语句和表达式保留为重建后的 AST 节点。IR 表达式和语句同时继承 AST 基类，
 * 因此可以直接挂在 AST 子树中。</p>
 */
public interface IrNode {

    SourceLocation getLocation();

    <R, C> R accept(IrVisitor<R, C> visitor, C context);
}
