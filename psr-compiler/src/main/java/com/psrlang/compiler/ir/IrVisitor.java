package com.psrlang.compiler.ir;

import com.psrlang.compiler.ir.decl.ComponentIR;
import com.psrlang.compiler.ir.decl.ProgramIR;
import com.psrlang.compiler.ir.decl.VerbatimIR;
import com.psrlang.compiler.ir.expr.ArrowFunctionIR;
import com.psrlang.compiler.ir.expr.CallIR;
import com.psrlang.compiler.ir.expr.IdentifierIR;
import com.psrlang.compiler.ir.expr.RegistryExecuteIR;
import com.psrlang.compiler.ir.jsx.*;

/**
 * IR 访问者接口
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface IrVisitor<R, C> {

    // ===== 声明 =====
    R visitProgram(ProgramIR node, C context);
    R visitComponent(ComponentIR node, C context);
    R visitVerbatim(VerbatimIR node, C context);

    // ===== 表达式 =====
    R visitCall(CallIR node, C context);
    R visitIdentifier(IdentifierIR node, C context);
    R visitArrowFunction(ArrowFunctionIR node, C context);
    R visitRegistryExecute(RegistryExecuteIR node, C context);

    // ===== JSX =====
    R visitElement(ElementIR node, C context);
    R visitFragment(FragmentIR node, C context);
    R visitComponentCall(ComponentCallIR node, C context);
    R visitText(TextIR node, C context);
    R visitExpressionChild(ExpressionChildIR node, C context);
    R visitAttribute(AttributeIR node, C context);
    R visitSignalBinding(SignalBindingIR node, C context);
    R visitEventHandler(EventHandlerIR node, C context);
}
