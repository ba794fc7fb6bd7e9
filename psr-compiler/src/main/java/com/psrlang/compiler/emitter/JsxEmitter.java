package com.psrlang.compiler.emitter;

import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.Literal;
import com.psrlang.compiler.classifier.Category;
import com.psrlang.compiler.ir.IrNode;
import com.psrlang.compiler.ir.jsx.*;
import com.psrlang.compiler.lexer.Lexer;

import java.util.List;

/**
 * JSX IR 的发射
 *
 * <p>静态元素直接写成 {@code t_element(tag, props, children)}。
 * 含绑定、事件、ref 或动态子节点的元素写成立即执行的箭头函数：先创建元素，
 * 再逐个连接绑定和事件、追加子节点，最后返回元素。</p>
 */
final class JsxEmitter {

    private final Emitter emitter;
    private final ExpressionEmitter exprs;

    JsxEmitter(Emitter emitter, ExpressionEmitter exprs) {
        this.emitter = emitter;
        this.exprs = exprs;
    }

    // ========== 元素 ==========

    void emitElement(ElementIR node, EmitContext ctx) {
        if (node.isStatic()) {
            emitStaticElement(node, ctx);
            return;
        }
        String el = ctx.temp("el");
        openIife(ctx);
        ctx.out.append("const ").append(el).append(" = ");
        emitCreate(node.getTag(), node.getAttributes(), ctx);
        // 子节点在后面逐个追加
        ctx.out.line("[]);");

        ctx.pushElement(el);
        try {
            for (SignalBindingIR binding : node.getBindings()) {
                emitter.visitSignalBinding(binding, ctx);
            }
            for (EventHandlerIR event : node.getEvents()) {
                emitter.visitEventHandler(event, ctx);
            }
        } finally {
            ctx.popElement();
        }
        emitChildren(el, node.getJsxChildren(), ctx);
        if (node.getRef() != null) {
            emitRef(el, node.getRef(), ctx);
        }
        closeIife(el, ctx);
    }

    private void emitStaticElement(ElementIR node, EmitContext ctx) {
        emitCreate(node.getTag(), node.getAttributes(), ctx);
        List<Expression> children = node.getJsxChildren();
        ctx.out.append("[");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            emitValue(children.get(i), ctx);
        }
        ctx.out.append("])");
    }

    /** t_element('tag', { props }, 之前的部分 */
    private void emitCreate(String tag, List<AttributeIR> attributes, EmitContext ctx) {
        ctx.out.append(ctx.runtime(RuntimeSymbols.T_ELEMENT)).append("(").append(ctx.quote(tag)).append(", ");
        emitPropsObject(attributes, null, false, ctx);
        ctx.out.append(", ");
    }

    private void emitPropsObject(List<AttributeIR> props, List<Expression> children, boolean deferred,
                                 EmitContext ctx) {
        boolean hasChildren = children != null && !children.isEmpty();
        if (props.isEmpty() && !hasChildren) {
            ctx.out.append("{}");
            return;
        }
        ctx.out.append("{ ");
        for (int i = 0; i < props.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            emitProp(props.get(i), ctx);
        }
        if (hasChildren) {
            if (!props.isEmpty()) ctx.out.append(", ");
            ctx.out.append("children: ");
            if (deferred && children.size() == 1 && startsWithBrace(children.get(0))) {
                ctx.out.append("() => (");
                emitChildrenProp(children, ctx);
                ctx.out.append(")");
            } else {
                if (deferred) {
                    ctx.out.append("() => ");
                }
                emitChildrenProp(children, ctx);
            }
        }
        ctx.out.append(" }");
    }

    /**
     * 对象字面量中的一项：key: value 或 ...spread
     */
    void emitProp(AttributeIR prop, EmitContext ctx) {
        if (prop.isSpread()) {
            ctx.out.append("...");
            exprs.emit(prop.getValue(), Precedence.ASSIGNMENT, ctx);
            return;
        }
        String name = prop.getName();
        ctx.out.append(Lexer.isIdentifier(name) ? name : ctx.quote(name)).append(": ");
        Expression value = prop.getValue();
        if (value == null) {
            ctx.out.append("true");
        } else if (value instanceof Literal && ((Literal) value).isString()) {
            exprs.emitStringValue((Literal) value, ctx);
        } else {
            exprs.emit(value, Precedence.ASSIGNMENT, ctx);
        }
    }

    // ========== 绑定与事件 ==========

    void emitBinding(SignalBindingIR binding, String el, EmitContext ctx) {
        ctx.out.append(ctx.runtime(RuntimeSymbols.REGISTRY)).append(".wire(").append(el).append(", ")
                .append(ctx.quote(binding.getProperty())).append(", ");
        emitGetter(binding.getExpression(), ctx);
        ctx.out.line(");");
    }

    void emitEvent(EventHandlerIR event, String el, EmitContext ctx) {
        ctx.out.append(el).append(".addEventListener(").append(ctx.quote(event.getEventName())).append(", ");
        exprs.emit(event.getHandler(), Precedence.ASSIGNMENT, ctx);
        ctx.out.line(");");
    }

    /** () => expr */
    private void emitGetter(Expression expr, EmitContext ctx) {
        ctx.out.append("() => ");
        if (ExpressionEmitter.needsStatementParens(expr)) {
            ctx.out.append("(");
            exprs.emit(expr, ctx);
            ctx.out.append(")");
        } else {
            exprs.emit(expr, Precedence.ASSIGNMENT, ctx);
        }
    }

    /**
     * ref 为函数时以元素调用，为对象时写入 current
     */
    private void emitRef(String el, Expression ref, EmitContext ctx) {
        String r = ctx.temp("r");
        ctx.out.append("const ").append(r).append(" = ");
        exprs.emit(ref, Precedence.ASSIGNMENT, ctx);
        ctx.out.line(";");
        ctx.out.line("if (typeof " + r + " === 'function') {");
        ctx.out.indent();
        ctx.out.line(r + "(" + el + ");");
        ctx.out.dedent();
        ctx.out.line("} else if (" + r + " && typeof " + r + " === 'object' && 'current' in " + r + ") {");
        ctx.out.indent();
        ctx.out.line(r + ".current = " + el + ";");
        ctx.out.dedent();
        ctx.out.line("}");
    }

    // ========== 片段 ==========

    void emitFragment(FragmentIR node, EmitContext ctx) {
        String frag = ctx.temp("frag");
        openIife(ctx);
        ctx.out.line("const " + frag + " = document.createDocumentFragment();");
        emitChildren(frag, node.getJsxChildren(), ctx);
        closeIife(frag, ctx);
    }

    // ========== 组件调用 ==========

    /**
     * Name({ a: v, ...rest, children: x })；Provider 为 children: () => x
     */
    void emitComponentCall(ComponentCallIR node, EmitContext ctx) {
        exprs.emit(node.getCallee(), Precedence.CALL, ctx);
        ctx.out.append("(");
        emitPropsObject(node.getProps(), node.getJsxChildren(), node.hasDeferredChildren(), ctx);
        ctx.out.append(")");
    }

    /** 单个非展开子节点直接传值，否则传数组 */
    private void emitChildrenProp(List<Expression> children, EmitContext ctx) {
        if (children.size() == 1 && !isSpread(children.get(0))) {
            emitValue(children.get(0), ctx);
            return;
        }
        ctx.out.append("[");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            emitValue(children.get(i), ctx);
        }
        ctx.out.append("]");
    }

    private static boolean startsWithBrace(Expression child) {
        return child instanceof ExpressionChildIR && !((ExpressionChildIR) child).isSpread()
                && ExpressionEmitter.needsStatementParens(((ExpressionChildIR) child).getExpression());
    }

    private static boolean isSpread(Expression child) {
        return child instanceof ExpressionChildIR && ((ExpressionChildIR) child).isSpread();
    }

    /** 子节点作为值出现：文本为字符串，其余按表达式 */
    private void emitValue(Expression child, EmitContext ctx) {
        ((IrNode) child).accept(emitter, ctx);
    }

    // ========== 子节点追加 ==========

    private void emitChildren(String parent, List<Expression> children, EmitContext ctx) {
        for (Expression child : children) {
            if (child instanceof TextIR) {
                ctx.out.line(parent + ".appendChild(document.createTextNode("
                        + ctx.quote(((TextIR) child).getValue()) + "));");
            } else if (child instanceof ExpressionChildIR) {
                emitExpressionChild(parent, (ExpressionChildIR) child, ctx);
            } else {
                ctx.out.append(parent).append(".appendChild(");
                emitValue(child, ctx);
                ctx.out.line(");");
            }
        }
    }

    private void emitExpressionChild(String parent, ExpressionChildIR child, EmitContext ctx) {
        Category category = child.getClassification().getCategory();
        if (!child.getClassification().isReactive()) {
            emitStaticChild(parent, child, ctx);
        } else if (category == Category.DYNAMIC && !child.isSpread()) {
            emitTextBinding(parent, child, ctx);
        } else {
            emitRegion(parent, child, ctx);
        }
    }

    /**
     * 只求值一次：数组逐项追加，null、undefined 和 false 跳过，非节点值转为文本节点
     */
    private void emitStaticChild(String parent, ExpressionChildIR child, EmitContext ctx) {
        String c = ctx.temp("c");
        ctx.out.append("const ").append(c).append(" = ");
        exprs.emit(child.getExpression(), Precedence.ASSIGNMENT, ctx);
        ctx.out.line(";");
        ctx.out.line("for (const _n of (Array.isArray(" + c + ") ? " + c + " : [" + c + "])) {");
        ctx.out.indent();
        ctx.out.line("if (_n === null || _n === undefined || _n === false) continue;");
        ctx.out.line(parent + ".appendChild(_n instanceof Node ? _n : document.createTextNode(String(_n)));");
        ctx.out.dedent();
        ctx.out.line("}");
    }

    /**
     * 读取信号的文本：文本节点的 textContent 随信号更新
     */
    private void emitTextBinding(String parent, ExpressionChildIR child, EmitContext ctx) {
        String txt = ctx.temp("txt");
        ctx.out.line("const " + txt + " = document.createTextNode('');");
        ctx.out.append(ctx.runtime(RuntimeSymbols.REGISTRY)).append(".wire(").append(txt)
                .append(", 'textContent', ");
        if (child.getClassification().isNullable()) {
            ctx.out.append("() => {");
            ctx.out.newLine();
            ctx.out.indent();
            ctx.out.append("const _v = ");
            exprs.emit(child.getExpression(), Precedence.ASSIGNMENT, ctx);
            ctx.out.line(";");
            ctx.out.line("return _v === null || _v === undefined || _v === false ? '' : String(_v);");
            ctx.out.dedent();
            ctx.out.append("}");
        } else {
            emitGetter(child.getExpression(), ctx);
        }
        ctx.out.line(");");
        ctx.out.line(parent + ".appendChild(" + txt + ");");
    }

    /**
     * 条件或列表：注释节点作为锚点，effect 中移除旧节点并在锚点前插入新节点
     */
    private void emitRegion(String parent, ExpressionChildIR child, EmitContext ctx) {
        String anchor = ctx.temp("a");
        String nodes = ctx.temp("n");
        ctx.out.line("const " + anchor + " = document.createComment('');");
        ctx.out.line(parent + ".appendChild(" + anchor + ");");
        ctx.out.line("let " + nodes + ": Node[] = [];");
        ctx.out.line(ctx.runtime(RuntimeSymbols.CREATE_EFFECT) + "(() => {");
        ctx.out.indent();
        ctx.out.line("for (const _old of " + nodes + ") {");
        ctx.out.indent();
        ctx.out.line("_old.parentNode?.removeChild(_old);");
        ctx.out.dedent();
        ctx.out.line("}");
        ctx.out.line(nodes + " = [];");
        ctx.out.append("const _v = ");
        exprs.emit(child.getExpression(), Precedence.ASSIGNMENT, ctx);
        ctx.out.line(";");
        ctx.out.line("for (const _item of (Array.isArray(_v) ? _v : [_v])) {");
        ctx.out.indent();
        ctx.out.line("if (_item === null || _item === undefined || _item === false) continue;");
        ctx.out.line("const _node = _item instanceof Node ? _item : document.createTextNode(String(_item));");
        ctx.out.line("if (_node instanceof DocumentFragment) {");
        ctx.out.indent();
        ctx.out.line(nodes + ".push(...Array.from(_node.childNodes));");
        ctx.out.dedent();
        ctx.out.line("} else {");
        ctx.out.indent();
        ctx.out.line(nodes + ".push(_node);");
        ctx.out.dedent();
        ctx.out.line("}");
        ctx.out.line(anchor + ".parentNode?.insertBefore(_node, " + anchor + ");");
        ctx.out.dedent();
        ctx.out.line("}");
        ctx.out.dedent();
        ctx.out.line("});");
    }

    // ========== 立即执行函数 ==========

    private void openIife(EmitContext ctx) {
        ctx.out.append("(() => {");
        ctx.out.newLine();
        ctx.out.indent();
    }

    private void closeIife(String result, EmitContext ctx) {
        ctx.out.line("return " + result + ";");
        ctx.out.dedent();
        ctx.out.append("})()");
    }
}
