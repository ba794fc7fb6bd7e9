package com.psrlang.compiler.emitter;

import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.decl.Parameter;
import com.psrlang.compiler.ast.expr.*;
import com.psrlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.psrlang.compiler.ast.jsx.JsxElement;
import com.psrlang.compiler.ast.jsx.JsxFragment;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;
import com.psrlang.compiler.ir.IrNode;
import com.psrlang.compiler.ir.expr.ArrowFunctionIR;
import com.psrlang.compiler.ir.expr.CallIR;
import com.psrlang.compiler.ir.expr.IdentifierIR;

import java.util.List;

/**
 * 表达式发射
 *
 * <p>按优先级决定括号：子表达式优先级低于所在位置要求时才加括号。
 * IR 表达式交给 {@link Emitter} 的 IrVisitor 分派。</p>
 */
final class ExpressionEmitter implements AstVisitor<Void, EmitContext> {

    private final Emitter emitter;

    ExpressionEmitter(Emitter emitter) {
        this.emitter = emitter;
    }

    // ========== 入口 ==========

    void emit(Expression expr, EmitContext ctx) {
        emit(expr, Precedence.SEQUENCE, ctx);
    }

    void emit(Expression expr, int minPrecedence, EmitContext ctx) {
        if (expr == null) return;
        boolean parens = Precedence.of(expr) < minPrecedence;
        ctx.depth.enter(expr.getLocation());
        try {
            if (parens) ctx.out.append("(");
            if (expr instanceof IrNode) {
                ((IrNode) expr).accept(emitter, ctx);
            } else {
                expr.accept(this, ctx);
            }
            if (parens) ctx.out.append(")");
        } finally {
            ctx.depth.exit();
        }
    }

    /** 逗号分隔的列表，每项至少为赋值表达式 */
    void emitList(List<? extends Expression> items, EmitContext ctx) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            emit(items.get(i), Precedence.ASSIGNMENT, ctx);
        }
    }

    /** 以 { 开头的表达式放在语句或箭头函数体位置时需要括号 */
    static boolean needsStatementParens(Expression expr) {
        Expression first = Precedence.leftmost(expr);
        return first instanceof ObjectLiteral || first instanceof FunctionExpr || first instanceof ClassExpr;
    }

    // ========== 函数公共部分 ==========

    void emitTypeArgs(List<TypeNode> typeArgs, EmitContext ctx) {
        if (typeArgs == null || typeArgs.isEmpty()) return;
        ctx.out.append("<");
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            ctx.out.append(typeArgs.get(i).getText());
        }
        ctx.out.append(">");
    }

    void emitTypeParams(TypeParams typeParams, EmitContext ctx) {
        if (typeParams != null) {
            ctx.out.append(typeParams.getText());
        }
    }

    void emitParams(List<Parameter> params, EmitContext ctx) {
        ctx.out.append("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            emitParam(params.get(i), ctx);
        }
        ctx.out.append(")");
    }

    private void emitParam(Parameter param, EmitContext ctx) {
        emitter.emitInlineDecorators(param.getDecorators(), ctx);
        emitter.emitModifiers(param.getModifiers(), ctx);
        if (param.isRest()) ctx.out.append("...");
        emit(param.getPattern(), Precedence.ASSIGNMENT, ctx);
        if (param.isOptional()) ctx.out.append("?");
        if (param.getType() != null) {
            ctx.out.append(": ").append(param.getType().getText());
        }
        if (param.getInitializer() != null) {
            ctx.out.append(" = ");
            emit(param.getInitializer(), Precedence.ASSIGNMENT, ctx);
        }
    }

    /** 类型参数、参数列表、返回类型和函数体 */
    void emitFunctionTail(TypeParams typeParams, List<Parameter> params, TypeNode returnType,
                          Block body, EmitContext ctx) {
        emitTypeParams(typeParams, ctx);
        emitParams(params, ctx);
        if (returnType != null) {
            ctx.out.append(": ").append(returnType.getText());
        }
        if (body == null) {
            ctx.out.append(";");
        } else {
            ctx.out.append(" ");
            emitter.emitBlock(body, ctx);
        }
    }

    private void emitArrow(TypeParams typeParams, List<Parameter> params, TypeNode returnType,
                           Object body, boolean async, EmitContext ctx) {
        if (async) ctx.out.append("async ");
        emitTypeParams(typeParams, ctx);
        emitParams(params, ctx);
        if (returnType != null) {
            ctx.out.append(": ").append(returnType.getText());
        }
        ctx.out.append(" => ");
        if (body instanceof Block) {
            emitter.emitBlock((Block) body, ctx);
        } else {
            Expression expr = (Expression) body;
            if (needsStatementParens(expr)) {
                ctx.out.append("(");
                emit(expr, ctx);
                ctx.out.append(")");
            } else {
                emit(expr, Precedence.ASSIGNMENT, ctx);
            }
        }
    }

    // ========== IR 表达式 ==========

    void emitCall(CallIR node, EmitContext ctx) {
        Expression callee = node.getCallee();
        if (node.isSignalCreation() && callee instanceof IdentifierIR && ((IdentifierIR) callee).isUnbound()) {
            String name = ((IdentifierIR) callee).getName();
            if (RuntimeSymbols.SIGNAL_SHORTHAND.equals(name)) {
                name = RuntimeSymbols.CREATE_SIGNAL;
            }
            ctx.out.append(ctx.runtime(name));
        } else {
            emitCallee(callee, ctx);
        }
        emitCallTail(node.getTypeArgs(), node.getArguments(), node.isOptional(), ctx);
    }

    void emitIdentifier(IdentifierIR node, EmitContext ctx) {
        ctx.out.append(node.getName());
    }

    void emitArrowFunction(ArrowFunctionIR node, EmitContext ctx) {
        emitArrow(node.getTypeParams(), node.getParams(), node.getReturnType(), node.getBody(), node.isAsync(), ctx);
    }

    private void emitCallee(Expression callee, EmitContext ctx) {
        if (callee instanceof FunctionExpr || callee instanceof ClassExpr) {
            ctx.out.append("(");
            emit(callee, ctx);
            ctx.out.append(")");
        } else {
            emit(callee, Precedence.CALL, ctx);
        }
    }

    private void emitCallTail(List<TypeNode> typeArgs, List<Expression> args, boolean optional, EmitContext ctx) {
        if (optional) ctx.out.append("?.");
        emitTypeArgs(typeArgs, ctx);
        ctx.out.append("(");
        emitList(args, ctx);
        ctx.out.append(")");
    }

    // ========== 基本表达式 ==========

    @Override
    public Void visitIdentifier(Identifier node, EmitContext ctx) {
        ctx.out.append(node.getName());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, EmitContext ctx) {
        if (node.isString()) {
            String raw = node.getRaw();
            if (raw == null || (ctx.config.isAsciiOnly() && !isAscii(raw)) || !isQuoted(raw)) {
                ctx.out.append(ctx.quote(String.valueOf(node.getValue())));
            } else {
                ctx.out.append(raw);
            }
            return null;
        }
        ctx.out.append(node.getRaw() != null ? node.getRaw() : String.valueOf(node.getValue()));
        return null;
    }

    /** JSX 属性字符串中可能含有实体，其值需要重新加引号 */
    void emitStringValue(Literal node, EmitContext ctx) {
        ctx.out.append(ctx.quote(String.valueOf(node.getValue())));
    }

    private static boolean isQuoted(String raw) {
        if (raw.length() < 2) return false;
        char first = raw.charAt(0);
        return (first == '\'' || first == '"') && raw.charAt(raw.length() - 1) == first
                && raw.indexOf('\n') < 0;
    }

    private static boolean isAscii(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) > 0x7E) return false;
        }
        return true;
    }

    @Override
    public Void visitTemplateLiteral(TemplateLiteral node, EmitContext ctx) {
        List<String> quasis = node.getRawQuasis();
        List<Expression> expressions = node.getExpressions();
        ctx.out.append("`").append(quasis.get(0));
        for (int i = 0; i < expressions.size(); i++) {
            ctx.out.append("${");
            emit(expressions.get(i), ctx);
            ctx.out.append("}").append(quasis.get(i + 1));
        }
        ctx.out.append("`");
        return null;
    }

    @Override
    public Void visitTaggedTemplateExpr(TaggedTemplateExpr node, EmitContext ctx) {
        emit(node.getTag(), Precedence.CALL, ctx);
        emitTypeArgs(node.getTypeArgs(), ctx);
        emit(node.getQuasi(), ctx);
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteral node, EmitContext ctx) {
        List<Expression> elements = node.getElements();
        ctx.out.append("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            emit(elements.get(i), Precedence.ASSIGNMENT, ctx);
        }
        // 末尾空位需要保留逗号
        if (!elements.isEmpty() && elements.get(elements.size() - 1) == null) {
            ctx.out.append(",");
        }
        ctx.out.append("]");
        return null;
    }

    @Override
    public Void visitObjectLiteral(ObjectLiteral node, EmitContext ctx) {
        List<ObjectProperty> properties = node.getProperties();
        if (properties.isEmpty()) {
            ctx.out.append("{}");
            return null;
        }
        ctx.out.append("{ ");
        for (int i = 0; i < properties.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            emitProperty(properties.get(i), ctx);
        }
        ctx.out.append(" }");
        return null;
    }

    private void emitProperty(ObjectProperty property, EmitContext ctx) {
        switch (property.getKind()) {
            case SPREAD:
                ctx.out.append("...");
                emit(property.getValue(), Precedence.ASSIGNMENT, ctx);
                break;
            case INIT:
                if (property.isShorthand()) {
                    // { a } 或解构中的 { a = 1 }
                    if (property.getValue() instanceof AssignExpr) {
                        emit(property.getValue(), Precedence.ASSIGNMENT, ctx);
                    } else {
                        emitKey(property.getKey(), property.isComputed(), ctx);
                    }
                } else {
                    emitKey(property.getKey(), property.isComputed(), ctx);
                    ctx.out.append(": ");
                    emit(property.getValue(), Precedence.ASSIGNMENT, ctx);
                }
                break;
            default: {
                FunctionExpr function = (FunctionExpr) property.getValue();
                if (function.isAsync()) ctx.out.append("async ");
                if (property.getKind() == ObjectProperty.PropertyKind.GET) ctx.out.append("get ");
                if (property.getKind() == ObjectProperty.PropertyKind.SET) ctx.out.append("set ");
                if (function.isGenerator()) ctx.out.append("*");
                emitKey(property.getKey(), property.isComputed(), ctx);
                emitFunctionTail(function.getTypeParams(), function.getParams(), function.getReturnType(),
                        function.getBody(), ctx);
            }
        }
    }

    void emitKey(Expression key, boolean computed, EmitContext ctx) {
        if (computed) {
            ctx.out.append("[");
            emit(key, Precedence.ASSIGNMENT, ctx);
            ctx.out.append("]");
        } else {
            emit(key, ctx);
        }
    }

    @Override
    public Void visitFunctionExpr(FunctionExpr node, EmitContext ctx) {
        if (node.isAsync()) ctx.out.append("async ");
        ctx.out.append(node.isGenerator() ? "function*" : "function");
        if (node.getName() != null) {
            ctx.out.append(" ").append(node.getName());
        }
        emitFunctionTail(node.getTypeParams(), node.getParams(), node.getReturnType(), node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitArrowFunction(ArrowFunction node, EmitContext ctx) {
        emitArrow(node.getTypeParams(), node.getParams(), node.getReturnType(), node.getBody(), node.isAsync(), ctx);
        return null;
    }

    @Override
    public Void visitClassExpr(ClassExpr node, EmitContext ctx) {
        emitter.emitClass(node.getDeclaration(), ctx);
        return null;
    }

    // ========== 运算 ==========

    @Override
    public Void visitUnaryExpr(UnaryExpr node, EmitContext ctx) {
        String op = node.getOperator();
        ctx.out.append(op);
        Expression operand = node.getOperand();
        if (Character.isLetter(op.charAt(0))) {
            ctx.out.append(" ");
        } else if (startsWithSign(operand, op.charAt(0))) {
            // - -x、+ ++x
            ctx.out.append(" ");
        }
        emit(operand, Precedence.UNARY, ctx);
        return null;
    }

    private static boolean startsWithSign(Expression operand, char sign) {
        if (sign != '-' && sign != '+') return false;
        if (operand instanceof UnaryExpr) return ((UnaryExpr) operand).getOperator().charAt(0) == sign;
        if (operand instanceof UpdateExpr && ((UpdateExpr) operand).isPrefix()) {
            return ((UpdateExpr) operand).getOperator().charAt(0) == sign;
        }
        return false;
    }

    @Override
    public Void visitUpdateExpr(UpdateExpr node, EmitContext ctx) {
        if (node.isPrefix()) {
            ctx.out.append(node.getOperator());
            emit(node.getOperand(), Precedence.CALL, ctx);
        } else {
            emit(node.getOperand(), Precedence.CALL, ctx);
            ctx.out.append(node.getOperator());
        }
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, EmitContext ctx) {
        BinaryOp op = node.getOperator();
        int precedence = Precedence.binary(op);
        boolean exponent = op == BinaryOp.EXP;
        // ** 右结合，且左侧不能是一元表达式
        emit(node.getLeft(), exponent ? Precedence.POSTFIX : precedence, ctx);
        ctx.out.append(" ").append(op.getSymbol()).append(" ");
        emit(node.getRight(), exponent ? precedence : precedence + 1, ctx);
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, EmitContext ctx) {
        emit(node.getTarget(), Precedence.POSTFIX, ctx);
        ctx.out.append(" ").append(node.getOperator()).append(" ");
        emit(node.getValue(), Precedence.ASSIGNMENT, ctx);
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, EmitContext ctx) {
        emit(node.getCondition(), Precedence.CONDITIONAL + 1, ctx);
        ctx.out.append(" ? ");
        emit(node.getThenExpr(), Precedence.ASSIGNMENT, ctx);
        ctx.out.append(" : ");
        emit(node.getElseExpr(), Precedence.ASSIGNMENT, ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, EmitContext ctx) {
        emitCallee(node.getCallee(), ctx);
        emitCallTail(node.getTypeArgs(), node.getArguments(), node.isOptional(), ctx);
        return null;
    }

    @Override
    public Void visitNewExpr(NewExpr node, EmitContext ctx) {
        ctx.out.append("new ");
        Expression callee = node.getCallee();
        // new (f())() 与 new f()() 含义不同
        if (callee instanceof CallExpr || callee instanceof CallIR) {
            ctx.out.append("(");
            emit(callee, ctx);
            ctx.out.append(")");
        } else {
            emitCallee(callee, ctx);
        }
        emitTypeArgs(node.getTypeArgs(), ctx);
        if (node.getArguments() != null) {
            ctx.out.append("(");
            emitList(node.getArguments(), ctx);
            ctx.out.append(")");
        }
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, EmitContext ctx) {
        emit(node.getObject(), Precedence.CALL, ctx);
        ctx.out.append(node.isOptional() ? "?." : ".").append(node.getProperty());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, EmitContext ctx) {
        emit(node.getObject(), Precedence.CALL, ctx);
        ctx.out.append(node.isOptional() ? "?.[" : "[");
        emit(node.getIndex(), ctx);
        ctx.out.append("]");
        return null;
    }

    @Override
    public Void visitNonNullExpr(NonNullExpr node, EmitContext ctx) {
        emit(node.getExpression(), Precedence.CALL, ctx);
        ctx.out.append("!");
        return null;
    }

    @Override
    public Void visitTypeAssertionExpr(TypeAssertionExpr node, EmitContext ctx) {
        emit(node.getExpression(), Precedence.ASSERTION, ctx);
        ctx.out.append(" ").append(node.getKeyword()).append(" ").append(node.getType().getText());
        return null;
    }

    @Override
    public Void visitSequenceExpr(SequenceExpr node, EmitContext ctx) {
        emitList(node.getExpressions(), ctx);
        return null;
    }

    @Override
    public Void visitSpreadElement(SpreadElement node, EmitContext ctx) {
        ctx.out.append("...");
        emit(node.getArgument(), Precedence.ASSIGNMENT, ctx);
        return null;
    }

    @Override
    public Void visitAwaitExpr(AwaitExpr node, EmitContext ctx) {
        ctx.out.append("await ");
        emit(node.getArgument(), Precedence.UNARY, ctx);
        return null;
    }

    @Override
    public Void visitYieldExpr(YieldExpr node, EmitContext ctx) {
        ctx.out.append(node.isDelegate() ? "yield*" : "yield");
        if (node.getArgument() != null) {
            ctx.out.append(" ");
            emit(node.getArgument(), Precedence.ASSIGNMENT, ctx);
        }
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node, EmitContext ctx) {
        ctx.out.append("(");
        emit(node.getExpression(), ctx);
        ctx.out.append(")");
        return null;
    }

    @Override
    public Void visitThisExpr(ThisExpr node, EmitContext ctx) {
        ctx.out.append("this");
        return null;
    }

    @Override
    public Void visitSuperExpr(SuperExpr node, EmitContext ctx) {
        ctx.out.append("super");
        return null;
    }

    @Override
    public Void visitMetaProperty(MetaProperty node, EmitContext ctx) {
        ctx.out.append(node.getMeta()).append(".").append(node.getProperty());
        return null;
    }

    @Override
    public Void visitJsxElement(JsxElement node, EmitContext ctx) {
        throw new EmitException("JSX element <" + node.getTagName() + "> was not lowered", node.getLocation());
    }

    @Override
    public Void visitJsxFragment(JsxFragment node, EmitContext ctx) {
        throw new EmitException("JSX fragment was not lowered", node.getLocation());
    }
}
