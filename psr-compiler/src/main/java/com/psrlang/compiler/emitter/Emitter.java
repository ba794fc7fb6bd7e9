package com.psrlang.compiler.emitter;

import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.MethodKind;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.decl.*;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.FunctionExpr;
import com.psrlang.compiler.ast.stmt.*;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ir.IrNode;
import com.psrlang.compiler.ir.IrVisitor;
import com.psrlang.compiler.ir.decl.ComponentIR;
import com.psrlang.compiler.ir.decl.ProgramIR;
import com.psrlang.compiler.ir.decl.VerbatimIR;
import com.psrlang.compiler.ir.expr.ArrowFunctionIR;
import com.psrlang.compiler.ir.expr.CallIR;
import com.psrlang.compiler.ir.expr.IdentifierIR;
import com.psrlang.compiler.ir.expr.RegistryExecuteIR;
import com.psrlang.compiler.ir.jsx.*;

import java.util.List;
import java.util.logging.Logger;

/**
 * IR → TypeScript 代码生成
 *
 * <p>遍历 {@link ProgramIR}，语句和声明在这里输出，表达式交给 {@link ExpressionEmitter}，
 * JSX 交给 {@link JsxEmitter}。导入在正文之后统一生成，放在输出最前面。</p>
 *
 * <p>同一 Emitter 实例可重复使用，每次发射的状态都保存在 {@link EmitContext} 中。</p>
 */
public class Emitter implements IrVisitor<Void, EmitContext>, AstVisitor<Void, EmitContext> {

    private static final Logger LOG = Logger.getLogger(Emitter.class.getName());

    private final EmitterConfig config;
    private final ExpressionEmitter exprs = new ExpressionEmitter(this);
    private final JsxEmitter jsx = new JsxEmitter(this, exprs);

    public Emitter(EmitterConfig config) {
        this.config = config;
    }

    public Emitter() {
        this(EmitterConfig.defaults());
    }

    public EmitterConfig getConfig() {
        return config;
    }

    // ============ 公共入口 ============

    /**
     * 生成整个模块的代码
     */
    public String emit(ProgramIR program) {
        return emit(program, new ImportRegistry());
    }

    /**
     * 使用外部提供的导入注册表生成代码；源码中的 import 会先合并进注册表
     */
    public String emit(ProgramIR program, ImportRegistry imports) {
        for (ImportDecl decl : program.getImports()) {
            imports.addImportDecl(decl);
        }
        EmitContext ctx = new EmitContext(config, imports);
        visitProgram(program, ctx);

        StringBuilder result = new StringBuilder();
        List<String> importLines = imports.generateImportStatements(config.getModuleFormat());
        for (String line : importLines) {
            result.append(line).append('\n');
        }
        String body = ctx.out.getOutput();
        if (!importLines.isEmpty() && !body.isEmpty()) {
            result.append('\n');
        }
        result.append(body);
        LOG.fine("Emitted " + program.getFileName() + ": " + importLines.size() + " import line(s), "
                + program.getComponents().size() + " component(s)");
        return result.toString();
    }

    // ============ 程序与 IR 声明 ============

    @Override
    public Void visitProgram(ProgramIR node, EmitContext ctx) {
        List<Statement> body = node.getBody();
        for (int i = 0; i < body.size(); i++) {
            // 块状声明前后空一行
            if (i > 0 && (isBlockLike(body.get(i - 1)) || isBlockLike(body.get(i)))) {
                ctx.out.blankLine();
            }
            emitStatement(body.get(i), ctx);
        }
        return null;
    }

    private static boolean isBlockLike(Statement stmt) {
        if (stmt instanceof ExportDecl && ((ExportDecl) stmt).getDeclaration() != null) {
            return isBlockLike(((ExportDecl) stmt).getDeclaration());
        }
        if (stmt instanceof VerbatimIR) {
            return ((VerbatimIR) stmt).getText().indexOf('\n') >= 0;
        }
        return stmt instanceof FunctionDecl || stmt instanceof ClassDecl || stmt instanceof ComponentIR;
    }

    @Override
    public Void visitComponent(ComponentIR node, EmitContext ctx) {
        emitComponent(node, "", ctx);
        return null;
    }

    /**
     * const Name = (props): HTMLElement => {
     *   return $REGISTRY.execute('component:Name', () => { ... });
     * };
     */
    private void emitComponent(ComponentIR node, String prefix, EmitContext ctx) {
        ctx.out.append(prefix).append("const ").append(node.getName()).append(" = ");
        exprs.emitTypeParams(node.getTypeParams(), ctx);
        exprs.emitParams(node.getParams(), ctx);
        TypeNode returnType = node.getReturnType();
        ctx.out.append(": ").append(returnType != null ? returnType.getText() : "HTMLElement").append(" => {");
        ctx.out.newLine();
        ctx.out.indent();
        ctx.out.append("return ");
        emitRegistryExecute(node.getRegistryKey(), node.getBody(), ctx);
        ctx.out.append(";");
        ctx.out.newLine();
        ctx.out.dedent();
        ctx.out.line("};");
    }

    /** $REGISTRY.execute('key', () => body) */
    private void emitRegistryExecute(String key, Object body, EmitContext ctx) {
        ctx.out.append(ctx.runtime(RuntimeSymbols.REGISTRY)).append(".execute(")
                .append(ctx.quote(key)).append(", () => ");
        if (body instanceof Block) {
            emitBlock((Block) body, ctx);
        } else {
            Expression expr = (Expression) body;
            if (ExpressionEmitter.needsStatementParens(expr)) {
                ctx.out.append("(");
                exprs.emit(expr, ctx);
                ctx.out.append(")");
            } else {
                exprs.emit(expr, Precedence.ASSIGNMENT, ctx);
            }
        }
        ctx.out.append(")");
    }

    @Override
    public Void visitRegistryExecute(RegistryExecuteIR node, EmitContext ctx) {
        emitRegistryExecute(node.getRegistryKey(), node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitVerbatim(VerbatimIR node, EmitContext ctx) {
        String text = node.getText().trim();
        if (!text.endsWith(";") && !text.endsWith("}")) {
            text = text + ";";
        }
        ctx.out.appendLines(text);
        ctx.out.newLine();
        return null;
    }

    // ============ IR 表达式 ============

    @Override
    public Void visitCall(CallIR node, EmitContext ctx) {
        exprs.emitCall(node, ctx);
        return null;
    }

    @Override
    public Void visitIdentifier(IdentifierIR node, EmitContext ctx) {
        exprs.emitIdentifier(node, ctx);
        return null;
    }

    @Override
    public Void visitArrowFunction(ArrowFunctionIR node, EmitContext ctx) {
        exprs.emitArrowFunction(node, ctx);
        return null;
    }

    // ============ JSX ============

    @Override
    public Void visitElement(ElementIR node, EmitContext ctx) {
        jsx.emitElement(node, ctx);
        return null;
    }

    @Override
    public Void visitFragment(FragmentIR node, EmitContext ctx) {
        jsx.emitFragment(node, ctx);
        return null;
    }

    @Override
    public Void visitComponentCall(ComponentCallIR node, EmitContext ctx) {
        jsx.emitComponentCall(node, ctx);
        return null;
    }

    @Override
    public Void visitText(TextIR node, EmitContext ctx) {
        ctx.out.append(ctx.quote(node.getValue()));
        return null;
    }

    @Override
    public Void visitExpressionChild(ExpressionChildIR node, EmitContext ctx) {
        if (node.isSpread()) ctx.out.append("...");
        exprs.emit(node.getExpression(), Precedence.ASSIGNMENT, ctx);
        return null;
    }

    @Override
    public Void visitAttribute(AttributeIR node, EmitContext ctx) {
        jsx.emitProp(node, ctx);
        return null;
    }

    @Override
    public Void visitSignalBinding(SignalBindingIR node, EmitContext ctx) {
        jsx.emitBinding(node, requireElement(node, ctx), ctx);
        return null;
    }

    @Override
    public Void visitEventHandler(EventHandlerIR node, EmitContext ctx) {
        jsx.emitEvent(node, requireElement(node, ctx), ctx);
        return null;
    }

    private static String requireElement(IrNode node, EmitContext ctx) {
        String element = ctx.currentElement();
        if (element == null) {
            throw new EmitException("Element binding emitted outside of an element", node.getLocation());
        }
        return element;
    }

    // ============ 语句 ============

    void emitStatement(Statement stmt, EmitContext ctx) {
        ctx.depth.enter(stmt.getLocation());
        try {
            if (stmt instanceof IrNode) {
                ((IrNode) stmt).accept(this, ctx);
            } else {
                stmt.accept(this, ctx);
            }
        } finally {
            ctx.depth.exit();
        }
    }

    /**
     * 输出代码块，不换行结束
     */
    void emitBlock(Block block, EmitContext ctx) {
        if (block.getStatements().isEmpty()) {
            ctx.out.append("{}");
            return;
        }
        ctx.out.append("{");
        ctx.out.newLine();
        ctx.out.indent();
        for (Statement stmt : block.getStatements()) {
            emitStatement(stmt, ctx);
        }
        ctx.out.dedent();
        ctx.out.append("}");
    }

    /**
     * 控制语句的循环体或分支；返回 true 表示以代码块结束且尚未换行
     */
    private boolean emitBody(Statement body, EmitContext ctx) {
        if (body instanceof Block) {
            ctx.out.append(" ");
            emitBlock((Block) body, ctx);
            return true;
        }
        ctx.out.newLine();
        ctx.out.indent();
        emitStatement(body, ctx);
        ctx.out.dedent();
        return false;
    }

    private void endBody(boolean block, EmitContext ctx) {
        if (block) ctx.out.newLine();
    }

    @Override
    public Void visitBlock(Block node, EmitContext ctx) {
        emitBlock(node, ctx);
        ctx.out.newLine();
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, EmitContext ctx) {
        Expression expr = node.getExpression();
        if (ExpressionEmitter.needsStatementParens(expr)) {
            ctx.out.append("(");
            exprs.emit(expr, ctx);
            ctx.out.append(")");
        } else {
            exprs.emit(expr, ctx);
        }
        ctx.out.line(";");
        return null;
    }

    @Override
    public Void visitVariableDecl(VariableDecl node, EmitContext ctx) {
        emitVariableDecl(node, ctx);
        ctx.out.line(";");
        return null;
    }

    private void emitVariableDecl(VariableDecl node, EmitContext ctx) {
        ctx.out.append(node.getKind()).append(" ");
        List<VariableDeclarator> declarators = node.getDeclarators();
        for (int i = 0; i < declarators.size(); i++) {
            if (i > 0) ctx.out.append(", ");
            VariableDeclarator d = declarators.get(i);
            exprs.emit(d.getTarget(), Precedence.ASSIGNMENT, ctx);
            if (d.isDefinite()) ctx.out.append("!");
            if (d.getType() != null) ctx.out.append(": ").append(d.getType().getText());
            if (d.getInit() != null) {
                ctx.out.append(" = ");
                exprs.emit(d.getInit(), Precedence.ASSIGNMENT, ctx);
            }
        }
    }

    @Override
    public Void visitIfStmt(IfStmt node, EmitContext ctx) {
        ctx.out.append("if (");
        exprs.emit(node.getCondition(), ctx);
        ctx.out.append(")");
        boolean block = emitBody(node.getThenBranch(), ctx);
        Statement alternate = node.getElseBranch();
        if (alternate == null) {
            endBody(block, ctx);
            return null;
        }
        ctx.out.append(block ? " else" : "else");
        if (alternate instanceof IfStmt) {
            ctx.out.append(" ");
            emitStatement(alternate, ctx);
        } else {
            endBody(emitBody(alternate, ctx), ctx);
        }
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, EmitContext ctx) {
        ctx.out.append("for (");
        emitForHead(node.getInit(), ctx);
        ctx.out.append(";");
        if (node.getTest() != null) {
            ctx.out.append(" ");
            exprs.emit(node.getTest(), ctx);
        }
        ctx.out.append(";");
        if (node.getUpdate() != null) {
            ctx.out.append(" ");
            exprs.emit(node.getUpdate(), ctx);
        }
        ctx.out.append(")");
        endBody(emitBody(node.getBody(), ctx), ctx);
        return null;
    }

    private void emitForHead(Object head, EmitContext ctx) {
        if (head instanceof VariableDecl) {
            emitVariableDecl((VariableDecl) head, ctx);
        } else if (head instanceof Expression) {
            exprs.emit((Expression) head, ctx);
        }
    }

    @Override
    public Void visitForInStmt(ForInStmt node, EmitContext ctx) {
        ctx.out.append(node.isAwait() ? "for await (" : "for (");
        emitForHead(node.getLeft(), ctx);
        ctx.out.append(node.isOf() ? " of " : " in ");
        exprs.emit(node.getRight(), Precedence.ASSIGNMENT, ctx);
        ctx.out.append(")");
        endBody(emitBody(node.getBody(), ctx), ctx);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, EmitContext ctx) {
        ctx.out.append("while (");
        exprs.emit(node.getCondition(), ctx);
        ctx.out.append(")");
        endBody(emitBody(node.getBody(), ctx), ctx);
        return null;
    }

    @Override
    public Void visitDoWhileStmt(DoWhileStmt node, EmitContext ctx) {
        ctx.out.append("do");
        boolean block = emitBody(node.getBody(), ctx);
        ctx.out.append(block ? " while (" : "while (");
        exprs.emit(node.getCondition(), ctx);
        ctx.out.line(");");
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, EmitContext ctx) {
        ctx.out.append("return");
        if (node.getValue() != null) {
            ctx.out.append(" ");
            exprs.emit(node.getValue(), ctx);
        }
        ctx.out.line(";");
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, EmitContext ctx) {
        ctx.out.line(node.getLabel() != null ? "break " + node.getLabel() + ";" : "break;");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, EmitContext ctx) {
        ctx.out.line(node.getLabel() != null ? "continue " + node.getLabel() + ";" : "continue;");
        return null;
    }

    @Override
    public Void visitThrowStmt(ThrowStmt node, EmitContext ctx) {
        ctx.out.append("throw ");
        exprs.emit(node.getValue(), ctx);
        ctx.out.line(";");
        return null;
    }

    @Override
    public Void visitTryStmt(TryStmt node, EmitContext ctx) {
        ctx.out.append("try ");
        emitBlock(node.getBlock(), ctx);
        CatchClause handler = node.getHandler();
        if (handler != null) {
            ctx.out.append(" catch ");
            if (handler.getParam() != null) {
                ctx.out.append("(");
                exprs.emit(handler.getParam(), Precedence.ASSIGNMENT, ctx);
                if (handler.getParamType() != null) {
                    ctx.out.append(": ").append(handler.getParamType().getText());
                }
                ctx.out.append(") ");
            }
            emitBlock(handler.getBody(), ctx);
        }
        if (node.getFinalizer() != null) {
            ctx.out.append(" finally ");
            emitBlock(node.getFinalizer(), ctx);
        }
        ctx.out.newLine();
        return null;
    }

    @Override
    public Void visitSwitchStmt(SwitchStmt node, EmitContext ctx) {
        ctx.out.append("switch (");
        exprs.emit(node.getDiscriminant(), ctx);
        ctx.out.line(") {");
        ctx.out.indent();
        for (SwitchCase c : node.getCases()) {
            if (c.getTest() != null) {
                ctx.out.append("case ");
                exprs.emit(c.getTest(), ctx);
                ctx.out.line(":");
            } else {
                ctx.out.line("default:");
            }
            ctx.out.indent();
            for (Statement stmt : c.getConsequent()) {
                emitStatement(stmt, ctx);
            }
            ctx.out.dedent();
        }
        ctx.out.dedent();
        ctx.out.line("}");
        return null;
    }

    @Override
    public Void visitLabeledStmt(LabeledStmt node, EmitContext ctx) {
        ctx.out.append(node.getLabel()).append(": ");
        emitStatement(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitEmptyStmt(EmptyStmt node, EmitContext ctx) {
        ctx.out.line(";");
        return null;
    }

    @Override
    public Void visitDebuggerStmt(DebuggerStmt node, EmitContext ctx) {
        ctx.out.line("debugger;");
        return null;
    }

    // ============ 声明 ============

    @Override
    public Void visitExportDecl(ExportDecl node, EmitContext ctx) {
        switch (node.getKind()) {
            case DECLARATION:
                if (node.getDeclaration() instanceof ComponentIR) {
                    emitComponent((ComponentIR) node.getDeclaration(), "export ", ctx);
                } else {
                    ctx.out.append("export ");
                    emitStatement(node.getDeclaration(), ctx);
                }
                break;
            case DEFAULT_DECLARATION:
                if (node.getDeclaration() instanceof ComponentIR) {
                    // 箭头函数常量不能直接 export default，先声明再导出
                    ComponentIR component = (ComponentIR) node.getDeclaration();
                    emitComponent(component, "", ctx);
                    ctx.out.line("export default " + component.getName() + ";");
                } else {
                    ctx.out.append("export default ");
                    emitStatement(node.getDeclaration(), ctx);
                }
                break;
            case DEFAULT_EXPRESSION:
                ctx.out.append("export default ");
                exprs.emit(node.getExpression(), Precedence.ASSIGNMENT, ctx);
                ctx.out.line(";");
                break;
            case ALL:
                ctx.out.append("export * ");
                if (node.getNamespaceAlias() != null) {
                    ctx.out.append("as ").append(node.getNamespaceAlias()).append(" ");
                }
                ctx.out.line("from " + ctx.quote(node.getSource()) + ";");
                break;
            default:
                emitNamedExport(node, ctx);
        }
        return null;
    }

    private void emitNamedExport(ExportDecl node, EmitContext ctx) {
        ctx.out.append(node.isTypeOnly() ? "export type {" : "export {");
        List<ExportSpecifier> specifiers = node.getSpecifiers();
        for (int i = 0; i < specifiers.size(); i++) {
            ExportSpecifier s = specifiers.get(i);
            ctx.out.append(i > 0 ? ", " : " ");
            if (s.isTypeOnly()) ctx.out.append("type ");
            ctx.out.append(s.getLocal());
            if (!s.getLocal().equals(s.getExported())) {
                ctx.out.append(" as ").append(s.getExported());
            }
        }
        ctx.out.append(specifiers.isEmpty() ? "}" : " }");
        if (node.getSource() != null) {
            ctx.out.append(" from ").append(ctx.quote(node.getSource()));
        }
        ctx.out.line(";");
    }

    @Override
    public Void visitImportDecl(ImportDecl node, EmitContext ctx) {
        throw new EmitException("Import declarations are emitted through the import registry", node.getLocation());
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, EmitContext ctx) {
        emitModifiers(node.getModifiers(), ctx);
        if (node.isAsync()) ctx.out.append("async ");
        ctx.out.append(node.isGenerator() ? "function*" : "function");
        if (node.getName() != null) {
            ctx.out.append(" ").append(node.getName());
        }
        exprs.emitFunctionTail(node.getTypeParams(), node.getParams(), node.getReturnType(), node.getBody(), ctx);
        ctx.out.newLine();
        return null;
    }

    @Override
    public Void visitComponentDecl(ComponentDecl node, EmitContext ctx) {
        throw new EmitException("Component '" + node.getName() + "' was not lowered", node.getLocation());
    }

    @Override
    public Void visitClassDecl(ClassDecl node, EmitContext ctx) {
        for (Decorator decorator : node.getDecorators()) {
            emitDecorator(decorator, ctx);
            ctx.out.newLine();
        }
        emitClassBody(node, ctx);
        ctx.out.newLine();
        return null;
    }

    /** 类表达式：装饰器写在同一行 */
    void emitClass(ClassDecl node, EmitContext ctx) {
        emitInlineDecorators(node.getDecorators(), ctx);
        emitClassBody(node, ctx);
    }

    private void emitClassBody(ClassDecl node, EmitContext ctx) {
        emitModifiers(node.getModifiers(), ctx);
        ctx.out.append("class");
        if (node.getName() != null) {
            ctx.out.append(" ").append(node.getName());
        }
        exprs.emitTypeParams(node.getTypeParams(), ctx);
        if (node.getSuperClass() != null) {
            ctx.out.append(" extends ");
            exprs.emit(node.getSuperClass(), Precedence.CALL, ctx);
            exprs.emitTypeArgs(node.getSuperTypeArgs(), ctx);
        }
        List<TypeNode> implementsTypes = node.getImplementsTypes();
        if (implementsTypes != null && !implementsTypes.isEmpty()) {
            ctx.out.append(" implements ");
            for (int i = 0; i < implementsTypes.size(); i++) {
                if (i > 0) ctx.out.append(", ");
                ctx.out.append(implementsTypes.get(i).getText());
            }
        }
        if (node.getMembers().isEmpty()) {
            ctx.out.append(" {}");
            return;
        }
        ctx.out.append(" {");
        ctx.out.newLine();
        ctx.out.indent();
        for (ClassMember member : node.getMembers()) {
            ctx.depth.enter(member.getLocation());
            try {
                member.accept(this, ctx);
            } finally {
                ctx.depth.exit();
            }
        }
        ctx.out.dedent();
        ctx.out.append("}");
    }

    @Override
    public Void visitPropertyMember(PropertyMember node, EmitContext ctx) {
        emitInlineDecorators(node.getDecorators(), ctx);
        emitModifiers(node.getModifiers(), ctx);
        exprs.emitKey(node.getKey(), node.isComputed(), ctx);
        if (node.isOptional()) ctx.out.append("?");
        if (node.isDefinite()) ctx.out.append("!");
        if (node.getType() != null) ctx.out.append(": ").append(node.getType().getText());
        if (node.getValue() != null) {
            ctx.out.append(" = ");
            exprs.emit(node.getValue(), Precedence.ASSIGNMENT, ctx);
        }
        ctx.out.line(";");
        return null;
    }

    @Override
    public Void visitMethodMember(MethodMember node, EmitContext ctx) {
        FunctionExpr function = node.getFunction();
        emitInlineDecorators(node.getDecorators(), ctx);
        emitModifiers(node.getModifiers(), ctx);
        if (function.isAsync()) ctx.out.append("async ");
        if (node.getKind() == MethodKind.GETTER) ctx.out.append("get ");
        if (node.getKind() == MethodKind.SETTER) ctx.out.append("set ");
        if (function.isGenerator()) ctx.out.append("*");
        exprs.emitKey(node.getKey(), node.isComputed(), ctx);
        if (node.isOptional()) ctx.out.append("?");
        exprs.emitFunctionTail(function.getTypeParams(), function.getParams(), function.getReturnType(),
                function.getBody(), ctx);
        ctx.out.newLine();
        return null;
    }

    @Override
    public Void visitIndexSignatureMember(IndexSignatureMember node, EmitContext ctx) {
        String text = node.getText().trim();
        ctx.out.line(text.endsWith(";") ? text : text + ";");
        return null;
    }

    @Override
    public Void visitStaticBlockMember(StaticBlockMember node, EmitContext ctx) {
        ctx.out.append("static ");
        emitBlock(node.getBody(), ctx);
        ctx.out.newLine();
        return null;
    }

    @Override
    public Void visitInterfaceDecl(InterfaceDecl node, EmitContext ctx) {
        throw new EmitException("Interface '" + node.getName() + "' must be emitted verbatim", node.getLocation());
    }

    @Override
    public Void visitTypeAliasDecl(TypeAliasDecl node, EmitContext ctx) {
        throw new EmitException("Type alias '" + node.getName() + "' must be emitted verbatim", node.getLocation());
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, EmitContext ctx) {
        throw new EmitException("Enum '" + node.getName() + "' must be emitted verbatim", node.getLocation());
    }

    @Override
    public Void visitNamespaceDecl(NamespaceDecl node, EmitContext ctx) {
        throw new EmitException("Namespace '" + node.getName() + "' must be emitted verbatim", node.getLocation());
    }

    // ============ 修饰符与装饰器 ============

    /** async 由函数自身输出 */
    void emitModifiers(List<Modifier> modifiers, EmitContext ctx) {
        if (modifiers == null) return;
        for (Modifier modifier : modifiers) {
            if (modifier != Modifier.ASYNC) {
                ctx.out.append(modifier.getKeyword()).append(" ");
            }
        }
    }

    void emitInlineDecorators(List<Decorator> decorators, EmitContext ctx) {
        if (decorators == null) return;
        for (Decorator decorator : decorators) {
            emitDecorator(decorator, ctx);
            ctx.out.append(" ");
        }
    }

    private void emitDecorator(Decorator decorator, EmitContext ctx) {
        ctx.out.append("@");
        exprs.emit(decorator.getExpression(), Precedence.CALL, ctx);
    }
}
