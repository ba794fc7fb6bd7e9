package com.psrlang.compiler.ir.builder;

import com.psrlang.compiler.analysis.AstWalker;
import com.psrlang.compiler.analysis.Patterns;
import com.psrlang.compiler.analysis.Scope;
import com.psrlang.compiler.ast.*;
import com.psrlang.compiler.ast.decl.*;
import com.psrlang.compiler.ast.expr.*;
import com.psrlang.compiler.ast.jsx.JsxElement;
import com.psrlang.compiler.ast.jsx.JsxFragment;
import com.psrlang.compiler.ast.stmt.*;
import com.psrlang.compiler.ir.decl.ComponentIR;
import com.psrlang.compiler.ir.decl.ProgramIR;
import com.psrlang.compiler.ir.decl.VerbatimIR;
import com.psrlang.compiler.ir.expr.ArrowFunctionIR;
import com.psrlang.compiler.ir.expr.CallIR;
import com.psrlang.compiler.ir.expr.IdentifierIR;
import com.psrlang.compiler.ir.expr.RegistryExecuteIR;
import com.psrlang.compiler.ir.IdentifierScope;

import java.util.*;
import java.util.logging.Logger;

/**
 * AST → IR 构建
 *
 * <p>实现 AstVisitor，一次遍历重建整棵树：JSX、组件、调用、标识符和箭头函数换成 IR 节点，
 * 纯类型声明换成 {@link VerbatimIR}，其余节点按原结构重建。</p>
 */
public class IrBuilder implements AstVisitor<AstNode, BuildContext> {

    private static final Logger LOG = Logger.getLogger(IrBuilder.class.getName());

    private final JsxLowering jsx = new JsxLowering(this);

    // ========== 公共入口 ==========

    public ProgramIR build(Program program, BuildContext ctx) {
        ProgramIR result = (ProgramIR) program.accept(this, ctx);
        LOG.fine("Built IR for " + ctx.getFileName() + ": " + result.getComponents().size() + " component(s)");
        return result;
    }

    // ========== 辅助方法 ==========

    Expression buildExpr(Expression expr, BuildContext ctx) {
        if (expr == null) return null;
        ctx.getDepthGuard().enter(expr.getLocation());
        try {
            return (Expression) expr.accept(this, ctx);
        } finally {
            ctx.getDepthGuard().exit();
        }
    }

    private Statement buildStmt(Statement stmt, BuildContext ctx) {
        if (stmt == null) return null;
        ctx.getDepthGuard().enter(stmt.getLocation());
        try {
            return (Statement) stmt.accept(this, ctx);
        } finally {
            ctx.getDepthGuard().exit();
        }
    }

    private List<Expression> buildExprs(List<? extends Expression> exprs, BuildContext ctx) {
        if (exprs == null || exprs.isEmpty()) return Collections.<Expression>emptyList();
        List<Expression> result = new ArrayList<Expression>(exprs.size());
        // 数组空位保留为 null
        for (Expression e : exprs) result.add(buildExpr(e, ctx));
        return result;
    }

    private List<Statement> buildStmts(List<? extends Statement> stmts, BuildContext ctx) {
        if (stmts == null || stmts.isEmpty()) return Collections.<Statement>emptyList();
        List<Statement> result = new ArrayList<Statement>(stmts.size());
        for (Statement s : stmts) result.add(buildStmt(s, ctx));
        return result;
    }

    private Block buildBlock(Block block, BuildContext ctx) {
        if (block == null) return null;
        return (Block) buildStmt(block, ctx);
    }

    /** for 初始化和 for-in/of 左侧：变量声明或表达式 */
    private AstNode buildForHead(AstNode node, BuildContext ctx, boolean pattern) {
        if (node == null) return null;
        if (node instanceof Statement) return buildStmt((Statement) node, ctx);
        return pattern ? buildPattern((Expression) node, ctx) : buildExpr((Expression) node, ctx);
    }

    /**
     * 绑定模式：标识符保持为绑定名，默认值和计算键按表达式构建
     */
    Expression buildPattern(Expression pattern, BuildContext ctx) {
        if (pattern == null || pattern instanceof Identifier) {
            return pattern;
        }
        if (pattern instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) pattern;
            return new AssignExpr(assign.getLocation(), assign.getOperator(),
                    buildPattern(assign.getTarget(), ctx), buildExpr(assign.getValue(), ctx));
        }
        if (pattern instanceof SpreadElement) {
            return new SpreadElement(pattern.getLocation(),
                    buildPattern(((SpreadElement) pattern).getArgument(), ctx));
        }
        if (pattern instanceof ArrayLiteral) {
            List<Expression> elements = new ArrayList<Expression>();
            for (Expression element : ((ArrayLiteral) pattern).getElements()) {
                elements.add(buildPattern(element, ctx));
            }
            return new ArrayLiteral(pattern.getLocation(), elements);
        }
        if (pattern instanceof ObjectLiteral) {
            List<ObjectProperty> properties = new ArrayList<ObjectProperty>();
            for (ObjectProperty property : ((ObjectLiteral) pattern).getProperties()) {
                Expression key = property.isComputed() ? buildExpr(property.getKey(), ctx) : property.getKey();
                properties.add(new ObjectProperty(property.getLocation(), property.getKind(), key,
                        property.isComputed(), property.isShorthand(), buildPattern(property.getValue(), ctx)));
            }
            return new ObjectLiteral(pattern.getLocation(), properties);
        }
        // 赋值目标中的成员表达式等
        return buildExpr(pattern, ctx);
    }

    private List<Parameter> buildParams(List<Parameter> params, BuildContext ctx) {
        if (params == null || params.isEmpty()) return Collections.<Parameter>emptyList();
        List<Parameter> result = new ArrayList<Parameter>(params.size());
        for (Parameter p : params) {
            result.add(new Parameter(p.getLocation(), buildPattern(p.getPattern(), ctx), p.getType(),
                    p.isOptional(), buildExpr(p.getInitializer(), ctx), p.isRest(), p.getModifiers(),
                    buildDecorators(p.getDecorators(), ctx)));
        }
        return result;
    }

    private List<Decorator> buildDecorators(List<Decorator> decorators, BuildContext ctx) {
        if (decorators == null || decorators.isEmpty()) return Collections.<Decorator>emptyList();
        List<Decorator> result = new ArrayList<Decorator>(decorators.size());
        for (Decorator d : decorators) {
            result.add(new Decorator(d.getLocation(), buildExpr(d.getExpression(), ctx)));
        }
        return result;
    }

    private VerbatimIR verbatim(AstNode node, String kind, BuildContext ctx) {
        return new VerbatimIR(node.getLocation(), ctx.sourceText(node.getLocation()), kind);
    }

    // ========== 程序与声明 ==========

    @Override
    public AstNode visitProgram(Program node, BuildContext ctx) {
        boolean scoped = ctx.enterScope(node);
        List<ImportDecl> imports = new ArrayList<ImportDecl>();
        List<Statement> body = new ArrayList<Statement>();
        for (Statement statement : node.getBody()) {
            if (statement instanceof ImportDecl) {
                imports.add((ImportDecl) statement);
            } else {
                body.add(buildStmt(statement, ctx));
            }
        }
        if (scoped) ctx.exitScope();
        return new ProgramIR(node.getLocation(), ctx.getFileName(), imports, body,
                new ArrayList<ComponentIR>(ctx.getComponents()), ctx.usesJsx());
    }

    @Override
    public AstNode visitImportDecl(ImportDecl node, BuildContext ctx) {
        return node;
    }

    @Override
    public AstNode visitExportDecl(ExportDecl node, BuildContext ctx) {
        switch (node.getKind()) {
            case DECLARATION:
            case DEFAULT_DECLARATION: {
                Statement decl = buildStmt(node.getDeclaration(), ctx);
                if (decl instanceof VerbatimIR) {
                    return verbatim(node, ((VerbatimIR) decl).getKind(), ctx);
                }
                return new ExportDecl(node.getLocation(), node.getKind(), decl, null,
                        node.getSpecifiers(), node.getSource(), node.getNamespaceAlias(), node.isTypeOnly());
            }
            case DEFAULT_EXPRESSION:
                return new ExportDecl(node.getLocation(), node.getKind(), null,
                        buildExpr(node.getExpression(), ctx), node.getSpecifiers(), node.getSource(),
                        node.getNamespaceAlias(), node.isTypeOnly());
            default:
                if (node.isTypeOnly()) {
                    return verbatim(node, "export type", ctx);
                }
                return node;
        }
    }

    @Override
    public AstNode visitVariableDecl(VariableDecl node, BuildContext ctx) {
        if (node.isDeclare()) {
            return verbatim(node, "declare", ctx);
        }
        List<VariableDeclarator> declarators = new ArrayList<VariableDeclarator>();
        for (VariableDeclarator d : node.getDeclarators()) {
            declarators.add((VariableDeclarator) visitVariableDeclarator(d, ctx));
        }
        return new VariableDecl(node.getLocation(), node.getKind(), declarators, false);
    }

    @Override
    public AstNode visitVariableDeclarator(VariableDeclarator node, BuildContext ctx) {
        return new VariableDeclarator(node.getLocation(), buildPattern(node.getTarget(), ctx), node.getType(),
                buildExpr(node.getInit(), ctx), node.isDefinite());
    }

    @Override
    public AstNode visitFunctionDecl(FunctionDecl node, BuildContext ctx) {
        if (node.isAmbient() || node.isSignatureOnly()) {
            return verbatim(node, node.isAmbient() ? "declare" : "overload", ctx);
        }
        boolean scoped = ctx.enterScope(node);
        try {
            List<Parameter> params = buildParams(node.getParams(), ctx);
            String component = ctx.detectedComponent(node);
            Block body = component != null
                    ? buildDetectedBlock(component, node.getBody(), ctx)
                    : buildBlock(node.getBody(), ctx);
            return new FunctionDecl(node.getLocation(), node.getName(), node.getModifiers(), node.getTypeParams(),
                    params, node.getReturnType(), body, node.isAsync(), node.isGenerator());
        } finally {
            if (scoped) ctx.exitScope();
        }
    }

    @Override
    public AstNode visitComponentDecl(ComponentDecl node, BuildContext ctx) {
        String name = node.getName();
        if (!ctx.registerComponentName(name)) {
            throw new IrBuildException("Duplicate component '" + name + "'", node.getLocation());
        }
        validateProps(node);

        boolean scoped = ctx.enterScope(node);
        ctx.enterComponent();
        BuildContext.ComponentState state;
        List<Parameter> params;
        Block body;
        try {
            params = buildParams(node.getParams(), ctx);
            body = buildBlock(node.getBody(), ctx);
        } finally {
            state = ctx.exitComponent();
            if (scoped) ctx.exitScope();
        }
        ComponentIR component = new ComponentIR(node.getLocation(), name, node.getTypeParams(), params,
                node.getReturnType(), body, new ArrayList<String>(state.dependencies),
                state.usesSignals, state.hasEventHandlers);
        ctx.addComponent(component);
        return component;
    }

    // ========== 检测为组件的函数 ==========

    /**
     * 函数体改写为 { return $REGISTRY.execute('component:Name', () => { 原函数体 }); }
     */
    private Block buildDetectedBlock(String name, Block source, BuildContext ctx) {
        ctx.enterComponent();
        BuildContext.ComponentState state;
        Block built;
        try {
            built = buildBlock(source, ctx);
        } finally {
            state = ctx.exitComponent();
        }
        RegistryExecuteIR execute = new RegistryExecuteIR(source.getLocation(), name, built,
                new ArrayList<String>(state.dependencies));
        LOG.fine("Wrapping detected component " + name + " in the registry");
        List<Statement> statements = new ArrayList<Statement>();
        statements.add(new ReturnStmt(source.getLocation(), execute));
        return new Block(source.getLocation(), statements);
    }

    /** 表达式体的箭头函数：() => $REGISTRY.execute('component:Name', () => 表达式) */
    private Expression buildDetectedExpr(String name, Expression source, BuildContext ctx) {
        ctx.enterComponent();
        BuildContext.ComponentState state;
        Expression built;
        try {
            built = buildExpr(source, ctx);
        } finally {
            state = ctx.exitComponent();
        }
        LOG.fine("Wrapping detected component " + name + " in the registry");
        return new RegistryExecuteIR(source.getLocation(), name, built, new ArrayList<String>(state.dependencies));
    }

    /**
     * 组件最多一个 props 参数，只能是标识符或对象解构
     */
    private void validateProps(ComponentDecl node) {
        List<Parameter> params = node.getParams();
        if (params.size() > 1) {
            throw new IrBuildException("Component '" + node.getName()
                    + "' must declare at most one props parameter", params.get(1).getLocation());
        }
        if (params.isEmpty()) return;
        Parameter props = params.get(0);
        if (props.isRest()) {
            throw new IrBuildException("Component '" + node.getName()
                    + "' props cannot be a rest parameter", props.getLocation());
        }
        if (!(props.getPattern() instanceof Identifier) && !(props.getPattern() instanceof ObjectLiteral)) {
            throw new IrBuildException("Component '" + node.getName()
                    + "' props must be an identifier or an object pattern", props.getLocation());
        }
    }

    @Override
    public AstNode visitClassDecl(ClassDecl node, BuildContext ctx) {
        if (node.isAmbient()) {
            return verbatim(node, "declare", ctx);
        }
        List<Decorator> decorators = buildDecorators(node.getDecorators(), ctx);
        Expression superClass = buildExpr(node.getSuperClass(), ctx);
        boolean scoped = ctx.enterScope(node);
        try {
            List<ClassMember> members = new ArrayList<ClassMember>();
            for (ClassMember member : node.getMembers()) {
                members.add(buildMember(member, ctx));
            }
            return new ClassDecl(node.getLocation(), node.getName(), node.getModifiers(), node.getTypeParams(),
                    superClass, node.getSuperTypeArgs(), node.getImplementsTypes(), members, decorators);
        } finally {
            if (scoped) ctx.exitScope();
        }
    }

    private ClassMember buildMember(ClassMember member, BuildContext ctx) {
        ctx.getDepthGuard().enter(member.getLocation());
        try {
            return (ClassMember) member.accept(this, ctx);
        } finally {
            ctx.getDepthGuard().exit();
        }
    }

    @Override
    public AstNode visitPropertyMember(PropertyMember node, BuildContext ctx) {
        Expression key = node.isComputed() ? buildExpr(node.getKey(), ctx) : node.getKey();
        return new PropertyMember(node.getLocation(), node.getModifiers(), buildDecorators(node.getDecorators(), ctx),
                key, node.isComputed(), node.isOptional(), node.isDefinite(), node.getType(),
                buildExpr(node.getValue(), ctx));
    }

    @Override
    public AstNode visitMethodMember(MethodMember node, BuildContext ctx) {
        Expression key = node.isComputed() ? buildExpr(node.getKey(), ctx) : node.getKey();
        return new MethodMember(node.getLocation(), node.getModifiers(), buildDecorators(node.getDecorators(), ctx),
                node.getKind(), key, node.isComputed(), node.isOptional(),
                (FunctionExpr) buildExpr(node.getFunction(), ctx));
    }

    @Override
    public AstNode visitIndexSignatureMember(IndexSignatureMember node, BuildContext ctx) {
        return node;
    }

    @Override
    public AstNode visitStaticBlockMember(StaticBlockMember node, BuildContext ctx) {
        return new StaticBlockMember(node.getLocation(), node.getModifiers(), node.getDecorators(),
                buildBlock(node.getBody(), ctx));
    }

    @Override
    public AstNode visitInterfaceDecl(InterfaceDecl node, BuildContext ctx) {
        return verbatim(node, "interface", ctx);
    }

    @Override
    public AstNode visitTypeAliasDecl(TypeAliasDecl node, BuildContext ctx) {
        return verbatim(node, "type", ctx);
    }

    @Override
    public AstNode visitEnumDecl(EnumDecl node, BuildContext ctx) {
        return verbatim(node, "enum", ctx);
    }

    @Override
    public AstNode visitNamespaceDecl(NamespaceDecl node, BuildContext ctx) {
        return verbatim(node, node.getKeyword(), ctx);
    }

    // ========== 语句 ==========

    @Override
    public AstNode visitBlock(Block node, BuildContext ctx) {
        boolean scoped = ctx.enterScope(node);
        try {
            return new Block(node.getLocation(), buildStmts(node.getStatements(), ctx));
        } finally {
            if (scoped) ctx.exitScope();
        }
    }

    @Override
    public AstNode visitExpressionStmt(ExpressionStmt node, BuildContext ctx) {
        return new ExpressionStmt(node.getLocation(), buildExpr(node.getExpression(), ctx));
    }

    @Override
    public AstNode visitIfStmt(IfStmt node, BuildContext ctx) {
        return new IfStmt(node.getLocation(), buildExpr(node.getCondition(), ctx),
                buildStmt(node.getThenBranch(), ctx), buildStmt(node.getElseBranch(), ctx));
    }

    @Override
    public AstNode visitForStmt(ForStmt node, BuildContext ctx) {
        boolean scoped = ctx.enterScope(node);
        try {
            return new ForStmt(node.getLocation(), buildForHead(node.getInit(), ctx, false),
                    buildExpr(node.getTest(), ctx), buildExpr(node.getUpdate(), ctx), buildStmt(node.getBody(), ctx));
        } finally {
            if (scoped) ctx.exitScope();
        }
    }

    @Override
    public AstNode visitForInStmt(ForInStmt node, BuildContext ctx) {
        boolean scoped = ctx.enterScope(node);
        try {
            return new ForInStmt(node.getLocation(), buildForHead(node.getLeft(), ctx, true),
                    buildExpr(node.getRight(), ctx), buildStmt(node.getBody(), ctx), node.isOf(), node.isAwait());
        } finally {
            if (scoped) ctx.exitScope();
        }
    }

    @Override
    public AstNode visitWhileStmt(WhileStmt node, BuildContext ctx) {
        return new WhileStmt(node.getLocation(), buildExpr(node.getCondition(), ctx), buildStmt(node.getBody(), ctx));
    }

    @Override
    public AstNode visitDoWhileStmt(DoWhileStmt node, BuildContext ctx) {
        return new DoWhileStmt(node.getLocation(), buildStmt(node.getBody(), ctx), buildExpr(node.getCondition(), ctx));
    }

    @Override
    public AstNode visitReturnStmt(ReturnStmt node, BuildContext ctx) {
        return new ReturnStmt(node.getLocation(), buildExpr(node.getValue(), ctx));
    }

    @Override
    public AstNode visitBreakStmt(BreakStmt node, BuildContext ctx) {
        return node;
    }

    @Override
    public AstNode visitContinueStmt(ContinueStmt node, BuildContext ctx) {
        return node;
    }

    @Override
    public AstNode visitThrowStmt(ThrowStmt node, BuildContext ctx) {
        return new ThrowStmt(node.getLocation(), buildExpr(node.getValue(), ctx));
    }

    @Override
    public AstNode visitTryStmt(TryStmt node, BuildContext ctx) {
        CatchClause handler = null;
        if (node.getHandler() != null) {
            handler = (CatchClause) visitCatchClause(node.getHandler(), ctx);
        }
        return new TryStmt(node.getLocation(), buildBlock(node.getBlock(), ctx), handler,
                buildBlock(node.getFinalizer(), ctx));
    }

    @Override
    public AstNode visitCatchClause(CatchClause node, BuildContext ctx) {
        boolean scoped = ctx.enterScope(node);
        try {
            return new CatchClause(node.getLocation(), buildPattern(node.getParam(), ctx), node.getParamType(),
                    buildBlock(node.getBody(), ctx));
        } finally {
            if (scoped) ctx.exitScope();
        }
    }

    @Override
    public AstNode visitSwitchStmt(SwitchStmt node, BuildContext ctx) {
        Expression discriminant = buildExpr(node.getDiscriminant(), ctx);
        List<SwitchCase> cases = new ArrayList<SwitchCase>();
        for (SwitchCase c : node.getCases()) {
            cases.add(new SwitchCase(c.getLocation(), buildExpr(c.getTest(), ctx), buildStmts(c.getConsequent(), ctx)));
        }
        return new SwitchStmt(node.getLocation(), discriminant, cases);
    }

    @Override
    public AstNode visitLabeledStmt(LabeledStmt node, BuildContext ctx) {
        return new LabeledStmt(node.getLocation(), node.getLabel(), buildStmt(node.getBody(), ctx));
    }

    @Override
    public AstNode visitEmptyStmt(EmptyStmt node, BuildContext ctx) {
        return node;
    }

    @Override
    public AstNode visitDebuggerStmt(DebuggerStmt node, BuildContext ctx) {
        return node;
    }

    // ========== 表达式 ==========

    @Override
    public AstNode visitIdentifier(Identifier node, BuildContext ctx) {
        String name = node.getName();
        return new IdentifierIR(node.getLocation(), name, ctx.resolveScope(name),
                ctx.getSignals().isAccessor(name));
    }

    @Override
    public AstNode visitLiteral(Literal node, BuildContext ctx) {
        return node;
    }

    @Override
    public AstNode visitTemplateLiteral(TemplateLiteral node, BuildContext ctx) {
        return new TemplateLiteral(node.getLocation(), node.getRawQuasis(), node.getCookedQuasis(),
                buildExprs(node.getExpressions(), ctx));
    }

    @Override
    public AstNode visitTaggedTemplateExpr(TaggedTemplateExpr node, BuildContext ctx) {
        return new TaggedTemplateExpr(node.getLocation(), buildExpr(node.getTag(), ctx), node.getTypeArgs(),
                (TemplateLiteral) buildExpr(node.getQuasi(), ctx));
    }

    @Override
    public AstNode visitArrayLiteral(ArrayLiteral node, BuildContext ctx) {
        return new ArrayLiteral(node.getLocation(), buildExprs(node.getElements(), ctx));
    }

    @Override
    public AstNode visitObjectLiteral(ObjectLiteral node, BuildContext ctx) {
        List<ObjectProperty> properties = new ArrayList<ObjectProperty>();
        for (ObjectProperty p : node.getProperties()) {
            Expression key = p.isComputed() ? buildExpr(p.getKey(), ctx) : p.getKey();
            properties.add(new ObjectProperty(p.getLocation(), p.getKind(), key, p.isComputed(),
                    p.isShorthand(), buildExpr(p.getValue(), ctx)));
        }
        return new ObjectLiteral(node.getLocation(), properties);
    }

    @Override
    public AstNode visitFunctionExpr(FunctionExpr node, BuildContext ctx) {
        boolean scoped = ctx.enterScope(node);
        try {
            List<Parameter> params = buildParams(node.getParams(), ctx);
            String component = ctx.detectedComponent(node);
            Block body = component != null
                    ? buildDetectedBlock(component, node.getBody(), ctx)
                    : buildBlock(node.getBody(), ctx);
            return new FunctionExpr(node.getLocation(), node.getName(), node.getTypeParams(),
                    params, node.getReturnType(), body, node.isAsync(), node.isGenerator());
        } finally {
            if (scoped) ctx.exitScope();
        }
    }

    @Override
    public AstNode visitArrowFunction(ArrowFunction node, BuildContext ctx) {
        boolean scoped = ctx.enterScope(node);
        try {
            List<Parameter> params = buildParams(node.getParams(), ctx);
            String component = ctx.detectedComponent(node);
            AstNode body;
            if (component != null && node.getBody() instanceof Block) {
                body = buildDetectedBlock(component, (Block) node.getBody(), ctx);
            } else if (component != null) {
                body = buildDetectedExpr(component, (Expression) node.getBody(), ctx);
            } else if (node.getBody() instanceof Block) {
                body = buildBlock((Block) node.getBody(), ctx);
            } else {
                body = buildExpr((Expression) node.getBody(), ctx);
            }
            Scope scope = scoped ? ctx.currentScope() : null;
            List<String> captures = captures(node, scope);
            return new ArrowFunctionIR(node.getLocation(), node.getTypeParams(), params, node.getReturnType(),
                    body, node.isAsync(), captures, isPure(node, captures));
        } finally {
            if (scoped) ctx.exitScope();
        }
    }

    /**
     * 函数体引用的、在函数外部声明的本文件绑定
     */
    private static List<String> captures(ArrowFunction node, Scope scope) {
        final Set<String> referenced = new LinkedHashSet<String>();
        AstWalker.walk(node.getBody(), new AstWalker.NodeFilter() {
            @Override
            public boolean enter(AstNode n) {
                if (n instanceof Identifier) {
                    referenced.add(((Identifier) n).getName());
                } else if (n instanceof ObjectProperty) {
                    ObjectProperty p = (ObjectProperty) n;
                    // 非计算键不是引用
                    if (!p.isComputed() && p.getKey() != null && p.getValue() != null && !p.isShorthand()) {
                        AstWalker.walk(p.getValue(), this);
                        return false;
                    }
                }
                return true;
            }
        });
        List<String> result = new ArrayList<String>();
        if (scope == null) return result;
        Set<String> inner = new HashSet<String>();
        collectDeclared(scope, inner);
        for (String name : referenced) {
            if (inner.contains(name)) continue;
            Scope declaring = scope.getParent() != null ? scope.getParent().findDeclaringScope(name) : null;
            if (declaring != null && declaring.getType() != Scope.ScopeType.GLOBAL) {
                result.add(name);
            }
        }
        return result;
    }

    private static void collectDeclared(Scope scope, Set<String> out) {
        out.addAll(scope.getSymbols().keySet());
        for (Scope child : scope.getChildren()) {
            collectDeclared(child, out);
        }
    }

    /**
     * 没有调用、构造、await/yield，也不修改捕获的变量
     */
    private static boolean isPure(ArrowFunction node, final List<String> captures) {
        final boolean[] pure = {true};
        AstWalker.walk(node.getBody(), new AstWalker.NodeFilter() {
            @Override
            public boolean enter(AstNode n) {
                if (!pure[0]) return false;
                if (n instanceof CallExpr || n instanceof NewExpr || n instanceof TaggedTemplateExpr
                        || n instanceof AwaitExpr || n instanceof YieldExpr) {
                    pure[0] = false;
                } else if (n instanceof UnaryExpr && "delete".equals(((UnaryExpr) n).getOperator())) {
                    pure[0] = false;
                } else if (n instanceof AssignExpr) {
                    pure[0] = !writesCapture(((AssignExpr) n).getTarget(), captures);
                } else if (n instanceof UpdateExpr) {
                    pure[0] = !writesCapture(((UpdateExpr) n).getOperand(), captures);
                }
                return pure[0];
            }
        });
        return pure[0];
    }

    private static boolean writesCapture(Expression target, List<String> captures) {
        Expression root = target;
        while (root instanceof MemberExpr || root instanceof IndexExpr || root instanceof ParenExpr) {
            if (root instanceof MemberExpr) root = ((MemberExpr) root).getObject();
            else if (root instanceof IndexExpr) root = ((IndexExpr) root).getObject();
            else root = ((ParenExpr) root).getExpression();
        }
        for (String name : Patterns.boundNames(root)) {
            if (captures.contains(name)) return true;
        }
        return false;
    }

    @Override
    public AstNode visitClassExpr(ClassExpr node, BuildContext ctx) {
        return new ClassExpr(node.getLocation(), (ClassDecl) visitClassDecl(node.getDeclaration(), ctx));
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, BuildContext ctx) {
        return new UnaryExpr(node.getLocation(), node.getOperator(), buildExpr(node.getOperand(), ctx));
    }

    @Override
    public AstNode visitUpdateExpr(UpdateExpr node, BuildContext ctx) {
        return new UpdateExpr(node.getLocation(), node.getOperator(), node.isPrefix(), buildExpr(node.getOperand(), ctx));
    }

    @Override
    public AstNode visitBinaryExpr(BinaryExpr node, BuildContext ctx) {
        return new BinaryExpr(node.getLocation(), buildExpr(node.getLeft(), ctx), node.getOperator(),
                buildExpr(node.getRight(), ctx));
    }

    @Override
    public AstNode visitAssignExpr(AssignExpr node, BuildContext ctx) {
        return new AssignExpr(node.getLocation(), node.getOperator(), buildExpr(node.getTarget(), ctx),
                buildExpr(node.getValue(), ctx));
    }

    @Override
    public AstNode visitConditionalExpr(ConditionalExpr node, BuildContext ctx) {
        return new ConditionalExpr(node.getLocation(), buildExpr(node.getCondition(), ctx),
                buildExpr(node.getThenExpr(), ctx), buildExpr(node.getElseExpr(), ctx));
    }

    @Override
    public AstNode visitCallExpr(CallExpr node, BuildContext ctx) {
        String calleeName = node.getCalleeName();
        boolean signalCreation = false;
        if (calleeName != null) {
            IdentifierScope scope = ctx.resolveScope(calleeName);
            // 同名的本地函数不是信号创建函数
            signalCreation = ctx.getSignals().isCreator(calleeName)
                    && (scope == IdentifierScope.GLOBAL || scope == IdentifierScope.IMPORTED);
            if (signalCreation || ctx.getSignals().isAccessor(calleeName)) {
                ctx.markSignalUse();
            }
        }
        return new CallIR(node.getLocation(), buildExpr(node.getCallee(), ctx), node.getTypeArgs(),
                buildExprs(node.getArguments(), ctx), node.isOptional(), signalCreation);
    }

    @Override
    public AstNode visitNewExpr(NewExpr node, BuildContext ctx) {
        return new NewExpr(node.getLocation(), buildExpr(node.getCallee(), ctx), node.getTypeArgs(),
                node.getArguments() == null ? null : buildExprs(node.getArguments(), ctx));
    }

    @Override
    public AstNode visitMemberExpr(MemberExpr node, BuildContext ctx) {
        return new MemberExpr(node.getLocation(), buildExpr(node.getObject(), ctx), node.getProperty(), node.isOptional());
    }

    @Override
    public AstNode visitIndexExpr(IndexExpr node, BuildContext ctx) {
        return new IndexExpr(node.getLocation(), buildExpr(node.getObject(), ctx), buildExpr(node.getIndex(), ctx),
                node.isOptional());
    }

    @Override
    public AstNode visitNonNullExpr(NonNullExpr node, BuildContext ctx) {
        return new NonNullExpr(node.getLocation(), buildExpr(node.getExpression(), ctx));
    }

    @Override
    public AstNode visitTypeAssertionExpr(TypeAssertionExpr node, BuildContext ctx) {
        return new TypeAssertionExpr(node.getLocation(), buildExpr(node.getExpression(), ctx), node.getKeyword(),
                node.getType());
    }

    @Override
    public AstNode visitSequenceExpr(SequenceExpr node, BuildContext ctx) {
        return new SequenceExpr(node.getLocation(), buildExprs(node.getExpressions(), ctx));
    }

    @Override
    public AstNode visitSpreadElement(SpreadElement node, BuildContext ctx) {
        return new SpreadElement(node.getLocation(), buildExpr(node.getArgument(), ctx));
    }

    @Override
    public AstNode visitAwaitExpr(AwaitExpr node, BuildContext ctx) {
        return new AwaitExpr(node.getLocation(), buildExpr(node.getArgument(), ctx));
    }

    @Override
    public AstNode visitYieldExpr(YieldExpr node, BuildContext ctx) {
        return new YieldExpr(node.getLocation(), buildExpr(node.getArgument(), ctx), node.isDelegate());
    }

    @Override
    public AstNode visitParenExpr(ParenExpr node, BuildContext ctx) {
        return new ParenExpr(node.getLocation(), buildExpr(node.getExpression(), ctx));
    }

    @Override
    public AstNode visitThisExpr(ThisExpr node, BuildContext ctx) {
        return node;
    }

    @Override
    public AstNode visitSuperExpr(SuperExpr node, BuildContext ctx) {
        return node;
    }

    @Override
    public AstNode visitMetaProperty(MetaProperty node, BuildContext ctx) {
        return node;
    }

    // ========== JSX ==========

    @Override
    public AstNode visitJsxElement(JsxElement node, BuildContext ctx) {
        return jsx.lowerElement(node, ctx);
    }

    @Override
    public AstNode visitJsxFragment(JsxFragment node, BuildContext ctx) {
        return jsx.lowerFragment(node, ctx);
    }
}
