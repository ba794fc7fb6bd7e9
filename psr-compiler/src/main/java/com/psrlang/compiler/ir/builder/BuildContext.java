package com.psrlang.compiler.ir.builder;

import com.psrlang.compiler.analysis.Scope;
import com.psrlang.compiler.analysis.SignalInfo;
import com.psrlang.compiler.analysis.Symbol;
import com.psrlang.compiler.analysis.SymbolKind;
import com.psrlang.compiler.analysis.SymbolTable;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.classifier.ClassificationContext;
import com.psrlang.compiler.detector.DetectionReport;
import com.psrlang.compiler.diagnostic.Phase;
import com.psrlang.compiler.ir.IdentifierScope;
import com.psrlang.compiler.ir.decl.ComponentIR;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * IR 构建上下文：源码、符号表、当前作用域和正在构建的组件
 */
public final class BuildContext {

    /**
     * 正在构建的组件中累积的信息
     */
    static final class ComponentState {
        final Set<String> dependencies = new LinkedHashSet<String>();
        boolean usesSignals;
        boolean hasEventHandlers;
    }

    private final String source;
    private final String fileName;
    private final SymbolTable symbols;
    private final SignalInfo signals;
    private final ClassificationContext classification;
    private final DepthGuard depth;

    private final Deque<Scope> scopes = new ArrayDeque<Scope>();
    private final Deque<ComponentState> componentStates = new ArrayDeque<ComponentState>();
    private final Set<String> componentNames = new LinkedHashSet<String>();
    private final List<ComponentIR> components = new ArrayList<ComponentIR>();
    private DetectionReport detection;
    private boolean usesJsx;

    public BuildContext(String source, String fileName, SymbolTable symbols, SignalInfo signals, int maxDepth) {
        this.source = source;
        this.fileName = fileName;
        this.symbols = symbols != null ? symbols : new SymbolTable();
        this.signals = signals != null ? signals : SignalInfo.empty();
        this.classification = new ClassificationContext(this.signals, new ClassificationContext.TypeLookup() {
            @Override
            public String typeOf(String name) {
                Symbol symbol = lookup(name);
                // 导入符号记录的是模块路径
                if (symbol == null || symbol.getKind() == SymbolKind.IMPORT) return null;
                return symbol.getInferredType();
            }
        });
        this.depth = new DepthGuard(maxDepth, Phase.ANALYZER);
        this.scopes.push(this.symbols.getGlobalScope());
    }

    public String getFileName() {
        return fileName;
    }

    public SignalInfo getSignals() {
        return signals;
    }

    public ClassificationContext getClassificationContext() {
        return classification;
    }

    public DepthGuard getDepthGuard() {
        return depth;
    }

    /** 节点对应的源码文本 */
    public String sourceText(SourceLocation location) {
        int start = location.getOffset();
        int end = location.getEndOffset();
        if (source == null || start < 0 || end > source.length() || start > end) {
            throw new IrBuildException("Source text is not available for this declaration", location);
        }
        return source.substring(start, end);
    }

    // ============ 作用域 ============

    /**
     * 节点引入了作用域时进入该作用域
     *
     * @return 是否进入（调用方据此决定是否 exitScope）
     */
    public boolean enterScope(AstNode node) {
        Scope scope = symbols.getScope(node);
        if (scope == null) return false;
        scopes.push(scope);
        return true;
    }

    public void exitScope() {
        scopes.pop();
    }

    public Scope currentScope() {
        return scopes.peek();
    }

    public Symbol lookup(String name) {
        return currentScope().resolve(name);
    }

    public IdentifierScope resolveScope(String name) {
        Symbol symbol = lookup(name);
        if (symbol == null) return IdentifierScope.GLOBAL;
        if (symbol.getKind() == SymbolKind.IMPORT) return IdentifierScope.IMPORTED;
        if (symbol.getKind() == SymbolKind.PARAMETER) return IdentifierScope.PARAMETER;
        return IdentifierScope.LOCAL;
    }

    // ============ 组件 ============

    /** 检测阶段的结果；被检测为组件的函数体在注册表中执行 */
    public void setDetection(DetectionReport detection) {
        this.detection = detection;
    }

    /**
     * 被检测为组件的函数的组件名；未检测到或没有名称时为 null
     */
    String detectedComponent(AstNode function) {
        if (detection == null) return null;
        DetectionReport.Entry entry = detection.entryFor(function);
        return entry != null ? entry.getName() : null;
    }

    /**
     * 登记组件名
     *
     * @return 同名组件已存在时返回 false
     */
    boolean registerComponentName(String name) {
        return componentNames.add(name);
    }

    void enterComponent() {
        componentStates.push(new ComponentState());
    }

    ComponentState exitComponent() {
        return componentStates.pop();
    }

    void addComponent(ComponentIR component) {
        components.add(component);
    }

    public List<ComponentIR> getComponents() {
        return components;
    }

    void addDependencies(Collection<String> deps) {
        ComponentState state = componentStates.peek();
        if (state != null && !deps.isEmpty()) {
            state.dependencies.addAll(deps);
            state.usesSignals = true;
        }
    }

    void markSignalUse() {
        ComponentState state = componentStates.peek();
        if (state != null) state.usesSignals = true;
    }

    void markEventHandler() {
        ComponentState state = componentStates.peek();
        if (state != null) state.hasEventHandlers = true;
    }

    void markJsx() {
        usesJsx = true;
    }

    public boolean usesJsx() {
        return usesJsx;
    }
}
