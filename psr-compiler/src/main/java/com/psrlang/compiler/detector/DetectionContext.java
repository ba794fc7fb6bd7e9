package com.psrlang.compiler.detector;

import com.psrlang.compiler.analysis.ParentMap;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.decl.VariableDeclarator;
import com.psrlang.compiler.ast.expr.ParenExpr;
import com.psrlang.compiler.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 检测上下文：父节点映射、调试开关和检测期间产生的警告
 */
public final class DetectionContext {

    private final ParentMap parents;
    private final boolean debug;
    private final List<Diagnostic> warnings = new ArrayList<Diagnostic>();

    public DetectionContext(ParentMap parents, boolean debug) {
        this.parents = parents;
        this.debug = debug;
    }

    public boolean isDebug() {
        return debug;
    }

    /** 父节点，括号表达式视为透明 */
    public AstNode getParent(AstNode node) {
        AstNode parent = parents != null ? parents.getParent(node) : null;
        while (parent instanceof ParenExpr) {
            parent = parents.getParent(parent);
        }
        return parent;
    }

    /**
     * 函数名：声明名称，或匿名函数所绑定的变量名
     */
    public String nameOf(FunctionLike function) {
        if (function.getName() != null) {
            return function.getName();
        }
        AstNode parent = getParent((AstNode) function);
        while (parent instanceof ParenExpr) {
            parent = getParent(parent);
        }
        if (parent instanceof VariableDeclarator) {
            return ((VariableDeclarator) parent).getSimpleName();
        }
        return null;
    }

    public void addWarning(Diagnostic warning) {
        warnings.add(warning);
    }

    public List<Diagnostic> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
