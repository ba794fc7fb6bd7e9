package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.decl.VariableDecl;
import com.psrlang.compiler.ast.decl.VariableDeclarator;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.Identifier;
import com.psrlang.compiler.ast.stmt.ReturnStmt;
import com.psrlang.compiler.ast.stmt.Statement;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeReference;
import com.psrlang.compiler.diagnostic.Diagnostic;
import com.psrlang.compiler.diagnostic.Phase;

import java.util.Collections;
import java.util.logging.Logger;

/**
 * 先把 JSX 赋给变量再返回该变量：const el = &lt;div/&gt;; return el;
 *
 * <p>命中且没有返回类型时补上 {@code : HTMLElement}；已有注解时从不覆盖，
 * 注解不是元素类型则产生警告。</p>
 */
public final class VariableJsxReturnStrategy implements DetectionStrategy {

    private static final Logger LOG = Logger.getLogger(VariableJsxReturnStrategy.class.getName());

    static final String ELEMENT_TYPE = "HTMLElement";

    @Override
    public String getName() {
        return "VariableJsxReturn";
    }

    @Override
    public int getPriority() {
        return 2;
    }

    @Override
    public DetectionResult detect(FunctionLike function, DetectionContext context) {
        String variable = findReturnedJsxVariable(function);
        if (variable == null) {
            return DetectionResult.negative(getName(), "No variable JSX return");
        }
        String name = context.nameOf(function);
        annotate(function, name, context);
        return DetectionResult.positive(getName(), Confidence.HIGH,
                "const " + variable + " = <JSX>; return " + variable, name);
    }

    /** 顶层 const/let 以 JSX 初始化且随后被 return 的变量名 */
    static String findReturnedJsxVariable(FunctionLike function) {
        String candidate = null;
        for (Statement statement : JsxReturns.statements(function)) {
            if (statement instanceof VariableDecl) {
                for (VariableDeclarator declarator : ((VariableDecl) statement).getDeclarators()) {
                    if (declarator.getSimpleName() != null && declarator.getInit() != null
                            && JsxReturns.isJsx(declarator.getInit())) {
                        candidate = declarator.getSimpleName();
                    }
                }
            } else if (statement instanceof ReturnStmt && candidate != null) {
                Expression value = JsxReturns.unwrap(((ReturnStmt) statement).getValue());
                if (value instanceof Identifier && ((Identifier) value).getName().equals(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private void annotate(FunctionLike function, String name, DetectionContext context) {
        TypeNode existing = function.getReturnType();
        SourceLocation loc = function.getLocation();
        if (existing == null) {
            // async 函数的返回类型是 Promise，不自动补写
            if (function.isAsync()) return;
            function.setReturnType(new TypeReference(loc, ELEMENT_TYPE, ELEMENT_TYPE,
                    Collections.<TypeNode>emptyList()));
            LOG.fine("Annotated " + (name != null ? name : "anonymous function") + " with ': HTMLElement'");
            return;
        }
        if (!ReturnTypeStrategy.isElementType(existing.getText())) {
            context.addWarning(Diagnostic.warning("Function '" + (name != null ? name : "<anonymous>")
                    + "' returns a JSX element but is annotated ': " + existing.getText() + "'",
                    Phase.DETECTOR, loc.getLine(), loc.getColumn()));
        }
    }
}
