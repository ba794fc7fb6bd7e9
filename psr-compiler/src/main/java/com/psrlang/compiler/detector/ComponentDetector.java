package com.psrlang.compiler.detector;

import com.psrlang.compiler.analysis.AstWalker;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.decl.ExportDecl;
import com.psrlang.compiler.ast.decl.FunctionDecl;
import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.ast.decl.VariableDeclarator;
import com.psrlang.compiler.ast.expr.ArrowFunction;
import com.psrlang.compiler.ast.expr.FunctionExpr;
import com.psrlang.compiler.ast.expr.ParenExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * 组件检测器：按优先级依次运行策略，第一个命中的结果即为最终结果
 *
 * <p>否定策略总在检测策略之前运行，命中后直接判定为非组件。
 * 同优先级的策略保持注册顺序。</p>
 */
public final class ComponentDetector {

    private static final Logger LOG = Logger.getLogger(ComponentDetector.class.getName());

    private final List<SuppressionStrategy> suppressions = new ArrayList<SuppressionStrategy>();
    private final List<DetectionStrategy> strategies = new ArrayList<DetectionStrategy>();

    public ComponentDetector() {
        register(new AnonymousCallbackStrategy());
        register(new ReturnTypeStrategy());
        register(new DirectJsxReturnStrategy());
        register(new VariableJsxReturnStrategy());
        register(new ConditionalJsxReturnStrategy());
        register(new PascalCaseStrategy());
        register(new HasJsxInBodyStrategy());
    }

    /** 不含任何策略的检测器 */
    public static ComponentDetector empty() {
        ComponentDetector detector = new ComponentDetector();
        detector.suppressions.clear();
        detector.strategies.clear();
        return detector;
    }

    public void register(DetectionStrategy strategy) {
        strategies.add(strategy);
        // Collections.sort 是稳定排序，同优先级保持注册顺序
        Collections.sort(strategies, new Comparator<DetectionStrategy>() {
            @Override
            public int compare(DetectionStrategy a, DetectionStrategy b) {
                return Integer.compare(a.getPriority(), b.getPriority());
            }
        });
    }

    public void register(SuppressionStrategy strategy) {
        suppressions.add(strategy);
        Collections.sort(suppressions, new Comparator<SuppressionStrategy>() {
            @Override
            public int compare(SuppressionStrategy a, SuppressionStrategy b) {
                return Integer.compare(a.getPriority(), b.getPriority());
            }
        });
    }

    public List<DetectionStrategy> getStrategies() {
        return Collections.unmodifiableList(strategies);
    }

    public DetectionResult detect(FunctionLike function, DetectionContext context) {
        for (SuppressionStrategy suppression : suppressions) {
            if (suppression.suppresses(function, context)) {
                return DetectionResult.negative(suppression.getName(), suppression.getReason());
            }
        }
        for (DetectionStrategy strategy : strategies) {
            DetectionResult result = strategy.detect(function, context);
            if (result.isComponent()) {
                return result;
            }
        }
        return DetectionResult.none(context.nameOf(function));
    }

    /**
     * 检测程序中的函数声明、绑定到变量的函数表达式/箭头函数和默认导出的函数
     */
    public DetectionReport detectAll(Program program, final DetectionContext context) {
        final DetectionReport report = new DetectionReport();
        AstWalker.walk(program, new AstWalker.NodeFilter() {
            @Override
            public boolean enter(AstNode node) {
                if (isCandidate(node, context)) {
                    FunctionLike function = (FunctionLike) node;
                    DetectionResult result = detect(function, context);
                    if (result.isComponent()) {
                        String name = result.getComponentName() != null
                                ? result.getComponentName() : context.nameOf(function);
                        report.add(name, node, result);
                        LOG.fine("Detected " + name + ": " + result);
                    }
                }
                return true;
            }
        });
        return report;
    }

    private static boolean isCandidate(AstNode node, DetectionContext context) {
        if (node instanceof FunctionDecl) {
            return !((FunctionDecl) node).isSignatureOnly();
        }
        if (node instanceof FunctionExpr || node instanceof ArrowFunction) {
            AstNode parent = context.getParent(node);
            while (parent instanceof ParenExpr) {
                parent = context.getParent(parent);
            }
            return parent instanceof VariableDeclarator || parent instanceof ExportDecl;
        }
        return false;
    }
}
