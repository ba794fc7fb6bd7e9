package com.psrlang.compiler.detector;

import com.psrlang.compiler.analysis.AstWalker;
import com.psrlang.compiler.analysis.ParentMap;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.decl.FunctionDecl;
import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.ast.decl.VariableDecl;
import com.psrlang.compiler.ast.expr.ArrowFunction;
import com.psrlang.compiler.ast.expr.CallExpr;
import com.psrlang.compiler.ast.expr.ParenExpr;
import com.psrlang.compiler.ast.stmt.ExpressionStmt;
import com.psrlang.compiler.ast.stmt.Statement;
import com.psrlang.compiler.diagnostic.Diagnostic;
import com.psrlang.compiler.diagnostic.DiagnosticType;
import com.psrlang.compiler.diagnostic.Phase;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ComponentDetector 与检测策略测试
 */
class ComponentDetectorTest {

    private Program program;
    private DetectionContext context;

    // ============ 辅助方法 ============

    private Program parse(String source) {
        program = new Parser(new Lexer(source)).parse();
        context = new DetectionContext(ParentMap.build(program), false);
        return program;
    }

    /**
     * 解析单个函数声明或 const x = 函数 并运行默认检测器
     */
    private DetectionResult detect(String source) {
        parse(source);
        return new ComponentDetector().detect(firstFunction(), context);
    }

    private FunctionLike firstFunction() {
        Statement first = program.getBody().get(0);
        if (first instanceof FunctionDecl) {
            return (FunctionDecl) first;
        }
        if (first instanceof VariableDecl) {
            return (FunctionLike) ((VariableDecl) first).getDeclarators().get(0).getInit();
        }
        CallExpr call = (CallExpr) ((ExpressionStmt) first).getExpression();
        return (FunctionLike) call.getArguments().get(0);
    }

    /** 固定结果的测试策略 */
    private static DetectionStrategy fixed(final String name, final int priority, final boolean hit) {
        return new DetectionStrategy() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public int getPriority() {
                return priority;
            }

            @Override
            public DetectionResult detect(FunctionLike function, DetectionContext context) {
                return hit
                        ? DetectionResult.positive(name, Confidence.LOW, "fixed", "F")
                        : DetectionResult.negative(name, "fixed");
            }
        };
    }

    // ============ 内置策略 ============

    @Nested
    @DisplayName("内置策略")
    class BuiltinStrategyTests {

        @Test
        @DisplayName("元素返回类型优先于直接 JSX 返回")
        void testReturnTypeWins() {
            DetectionResult result = detect("function view(): HTMLElement { return <div/>; }");
            assertThat(result.isComponent()).isTrue();
            assertThat(result.getStrategyName()).isEqualTo("ReturnType");
            assertThat(result.getConfidence()).isEqualTo(Confidence.HIGH);
            assertThat(result.getComponentName()).isEqualTo("view");
        }

        @Test
        @DisplayName("箭头函数表达式体为 JSX")
        void testDirectArrow() {
            DetectionResult result = detect("const view = () => <div/>;");
            assertThat(result.getStrategyName()).isEqualTo("DirectJsxReturn");
            assertThat(result.getComponentName()).isEqualTo("view");
        }

        @Test
        @DisplayName("条件分支中返回 JSX")
        void testConditional() {
            DetectionResult result = detect("function view(ok) { if (ok) { return <a/>; } return null; }");
            assertThat(result.getStrategyName()).isEqualTo("ConditionalJsxReturn");

            assertThat(detect("const v = (ok) => ok ? <a/> : null;").getStrategyName())
                    .isEqualTo("ConditionalJsxReturn");
        }

        @Test
        @DisplayName("PascalCase 名称为中等置信度")
        void testPascalCase() {
            DetectionResult result = detect("function Header() { return title; }");
            assertThat(result.getStrategyName()).isEqualTo("PascalCase");
            assertThat(result.getConfidence()).isEqualTo(Confidence.MEDIUM);
        }

        @Test
        @DisplayName("嵌套回调中的 JSX 为低置信度")
        void testJsxInBody() {
            DetectionResult result = detect("function render() { items.map(i => <li/>); return 1; }");
            assertThat(result.getStrategyName()).isEqualTo("HasJsxInBody");
            assertThat(result.getConfidence()).isEqualTo(Confidence.LOW);
        }

        @Test
        @DisplayName("没有策略命中")
        void testNone() {
            DetectionResult result = detect("function HEADER() { return x; }");
            assertThat(result.isComponent()).isFalse();
            assertThat(result.getStrategyName()).isEqualTo(DetectionResult.NONE);
        }
    }

    // ============ 变量返回与自动注解 ============

    @Nested
    @DisplayName("变量 JSX 返回")
    class VariableReturnTests {

        @Test
        @DisplayName("缺少返回类型时补上 HTMLElement")
        void testAnnotates() {
            DetectionResult result = detect("function card() { const el = <div/>; return el; }");
            assertThat(result.getStrategyName()).isEqualTo("VariableJsxReturn");
            assertThat(firstFunction().getReturnType().getText()).isEqualTo("HTMLElement");
            assertThat(context.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("async 函数不补写返回类型")
        void testAsyncNotAnnotated() {
            DetectionResult result = detect("async function card() { const el = <div/>; return el; }");
            assertThat(result.isComponent()).isTrue();
            assertThat(firstFunction().getReturnType()).isNull();
        }

        @Test
        @DisplayName("非元素类型注解不被覆盖并产生警告")
        void testWarnsOnMismatch() {
            detect("function Card(): string { const el = <div/>; return el; }");

            assertThat(firstFunction().getReturnType().getText()).isEqualTo("string");
            List<Diagnostic> warnings = context.getWarnings();
            assertThat(warnings).hasSize(1);
            assertThat(warnings.get(0).getType()).isEqualTo(DiagnosticType.WARNING);
            assertThat(warnings.get(0).getPhase()).isEqualTo(Phase.DETECTOR);
            assertThat(warnings.get(0).getMessage())
                    .isEqualTo("Function 'Card' returns a JSX element but is annotated ': string'");
        }
    }

    // ============ 否定策略 ============

    @Nested
    @DisplayName("匿名回调")
    class SuppressionTests {

        @Test
        @DisplayName("作为实参的箭头函数不是组件")
        void testCallbackSuppressed() {
            DetectionResult result = detect("items.map((i) => <li>{i}</li>);");
            assertThat(result.isComponent()).isFalse();
            assertThat(result.getStrategyName()).isEqualTo("AnonymousCallback");
        }

        @Test
        @DisplayName("立即调用的箭头函数不被否定")
        void testIifeNotSuppressed() {
            parse("(() => <div/>)();");
            CallExpr call = (CallExpr) ((ExpressionStmt) program.getBody().get(0)).getExpression();
            FunctionLike arrow = (FunctionLike) ((ParenExpr) call.getCallee()).getExpression();
            DetectionResult result = new ComponentDetector().detect(arrow, context);
            assertThat(result.getStrategyName()).isEqualTo("DirectJsxReturn");
        }

        @Test
        @DisplayName("数组元素、对象属性值和 new 实参中的箭头函数不是组件")
        void testElementAndPropertySuppressed() {
            String[] sources = {
                    "const rows = [() => <tr/>, () => <tr/>];",
                    "const routes = { home: () => <Home/> };",
                    "const task = new Task(() => <p/>);"
            };
            for (String source : sources) {
                parse(source);
                DetectionResult result = new ComponentDetector().detect(firstArrow(), context);
                assertThat(result.isComponent()).as(source).isFalse();
                assertThat(result.getStrategyName()).as(source).isEqualTo("AnonymousCallback");
            }
        }

        @Test
        @DisplayName("括号包裹的回调同样被否定")
        void testParenthesizedCallback() {
            parse("f((() => <X/>));");
            DetectionResult result = new ComponentDetector().detect(firstArrow(), context);
            assertThat(result.isComponent()).isFalse();
            assertThat(result.getStrategyName()).isEqualTo("AnonymousCallback");
        }

        @Test
        @DisplayName("括号包裹的变量初始值仍按名称检测")
        void testParenthesizedInitializer() {
            parse("const Badge = (() => <span/>);");
            DetectionResult result = new ComponentDetector().detect(firstArrow(), context);
            assertThat(result.isComponent()).isTrue();
            assertThat(result.getComponentName()).isEqualTo("Badge");
        }

        private FunctionLike firstArrow() {
            final FunctionLike[] found = new FunctionLike[1];
            AstWalker.walk(program, new AstWalker.NodeFilter() {
                @Override
                public boolean enter(AstNode node) {
                    if (found[0] == null && node instanceof ArrowFunction) {
                        found[0] = (FunctionLike) node;
                    }
                    return found[0] == null;
                }
            });
            return found[0];
        }
    }

    // ============ 优先级 ============

    @Nested
    @DisplayName("优先级规则")
    class PriorityTests {

        @Test
        @DisplayName("数值更小的策略先运行，与注册顺序无关")
        void testLowerPriorityFirst() {
            ComponentDetector detector = ComponentDetector.empty();
            detector.register(fixed("late", 5, true));
            detector.register(fixed("early", 1, true));

            assertThat(detector.getStrategies()).hasSize(2);
            assertThat(detector.getStrategies().get(0).getName()).isEqualTo("early");
            parse("function f() {}");
            assertThat(detector.detect(firstFunction(), context).getStrategyName()).isEqualTo("early");
        }

        @Test
        @DisplayName("同优先级按注册顺序")
        void testRegistrationOrderTieBreak() {
            ComponentDetector detector = ComponentDetector.empty();
            detector.register(fixed("miss", 2, false));
            detector.register(fixed("first", 2, true));
            detector.register(fixed("second", 2, true));

            parse("function f() {}");
            assertThat(detector.detect(firstFunction(), context).getStrategyName()).isEqualTo("first");
        }

        @Test
        @DisplayName("空检测器总是返回 none")
        void testEmpty() {
            parse("function Foo() { return <div/>; }");
            DetectionResult result = ComponentDetector.empty().detect(firstFunction(), context);
            assertThat(result.isComponent()).isFalse();
            assertThat(result.getComponentName()).isEqualTo("Foo");
        }
    }

    // ============ 全程序检测 ============

    @Nested
    @DisplayName("全程序检测")
    class DetectAllTests {

        @Test
        @DisplayName("只收集声明和绑定到变量的函数")
        void testCandidates() {
            parse("function Foo() { return <div/>; }\n"
                    + "const bar = () => <span/>;\n"
                    + "const x = list.map(i => <li/>);\n"
                    + "function util() { return 1; }");
            DetectionReport report = new ComponentDetector().detectAll(program, context);

            assertThat(report.size()).isEqualTo(2);
            assertThat(report.find("Foo").getResult().getStrategyName()).isEqualTo("DirectJsxReturn");
            assertThat(report.find("bar")).isNotNull();
            assertThat(report.find("util")).isNull();
            assertThat(report.find("Foo").getLine()).isEqualTo(1);
        }

        @Test
        @DisplayName("报告转换为 info 诊断")
        void testToDiagnostics() {
            parse("function Foo() { return <div/>; }");
            List<Diagnostic> diagnostics = new ComponentDetector().detectAll(program, context).toDiagnostics();

            assertThat(diagnostics).hasSize(1);
            assertThat(diagnostics.get(0).getType()).isEqualTo(DiagnosticType.INFO);
            assertThat(diagnostics.get(0).getMessage())
                    .isEqualTo("Detected component 'Foo' via DirectJsxReturn (HIGH): Function has a direct JSX return");
        }
    }

    // ============ 静态判断 ============

    @Nested
    @DisplayName("类型与命名判断")
    class PredicateTests {

        @Test
        @DisplayName("元素类型")
        void testElementType() {
            assertThat(ReturnTypeStrategy.isElementType("HTMLElement")).isTrue();
            assertThat(ReturnTypeStrategy.isElementType("HTMLElement | null")).isTrue();
            assertThat(ReturnTypeStrategy.isElementType("JSX.Element")).isTrue();
            assertThat(ReturnTypeStrategy.isElementType("string")).isFalse();
            assertThat(ReturnTypeStrategy.isElementType(null)).isFalse();
        }

        @Test
        @DisplayName("PascalCase")
        void testPascalCase() {
            assertThat(PascalCaseStrategy.isPascalCase("Foo")).isTrue();
            assertThat(PascalCaseStrategy.isPascalCase("A")).isTrue();
            assertThat(PascalCaseStrategy.isPascalCase("FOO")).isFalse();
            assertThat(PascalCaseStrategy.isPascalCase("_Foo")).isFalse();
            assertThat(PascalCaseStrategy.isPascalCase("foo")).isFalse();
        }
    }
}
