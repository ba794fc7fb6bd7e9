package com.psrlang.compiler;

import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.detector.ComponentDetector;
import com.psrlang.compiler.detector.DetectionContext;
import com.psrlang.compiler.detector.DetectionResult;
import com.psrlang.compiler.detector.DetectionStrategy;
import com.psrlang.compiler.diagnostic.Diagnostic;
import com.psrlang.compiler.diagnostic.DiagnosticType;
import com.psrlang.compiler.diagnostic.Phase;
import com.psrlang.compiler.lexer.LexerMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PsrCompiler 端到端测试
 */
class PsrCompilerTest {

    private static final String COUNTER = "component Counter() {\n"
            + "  const count = signal(0);\n"
            + "  return <div>{count()}</div>;\n"
            + "}\n";

    private final PsrCompiler compiler = new PsrCompiler();

    // ============ 成功路径 ============

    @Nested
    @DisplayName("转换")
    class TransformTests {

        @Test
        @DisplayName("静态组件")
        void testGreeting() {
            TransformResult result = compiler.transform(
                    "component Greeting(name: string) {\n  return <div>Hello {name}</div>;\n}\n");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getDiagnostics()).isEmpty();
            assertThat(result.getMetrics()).isNull();
            assertThat(result.getCode()).isEqualTo(
                    "import { $REGISTRY, t_element } from '@pulsar-framework/pulsar.dev';\n"
                            + "\n"
                            + "const Greeting = (name: string): HTMLElement => {\n"
                            + "  return $REGISTRY.execute('component:Greeting', () => {\n"
                            + "    return t_element('div', {}, ['Hello ', name]);\n"
                            + "  });\n"
                            + "};\n");
        }

        @Test
        @DisplayName("读取信号的组件")
        void testCounter() {
            TransformResult result = compiler.transform(COUNTER);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).isEqualTo(
                    "import { $REGISTRY, createSignal, t_element } from '@pulsar-framework/pulsar.dev';\n"
                            + "\n"
                            + "const Counter = (): HTMLElement => {\n"
                            + "  return $REGISTRY.execute('component:Counter', () => {\n"
                            + "    const count = createSignal(0);\n"
                            + "    return (() => {\n"
                            + "      const _el0 = t_element('div', {}, []);\n"
                            + "      const _txt1 = document.createTextNode('');\n"
                            + "      $REGISTRY.wire(_txt1, 'textContent', () => {\n"
                            + "        const _v = count();\n"
                            + "        return _v === null || _v === undefined || _v === false ? '' : String(_v);\n"
                            + "      });\n"
                            + "      _el0.appendChild(_txt1);\n"
                            + "      return _el0;\n"
                            + "    })();\n"
                            + "  });\n"
                            + "};\n");
        }

        @Test
        @DisplayName("没有组件和 JSX 的源码原样返回")
        void testPassThrough() {
            String source = "const a = 1;\nexport default a;\n";
            TransformResult result = compiler.transform(source);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).isEqualTo(source);
            assertThat(result.getDiagnostics()).hasSize(1);
            Diagnostic info = result.getDiagnostics().get(0);
            assertThat(info.getType()).isEqualTo(DiagnosticType.INFO);
            assertThat(info.getPhase()).isEqualTo(Phase.PIPELINE);
            assertThat(info.getMessage()).isEqualTo("No component or JSX found; source passed through unchanged");
        }

        @Test
        @DisplayName("检测器为返回元素变量的函数补上返回类型")
        void testDetectorAnnotation() {
            TransformResult result = compiler.transform("function card() { const el = <div/>; return el; }");
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).contains("function card(): HTMLElement {");
        }

        @Test
        @DisplayName("检测到的函数组件包装为注册表执行")
        void testDetectedComponents() {
            TransformResult result = compiler.transform("export function Card() { return <div/>; }\n"
                    + "export const Badge = () => <span/>;\n");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).contains("export function Card(");
            assertThat(result.getCode()).contains("  return $REGISTRY.execute('component:Card', () => {\n"
                    + "    return t_element('div', {}, []);\n"
                    + "  });\n"
                    + "}\n");
            assertThat(result.getCode())
                    .contains("$REGISTRY.execute('component:Badge', () => t_element('span', {}, []))");
        }

        @Test
        @DisplayName("回调中的 JSX 不包装")
        void testCallbackNotWrapped() {
            TransformResult result = compiler.transform("const list = items.map((i) => <li>{i}</li>);");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).doesNotContain("$REGISTRY");
        }

        @Test
        @DisplayName("未声明的组件标签按全局名称调用")
        void testUndeclaredComponent() {
            TransformResult result = compiler.transform("runTest('x', () => <Foo/>);");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).contains("runTest('x', () => Foo({}));");
        }

        @Test
        @DisplayName("未声明的 Provider 按全局名称调用并延迟 children")
        void testUndeclaredProvider() {
            TransformResult result = compiler.transform(
                    "component App() { return <ThemeContext.Provider value={1}><Child/></ThemeContext.Provider>; }");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).contains("return ThemeContext.Provider({ value: 1, children: () => Child({}) });");
        }

        @Test
        @DisplayName("通过 props 传入的 getter 绑定到 DOM")
        void testGetterFromProps() {
            TransformResult result = compiler.transform(
                    "component Child({ value }) { return <span class={value()}>{value()}</span>; }");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).contains("$REGISTRY.wire(_el0, 'className', () => value());");
            assertThat(result.getCode()).contains("const _v = value();");
            assertThat(result.getCode()).doesNotContain("t_element('span', { class: value() }");
        }

        @Test
        @DisplayName("同一模块的多个默认导入都保留")
        void testMultipleDefaultImports() {
            TransformResult result = compiler.transform("import A from './m';\nimport B from './m';\n"
                    + "component X() { return <div>{A}{B}</div>; }");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).contains("import A from './m';\n").contains("import B from './m';\n");
        }

        @Test
        @DisplayName("调试模式记录耗时和检测报告")
        void testDebug() {
            TransformResult result = compiler.transform("function Foo() { return <div/>; }",
                    CompilerConfig.defaults().setDebug(true));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMetrics()).isNotNull();
            assertThat(result.getMetrics().toMap()).containsOnlyKeys(
                    "lexerTime", "parserTime", "detectorTime", "analyzerTime", "emitterTime", "totalTime");
            assertThat(result.getDiagnostics()).extracting(Diagnostic::getMessage).contains(
                    "Detected component 'Foo' via DirectJsxReturn (HIGH): Function has a direct JSX return");
        }

        @Test
        @DisplayName("同一实例可在多个线程中并发使用")
        void testConcurrentUse() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> futures = new ArrayList<Future<String>>();
                for (int i = 0; i < 8; i++) {
                    futures.add(pool.submit(new Callable<String>() {
                        @Override
                        public String call() {
                            return compiler.transform(COUNTER).getCode();
                        }
                    }));
                }
                String expected = compiler.transform(COUNTER).getCode();
                for (Future<String> future : futures) {
                    assertThat(future.get()).isEqualTo(expected);
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    // ============ 严格模式 ============

    @Nested
    @DisplayName("严格模式")
    class StrictTests {

        private static final String MISMATCH = "function Card(): string { const el = <div/>; return el; }";
        private static final String WARNING = "Function 'Card' returns a JSX element but is annotated ': string'";

        @Test
        @DisplayName("默认模式下检测器警告不影响输出")
        void testWarningKept() {
            TransformResult result = compiler.transform(MISMATCH);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getCode()).contains("function Card(): string {");
            assertThat(result.getDiagnostics()).hasSize(1);
            assertThat(result.getDiagnostics().get(0).getType()).isEqualTo(DiagnosticType.WARNING);
            assertThat(result.getDiagnostics().get(0).getMessage()).isEqualTo(WARNING);
        }

        @Test
        @DisplayName("严格模式下警告变为错误，不产生代码")
        void testWarningBecomesError() {
            TransformResult result = compiler.transform(MISMATCH, CompilerConfig.defaults().setStrict(true));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getCode()).isEmpty();
            assertThat(result.getErrors()).hasSize(1);
            assertThat(result.getErrors().get(0).getMessage()).isEqualTo(WARNING);
            assertThat(result.getErrors().get(0).getPhase()).isEqualTo(Phase.DETECTOR);
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("错误诊断")
    class ErrorTests {

        @Test
        @DisplayName("词法错误")
        void testLexerError() {
            TransformResult result = compiler.transform("let a = #;", CompilerConfig.defaults().setFileName("bad.psr"));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getCode()).isEmpty();
            Diagnostic error = result.getErrors().get(0);
            assertThat(error.getPhase()).isEqualTo(Phase.LEXER);
            assertThat(error.getMessage()).isEqualTo("[bad.psr:1:9] Lexer error: Unexpected character: #");
            assertThat(error.getLine()).isEqualTo(1);
            assertThat(error.getColumn()).isEqualTo(9);
        }

        @Test
        @DisplayName("收集模式下报告全部词法错误")
        void testCollectedLexerErrors() {
            TransformResult result = compiler.transform("let a = #;\nlet b = #;",
                    CompilerConfig.defaults().setLexerMode(LexerMode.COLLECT));

            assertThat(result.getErrors()).hasSize(2);
            assertThat(result.getErrors()).extracting(Diagnostic::getMessage)
                    .containsOnly("Unexpected character: #");
            assertThat(result.getErrors().get(1).getLine()).isEqualTo(2);
        }

        @Test
        @DisplayName("语法错误")
        void testParseError() {
            TransformResult result = compiler.transform("component App()");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors()).hasSize(1);
            assertThat(result.getErrors().get(0).getPhase()).isEqualTo(Phase.PARSER);
            assertThat(result.getErrors().get(0).getMessage()).startsWith("Expected component body");
        }

        @Test
        @DisplayName("收集模式下报告多个语法错误")
        void testCollectedParseErrors() {
            TransformResult result = compiler.transform("const = 1;\nconst = 2;\n",
                    CompilerConfig.defaults().setCollectErrors(true));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors()).isNotEmpty();
            assertThat(result.getErrors()).extracting(Diagnostic::getPhase).containsOnly(Phase.PARSER);
        }

        @Test
        @DisplayName("IR 构建错误带有位置")
        void testIrError() {
            TransformResult result = compiler.transform("component A() { return <i/>; }\n"
                    + "component A() { return <b/>; }");

            Diagnostic error = result.getErrors().get(0);
            assertThat(error.getMessage()).isEqualTo("Duplicate component 'A'");
            assertThat(error.getPhase()).isEqualTo(Phase.ANALYZER);
            assertThat(error.getLine()).isEqualTo(2);
        }

        @Test
        @DisplayName("嵌套深度上限")
        void testMaxDepth() {
            String source = "component A() { if (a) { if (b) { if (c) { x(); } } } return <p/>; }";
            TransformResult result = compiler.transform(source, CompilerConfig.defaults().setMaxDepth(5));

            assertThat(result.getErrors().get(0).getMessage()).startsWith("Maximum nesting depth of 5 exceeded");
            assertThat(compiler.transform(source).isSuccess()).isTrue();
            assertThatThrownBy(() -> CompilerConfig.defaults().setMaxDepth(0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("maxDepth must be positive: 0");
        }

        @Test
        @DisplayName("深层嵌套的表达式在语法分析阶段报错")
        void testDeepExpression() {
            StringBuilder parens = new StringBuilder("const a = <div>{");
            for (int i = 0; i < 3000; i++) parens.append('(');
            parens.append('x');
            for (int i = 0; i < 3000; i++) parens.append(')');
            parens.append("}</div>;");

            StringBuilder brackets = new StringBuilder("const x = ");
            for (int i = 0; i < 5000; i++) brackets.append('[');

            for (String source : new String[] {parens.toString(), brackets.toString()}) {
                TransformResult result = compiler.transform(source);

                assertThat(result.isSuccess()).isFalse();
                assertThat(result.getCode()).isEmpty();
                Diagnostic error = result.getErrors().get(0);
                assertThat(error.getPhase()).isEqualTo(Phase.PARSER);
                assertThat(error.getMessage()).startsWith("Maximum nesting depth of 100 exceeded");
                assertThat(error.getLine()).isEqualTo(1);
                assertThat(error.getColumn()).isGreaterThan(1);
            }
        }

        @Test
        @DisplayName("意外异常转换为内部错误诊断")
        void testInternalError() {
            ComponentDetector detector = ComponentDetector.empty();
            detector.register(new DetectionStrategy() {
                @Override
                public String getName() {
                    return "Broken";
                }

                @Override
                public int getPriority() {
                    return 1;
                }

                @Override
                public DetectionResult detect(FunctionLike function, DetectionContext context) {
                    throw new IllegalStateException("boom");
                }
            });

            TransformResult result = new PsrCompiler(detector).transform("function f() { return <div/>; }");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors().get(0).getPhase()).isEqualTo(Phase.PIPELINE);
            assertThat(result.getErrors().get(0).getMessage())
                    .isEqualTo("Internal compiler error: java.lang.IllegalStateException: boom");
        }
    }
}
