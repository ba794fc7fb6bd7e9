package com.psrlang.compiler.ir.builder;

import com.psrlang.compiler.analysis.ParentMap;
import com.psrlang.compiler.analysis.ScopeBuilder;
import com.psrlang.compiler.analysis.SignalCollector;
import com.psrlang.compiler.analysis.SignalInfo;
import com.psrlang.compiler.analysis.SymbolTable;
import com.psrlang.compiler.ast.decl.ExportDecl;
import com.psrlang.compiler.ast.decl.FunctionDecl;
import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.ast.decl.VariableDecl;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.MemberExpr;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.stmt.ReturnStmt;
import com.psrlang.compiler.ast.stmt.Statement;
import com.psrlang.compiler.detector.ComponentDetector;
import com.psrlang.compiler.detector.DetectionContext;
import com.psrlang.compiler.emitter.EmitterConfig;
import com.psrlang.compiler.ir.IdentifierScope;
import com.psrlang.compiler.ir.decl.ComponentIR;
import com.psrlang.compiler.ir.decl.ProgramIR;
import com.psrlang.compiler.ir.decl.VerbatimIR;
import com.psrlang.compiler.ir.expr.ArrowFunctionIR;
import com.psrlang.compiler.ir.expr.CallIR;
import com.psrlang.compiler.ir.expr.IdentifierIR;
import com.psrlang.compiler.ir.expr.RegistryExecuteIR;
import com.psrlang.compiler.ir.jsx.ComponentCallIR;
import com.psrlang.compiler.ir.jsx.ElementIR;
import com.psrlang.compiler.ir.jsx.ExpressionChildIR;
import com.psrlang.compiler.ir.jsx.TextIR;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IrBuilder 与 JSX 降级测试
 */
class IrBuilderTest {

    // ============ 辅助方法 ============

    private ProgramIR build(String source) {
        return build(source, DepthGuard.DEFAULT_MAX_DEPTH);
    }

    private ProgramIR build(String source, int maxDepth) {
        return build(source, maxDepth, false);
    }

    /** 先运行组件检测，再构建 IR */
    private ProgramIR buildDetected(String source) {
        return build(source, DepthGuard.DEFAULT_MAX_DEPTH, true);
    }

    private ProgramIR build(String source, int maxDepth, boolean detect) {
        Program program = new Parser(new Lexer(source)).parse();
        SymbolTable table = new ScopeBuilder().build(program);
        SignalInfo signals = new SignalCollector(Collections.singletonList(EmitterConfig.DEFAULT_RUNTIME_MODULE))
                .collect(program, table);
        BuildContext context = new BuildContext(source, "test.psr", table, signals, maxDepth);
        if (detect) {
            context.setDetection(new ComponentDetector()
                    .detectAll(program, new DetectionContext(ParentMap.build(program), false)));
        }
        return new IrBuilder().build(program, context);
    }

    /** 组件体中最后一条 return 的值 */
    private static Expression returned(ComponentIR component) {
        List<Statement> statements = component.getBody().getStatements();
        return ((ReturnStmt) statements.get(statements.size() - 1)).getValue();
    }

    private static Expression init(Statement statement) {
        return ((VariableDecl) statement).getDeclarators().get(0).getInit();
    }

    // ============ 组件 ============

    @Nested
    @DisplayName("组件")
    class ComponentTests {

        @Test
        @DisplayName("无信号组件：注册键、参数和静态元素")
        void testStaticComponent() {
            ProgramIR program = build("component Greeting(name: string) { return <div>Hello {name}</div>; }");

            assertThat(program.getComponents()).hasSize(1);
            ComponentIR greeting = program.findComponent("Greeting");
            assertThat(greeting).isSameAs(program.getBody().get(0));
            assertThat(greeting.getRegistryKey()).isEqualTo("component:Greeting");
            assertThat(greeting.getParams()).hasSize(1);
            assertThat(greeting.usesSignals()).isFalse();
            assertThat(greeting.hasEventHandlers()).isFalse();
            assertThat(greeting.getReactiveDependencies()).isEmpty();
            assertThat(program.usesJsx()).isTrue();
            assertThat(program.findComponent("Missing")).isNull();

            ElementIR div = (ElementIR) returned(greeting);
            assertThat(div.getTag()).isEqualTo("div");
            assertThat(div.isStatic()).isTrue();
            assertThat(div.getJsxChildren()).hasSize(2);
            assertThat(((TextIR) div.getJsxChildren().get(0)).getValue()).isEqualTo("Hello ");

            ExpressionChildIR child = (ExpressionChildIR) div.getJsxChildren().get(1);
            assertThat(child.isStatic()).isTrue();
            IdentifierIR name = (IdentifierIR) child.getExpression();
            assertThat(name.getScope()).isEqualTo(IdentifierScope.PARAMETER);
        }

        @Test
        @DisplayName("读取信号的组件记录依赖")
        void testSignalComponent() {
            ProgramIR program = build("component Counter() { const count = signal(0); return <div>{count()}</div>; }");
            ComponentIR counter = program.findComponent("Counter");

            assertThat(counter.usesSignals()).isTrue();
            assertThat(counter.getReactiveDependencies()).containsExactly("count");

            CallIR creation = (CallIR) init(counter.getBody().getStatements().get(0));
            assertThat(creation.isSignalCreation()).isTrue();
            assertThat(creation.getCalleeName()).isEqualTo("signal");

            ElementIR div = (ElementIR) returned(counter);
            assertThat(div.isStatic()).isFalse();
            ExpressionChildIR child = (ExpressionChildIR) div.getJsxChildren().get(0);
            assertThat(child.getClassification().getDependencies()).containsExactly("count");
        }

        @Test
        @DisplayName("事件处理器与响应式属性绑定")
        void testEventsAndBindings() {
            ProgramIR program = build("component Toggle() {\n"
                    + "  const [n, setN] = createSignal(0);\n"
                    + "  return <button class={n() > 0 ? 'on' : 'off'} onClick={() => setN(n() + 1)}>+</button>;\n"
                    + "}");
            ComponentIR toggle = program.findComponent("Toggle");
            ElementIR button = (ElementIR) returned(toggle);

            assertThat(toggle.hasEventHandlers()).isTrue();
            assertThat(button.getEvents()).hasSize(1);
            assertThat(button.getEvents().get(0).getEventName()).isEqualTo("click");
            assertThat(button.getEvents().get(0).getHandler()).isInstanceOf(ArrowFunctionIR.class);

            assertThat(button.getBindings()).hasSize(1);
            assertThat(button.getBindings().get(0).getAttribute()).isEqualTo("class");
            assertThat(button.getBindings().get(0).getProperty()).isEqualTo("className");
            assertThat(button.getBindings().get(0).getDependencies()).containsExactly("n");
            assertThat(button.getAttributes()).isEmpty();
            assertThat(toggle.getReactiveDependencies()).containsExactly("n");
        }

        @Test
        @DisplayName("ref 属性被单独取出")
        void testRef() {
            ProgramIR program = build("component Box() { let el; return <div ref={el} id=\"box\"/>; }");
            ElementIR div = (ElementIR) returned(program.findComponent("Box"));

            assertThat(div.getRef()).isInstanceOf(IdentifierIR.class);
            assertThat(div.getAttributes()).hasSize(1);
            assertThat(div.getAttributes().get(0).getName()).isEqualTo("id");
            assertThat(div.isStatic()).isFalse();
        }

        @Test
        @DisplayName("没有检测结果时函数保持原样")
        void testFunctionWithoutDetection() {
            ProgramIR program = build("function Card() { return <div/>; }");
            FunctionDecl card = (FunctionDecl) program.getBody().get(0);

            assertThat(program.getComponents()).isEmpty();
            assertThat(card.getBody().getStatements().get(0)).isInstanceOf(ReturnStmt.class);
            assertThat(((ReturnStmt) card.getBody().getStatements().get(0)).getValue()).isInstanceOf(ElementIR.class);
            assertThat(program.usesJsx()).isTrue();
        }

        @Test
        @DisplayName("检测为组件的函数声明在注册表中执行")
        void testDetectedFunction() {
            ProgramIR program = buildDetected("export function Card({ title }) {\n"
                    + "  const [n] = createSignal(0);\n"
                    + "  return <div>{n()}</div>;\n"
                    + "}");
            ExportDecl export = (ExportDecl) program.getBody().get(0);
            FunctionDecl card = (FunctionDecl) export.getDeclaration();

            assertThat(card.getName()).isEqualTo("Card");
            assertThat(card.getBody().getStatements()).hasSize(1);
            RegistryExecuteIR execute = (RegistryExecuteIR) ((ReturnStmt) card.getBody().getStatements().get(0))
                    .getValue();
            assertThat(execute.getRegistryKey()).isEqualTo("component:Card");
            assertThat(execute.getReactiveDependencies()).containsExactly("n");
            assertThat(((Block) execute.getBody()).getStatements()).hasSize(2);
        }

        @Test
        @DisplayName("检测为组件的箭头函数保持箭头形式")
        void testDetectedArrow() {
            ProgramIR program = buildDetected("export const Badge = () => <span/>;\n"
                    + "const double = (x) => x * 2;");
            VariableDecl badge = (VariableDecl) ((ExportDecl) program.getBody().get(0)).getDeclaration();
            ArrowFunctionIR arrow = (ArrowFunctionIR) init(badge);
            RegistryExecuteIR execute = (RegistryExecuteIR) arrow.getBody();

            assertThat(execute.getComponentName()).isEqualTo("Badge");
            assertThat(execute.getBody()).isInstanceOf(ElementIR.class);
            assertThat(((ArrowFunctionIR) init(program.getBody().get(1))).getBody())
                    .isNotInstanceOf(RegistryExecuteIR.class);
        }

        @Test
        @DisplayName("回调中的箭头函数不被包装")
        void testCallbackNotWrapped() {
            ProgramIR program = buildDetected("component List(props) {\n"
                    + "  return <ul>{props.items.map((i) => <li>{i}</li>)}</ul>;\n"
                    + "}");
            ElementIR ul = (ElementIR) returned(program.findComponent("List"));
            CallIR map = (CallIR) ((ExpressionChildIR) ul.getJsxChildren().get(0)).getExpression();

            assertThat(((ArrowFunctionIR) map.getArguments().get(0)).getBody()).isInstanceOf(ElementIR.class);
        }
    }

    // ============ 组件调用 ============

    @Nested
    @DisplayName("组件调用")
    class ComponentCallTests {

        @Test
        @DisplayName("大写标签调用本文件组件，声明顺序无关")
        void testLocalComponent() {
            ProgramIR program = build("component App() { return <Child title=\"x\"/>; }\n"
                    + "component Child(props) { return <i>{props.title}</i>; }");
            ComponentCallIR call = (ComponentCallIR) returned(program.findComponent("App"));

            assertThat(call.getTag()).isEqualTo("Child");
            assertThat(((IdentifierIR) call.getCallee()).getScope()).isEqualTo(IdentifierScope.LOCAL);
            assertThat(call.getProps()).hasSize(1);
            assertThat(call.getProps().get(0).getName()).isEqualTo("title");
        }

        @Test
        @DisplayName("导入的组件")
        void testImportedComponent() {
            ProgramIR program = build("import { Icon } from './icon';\ncomponent App() { return <Icon/>; }");
            ComponentCallIR call = (ComponentCallIR) returned(program.findComponent("App"));

            assertThat(((IdentifierIR) call.getCallee()).getScope()).isEqualTo(IdentifierScope.IMPORTED);
            assertThat(program.getImports()).hasSize(1);
        }

        @Test
        @DisplayName("本文件未声明的组件按全局名称调用")
        void testUndeclaredComponent() {
            ProgramIR program = build("runTest('x', () => <Foo/>);\n"
                    + "component App() { return <Missing/>; }");
            ComponentCallIR call = (ComponentCallIR) returned(program.findComponent("App"));

            assertThat(call.getTag()).isEqualTo("Missing");
            assertThat(((IdentifierIR) call.getCallee()).getScope()).isEqualTo(IdentifierScope.GLOBAL);
            assertThat(call.hasDeferredChildren()).isFalse();
        }

        @Test
        @DisplayName("成员标签的根对象可以是全局名称")
        void testUndeclaredMemberTag() {
            ProgramIR program = build("component App() { return <ThemeContext.Provider value={1}><i/></ThemeContext.Provider>; }");
            ComponentCallIR call = (ComponentCallIR) returned(program.findComponent("App"));
            MemberExpr callee = (MemberExpr) call.getCallee();

            assertThat(callee.getProperty()).isEqualTo("Provider");
            assertThat(((IdentifierIR) callee.getObject()).getScope()).isEqualTo(IdentifierScope.GLOBAL);
        }

        @Test
        @DisplayName("Provider 的子节点延迟求值")
        void testProviderChildren() {
            ProgramIR program = build("component App() {\n"
                    + "  return <div>\n"
                    + "    <Theme.Provider value={1}><Child/></Theme.Provider>\n"
                    + "    <AuthProvider><Child/></AuthProvider>\n"
                    + "    <Panel><Child/></Panel>\n"
                    + "  </div>;\n"
                    + "}");
            ElementIR div = (ElementIR) returned(program.findComponent("App"));
            List<Expression> calls = new ArrayList<Expression>();
            for (Expression child : div.getJsxChildren()) {
                if (child instanceof ComponentCallIR) calls.add(child);
            }

            assertThat(calls).hasSize(3);
            assertThat(((ComponentCallIR) calls.get(0)).hasDeferredChildren()).isTrue();
            assertThat(((ComponentCallIR) calls.get(1)).hasDeferredChildren()).isTrue();
            assertThat(((ComponentCallIR) calls.get(2)).hasDeferredChildren()).isFalse();
        }

        @Test
        @DisplayName("本文件中不渲染 .Provider 的 XxxProvider 不延迟子节点")
        void testLocalProviderWithoutContext() {
            ProgramIR program = build("function FakeProvider(props) { return <div>{props.children}</div>; }\n"
                    + "component App() { return <FakeProvider><i/></FakeProvider>; }\n"
                    + "function RealProvider(props) { return <Ctx.Provider value={1}>{props.children}</Ctx.Provider>; }\n"
                    + "component B() { return <RealProvider><i/></RealProvider>; }");

            assertThat(((ComponentCallIR) returned(program.findComponent("App"))).hasDeferredChildren()).isFalse();
            assertThat(((ComponentCallIR) returned(program.findComponent("B"))).hasDeferredChildren()).isTrue();
        }
    }

    // ============ 标识符与调用 ============

    @Nested
    @DisplayName("标识符与调用")
    class IdentifierTests {

        @Test
        @DisplayName("同名本地函数不是信号创建")
        void testShadowedCreator() {
            ProgramIR program = build("function signal(v) { return v; }\n"
                    + "component C() { const s = signal(1); return <p/>; }");
            CallIR call = (CallIR) init(program.findComponent("C").getBody().getStatements().get(0));
            assertThat(call.isSignalCreation()).isFalse();
        }

        @Test
        @DisplayName("未声明的标识符视为全局")
        void testGlobal() {
            ProgramIR program = build("const body = document.body;");
            MemberExpr init = (MemberExpr) init(program.getBody().get(0));
            IdentifierIR document = (IdentifierIR) init.getObject();
            assertThat(document.getScope()).isEqualTo(IdentifierScope.GLOBAL);
            assertThat(document.isSignalAccessor()).isFalse();
            assertThat(program.getComponents()).isEmpty();
            assertThat(program.usesJsx()).isFalse();
        }

        @Test
        @DisplayName("箭头函数的捕获与纯度")
        void testArrowCaptures() {
            ProgramIR program = build("const k = 2;\n"
                    + "const scale = (x) => x * k;\n"
                    + "const log = (m) => console.log(m, k);");

            ArrowFunctionIR scale = (ArrowFunctionIR) init(program.getBody().get(1));
            assertThat(scale.getCaptures()).containsExactly("k");
            assertThat(scale.isPure()).isTrue();

            ArrowFunctionIR log = (ArrowFunctionIR) init(program.getBody().get(2));
            assertThat(log.getCaptures()).containsExactly("k");
            assertThat(log.isPure()).isFalse();
        }

        @Test
        @DisplayName("纯类型声明原样保留")
        void testVerbatim() {
            String source = "interface Props { title: string }\ntype Id = number;";
            ProgramIR program = build(source);

            VerbatimIR iface = (VerbatimIR) program.getBody().get(0);
            assertThat(iface.getKind()).isEqualTo("interface");
            assertThat(iface.getText()).isEqualTo("interface Props { title: string }");
            assertThat(((VerbatimIR) program.getBody().get(1)).getKind()).isEqualTo("type");
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("结构错误")
    class ErrorTests {

        @Test
        @DisplayName("组件重名")
        void testDuplicate() {
            assertThatThrownBy(() -> build("component A() { return <i/>; }\ncomponent A() { return <b/>; }"))
                    .isInstanceOf(IrBuildException.class)
                    .hasMessage("Duplicate component 'A'");
        }

        @Test
        @DisplayName("props 参数校验")
        void testProps() {
            assertThatThrownBy(() -> build("component A(a, b) { return <i/>; }"))
                    .hasMessage("Component 'A' must declare at most one props parameter");
            assertThatThrownBy(() -> build("component A(...rest) { return <i/>; }"))
                    .hasMessage("Component 'A' props cannot be a rest parameter");
            assertThatThrownBy(() -> build("component A([x]) { return <i/>; }"))
                    .hasMessage("Component 'A' props must be an identifier or an object pattern");
        }

        @Test
        @DisplayName("对象解构 props 合法")
        void testObjectPatternProps() {
            ProgramIR program = build("component A({ title }) { return <h1>{title}</h1>; }");
            assertThat(program.findComponent("A").getParams()).hasSize(1);
        }

        @Test
        @DisplayName("事件属性缺少处理器")
        void testEventWithoutHandler() {
            assertThatThrownBy(() -> build("component A() { return <button onClick/>; }"))
                    .isInstanceOf(IrBuildException.class)
                    .hasMessage("Event attribute 'onClick' requires a handler");
        }

        @Test
        @DisplayName("嵌套深度超过上限")
        void testRecursionLimit() {
            StringBuilder source = new StringBuilder("function deep(x) {\n");
            for (int i = 0; i < 150; i++) {
                source.append("if (x) {\n");
            }
            source.append("x = 1;\n");
            for (int i = 0; i < 150; i++) {
                source.append("}\n");
            }
            source.append("}");

            assertThatThrownBy(() -> build(source.toString()))
                    .isInstanceOf(RecursionLimitException.class)
                    .hasMessage("Maximum nesting depth of 100 exceeded")
                    .satisfies(e -> assertThat(((RecursionLimitException) e).getLimit()).isEqualTo(100));

            assertThat(build(source.toString(), 1000).getBody()).hasSize(1);
        }
    }
}
