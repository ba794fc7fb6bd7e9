package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.emitter.EmitterConfig;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SignalCollector 测试
 */
class SignalCollectorTest {

    private static final String RUNTIME = EmitterConfig.DEFAULT_RUNTIME_MODULE;

    private SymbolTable table;

    private SignalInfo collect(String source) {
        Program program = new Parser(new Lexer(source)).parse();
        table = new ScopeBuilder().build(program);
        return new SignalCollector(Collections.singletonList(RUNTIME)).collect(program, table);
    }

    @Test
    @DisplayName("单标识符绑定本身是访问器")
    void testSimpleAccessor() {
        SignalInfo info = collect("const count = signal(0);");
        assertThat(info.isAccessor("count")).isTrue();
        assertThat(info.getSetters()).isEmpty();
        assertThat(table.lookupAll("count").get(0).isSignal()).isTrue();
    }

    @Test
    @DisplayName("信号值类型取自类型参数或初始值")
    void testValueTypes() {
        SignalInfo info = collect("const count = createSignal<number>(0);\n"
                + "const [name, setName] = createSignal('x');\n"
                + "const user = signal<User | null>(null);\n"
                + "const data = createMemo(() => load());");

        assertThat(info.getValueType("count")).isEqualTo("number");
        assertThat(info.getValueType("name")).isEqualTo("string");
        assertThat(info.getValueType("user")).isEqualTo("User | null");
        assertThat(info.getValueType("data")).isNull();
        assertThat(table.lookupAll("count").get(0).getInferredType()).isEqualTo("() => number");
        assertThat(table.lookupAll("name").get(0).getInferredType()).isEqualTo("() => string");
    }

    @Test
    @DisplayName("同名信号类型不一致时不记录类型")
    void testConflictingValueTypes() {
        SignalInfo info = collect("function a() { const v = signal(1); }\nfunction b() { const v = signal('s'); }");
        assertThat(info.isAccessor("v")).isTrue();
        assertThat(info.getValueType("v")).isNull();
    }

    @Test
    @DisplayName("数组解构：getter 与 setter")
    void testTupleBinding() {
        SignalInfo info = collect("const [value, setValue] = createSignal(0);");
        assertThat(info.getAccessors()).containsExactly("value");
        assertThat(info.getSetters()).containsExactly("setValue");
        assertThat(table.lookupAll("value").get(0).isSignal()).isTrue();
        assertThat(table.lookupAll("setValue").get(0).isSignal()).isFalse();
    }

    @Test
    @DisplayName("派生信号与 await 包裹的资源")
    void testDerivedCreators() {
        SignalInfo info = collect("const total = createMemo(() => a() + b());\n"
                + "async function load() { const data = await createResource(fetcher); }");
        assertThat(info.isAccessor("total")).isTrue();
        assertThat(info.isAccessor("data")).isTrue();
    }

    @Test
    @DisplayName("组件内部的信号")
    void testInsideComponent() {
        SignalInfo info = collect("component Counter() { const c = signal(0); return <div>{c()}</div>; }");
        assertThat(info.isAccessor("c")).isTrue();
        assertThat(table.lookupAll("c").get(0).isSignal()).isTrue();
    }

    @Test
    @DisplayName("普通函数调用不是信号")
    void testPlainCall() {
        SignalInfo info = collect("const plain = compute(0);\nconst lit = 1;");
        assertThat(info.getAccessors()).isEmpty();
    }

    @Test
    @DisplayName("从运行时模块导入的别名成为创建函数")
    void testRuntimeAlias() {
        SignalInfo info = collect("import { createSignal as cs } from '" + RUNTIME + "';\n"
                + "const [n, setN] = cs(1);");
        assertThat(info.isCreator("cs")).isTrue();
        assertThat(info.isAccessor("n")).isTrue();
        assertThat(info.getSetters()).containsExactly("setN");
    }

    @Test
    @DisplayName("运行时子路径同样识别")
    void testRuntimeSubpath() {
        SignalInfo info = collect("import { signal as s } from '" + RUNTIME + "/core';\nconst v = s(0);");
        assertThat(info.isCreator("s")).isTrue();
        assertThat(info.isAccessor("v")).isTrue();
    }

    @Test
    @DisplayName("其他模块或仅类型导入的别名不是创建函数")
    void testForeignAlias() {
        SignalInfo foreign = collect("import { createSignal as cs } from 'other';\nconst v = cs(0);");
        assertThat(foreign.isCreator("cs")).isFalse();
        assertThat(foreign.isAccessor("v")).isFalse();

        SignalInfo typeOnly = collect("import type { createSignal as cs } from '" + RUNTIME + "';");
        assertThat(typeOnly.isCreator("cs")).isFalse();
    }

    @Test
    @DisplayName("运行时模块匹配不接受前缀相同的其他包")
    void testIsRuntimeModule() {
        SignalCollector collector = new SignalCollector(Collections.singletonList(RUNTIME));
        assertThat(collector.isRuntimeModule(RUNTIME)).isTrue();
        assertThat(collector.isRuntimeModule(RUNTIME + "/signals")).isTrue();
        assertThat(collector.isRuntimeModule(RUNTIME + "-extra")).isFalse();
        assertThat(collector.isRuntimeModule(null)).isFalse();
    }

    @Test
    @DisplayName("空信号信息只含内置创建函数")
    void testEmpty() {
        SignalInfo info = SignalInfo.empty();
        assertThat(info.getAccessors()).isEmpty();
        assertThat(info.getCreators()).containsAll(SignalCollector.DEFAULT_CREATORS);
    }
}
