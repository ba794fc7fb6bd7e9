package com.psrlang.compiler.classifier;

import com.psrlang.compiler.analysis.SignalCollector;
import com.psrlang.compiler.analysis.SignalInfo;
import com.psrlang.compiler.ast.decl.VariableDecl;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ReactivityClassifier 测试
 */
class ReactivityClassifierTest {

    private ReactivityClassifier classifier;
    private ClassificationContext context;

    @BeforeEach
    void setUp() {
        classifier = new ReactivityClassifier();
        SignalInfo signals = new SignalInfo(
                new LinkedHashSet<String>(Arrays.asList("count", "name", "items", "show")),
                new LinkedHashSet<String>(Collections.singletonList("setCount")),
                SignalCollector.DEFAULT_CREATORS);
        context = new ClassificationContext(signals);
    }

    /** 解析 const x = 表达式; 并取出初始化表达式 */
    private Expression expr(String source) {
        VariableDecl decl = (VariableDecl) new Parser(new Lexer("const x = " + source + ";")).parse()
                .getBody().get(0);
        return decl.getDeclarators().get(0).getInit();
    }

    private Classification classify(String source) {
        return classifier.classify(expr(source), context);
    }

    @Nested
    @DisplayName("类别")
    class CategoryTests {

        @Test
        @DisplayName("JSX 元素是静态的")
        void testJsx() {
            Classification c = classify("<div>{count()}</div>");
            assertThat(c.getCategory()).isEqualTo(Category.STATIC);
            assertThat(c.getReason()).isEqualTo("JSX element");
            assertThat(c.isNullable()).isFalse();
            assertThat(c.getDependencies()).isEmpty();
        }

        @Test
        @DisplayName(".map 调用是列表渲染")
        void testLoop() {
            Classification c = classify("items().map(i => <li>{i}</li>)");
            assertThat(c.getCategory()).isEqualTo(Category.LOOP);
            assertThat(c.getEmissionStrategy()).isEqualTo("for-component");
            assertThat(c.getDependencies()).containsExactly("items");
            assertThat(c.getReason()).isEqualTo("List rendering with .map()");
        }

        @Test
        @DisplayName("读取信号的条件表达式")
        void testConditionalWithSignal() {
            Classification c = classify("show() ? <a/> : null");
            assertThat(c.getCategory()).isEqualTo(Category.CONDITIONAL);
            assertThat(c.getEmissionStrategy()).isEqualTo("show-component");
            assertThat(c.getDependencies()).containsExactly("show");
        }

        @Test
        @DisplayName("分支含 JSX 的条件即使没有信号也是条件类别")
        void testConditionalWithJsxBranches() {
            Classification c = classify("ok ? <a/> : <b/>");
            assertThat(c.getCategory()).isEqualTo(Category.CONDITIONAL);
            assertThat(c.getReason()).isEqualTo("Conditional with JSX branches");
        }

        @Test
        @DisplayName("没有信号也没有 JSX 的条件是静态的")
        void testPlainConditional() {
            assertThat(classify("ok ? 1 : 2").getCategory()).isEqualTo(Category.STATIC);
        }

        @Test
        @DisplayName("逻辑运算按条件处理")
        void testLogical() {
            Classification c = classify("name() || 'anonymous'");
            assertThat(c.getCategory()).isEqualTo(Category.CONDITIONAL);
            assertThat(c.isNullable()).isTrue();
        }

        @Test
        @DisplayName("读取信号的算术表达式是动态的")
        void testDynamic() {
            Classification c = classify("count() * count() + name().length");
            assertThat(c.getCategory()).isEqualTo(Category.DYNAMIC);
            assertThat(c.getEmissionStrategy()).isEqualTo("registry-wire");
            assertThat(c.getDependencies()).containsExactly("count", "name");
            assertThat(c.isReactive()).isTrue();
        }

        @Test
        @DisplayName("括号被去掉")
        void testParens() {
            assertThat(classify("(count())").getCategory()).isEqualTo(Category.DYNAMIC);
        }

        @Test
        @DisplayName("嵌套函数中的信号读取不计入依赖")
        void testFunctionBoundary() {
            Classification c = classify("{ onTick: () => count() }");
            assertThat(c.getCategory()).isEqualTo(Category.STATIC);
            assertThat(c.getDependencies()).isEmpty();
            assertThat(c.isReactive()).isFalse();

            Classification call = classify("run(() => count())");
            assertThat(call.getCategory()).isEqualTo(Category.DYNAMIC);
            assertThat(call.getDependencies()).isEmpty();
        }

        @Test
        @DisplayName("无法静态识别的调用按动态处理")
        void testOpaqueCalls() {
            for (String source : new String[] {"props.count()", "value()", "store.get('k')"}) {
                Classification c = classify(source);
                assertThat(c.getCategory()).isEqualTo(Category.DYNAMIC);
                assertThat(c.getDependencies()).isEmpty();
                assertThat(c.getReason()).isEqualTo("Calls a function");
                assertThat(c.isReactive()).isTrue();
            }
        }

        @Test
        @DisplayName("含调用的条件表达式")
        void testConditionalWithCalls() {
            Classification c = classify("props.open() ? 'yes' : 'no'");
            assertThat(c.getCategory()).isEqualTo(Category.CONDITIONAL);
            assertThat(c.getReason()).isEqualTo("Conditional with call expressions");
        }

        @Test
        @DisplayName("setter 调用不是读取")
        void testSetterIsNotRead() {
            assertThat(classify("setCount(1)").getDependencies()).isEmpty();
        }
    }

    @Nested
    @DisplayName("可空性")
    class NullabilityTests {

        @Test
        @DisplayName("字面量与模板字符串不可空，null 可空")
        void testLiterals() {
            assertThat(classify("'text'").isNullable()).isFalse();
            assertThat(classify("42").isNullable()).isFalse();
            assertThat(classify("null").isNullable()).isTrue();
            assertThat(classify("`n=${count()}`").isNullable()).isFalse();
        }

        @Test
        @DisplayName("调用与标识符保守视为可空")
        void testConservative() {
            assertThat(classify("count()").isNullable()).isTrue();
            assertThat(classify("value").isNullable()).isTrue();
        }

        @Test
        @DisplayName("声明了非空值类型的信号不可空")
        void testTypedSignals() {
            Map<String, String> types = new HashMap<String, String>();
            types.put("count", "number");
            types.put("user", "User | null");
            types.put("label", "string | undefined");
            SignalInfo signals = new SignalInfo(
                    new LinkedHashSet<String>(Arrays.asList("count", "user", "label", "items")),
                    new LinkedHashSet<String>(), SignalCollector.DEFAULT_CREATORS, types);
            ClassificationContext typed = new ClassificationContext(signals);

            assertThat(classifier.classify(expr("count()"), typed).isNullable()).isFalse();
            assertThat(classifier.classify(expr("user()"), typed).isNullable()).isTrue();
            assertThat(classifier.classify(expr("label()"), typed).isNullable()).isTrue();
            assertThat(classifier.classify(expr("items()"), typed).isNullable()).isTrue();
        }

        @Test
        @DisplayName("作用域中的类型注解参与可空性判断")
        void testDeclaredTypes() {
            final Map<String, String> types = new HashMap<String, String>();
            types.put("title", "string");
            types.put("format", "() => string");
            types.put("find", "() => Item | undefined");
            ClassificationContext typed = new ClassificationContext(SignalInfo.empty(),
                    new ClassificationContext.TypeLookup() {
                        @Override
                        public String typeOf(String name) {
                            return types.get(name);
                        }
                    });

            assertThat(classifier.classify(expr("title"), typed).isNullable()).isFalse();
            assertThat(classifier.classify(expr("format()"), typed).isNullable()).isFalse();
            assertThat(classifier.classify(expr("find()"), typed).isNullable()).isTrue();
            assertThat(classifier.classify(expr("other()"), typed).isNullable()).isTrue();
        }

        @Test
        @DisplayName("非空类型判断")
        void testNonNullType() {
            assertThat(ReactivityClassifier.isNonNullType("number")).isTrue();
            assertThat(ReactivityClassifier.isNonNullType("string | number")).isTrue();
            assertThat(ReactivityClassifier.isNonNullType("string | null")).isFalse();
            assertThat(ReactivityClassifier.isNonNullType("any")).isFalse();
            assertThat(ReactivityClassifier.isNonNullType(null)).isFalse();
            assertThat(ReactivityClassifier.returnType("() => boolean")).isEqualTo("boolean");
            assertThat(ReactivityClassifier.returnType("(x: number) => boolean")).isNull();
        }

        @Test
        @DisplayName("算术一元与非逻辑二元运算不可空")
        void testOperators() {
            assertThat(classify("-count()").isNullable()).isFalse();
            assertThat(classify("!ok").isNullable()).isFalse();
            assertThat(classify("count() + 1").isNullable()).isFalse();
            assertThat(classify("a ?? b").isNullable()).isTrue();
        }
    }

    @Nested
    @DisplayName("属性")
    class AttributeTests {

        @Test
        @DisplayName("事件属性")
        void testEvent() {
            Classification c = classifier.classifyAttribute("onClick", expr("() => setCount(count() + 1)"), context);
            assertThat(c.getCategory()).isEqualTo(Category.EVENT);
            assertThat(c.getEmissionStrategy()).isEqualTo("add-event-listener");
            assertThat(c.getReason()).isEqualTo("Event handler for 'click'");
            assertThat(c.getDependencies()).isEmpty();
        }

        @Test
        @DisplayName("布尔属性")
        void testBooleanAttribute() {
            Classification c = classifier.classifyAttribute("disabled", null, context);
            assertThat(c.getCategory()).isEqualTo(Category.STATIC);
            assertThat(c.getReason()).isEqualTo("Boolean attribute");
        }

        @Test
        @DisplayName("小写 on 前缀不是事件属性")
        void testLowercaseOn() {
            Classification c = classifier.classifyAttribute("onclick", expr("count()"), context);
            assertThat(c.getCategory()).isEqualTo(Category.DYNAMIC);
        }

        @Test
        @DisplayName("DOM 事件名识别")
        void testDomEvents() {
            assertThat(DomEvents.isEventAttribute("onMouseEnter")).isTrue();
            assertThat(DomEvents.isEventAttribute("onFoo")).isFalse();
            assertThat(DomEvents.isEventAttribute("on")).isFalse();
            assertThat(DomEvents.eventName("onKeyDown")).isEqualTo("keydown");
        }
    }

    @Test
    @DisplayName("按节点数估计复杂度")
    void testComplexity() {
        assertThat(Complexity.ofNodeCount(4)).isEqualTo(Complexity.LOW);
        assertThat(Complexity.ofNodeCount(5)).isEqualTo(Complexity.MEDIUM);
        assertThat(Complexity.ofNodeCount(15)).isEqualTo(Complexity.HIGH);
        assertThat(classify("<div/>").getComplexity()).isEqualTo(Complexity.LOW);
    }
}
