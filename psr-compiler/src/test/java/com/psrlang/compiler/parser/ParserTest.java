package com.psrlang.compiler.parser;

import com.psrlang.compiler.ast.decl.ComponentDecl;
import com.psrlang.compiler.ast.decl.ExportDecl;
import com.psrlang.compiler.ast.decl.ExportDecl.ExportKind;
import com.psrlang.compiler.ast.decl.ImportDecl;
import com.psrlang.compiler.ast.decl.ImportSpecifier;
import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.ast.decl.VariableDecl;
import com.psrlang.compiler.ast.decl.VariableDeclarator;
import com.psrlang.compiler.ast.expr.ArrowFunction;
import com.psrlang.compiler.ast.expr.BinaryExpr;
import com.psrlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.Identifier;
import com.psrlang.compiler.ast.expr.Literal;
import com.psrlang.compiler.ast.jsx.JsxAttribute;
import com.psrlang.compiler.ast.jsx.JsxElement;
import com.psrlang.compiler.ast.jsx.JsxExpressionContainer;
import com.psrlang.compiler.ast.jsx.JsxFragment;
import com.psrlang.compiler.ast.jsx.JsxText;
import com.psrlang.compiler.ast.stmt.ReturnStmt;
import com.psrlang.compiler.ast.stmt.Statement;
import com.psrlang.compiler.diagnostic.Phase;
import com.psrlang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Parser 单元测试
 */
class ParserTest {

    // ============ 辅助方法 ============

    private Program parse(String source) {
        return new Parser(new Lexer(source)).parse();
    }

    private Statement single(String source) {
        Program program = parse(source);
        assertThat(program.getBody()).hasSize(1);
        return program.getBody().get(0);
    }

    /**
     * 解析 const x = ...; 并返回初始化表达式
     */
    private Expression initOf(String source) {
        VariableDecl decl = (VariableDecl) single(source);
        return decl.getDeclarators().get(0).getInit();
    }

    private ParseException parseError(String source) {
        try {
            parse(source);
        } catch (ParseException e) {
            return e;
        }
        throw new AssertionError("Expected a parse error for: " + source);
    }

    // ============ 组件 ============

    @Nested
    @DisplayName("组件声明")
    class ComponentTests {

        @Test
        @DisplayName("带参数与 JSX 返回的组件")
        void testComponent() {
            ComponentDecl decl = (ComponentDecl) single(
                    "component Greeting(name: string) { return <div>Hello {name}</div>; }");

            assertThat(decl.getName()).isEqualTo("Greeting");
            assertThat(decl.getParams()).hasSize(1);
            assertThat(decl.getParams().get(0).getName()).isEqualTo("name");
            assertThat(decl.getParams().get(0).getType().getText()).isEqualTo("string");
            assertThat(decl.getReturnType()).isNull();

            ReturnStmt ret = (ReturnStmt) decl.getBody().getStatements().get(0);
            JsxElement div = (JsxElement) ret.getValue();
            assertThat(div.getTagName()).isEqualTo("div");
            assertThat(div.getJsxChildren()).hasSize(2);
            assertThat(((JsxText) div.getJsxChildren().get(0)).getValue()).isEqualTo("Hello ");
            JsxExpressionContainer container = (JsxExpressionContainer) div.getJsxChildren().get(1);
            assertThat(((Identifier) container.getExpression()).getName()).isEqualTo("name");
        }

        @Test
        @DisplayName("带返回类型与泛型参数的组件")
        void testTypedComponent() {
            ComponentDecl decl = (ComponentDecl) single(
                    "component List<T>(props: { items: T[] }): HTMLElement { return <ul/>; }");
            assertThat(decl.getTypeParams()).isNotNull();
            assertThat(decl.getReturnType().getText()).isEqualTo("HTMLElement");
        }

        @Test
        @DisplayName("export component 与 export default component")
        void testExportedComponent() {
            ExportDecl named = (ExportDecl) single("export component App() { return <main/>; }");
            assertThat(named.getKind()).isEqualTo(ExportKind.DECLARATION);
            assertThat(named.getDeclaration()).isInstanceOf(ComponentDecl.class);

            ExportDecl def = (ExportDecl) single("export default component App() { return <main/>; }");
            assertThat(def.getKind()).isEqualTo(ExportKind.DEFAULT_DECLARATION);
            assertThat(((ComponentDecl) def.getDeclaration()).getName()).isEqualTo("App");
        }

        @Test
        @DisplayName("component 仍可作为普通标识符")
        void testComponentAsIdentifier() {
            VariableDecl decl = (VariableDecl) single("const component = 1;");
            assertThat(decl.getDeclarators().get(0).getSimpleName()).isEqualTo("component");
        }

        @Test
        @DisplayName("缺少组件体")
        void testMissingBody() {
            ParseException e = parseError("component App()");
            assertThat(e.getRawMessage()).isEqualTo("Expected component body");
            assertThat(e.getPhase()).isEqualTo(Phase.PARSER);
        }
    }

    // ============ 导入导出 ============

    @Nested
    @DisplayName("导入导出")
    class ModuleTests {

        @Test
        @DisplayName("命名导入、别名与类型导入")
        void testNamedImports() {
            ImportDecl decl = (ImportDecl) single("import { a, b as c, type T } from 'm';");
            assertThat(decl.getSource()).isEqualTo("m");
            assertThat(decl.getSpecifiers()).extracting("imported").containsExactly("a", "b", "T");
            assertThat(decl.getSpecifiers()).extracting("local").containsExactly("a", "c", "T");
            ImportSpecifier type = decl.getSpecifiers().get(2);
            assertThat(type.isTypeOnly()).isTrue();
        }

        @Test
        @DisplayName("默认导入加命名空间导入")
        void testDefaultAndNamespace() {
            ImportDecl decl = (ImportDecl) single("import D, * as ns from './lib';");
            assertThat(decl.getDefaultBinding()).isEqualTo("D");
            assertThat(decl.getNamespaceBinding()).isEqualTo("ns");
            assertThat(decl.isSideEffectOnly()).isFalse();
        }

        @Test
        @DisplayName("import type 与副作用导入")
        void testTypeAndSideEffect() {
            assertThat(((ImportDecl) single("import type { X } from 'm';")).isTypeOnly()).isTrue();
            assertThat(((ImportDecl) single("import './styles.css';")).isSideEffectOnly()).isTrue();
        }

        @Test
        @DisplayName("缺少 from 报错并带位置")
        void testMissingFrom() {
            ParseException e = parseError("import { a } 'm';");
            assertThat(e.getRawMessage()).isEqualTo("Missing 'from' in import declaration");
            assertThat(e.getLine()).isEqualTo(1);
            assertThat(e.getColumn()).isEqualTo(14);
            assertThat(e.getMessage()).contains(" at line 1, column 14 (found ''m'')");
        }

        @Test
        @DisplayName("export = 不受支持")
        void testExportAssignment() {
            assertThat(parseError("export = foo;").getRawMessage()).isEqualTo("'export =' is not supported");
        }

        @Test
        @DisplayName("重导出")
        void testReExport() {
            ExportDecl all = (ExportDecl) single("export * as utils from './utils';");
            assertThat(all.getKind()).isEqualTo(ExportKind.ALL);
            assertThat(all.getNamespaceAlias()).isEqualTo("utils");

            ExportDecl named = (ExportDecl) single("export { a as b } from './a';");
            assertThat(named.getKind()).isEqualTo(ExportKind.NAMED);
            assertThat(named.getSource()).isEqualTo("./a");
        }
    }

    // ============ JSX ============

    @Nested
    @DisplayName("JSX")
    class JsxTests {

        @Test
        @DisplayName("片段")
        void testFragment() {
            JsxFragment fragment = (JsxFragment) initOf("const f = <><a/><b/></>;");
            assertThat(fragment.getJsxChildren()).hasSize(2);
        }

        @Test
        @DisplayName("属性：字符串、表达式与布尔属性")
        void testAttributes() {
            JsxElement input = (JsxElement) initOf("const e = <input title=\"a &lt; b\" value={v} disabled />;");
            assertThat(input.isSelfClosing()).isTrue();
            assertThat(input.getAttributes()).hasSize(3);

            JsxAttribute title = (JsxAttribute) input.getAttributes().get(0);
            assertThat(((Literal) title.getValue()).getValue()).isEqualTo("a < b");
            JsxAttribute value = (JsxAttribute) input.getAttributes().get(1);
            assertThat(value.getValue()).isInstanceOf(JsxExpressionContainer.class);
            JsxAttribute disabled = (JsxAttribute) input.getAttributes().get(2);
            assertThat(disabled.getValue()).isNull();
        }

        @Test
        @DisplayName("组件标签与成员标签")
        void testComponentTag() {
            JsxElement el = (JsxElement) initOf("const e = <UI.Button/>;");
            assertThat(el.getTagName()).isEqualTo("UI.Button");
            assertThat(el.isComponentTag()).isTrue();
            assertThat(((JsxElement) initOf("const e = <span/>;")).isComponentTag()).isFalse();
        }

        @Test
        @DisplayName("文本中的实体被解码")
        void testEntityText() {
            JsxElement p = (JsxElement) initOf("const e = <p>a &amp; b</p>;");
            JsxText text = (JsxText) p.getJsxChildren().get(0);
            assertThat(text.getValue()).isEqualTo("a & b");
            assertThat(text.getRaw()).isEqualTo("a &amp; b");
        }

        @Test
        @DisplayName("空白文本与空表达式容器被丢弃")
        void testDroppedChildren() {
            JsxElement div = (JsxElement) initOf("const e = <div>\n  <span/>\n  {}\n</div>;");
            assertThat(div.getJsxChildren()).hasSize(1);
            assertThat(div.getJsxChildren().get(0)).isInstanceOf(JsxElement.class);
        }

        @Test
        @DisplayName("闭合标签不匹配")
        void testMismatchedClosingTag() {
            ParseException e = parseError("const x = <div></span>;");
            assertThat(e.getRawMessage()).isEqualTo("Expected corresponding JSX closing tag for <div>");
            assertThat(e.getExpected()).isEqualTo("</div>");
        }

        @Test
        @DisplayName("未闭合元素")
        void testUnterminated() {
            assertThat(parseError("const x = <div>").getRawMessage()).isEqualTo("Unterminated JSX element");
        }
    }

    // ============ 文本清理 ============

    @Nested
    @DisplayName("JSX 文本空白")
    class CleanTextTests {

        @Test
        @DisplayName("单行文本原样保留")
        void testSingleLine() {
            assertThat(JsxParser.cleanText("Hello ")).isEqualTo("Hello ");
            assertThat(JsxParser.cleanText("  a  ")).isEqualTo("  a  ");
        }

        @Test
        @DisplayName("多行文本逐行修剪并以空格连接")
        void testMultiLine() {
            assertThat(JsxParser.cleanText("\n  Hello\n  World\n")).isEqualTo("Hello World");
            assertThat(JsxParser.cleanText("a  \n  b")).isEqualTo("a b");
        }

        @Test
        @DisplayName("仅含空白的多行文本为空")
        void testBlank() {
            assertThat(JsxParser.cleanText("  \n  \n ")).isEmpty();
        }
    }

    // ============ 表达式与类型 ============

    @Nested
    @DisplayName("表达式与类型")
    class ExpressionTests {

        @Test
        @DisplayName("运算符优先级")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) initOf("const r = a + b * c;");
            assertThat(add.getOperator()).isEqualTo(BinaryOp.ADD);
            assertThat(((BinaryExpr) add.getRight()).getOperator()).isEqualTo(BinaryOp.MUL);
        }

        @Test
        @DisplayName("嵌套泛型类型注解")
        void testNestedGenericType() {
            VariableDecl decl = (VariableDecl) single("let x: Promise<Array<T>> = y;");
            VariableDeclarator declarator = decl.getDeclarators().get(0);
            assertThat(declarator.getType().getText()).isEqualTo("Promise<Array<T>>");
        }

        @Test
        @DisplayName("泛型箭头函数")
        void testGenericArrow() {
            ArrowFunction arrow = (ArrowFunction) initOf("const id = <T,>(x: T) => x;");
            assertThat(arrow.getTypeParams()).isNotNull();
            assertThat(arrow.getParams()).hasSize(1);
        }
    }

    // ============ 嵌套深度 ============

    @Nested
    @DisplayName("嵌套深度")
    class NestingTests {

        private String repeat(String text, int count) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < count; i++) sb.append(text);
            return sb.toString();
        }

        @Test
        @DisplayName("默认上限拒绝深层括号并报告位置")
        void testDeepParens() {
            ParseException e = parseError("const a = <div>{" + repeat("(", 3000) + "x" + repeat(")", 3000) + "}</div>;");

            assertThat(e.getRawMessage()).isEqualTo("Maximum nesting depth of " + Parser.DEFAULT_MAX_DEPTH + " exceeded");
            assertThat(e.getPhase()).isEqualTo(Phase.PARSER);
            assertThat(e.getLine()).isEqualTo(1);
            assertThat(e.getToken().getLexeme()).isEqualTo("(");
        }

        @Test
        @DisplayName("未闭合的深层数组")
        void testDeepArray() {
            ParseException e = parseError("const x = " + repeat("[", 5000));
            assertThat(e.getRawMessage()).isEqualTo("Maximum nesting depth of " + Parser.DEFAULT_MAX_DEPTH + " exceeded");
        }

        @Test
        @DisplayName("自定义上限作用于语句、一元运算和 JSX")
        void testCustomLimit() {
            String[] sources = {
                    repeat("{", 20) + repeat("}", 20),
                    "const a = " + repeat("!", 20) + "x;",
                    "const a = " + repeat("<i>", 20) + repeat("</i>", 20) + ";",
                    "let a: " + repeat("(", 20) + "T" + repeat(")", 20) + ";"
            };
            for (String source : sources) {
                assertThatThrownBy(() -> new Parser(new Lexer(source)).setMaxDepth(10).parse())
                        .isInstanceOf(ParseException.class)
                        .hasMessageStartingWith("Maximum nesting depth of 10 exceeded");
                assertThat(new Parser(new Lexer(source)).parse().getBody()).hasSize(1);
            }
        }

        @Test
        @DisplayName("上限内的嵌套正常解析")
        void testWithinLimit() {
            Program program = new Parser(new Lexer("const a = ((x));")).setMaxDepth(10).parse();
            assertThat(program.getBody()).hasSize(1);
        }

        @Test
        @DisplayName("容错解析在深度错误后继续")
        void testTolerantRecovery() {
            ParseResult result = new Parser(new Lexer("const a = " + repeat("(", 100) + "x" + repeat(")", 100)
                    + ";\nconst b = 1;")).setMaxDepth(50).parseTolerant();

            assertThat(result.getErrors()).hasSize(1);
            assertThat(result.getErrors().get(0).getMessage()).startsWith("Maximum nesting depth of 50 exceeded");
            assertThat(result.getProgram().getBody()).hasSize(1);
            VariableDecl b = (VariableDecl) result.getProgram().getBody().get(0);
            assertThat(b.getDeclarators().get(0).getSimpleName()).isEqualTo("b");
        }

        @Test
        @DisplayName("非正的上限")
        void testInvalidLimit() {
            assertThatThrownBy(() -> new Parser(new Lexer("")).setMaxDepth(0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("maxDepth must be positive: 0");
        }
    }

    // ============ 容错解析 ============

    @Nested
    @DisplayName("容错解析")
    class TolerantTests {

        @Test
        @DisplayName("错误后在语句边界恢复")
        void testRecovery() {
            ParseResult result = new Parser(new Lexer("let a = ;\nlet b = 2;")).parseTolerant();

            assertThat(result.hasErrors()).isTrue();
            assertThat(result.getErrors()).hasSize(1);
            assertThat(result.getErrors().get(0).getLine()).isEqualTo(1);
            assertThat(result.getProgram().getBody()).hasSize(1);
            VariableDecl b = (VariableDecl) result.getProgram().getBody().get(0);
            assertThat(b.getDeclarators().get(0).getSimpleName()).isEqualTo("b");
        }

        @Test
        @DisplayName("无错误时与普通解析一致")
        void testNoErrors() {
            ParseResult result = new Parser(new Lexer("const a = 1;\nconst b = 2;")).parseTolerant();
            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getProgram().getBody()).hasSize(2);
        }

        @Test
        @DisplayName("严格解析在第一个错误处抛出")
        void testStrictThrows() {
            assertThatThrownBy(() -> parse("let a = ;\nlet b = 2;"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageStartingWith("Unexpected token");
        }
    }
}
