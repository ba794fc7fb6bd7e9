package com.psrlang.compiler.analysis;

import com.psrlang.compiler.ast.decl.ComponentDecl;
import com.psrlang.compiler.ast.decl.FunctionDecl;
import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.stmt.IfStmt;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ScopeBuilder 测试
 */
class ScopeBuilderTest {

    private Program program;

    private SymbolTable build(String source) {
        program = new Parser(new Lexer(source)).parse();
        return new ScopeBuilder().build(program);
    }

    private Symbol only(SymbolTable table, String name) {
        List<Symbol> symbols = table.lookupAll(name);
        assertThat(symbols).hasSize(1);
        return symbols.get(0);
    }

    @Nested
    @DisplayName("声明登记")
    class DeclarationTests {

        @Test
        @DisplayName("模块作用域位于全局作用域之下")
        void testModuleScope() {
            SymbolTable table = build("const a = 1;");
            Scope module = table.getScope(program);

            assertThat(table.getGlobalScope().getType()).isEqualTo(Scope.ScopeType.GLOBAL);
            assertThat(module.getType()).isEqualTo(Scope.ScopeType.MODULE);
            assertThat(module.getParent()).isSameAs(table.getGlobalScope());
            assertThat(module.resolveLocal("a")).isNotNull();
            assertThat(module.isTopLevel()).isTrue();
        }

        @Test
        @DisplayName("各类顶层声明的符号种类")
        void testKinds() {
            SymbolTable table = build("import D, { createSignal as cs } from 'x';\n"
                    + "const a = 1;\n"
                    + "let b = 'text';\n"
                    + "function helper() {}\n"
                    + "class K {}\n"
                    + "interface I {}\n"
                    + "type T = string;\n"
                    + "enum E { A }\n"
                    + "component App() { return <div/>; }");

            assertThat(only(table, "D").getKind()).isEqualTo(SymbolKind.IMPORT);
            assertThat(only(table, "cs").getKind()).isEqualTo(SymbolKind.IMPORT);
            assertThat(only(table, "a").getKind()).isEqualTo(SymbolKind.CONSTANT);
            assertThat(only(table, "b").getKind()).isEqualTo(SymbolKind.VARIABLE);
            assertThat(only(table, "helper").getKind()).isEqualTo(SymbolKind.FUNCTION);
            assertThat(only(table, "K").getKind()).isEqualTo(SymbolKind.CLASS);
            assertThat(only(table, "I").getKind()).isEqualTo(SymbolKind.INTERFACE);
            assertThat(only(table, "T").getKind()).isEqualTo(SymbolKind.TYPE_ALIAS);
            assertThat(only(table, "E").getKind()).isEqualTo(SymbolKind.ENUM);
            assertThat(only(table, "App").getKind()).isEqualTo(SymbolKind.COMPONENT);
            assertThat(table.getAllSymbolsOfKind(SymbolKind.COMPONENT)).hasSize(1);
        }

        @Test
        @DisplayName("导入说明符的推断类型是模块路径")
        void testImportSource() {
            SymbolTable table = build("import { h } from './dom';");
            assertThat(only(table, "h").getInferredType()).isEqualTo("./dom");
        }

        @Test
        @DisplayName("由初始值和注解推断类型")
        void testInferredTypes() {
            SymbolTable table = build("const n = 1;\nconst s = `x`;\nconst el = <p/>;\n"
                    + "const r = /a/;\nconst d = new Date();\nconst t: Theme = pick();\nconst u = pick();");

            assertThat(only(table, "n").getInferredType()).isEqualTo("number");
            assertThat(only(table, "s").getInferredType()).isEqualTo("string");
            assertThat(only(table, "el").getInferredType()).isEqualTo("HTMLElement");
            assertThat(only(table, "r").getInferredType()).isEqualTo("RegExp");
            assertThat(only(table, "d").getInferredType()).isEqualTo("Date");
            assertThat(only(table, "t").getInferredType()).isEqualTo("Theme");
            assertThat(only(table, "u").getInferredType()).isNull();
        }

        @Test
        @DisplayName("解构绑定的每个名称都被登记")
        void testDestructuring() {
            SymbolTable table = build("const [value, setValue] = createSignal(0);\nconst { a, b: c } = obj;");
            assertThat(only(table, "value").getKind()).isEqualTo(SymbolKind.CONSTANT);
            assertThat(only(table, "setValue").getInferredType()).isNull();
            assertThat(only(table, "a")).isNotNull();
            assertThat(only(table, "c")).isNotNull();
            assertThat(table.lookupAll("b")).isEmpty();
        }

        @Test
        @DisplayName("同一作用域内的重复声明保留第一个")
        void testDuplicateKeepsFirst() {
            SymbolTable table = build("var v = 1;\nvar v = 'x';");
            assertThat(only(table, "v").getInferredType()).isEqualTo("number");
        }
    }

    @Nested
    @DisplayName("嵌套作用域")
    class NestingTests {

        @Test
        @DisplayName("组件作用域包含参数和局部变量")
        void testComponentScope() {
            SymbolTable table = build("component Card(props: CardProps) { const el = <div/>; return el; }");
            ComponentDecl card = (ComponentDecl) program.getBody().get(0);
            Scope scope = table.getScope(card);

            assertThat(scope.getType()).isEqualTo(Scope.ScopeType.COMPONENT);
            assertThat(scope.resolveLocal("props").getKind()).isEqualTo(SymbolKind.PARAMETER);
            assertThat(scope.resolveLocal("props").getInferredType()).isEqualTo("CardProps");
            assertThat(scope.resolveLocal("el")).isNotNull();
            assertThat(scope.resolve("Card").getKind()).isEqualTo(SymbolKind.COMPONENT);
            assertThat(scope.resolveLocal("Card")).isNull();
        }

        @Test
        @DisplayName("遮蔽：同名变量分别登记在各自作用域")
        void testShadowing() {
            SymbolTable table = build("const x = 1;\n"
                    + "function f() { const x = 'a'; if (x) { let x = true; } }");
            FunctionDecl f = (FunctionDecl) program.getBody().get(1);
            IfStmt ifStmt = (IfStmt) f.getBody().getStatements().get(1);
            Block then = (Block) ifStmt.getThenBranch();

            assertThat(table.lookupAll("x")).hasSize(3);
            assertThat(table.getScope(program).resolveLocal("x").getInferredType()).isEqualTo("number");
            assertThat(table.getScope(f).getType()).isEqualTo(Scope.ScopeType.FUNCTION);
            assertThat(table.getScope(f).resolveLocal("x").getInferredType()).isEqualTo("string");

            Scope block = table.getScope(then);
            assertThat(block.getType()).isEqualTo(Scope.ScopeType.BLOCK);
            assertThat(block.resolve("x").getInferredType()).isEqualTo("boolean");
            assertThat(block.findDeclaringScope("f")).isSameAs(table.getScope(program));
            assertThat(table.getScope(f).encloses(block)).isTrue();
            assertThat(block.encloses(table.getScope(f))).isFalse();
        }

        @Test
        @DisplayName("箭头函数参数不泄漏到外层")
        void testArrowParams() {
            SymbolTable table = build("const handler = (event) => event.target;");
            Symbol event = only(table, "event");
            assertThat(event.getKind()).isEqualTo(SymbolKind.PARAMETER);
            assertThat(table.getScope(program).resolveLocal("event")).isNull();
        }
    }

    // ============ 引用 ============

    @Nested
    @DisplayName("引用标记")
    class UsageTests {

        @Test
        @DisplayName("被引用的声明标记为已使用，声明本身不算引用")
        void testMarkUsed() {
            SymbolTable table = build("import { a, b } from 'm';\n"
                    + "const unused = 1;\n"
                    + "const used = a + 1;\n"
                    + "function later() { return used; }\n"
                    + "later();");

            assertThat(only(table, "a").isUsed()).isTrue();
            assertThat(only(table, "b").isUsed()).isFalse();
            assertThat(only(table, "unused").isUsed()).isFalse();
            assertThat(only(table, "used").isUsed()).isTrue();
            assertThat(only(table, "later").isUsed()).isTrue();
        }

        @Test
        @DisplayName("先使用后声明的函数同样解析")
        void testHoisted() {
            SymbolTable table = build("run();\nfunction run() {}");
            assertThat(only(table, "run").isUsed()).isTrue();
        }

        @Test
        @DisplayName("遮蔽时只标记内层符号")
        void testShadowedReference() {
            SymbolTable table = build("const x = 1;\nfunction f(x) { return x; }");

            List<Symbol> symbols = table.lookupAll("x");
            assertThat(symbols).hasSize(2);
            for (Symbol symbol : symbols) {
                assertThat(symbol.isUsed()).isEqualTo(symbol.getKind() == SymbolKind.PARAMETER);
            }
        }

        @Test
        @DisplayName("属性名和非计算键不是引用")
        void testPropertyNames() {
            SymbolTable table = build("const name = 1;\nconst key = 'k';\n"
                    + "const o = { name: 2, [key]: 3 };\n"
                    + "o.name;\n"
                    + "class K { name = 4; }");

            assertThat(only(table, "name").isUsed()).isFalse();
            assertThat(only(table, "key").isUsed()).isTrue();
            assertThat(only(table, "o").isUsed()).isTrue();
        }

        @Test
        @DisplayName("JSX 组件标签与导出说明符")
        void testJsxAndExports() {
            SymbolTable table = build("import Theme from './theme';\n"
                    + "function Card() { return <div/>; }\n"
                    + "const helper = 1;\n"
                    + "const view = <section><Card/><Theme.Provider/></section>;\n"
                    + "export { helper };");

            assertThat(only(table, "Card").isUsed()).isTrue();
            assertThat(only(table, "Theme").isUsed()).isTrue();
            assertThat(only(table, "helper").isUsed()).isTrue();
            assertThat(only(table, "view").isUsed()).isFalse();
        }
    }
}
