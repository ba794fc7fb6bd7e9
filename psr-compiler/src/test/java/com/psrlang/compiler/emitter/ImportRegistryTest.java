package com.psrlang.compiler.emitter;

import com.psrlang.compiler.ast.decl.ImportDecl;
import com.psrlang.compiler.ast.stmt.Statement;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ImportRegistry 测试
 */
class ImportRegistryTest {

    private ImportRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ImportRegistry();
    }

    // ============ ESM ============

    @Nested
    @DisplayName("ES 模块导入")
    class EsmTests {

        @Test
        @DisplayName("重复登记只生成一份，生成不改变状态")
        void testDedupAndIdempotent() {
            registry.addNamed("./a", "x");
            registry.addNamed("./a", "x");

            assertThat(registry.generateImportStatements()).containsExactly("import { x } from './a';");
            assertThat(registry.generateImportStatements()).isEqualTo(registry.generateImportStatements());
            assertThat(registry.getModuleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("副作用导入在前，其余按模块路径和说明符排序")
        void testOrdering() {
            registry.addNamed("./b", "y");
            registry.addNamed("./a", "z");
            registry.addNamed("./a", "x");
            registry.addSideEffect("polyfill");
            registry.addDefault("./a", "A", false);

            assertThat(registry.generateImportStatements()).containsExactly(
                    "import 'polyfill';",
                    "import A, { x, z } from './a';",
                    "import { y } from './b';");
        }

        @Test
        @DisplayName("已有绑定的模块不再生成副作用导入")
        void testSideEffectMergedIntoBindings() {
            registry.addSideEffect("./a");
            registry.addNamed("./a", "x");
            assertThat(registry.generateImportStatements()).containsExactly("import { x } from './a';");
        }

        @Test
        @DisplayName("命名空间导入与具名导入分成两条")
        void testNamespaceSplit() {
            registry.addNamespace("m", "ns", false);
            registry.addNamed("m", "a");
            assertThat(registry.generateImportStatements()).containsExactly(
                    "import * as ns from 'm';",
                    "import { a } from 'm';");

            ImportRegistry withDefault = new ImportRegistry();
            withDefault.addDefault("m", "D", false);
            withDefault.addNamespace("m", "ns", false);
            assertThat(withDefault.generateImportStatements()).containsExactly("import D, * as ns from 'm';");
        }

        @Test
        @DisplayName("类型导入单独一条，值导入覆盖同名类型导入")
        void testTypeImports() {
            registry.addNamed("m", "T", "T", true);
            registry.addNamed("m", "a");
            registry.addNamed("m", "U", "U", true);
            registry.addNamed("m", "U");

            assertThat(registry.generateImportStatements()).containsExactly(
                    "import { U, a } from 'm';",
                    "import type { T } from 'm';");
        }

        @Test
        @DisplayName("别名与绑定查询")
        void testAlias() {
            registry.addNamed("m", "a", "b", false);
            assertThat(registry.generateImportStatements()).containsExactly("import { a as b } from 'm';");
            assertThat(registry.isBound("b")).isTrue();
            assertThat(registry.isBound("a")).isFalse();
        }

        @Test
        @DisplayName("合并源码中的 import 声明")
        void testAddImportDecl() {
            String source = "import D, { b, type C } from './x';\n"
                    + "import type { T } from './t';\n"
                    + "import './side';";
            for (Statement statement : new Parser(new Lexer(source)).parse().getBody()) {
                registry.addImportDecl((ImportDecl) statement);
            }

            assertThat(registry.generateImportStatements()).containsExactly(
                    "import './side';",
                    "import type { T } from './t';",
                    "import D, { b } from './x';",
                    "import type { C } from './x';");
        }

        @Test
        @DisplayName("同一模块的多个默认导入和命名空间导入全部保留")
        void testMultipleDefaultBindings() {
            String source = "import A from './m';\n"
                    + "import B from './m';\n"
                    + "import * as N from './m';\n"
                    + "import * as O from './m';\n"
                    + "import { x } from './m';\n"
                    + "import A from './m';";
            for (Statement statement : new Parser(new Lexer(source)).parse().getBody()) {
                registry.addImportDecl((ImportDecl) statement);
            }

            assertThat(registry.generateImportStatements()).containsExactly(
                    "import A, * as N from './m';",
                    "import { x } from './m';",
                    "import B from './m';",
                    "import * as O from './m';");
            assertThat(registry.isBound("B")).isTrue();
            assertThat(registry.isBound("O")).isTrue();
        }

        @Test
        @DisplayName("多个类型默认导入")
        void testMultipleTypeDefaults() {
            registry.addDefault("m", "A", true);
            registry.addDefault("m", "B", true);
            registry.addDefault("m", "B", false);

            assertThat(registry.generateImportStatements()).containsExactly(
                    "import B from 'm';",
                    "import type A from 'm';");
        }

        @Test
        @DisplayName("空注册表")
        void testEmpty() {
            assertThat(registry.isEmpty()).isTrue();
            assertThat(registry.generateImportStatements()).isEmpty();
        }
    }

    // ============ CommonJS ============

    @Test
    @DisplayName("CommonJS 输出为 require")
    void testCommonJs() {
        registry.addNamed("m", "a", "b", false);
        registry.addDefault("m", "D", false);
        registry.addNamespace("n", "N", false);
        registry.addSideEffect("s");

        assertThat(registry.generateImportStatements(ModuleFormat.CJS)).containsExactly(
                "require('s');",
                "const D = require('m').default;",
                "const { a: b } = require('m');",
                "const N = require('n');");
    }

    @Test
    @DisplayName("CommonJS 下每个默认导入各占一行")
    void testCommonJsMultipleDefaults() {
        registry.addDefault("m", "A", false);
        registry.addDefault("m", "B", false);

        assertThat(registry.generateImportStatements(ModuleFormat.CJS)).containsExactly(
                "const A = require('m').default;",
                "const B = require('m').default;");
    }
}
