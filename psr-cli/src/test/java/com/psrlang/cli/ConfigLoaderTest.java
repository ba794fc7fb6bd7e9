package com.psrlang.cli;

import com.psrlang.compiler.CompilerConfig;
import com.psrlang.compiler.emitter.EmitterConfig;
import com.psrlang.compiler.emitter.ModuleFormat;
import com.psrlang.compiler.lexer.LexerMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * psr.properties 读取测试
 */
class ConfigLoaderTest {

    private static Properties props(String... pairs) {
        Properties properties = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            properties.setProperty(pairs[i], pairs[i + 1]);
        }
        return properties;
    }

    private static CompilerConfig apply(String... pairs) {
        CompilerConfig config = CompilerConfig.defaults();
        ConfigLoader.apply(props(pairs), config);
        return config;
    }

    // ============ 有效配置 ============

    @Nested
    @DisplayName("有效配置")
    class ValidTests {

        @Test
        @DisplayName("空配置保持默认值")
        void testEmpty() {
            CompilerConfig config = apply();
            assertThat(config.isDebug()).isFalse();
            assertThat(config.isStrict()).isFalse();
            assertThat(config.getLexerMode()).isEqualTo(LexerMode.STRICT);
            assertThat(config.getEmitter().getIndent()).isEqualTo("  ");
            assertThat(config.getEmitter().getRuntimeModule()).isEqualTo(EmitterConfig.DEFAULT_RUNTIME_MODULE);
        }

        @Test
        @DisplayName("编译器选项")
        void testCompilerKeys() {
            CompilerConfig config = apply(
                    ConfigLoader.DEBUG, "true",
                    ConfigLoader.STRICT, " TRUE ",
                    ConfigLoader.COLLECT_ERRORS, "true",
                    ConfigLoader.LEXER_MODE, "resilient",
                    ConfigLoader.MAX_DEPTH, "40");

            assertThat(config.isDebug()).isTrue();
            assertThat(config.isStrict()).isTrue();
            assertThat(config.isCollectErrors()).isTrue();
            assertThat(config.getLexerMode()).isEqualTo(LexerMode.RESILIENT);
            assertThat(config.getMaxDepth()).isEqualTo(40);
        }

        @Test
        @DisplayName("发射器选项")
        void testEmitterKeys() {
            EmitterConfig emitter = apply(
                    ConfigLoader.INDENT, "4",
                    ConfigLoader.MODULE_FORMAT, "cjs",
                    ConfigLoader.RUNTIME_MODULE, "my-runtime",
                    ConfigLoader.EXTRA_RUNTIME_MODULES, "@acme/signals, ./runtime, ,",
                    ConfigLoader.ASCII_ONLY, "true").getEmitter();

            assertThat(emitter.getIndent()).isEqualTo("    ");
            assertThat(emitter.getModuleFormat()).isEqualTo(ModuleFormat.CJS);
            assertThat(emitter.getRuntimeModule()).isEqualTo("my-runtime");
            assertThat(emitter.getRuntimeModules()).containsExactly("my-runtime", "@acme/signals", "./runtime");
            assertThat(emitter.isAsciiOnly()).isTrue();
        }

        @Test
        @DisplayName("缩进可为制表符或零")
        void testIndent() {
            assertThat(apply(ConfigLoader.INDENT, "tab").getEmitter().getIndent()).isEqualTo("\t");
            assertThat(apply(ConfigLoader.INDENT, "0").getEmitter().getIndent()).isEmpty();
        }

        @Test
        @DisplayName("从文件读取")
        void testLoad(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("psr.properties");
            Files.write(file, ("# 项目配置\n"
                    + "psr.strict=true\n"
                    + "psr.emitter.runtimeModule=@pulsar-framework/pulsar.dev/core\n")
                    .getBytes(StandardCharsets.UTF_8));

            CompilerConfig config = CompilerConfig.defaults();
            ConfigLoader.apply(ConfigLoader.load(file), config);

            assertThat(config.isStrict()).isTrue();
            assertThat(config.getEmitter().getRuntimeModule()).isEqualTo("@pulsar-framework/pulsar.dev/core");
        }
    }

    // ============ 无效配置 ============

    @Nested
    @DisplayName("无效配置")
    class InvalidTests {

        @Test
        @DisplayName("布尔值")
        void testBoolean() {
            assertThatThrownBy(() -> apply(ConfigLoader.DEBUG, "yes"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid value for psr.debug: 'yes' (expected true or false)");
        }

        @Test
        @DisplayName("整数")
        void testInteger() {
            assertThatThrownBy(() -> apply(ConfigLoader.MAX_DEPTH, "deep"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid value for psr.maxDepth: 'deep'");
        }

        @Test
        @DisplayName("非正的深度上限")
        void testNonPositiveDepth() {
            assertThatThrownBy(() -> apply(ConfigLoader.MAX_DEPTH, "0"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("maxDepth must be positive: 0");
        }

        @Test
        @DisplayName("枚举")
        void testEnum() {
            assertThatThrownBy(() -> apply(ConfigLoader.MODULE_FORMAT, "amd"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid value for psr.emitter.moduleFormat: 'amd'");
        }

        @Test
        @DisplayName("缩进超出范围")
        void testIndentRange() {
            assertThatThrownBy(() -> apply(ConfigLoader.INDENT, "9"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid value for psr.emitter.indent: '9'");
        }
    }
}
