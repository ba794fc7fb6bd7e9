package com.psrlang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TransformRunner 路径处理测试
 */
class TransformRunnerTest {

    @Test
    @DisplayName("只处理 .psr 和 .tsx 文件")
    void testIsSource() {
        assertThat(TransformRunner.isSource(Paths.get("src/App.psr"))).isTrue();
        assertThat(TransformRunner.isSource(Paths.get("src/App.tsx"))).isTrue();
        assertThat(TransformRunner.isSource(Paths.get("src/util.ts"))).isFalse();
        assertThat(TransformRunner.isSource(Paths.get("README.md"))).isFalse();
    }

    @Test
    @DisplayName("输出路径保持相对目录并改为 .ts")
    void testOutputPath() {
        Path src = Paths.get("src");
        Path out = Paths.get("build", "psr");

        assertThat(TransformRunner.outputPath(src, out, src.resolve("App.psr")))
                .isEqualTo(out.resolve("App.ts"));
        assertThat(TransformRunner.outputPath(src, out, src.resolve("ui").resolve("Button.tsx")))
                .isEqualTo(out.resolve("ui").resolve("Button.ts"));
        assertThat(TransformRunner.outputPath(src, out, src.resolve("a.b.psr")))
                .isEqualTo(out.resolve("a.b.ts"));
    }

    @Test
    @DisplayName("递归查找源文件并排序")
    void testFindSources(@TempDir Path dir) throws Exception {
        Files.createDirectories(dir.resolve("b"));
        Files.createFile(dir.resolve("b").resolve("Z.psr"));
        Files.createFile(dir.resolve("A.tsx"));
        Files.createFile(dir.resolve("notes.txt"));

        assertThat(TransformRunner.findSources(dir))
                .containsExactly(dir.resolve("A.tsx"), dir.resolve("b").resolve("Z.psr"));
    }
}
