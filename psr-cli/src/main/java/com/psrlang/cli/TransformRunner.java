package com.psrlang.cli;

import com.psrlang.compiler.CompilerConfig;
import com.psrlang.compiler.PsrCompiler;
import com.psrlang.compiler.TransformResult;
import com.psrlang.compiler.diagnostic.Diagnostic;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * 文件和目录转换执行器
 */
public class TransformRunner {

    private static final Logger LOG = Logger.getLogger(TransformRunner.class.getName());

    /** build 处理的源文件扩展名 */
    static final String[] SOURCE_EXTENSIONS = {".psr", ".tsx"};
    static final String OUTPUT_EXTENSION = ".ts";

    private final PsrCompiler compiler = new PsrCompiler();
    private final CompilerConfig config;
    private final boolean json;
    private final PrintWriter out;
    private final PrintWriter err;

    public TransformRunner(CompilerConfig config, boolean json, PrintWriter out, PrintWriter err) {
        this.config = config;
        this.json = json;
        this.out = out;
        this.err = err;
    }

    /**
     * 转换单个文件；output 为 null 时写到标准输出
     *
     * @return 退出码
     */
    public int transformFile(Path input, Path output) {
        if (!Files.isRegularFile(input)) {
            err.println("error: file not found: " + input);
            return Main.EXIT_USAGE_ERROR;
        }
        JsonReport report = new JsonReport();
        try {
            TransformResult result = transform(input);
            if (result.isSuccess() && output != null) {
                write(output, result.getCode());
            }
            if (json) {
                report.add(input.toString(), output != null ? output.toString() : null, result, output == null);
                out.println(report.toJson());
            } else {
                printDiagnostics(input, result);
                if (result.isSuccess() && output == null) {
                    out.print(result.getCode());
                    out.flush();
                }
            }
            return result.isSuccess() ? 0 : Main.EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "I/O error for " + input, e);
            err.println("error: " + e.getMessage());
            return Main.EXIT_USAGE_ERROR;
        }
    }

    /**
     * 转换目录下所有 .psr / .tsx 文件，保持相对路径写入输出目录，扩展名改为 .ts
     *
     * @return 退出码：任何文件失败时为编译错误
     */
    public int buildDirectory(Path sourceDir, Path outputDir) {
        if (!Files.isDirectory(sourceDir)) {
            err.println("error: not a directory: " + sourceDir);
            return Main.EXIT_USAGE_ERROR;
        }
        List<Path> sources;
        try {
            sources = findSources(sourceDir);
        } catch (IOException e) {
            err.println("error: cannot list " + sourceDir + ": " + e.getMessage());
            return Main.EXIT_USAGE_ERROR;
        }

        JsonReport report = new JsonReport();
        int failed = 0;
        for (Path source : sources) {
            Path target = outputPath(sourceDir, outputDir, source);
            try {
                TransformResult result = transform(source);
                if (result.isSuccess()) {
                    write(target, result.getCode());
                } else {
                    failed++;
                }
                if (json) {
                    report.add(source.toString(), target.toString(), result, false);
                } else {
                    printDiagnostics(source, result);
                }
            } catch (IOException e) {
                LOG.log(Level.WARNING, "I/O error for " + source, e);
                err.println("error: " + source + ": " + e.getMessage());
                failed++;
            }
        }

        if (json) {
            out.println(report.toJson());
        } else {
            out.println("Transformed " + (sources.size() - failed) + " of " + sources.size() + " file(s) into "
                    + outputDir);
        }
        LOG.info("Build finished: " + sources.size() + " file(s), " + failed + " failed");
        return failed == 0 ? 0 : Main.EXIT_COMPILE_ERROR;
    }

    private TransformResult transform(Path input) throws IOException {
        String source = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
        config.setFileName(input.getFileName().toString());
        return compiler.transform(source, config);
    }

    static List<Path> findSources(Path sourceDir) throws IOException {
        List<Path> sources = new ArrayList<Path>();
        try (Stream<Path> paths = Files.walk(sourceDir)) {
            Iterator<Path> it = paths.iterator();
            while (it.hasNext()) {
                Path path = it.next();
                if (Files.isRegularFile(path) && isSource(path)) {
                    sources.add(path);
                }
            }
        }
        Collections.sort(sources);
        return sources;
    }

    static boolean isSource(Path path) {
        String name = path.getFileName().toString();
        for (String extension : SOURCE_EXTENSIONS) {
            if (name.endsWith(extension)) return true;
        }
        return false;
    }

    static Path outputPath(Path sourceDir, Path outputDir, Path source) {
        Path relative = sourceDir.relativize(source);
        String name = relative.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String renamed = (dot > 0 ? name.substring(0, dot) : name) + OUTPUT_EXTENSION;
        Path parent = relative.getParent();
        return parent != null ? outputDir.resolve(parent).resolve(renamed) : outputDir.resolve(renamed);
    }

    private static void write(Path target, String code) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, code.getBytes(StandardCharsets.UTF_8));
    }

    /** file:line:column: type [phase] message */
    private void printDiagnostics(Path file, TransformResult result) {
        for (Diagnostic d : result.getDiagnostics()) {
            StringBuilder line = new StringBuilder(file.toString());
            if (d.hasLocation()) {
                line.append(':').append(d.getLine()).append(':').append(d.getColumn());
            }
            line.append(": ").append(d.getType().getId()).append(" [").append(d.getPhase().getId()).append("] ")
                    .append(d.getMessage());
            err.println(line);
        }
        if (result.getMetrics() != null) {
            err.println(file + ": " + result.getMetrics());
        }
        err.flush();
    }
}
