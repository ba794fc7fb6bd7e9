package com.psrlang.cli;

import com.psrlang.compiler.CompilerConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli build 子命令：转换目录下所有源文件
 */
@Command(name = "build", description = "Transform every .psr and .tsx file under a directory")
public class BuildCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", defaultValue = ".", paramLabel = "DIR",
                description = "Source directory (default: current directory)")
    Path sourceDir;

    @Option(names = {"-o", "--output"}, defaultValue = "build/psr", paramLabel = "DIR",
            description = "Output directory (default: build/psr)")
    Path outputDir;

    @Mixin
    CompileOptions options;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        Main.configureLogging(options.verbose);
        CompilerConfig config;
        try {
            config = options.toConfig();
        } catch (IOException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("error: " + e.getMessage());
            return Main.EXIT_USAGE_ERROR;
        }
        return new TransformRunner(config, options.json,
                spec.commandLine().getOut(), spec.commandLine().getErr()).buildDirectory(sourceDir, outputDir);
    }
}
