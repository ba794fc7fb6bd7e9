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
 * picocli transform 子命令：转换单个文件
 */
@Command(name = "transform", description = "Transform a single .psr or .tsx file into TypeScript")
public class TransformCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "Source file")
    Path file;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Output file (default: standard output)")
    Path output;

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
                spec.commandLine().getOut(), spec.commandLine().getErr()).transformFile(file, output);
    }
}
