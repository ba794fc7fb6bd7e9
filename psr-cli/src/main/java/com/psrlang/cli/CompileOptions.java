package com.psrlang.cli;

import com.psrlang.compiler.CompilerConfig;
import com.psrlang.compiler.emitter.ModuleFormat;
import com.psrlang.compiler.lexer.LexerMode;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * transform 和 build 共用的编译选项
 *
 * <p>优先级：命令行选项 &gt; --config 指定的 psr.properties &gt; 默认值。</p>
 */
public class CompileOptions {

    @Option(names = "--config", paramLabel = "FILE", description = "psr.properties configuration file")
    Path configFile;

    @Option(names = "--strict", description = "Treat detector warnings as errors")
    boolean strict;

    @Option(names = "--debug", description = "Record phase timings and report detected components")
    boolean debug;

    @Option(names = "--collect-errors", description = "Report every syntax error instead of stopping at the first")
    boolean collectErrors;

    @Option(names = "--lexer-mode", paramLabel = "MODE", description = "Lexer error mode: ${COMPLETION-CANDIDATES}")
    LexerMode lexerMode;

    @Option(names = "--max-depth", paramLabel = "N", description = "Maximum nesting depth")
    Integer maxDepth;

    @Option(names = "--runtime", paramLabel = "MODULE", description = "Runtime module for generated imports")
    String runtimeModule;

    @Option(names = "--module-format", paramLabel = "FORMAT", description = "Import style: ${COMPLETION-CANDIDATES}")
    ModuleFormat moduleFormat;

    @Option(names = "--ascii-only", description = "Escape non-ASCII characters in string literals")
    boolean asciiOnly;

    @Option(names = "--json", description = "Print a JSON report instead of plain diagnostics")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "Verbose logging")
    boolean verbose;

    /**
     * 合并配置文件和命令行选项
     */
    CompilerConfig toConfig() throws IOException {
        CompilerConfig config = CompilerConfig.defaults();
        if (configFile != null) {
            ConfigLoader.apply(ConfigLoader.load(configFile), config);
        }
        if (strict) config.setStrict(true);
        if (debug) config.setDebug(true);
        if (collectErrors) config.setCollectErrors(true);
        if (lexerMode != null) config.setLexerMode(lexerMode);
        if (maxDepth != null) config.setMaxDepth(maxDepth);
        if (runtimeModule != null) config.getEmitter().setRuntimeModule(runtimeModule);
        if (moduleFormat != null) config.getEmitter().setModuleFormat(moduleFormat);
        if (asciiOnly) config.getEmitter().setAsciiOnly(true);
        return config;
    }
}
