package com.psrlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * PSR 编译器命令行入口（picocli）
 */
@Command(name = "psrc", version = "psrc 0.1.0",
         mixinStandardHelpOptions = true,
         description = "Compiles PSR components and JSX into TypeScript",
         subcommands = {TransformCommand.class, BuildCommand.class, TokensCommand.class})
public class Main implements Runnable {

    /** 编译错误 */
    static final int EXIT_COMPILE_ERROR = 1;
    /** 参数、配置或文件读写错误 */
    static final int EXIT_USAGE_ERROR = 2;

    /** 持有引用，避免级别设置随 Logger 被回收而丢失 */
    private static final Logger PSR_LOGGER = Logger.getLogger("com.psrlang");

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 未指定子命令时打印用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * 读取类路径上的 logging.properties；verbose 时把根日志级别降到 FINE
     */
    static void configureLogging(boolean verbose) {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("Failed to read logging configuration: " + e.getMessage());
        }
        if (verbose) {
            PSR_LOGGER.setLevel(Level.FINE);
            Logger rootLogger = Logger.getLogger("");
            rootLogger.setLevel(Level.FINE);
            for (Handler handler : rootLogger.getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    public static void main(String[] args) {
        configureLogging(false);
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
