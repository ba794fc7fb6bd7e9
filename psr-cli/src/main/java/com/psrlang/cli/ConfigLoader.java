package com.psrlang.cli;

import com.psrlang.compiler.CompilerConfig;
import com.psrlang.compiler.emitter.EmitterConfig;
import com.psrlang.compiler.emitter.ModuleFormat;
import com.psrlang.compiler.lexer.LexerMode;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * psr.properties 配置文件
 *
 * <pre>
 * psr.debug=false
 * psr.strict=false
 * psr.collectErrors=false
 * psr.lexerMode=STRICT
 * psr.maxDepth=100
 * psr.emitter.indent=2
 * psr.emitter.moduleFormat=ESM
 * psr.emitter.runtimeModule=@pulsar-framework/pulsar.dev
 * psr.emitter.extraRuntimeModules=@acme/signals, ./runtime
 * psr.emitter.asciiOnly=false
 * </pre>
 */
final class ConfigLoader {

    static final String DEBUG = "psr.debug";
    static final String STRICT = "psr.strict";
    static final String COLLECT_ERRORS = "psr.collectErrors";
    static final String LEXER_MODE = "psr.lexerMode";
    static final String MAX_DEPTH = "psr.maxDepth";
    static final String INDENT = "psr.emitter.indent";
    static final String MODULE_FORMAT = "psr.emitter.moduleFormat";
    static final String RUNTIME_MODULE = "psr.emitter.runtimeModule";
    static final String EXTRA_RUNTIME_MODULES = "psr.emitter.extraRuntimeModules";
    static final String ASCII_ONLY = "psr.emitter.asciiOnly";

    private ConfigLoader() {
    }

    static Properties load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return properties;
    }

    /**
     * 把属性写入配置；值无法解析时抛出 IllegalArgumentException
     */
    static void apply(Properties properties, CompilerConfig config) {
        String value = get(properties, DEBUG);
        if (value != null) config.setDebug(parseBoolean(DEBUG, value));
        value = get(properties, STRICT);
        if (value != null) config.setStrict(parseBoolean(STRICT, value));
        value = get(properties, COLLECT_ERRORS);
        if (value != null) config.setCollectErrors(parseBoolean(COLLECT_ERRORS, value));
        value = get(properties, LEXER_MODE);
        if (value != null) config.setLexerMode(parseEnum(LexerMode.class, LEXER_MODE, value));
        value = get(properties, MAX_DEPTH);
        if (value != null) config.setMaxDepth(parseInt(MAX_DEPTH, value));

        EmitterConfig emitter = config.getEmitter();
        value = get(properties, INDENT);
        if (value != null) emitter.setIndent(parseIndent(value));
        value = get(properties, MODULE_FORMAT);
        if (value != null) emitter.setModuleFormat(parseEnum(ModuleFormat.class, MODULE_FORMAT, value));
        value = get(properties, RUNTIME_MODULE);
        if (value != null) emitter.setRuntimeModule(value);
        value = get(properties, EXTRA_RUNTIME_MODULES);
        if (value != null) {
            for (String module : value.split(",")) {
                if (!module.trim().isEmpty()) emitter.addRuntimeModule(module.trim());
            }
        }
        value = get(properties, ASCII_ONLY);
        if (value != null) emitter.setAsciiOnly(parseBoolean(ASCII_ONLY, value));
    }

    private static String get(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value != null ? value.trim() : null;
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "' (expected true or false)");
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    /** 数字表示空格个数，tab 表示制表符 */
    private static String parseIndent(String value) {
        if ("tab".equalsIgnoreCase(value)) return "\t";
        int width = parseInt(INDENT, value);
        if (width < 0 || width > 8) {
            throw new IllegalArgumentException("Invalid value for " + INDENT + ": '" + value + "'");
        }
        StringBuilder indent = new StringBuilder();
        for (int i = 0; i < width; i++) indent.append(' ');
        return indent.toString();
    }
}
