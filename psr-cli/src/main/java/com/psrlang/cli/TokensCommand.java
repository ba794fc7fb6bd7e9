package com.psrlang.cli;

import com.psrlang.compiler.lexer.LexError;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.lexer.LexerException;
import com.psrlang.compiler.lexer.LexerMode;
import com.psrlang.compiler.lexer.LexerOptions;
import com.psrlang.compiler.lexer.Token;
import com.psrlang.compiler.lexer.TokenType;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli tokens 子命令：打印词法分析结果
 */
@Command(name = "tokens", description = "Print the token stream of a source file")
public class TokensCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "Source file")
    Path file;

    @Option(names = "--lexer-mode", paramLabel = "MODE", defaultValue = "STRICT",
            description = "Lexer error mode: ${COMPLETION-CANDIDATES}")
    LexerMode lexerMode;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("error: cannot read " + file + ": " + e.getMessage());
            return Main.EXIT_USAGE_ERROR;
        }

        Lexer lexer = new Lexer(source, file.getFileName().toString(), LexerOptions.defaults().setMode(lexerMode));
        List<Token> tokens;
        try {
            tokens = lexer.scanTokens();
        } catch (LexerException e) {
            err.println(file + ": " + e.getMessage());
            return Main.EXIT_COMPILE_ERROR;
        }
        for (Token token : tokens) {
            if (token.is(TokenType.EOF)) break;
            out.println(token.getLine() + ":" + token.getColumn() + " " + token.getType() + " '"
                    + token.getLexeme() + "'");
        }
        for (LexError error : lexer.getErrors()) {
            err.println(file + ":" + error.getLine() + ":" + error.getColumn() + ": error [lexer] "
                    + error.getMessage());
        }
        out.flush();
        err.flush();
        return lexer.hasErrors() ? Main.EXIT_COMPILE_ERROR : 0;
    }
}
