package com.psrlang.compiler;

import com.psrlang.compiler.analysis.AstWalker;
import com.psrlang.compiler.analysis.ParentMap;
import com.psrlang.compiler.analysis.ScopeBuilder;
import com.psrlang.compiler.analysis.SignalCollector;
import com.psrlang.compiler.analysis.SignalInfo;
import com.psrlang.compiler.analysis.SymbolTable;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.decl.ComponentDecl;
import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.detector.ComponentDetector;
import com.psrlang.compiler.detector.DetectionContext;
import com.psrlang.compiler.detector.DetectionReport;
import com.psrlang.compiler.diagnostic.CompilationException;
import com.psrlang.compiler.diagnostic.Diagnostic;
import com.psrlang.compiler.diagnostic.Phase;
import com.psrlang.compiler.emitter.Emitter;
import com.psrlang.compiler.ir.builder.BuildContext;
import com.psrlang.compiler.ir.builder.IrBuilder;
import com.psrlang.compiler.ir.decl.ProgramIR;
import com.psrlang.compiler.lexer.LexError;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.lexer.Token;
import com.psrlang.compiler.parser.ParseError;
import com.psrlang.compiler.parser.ParseResult;
import com.psrlang.compiler.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PSR 编译器门面
 *
 * <p>管线：源码 → Lexer → Parser → 组件检测 → 作用域与信号分析 → IR 构建 → 代码生成。
 * 每个阶段完成后才进入下一阶段，所有状态都在一次 {@link #transform} 调用内创建，
 * 因此同一实例可以在多个线程间共享。</p>
 */
public class PsrCompiler {

    private static final Logger LOG = Logger.getLogger(PsrCompiler.class.getName());

    private final ComponentDetector detector;

    public PsrCompiler() {
        this(new ComponentDetector());
    }

    public PsrCompiler(ComponentDetector detector) {
        this.detector = detector;
    }

    public TransformResult transform(String source) {
        return transform(source, CompilerConfig.defaults());
    }

    /**
     * 转换一个编译单元
     *
     * @param source 源码
     * @param config 配置
     * @return 转换结果；失败时 code 为空串
     */
    public TransformResult transform(String source, CompilerConfig config) {
        long start = System.nanoTime();
        String fileName = config.getFileName();
        List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
        TransformMetrics metrics = config.isDebug() ? new TransformMetrics() : null;
        LOG.fine("Transforming " + fileName);

        try {
            // 词法分析
            long t = System.nanoTime();
            Lexer lexer = new Lexer(source, fileName, config.lexerOptions());
            List<Token> tokens = lexer.scanTokens();
            if (metrics != null) metrics.setLexerTime(millisSince(t));
            if (lexer.hasErrors()) {
                for (LexError error : lexer.getErrors()) {
                    diagnostics.add(Diagnostic.error(error.getMessage(), Phase.LEXER,
                            error.getLine(), error.getColumn()));
                }
                return failure(fileName, diagnostics, metrics, start);
            }

            // 语法分析
            t = System.nanoTime();
            Parser parser = new Parser(tokens, source, fileName).setMaxDepth(config.getMaxDepth());
            Program program;
            if (config.isCollectErrors()) {
                ParseResult parsed = parser.parseTolerant();
                if (parsed.hasErrors()) {
                    for (ParseError error : parsed.getErrors()) {
                        diagnostics.add(error.toDiagnostic());
                    }
                    return failure(fileName, diagnostics, metrics, start);
                }
                program = parsed.getProgram();
            } else {
                program = parser.parse();
            }
            if (metrics != null) metrics.setParserTime(millisSince(t));

            if (!needsTransform(program)) {
                diagnostics.add(Diagnostic.info("No component or JSX found; source passed through unchanged",
                        Phase.PIPELINE));
                return success(source, fileName, diagnostics, metrics, start);
            }

            // 组件检测（可能为函数补上返回类型）
            t = System.nanoTime();
            DetectionContext detection = new DetectionContext(ParentMap.build(program), config.isDebug());
            DetectionReport report = detector.detectAll(program, detection);
            if (metrics != null) metrics.setDetectorTime(millisSince(t));
            for (Diagnostic warning : detection.getWarnings()) {
                diagnostics.add(config.isStrict()
                        ? Diagnostic.error(warning.getMessage(), warning.getPhase(), warning.getLine(),
                        warning.getColumn())
                        : warning);
            }
            if (config.isDebug()) {
                diagnostics.addAll(report.toDiagnostics());
            }
            if (config.isStrict() && !detection.getWarnings().isEmpty()) {
                return failure(fileName, diagnostics, metrics, start);
            }

            // 作用域、信号分析与 IR 构建
            t = System.nanoTime();
            SymbolTable symbols = new ScopeBuilder().build(program);
            SignalInfo signals = new SignalCollector(config.getEmitter().getRuntimeModules())
                    .collect(program, symbols);
            BuildContext context = new BuildContext(source, fileName, symbols, signals, config.getMaxDepth());
            context.setDetection(report);
            ProgramIR ir = new IrBuilder().build(program, context);
            if (metrics != null) metrics.setAnalyzerTime(millisSince(t));

            // 代码生成
            t = System.nanoTime();
            String code = new Emitter(config.getEmitter()).emit(ir);
            if (metrics != null) metrics.setEmitterTime(millisSince(t));

            return success(code, fileName, diagnostics, metrics, start);
        } catch (CompilationException e) {
            LOG.log(Level.WARNING, "Transform of " + fileName + " failed in phase " + e.getPhase()
                    + ": " + e.getMessage());
            diagnostics.add(e.toDiagnostic());
            return failure(fileName, diagnostics, metrics, start);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Unexpected error while transforming " + fileName, e);
            diagnostics.add(Diagnostic.error("Internal compiler error: " + e, Phase.PIPELINE, 0, 0));
            return failure(fileName, diagnostics, metrics, start);
        } catch (StackOverflowError e) {
            LOG.log(Level.SEVERE, "Stack overflow while transforming " + fileName + " (maxDepth="
                    + config.getMaxDepth() + ")", e);
            diagnostics.add(Diagnostic.error("Internal compiler error: nesting too deep for the thread stack",
                    Phase.PIPELINE, 0, 0));
            return failure(fileName, diagnostics, metrics, start);
        }
    }

    /**
     * 含 component 声明或 JSX 的单元才需要转换
     */
    static boolean needsTransform(Program program) {
        final boolean[] found = new boolean[1];
        AstWalker.walk(program, new AstWalker.NodeFilter() {
            @Override
            public boolean enter(AstNode node) {
                if (node instanceof ComponentDecl || AstWalker.isJsx(node)) {
                    found[0] = true;
                }
                return !found[0];
            }
        });
        return found[0];
    }

    private static TransformResult success(String code, String fileName, List<Diagnostic> diagnostics,
                                           TransformMetrics metrics, long start) {
        if (metrics != null) metrics.setTotalTime(millisSince(start));
        LOG.fine("Transformed " + fileName + " in " + millisSince(start) + " ms");
        return new TransformResult(code, diagnostics, metrics);
    }

    private static TransformResult failure(String fileName, List<Diagnostic> diagnostics,
                                           TransformMetrics metrics, long start) {
        if (metrics != null) metrics.setTotalTime(millisSince(start));
        LOG.fine("Transform of " + fileName + " produced " + diagnostics.size() + " diagnostic(s)");
        return new TransformResult("", diagnostics, metrics);
    }

    private static long millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1000000L;
    }
}
