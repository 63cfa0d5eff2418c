package com.crowelang.compiler.compiler;

import com.crowelang.compiler.analysis.SemanticChecker;
import com.crowelang.compiler.ast.decl.Program;
import com.crowelang.compiler.codegen.CodeGenerator;
import com.crowelang.compiler.codegen.GeneratedCode;
import com.crowelang.compiler.diagnostic.Diagnostics;
import com.crowelang.compiler.diagnostic.InternalCompilerError;
import com.crowelang.compiler.lexer.Lexer;
import com.crowelang.compiler.lexer.Token;
import com.crowelang.compiler.lowering.AstBuilder;
import com.crowelang.compiler.parser.CstNode;
import com.crowelang.compiler.parser.Parser;

import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CroweLang 编译器入口
 *
 * <p>管道：Lexer → Parser → AstBuilder → SemanticChecker → CodeGenerator。
 * 词法或语法错误会跳过代码生成，此时结果中的代码为空字符串。</p>
 *
 * <p>构造后不可变，可被多个线程同时使用；每次调用都创建独立的各阶段实例。</p>
 */
public class CroweCompiler {
    private static final Logger LOGGER = Logger.getLogger(CroweCompiler.class.getName());

    private final CompileOptions options;
    private final CompilationCache cache;
    private final CompileStats stats = new CompileStats();

    public CroweCompiler() {
        this(new CompileOptions());
    }

    public CroweCompiler(CompileOptions options) {
        this.options = options.copy();
        this.cache = this.options.isUseCache()
                ? new CompilationCache(this.options.getCacheDirectory(), CompilationCache.DEFAULT_MAXIMUM_SIZE)
                : null;
    }

    /**
     * 编译源码
     *
     * @param source   CroweLang 源码
     * @param fileName 文件名（用于诊断与 Source Map）
     * @throws InternalCompilerError 编译器内部缺陷
     */
    public CompileResult compile(String source, String fileName) {
        Supplier<CompileResult> pipeline = () -> runPipeline(source, fileName);
        if (cache == null) {
            return pipeline.get();
        }
        String key = CompilationCache.key(options.fingerprint() + ";file=" + fileName, source);
        return cache.get(key, pipeline, stats);
    }

    /**
     * 只做词法、语法与语义检查，不生成代码
     */
    public ParseOutcome parseWithDiagnostics(String source, String fileName) {
        Diagnostics diagnostics = new Diagnostics(fileName);
        Program ast = analyze(source, fileName, diagnostics);
        return new ParseOutcome(ast, diagnostics.getErrors(), diagnostics.getWarnings());
    }

    public CompileOptions getOptions() {
        return options.copy();
    }

    public CompileStats getStats() {
        return stats;
    }

    private CompileResult runPipeline(String source, String fileName) {
        long start = System.nanoTime();
        Diagnostics diagnostics = new Diagnostics(fileName);
        Program ast = analyze(source, fileName, diagnostics);

        if (diagnostics.hasErrors() || ast == null) {
            LOGGER.fine("Compilation of " + fileName + " stopped with "
                    + diagnostics.getErrors().size() + " error(s)");
            return new CompileResult("", null, diagnostics.getErrors(), diagnostics.getWarnings(), ast, false);
        }

        long t = System.nanoTime();
        GeneratedCode generated = new CodeGenerator(options).generate(ast, fileName, source);
        stats.recordGenerate();
        logStage("generate", fileName, t);
        logStage("compile", fileName, start);
        return new CompileResult(generated.getCode(), generated.getSourceMap(),
                diagnostics.getErrors(), diagnostics.getWarnings(), ast, false);
    }

    /**
     * 词法 → 语法 → AST → 语义检查。存在语法错误时 AST 为尽力构建的结果，可能为 null。
     */
    private Program analyze(String source, String fileName, Diagnostics diagnostics) {
        long t = System.nanoTime();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        stats.recordLex();
        logStage("lex", fileName, t);

        t = System.nanoTime();
        CstNode cst = new Parser(tokens, diagnostics, options.getMaxNestingDepth()).parseProgram();
        stats.recordParse();
        logStage("parse", fileName, t);

        t = System.nanoTime();
        Program ast;
        try {
            ast = new AstBuilder(fileName).build(cst);
        } catch (InternalCompilerError e) {
            if (!diagnostics.hasErrors()) {
                throw e;
            }
            // 语法错误已报告，部分 CST 无法降级时放弃 AST
            LOGGER.log(Level.FINE, "No AST for " + fileName + " after syntax errors", e);
            return null;
        }
        stats.recordLower();
        logStage("lower", fileName, t);

        new SemanticChecker(diagnostics).check(ast);
        return ast;
    }

    private static void logStage(String stage, String fileName, long startNanos) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("%s %s: %.2f ms", stage, fileName, (System.nanoTime() - startNanos) / 1e6));
        }
    }
}
