package com.crowelang.cli;

import com.crowelang.compiler.codegen.CodeGenerator;
import com.crowelang.compiler.codegen.OptimizationLevel;
import com.crowelang.compiler.codegen.TargetDialect;
import com.crowelang.compiler.compiler.CompileOptions;
import com.crowelang.compiler.compiler.CompileResult;
import com.crowelang.compiler.compiler.CroweCompiler;
import com.crowelang.compiler.diagnostic.Diagnostics;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli compile 子命令：编译为 TypeScript / JavaScript
 */
@Command(name = "compile", description = "Compile a CroweLang file to TypeScript or JavaScript")
public class CompileCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Source file")
    Path file;

    @Option(names = {"-o", "--output"}, description = "Output file (default: next to the source)")
    Path output;

    @Option(names = "--target", defaultValue = "TYPESCRIPT",
            description = "Target dialect: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    TargetDialect target;

    @Option(names = "--source-map", description = "Write a v3 source map next to the output")
    boolean sourceMap;

    @Option(names = {"-O", "--optimize"}, defaultValue = "BASIC",
            description = "Optimization level: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    OptimizationLevel optimization;

    @Option(names = "--type-checks", description = "Emit runtime type checks for strategy parameters")
    boolean typeChecks;

    @Option(names = "--no-cache", description = "Disable the compilation cache")
    boolean noCache;

    @Option(names = "--cache-dir", description = "Directory for the on-disk compilation cache")
    Path cacheDir;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        try {
            source = SourceFiles.read(file);
        } catch (NoSuchFileException e) {
            err.println("Error: file not found: " + file);
            return 1;
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        CompileOptions options = new CompileOptions()
                .setTarget(target)
                .setSourceMap(sourceMap)
                .setOptimization(optimization)
                .setRuntimeTypeChecks(typeChecks)
                .setUseCache(!noCache)
                .setCacheDirectory(cacheDir);
        String fileName = file.getFileName().toString();
        CompileResult result = new CroweCompiler(options).compile(source, fileName);

        if (!result.getErrors().isEmpty() || !result.getWarnings().isEmpty()) {
            err.println(Diagnostics.format(result.getErrors(), result.getWarnings(), source));
        }
        if (!result.isSuccess()) {
            return 1;
        }

        Path destination = output != null ? output : resolveOutput();
        try {
            SourceFiles.write(destination, result.getCode());
            if (result.getSourceMap() != null) {
                SourceFiles.write(destination.resolveSibling(destination.getFileName() + ".map"), result.getSourceMap());
            }
        } catch (IOException e) {
            err.println("Error: cannot write " + destination + ": " + e.getMessage());
            return 1;
        }
        out.println("Compiled " + file + " -> " + destination);
        return 0;
    }

    private Path resolveOutput() {
        return file.resolveSibling(CodeGenerator.outputFileName(file.getFileName().toString(), target));
    }
}
