package com.crowelang.cli;

import com.crowelang.compiler.compiler.CroweCompiler;
import com.crowelang.compiler.compiler.ParseOutcome;
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
 * picocli check 子命令：只报告诊断，不生成代码
 */
@Command(name = "check", description = "Report diagnostics for a CroweLang file without generating code")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Source file")
    Path file;

    @Option(names = "--json", description = "Print diagnostics as JSON")
    boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        String source;
        try {
            source = SourceFiles.read(file);
        } catch (NoSuchFileException e) {
            spec.commandLine().getErr().println("Error: file not found: " + file);
            return 1;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        ParseOutcome outcome = new CroweCompiler().parseWithDiagnostics(source, file.getFileName().toString());
        if (json) {
            out.println(Diagnostics.toJson(outcome.getErrors(), outcome.getWarnings()));
        } else {
            out.println(Diagnostics.format(outcome.getErrors(), outcome.getWarnings(), source));
        }
        return outcome.hasErrors() ? 1 : 0;
    }
}
