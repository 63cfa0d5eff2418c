package com.crowelang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CroweLang CLI 入口点（picocli）
 */
@Command(name = "crowe", version = "CroweLang v0.1.0",
         mixinStandardHelpOptions = true,
         description = "CroweLang trading strategy compiler",
         subcommands = {CompileCommand.class, CheckCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Log pipeline stage timings and cache activity")
    void setVerbose(boolean verbose) {
        if (verbose) {
            enableVerboseLogging();
        }
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (compile or check)");
    }

    /** 根日志级别降到 FINE，使各阶段耗时与缓存命中可见 */
    static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }
}
