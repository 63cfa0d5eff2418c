package com.crowelang.compiler.compiler;

import com.crowelang.compiler.codegen.OptimizationLevel;
import com.crowelang.compiler.codegen.TargetDialect;
import com.crowelang.compiler.parser.Parser;

import java.nio.file.Path;

/**
 * 编译选项
 */
public class CompileOptions {
    public static final String DEFAULT_RUNTIME_MODULE = "@crowelang/runtime";

    private TargetDialect target = TargetDialect.TYPESCRIPT;
    private boolean runtimeTypeChecks = false;
    private OptimizationLevel optimization = OptimizationLevel.BASIC;
    private boolean sourceMap = false;
    private boolean useCache = true;
    private Path cacheDirectory;
    private int maxNestingDepth = Parser.DEFAULT_MAX_NESTING_DEPTH;
    private String runtimeModule = DEFAULT_RUNTIME_MODULE;

    public CompileOptions() {
    }

    public TargetDialect getTarget() {
        return target;
    }

    public CompileOptions setTarget(TargetDialect target) {
        this.target = target;
        return this;
    }

    public boolean isRuntimeTypeChecks() {
        return runtimeTypeChecks;
    }

    public CompileOptions setRuntimeTypeChecks(boolean runtimeTypeChecks) {
        this.runtimeTypeChecks = runtimeTypeChecks;
        return this;
    }

    public OptimizationLevel getOptimization() {
        return optimization;
    }

    public CompileOptions setOptimization(OptimizationLevel optimization) {
        this.optimization = optimization;
        return this;
    }

    public boolean isSourceMap() {
        return sourceMap;
    }

    public CompileOptions setSourceMap(boolean sourceMap) {
        this.sourceMap = sourceMap;
        return this;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public CompileOptions setUseCache(boolean useCache) {
        this.useCache = useCache;
        return this;
    }

    /** 磁盘缓存目录，null 表示只使用内存缓存 */
    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    public CompileOptions setCacheDirectory(Path cacheDirectory) {
        this.cacheDirectory = cacheDirectory;
        return this;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public CompileOptions setMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
        return this;
    }

    public String getRuntimeModule() {
        return runtimeModule;
    }

    public CompileOptions setRuntimeModule(String runtimeModule) {
        if (runtimeModule == null || runtimeModule.isEmpty()) {
            throw new IllegalArgumentException("runtimeModule must not be empty");
        }
        this.runtimeModule = runtimeModule;
        return this;
    }

    /**
     * 影响编译输出的选项指纹，用作缓存键的一部分（缓存相关选项不参与）
     */
    public String fingerprint() {
        return "target=" + target
                + ";typeChecks=" + runtimeTypeChecks
                + ";opt=" + optimization
                + ";sourceMap=" + sourceMap
                + ";depth=" + maxNestingDepth
                + ";runtime=" + runtimeModule;
    }

    public CompileOptions copy() {
        CompileOptions c = new CompileOptions();
        c.target = target;
        c.runtimeTypeChecks = runtimeTypeChecks;
        c.optimization = optimization;
        c.sourceMap = sourceMap;
        c.useCache = useCache;
        c.cacheDirectory = cacheDirectory;
        c.maxNestingDepth = maxNestingDepth;
        c.runtimeModule = runtimeModule;
        return c;
    }
}
