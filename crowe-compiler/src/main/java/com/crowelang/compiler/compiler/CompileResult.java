package com.crowelang.compiler.compiler;

import com.crowelang.compiler.ast.decl.Program;
import com.crowelang.compiler.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次编译的结果
 *
 * <p>存在错误时 {@code code} 为空字符串。从磁盘缓存恢复的结果不携带 AST。</p>
 */
public final class CompileResult {
    private final String code;
    private final String sourceMap;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;
    private final Program ast;
    private final boolean fromCache;

    public CompileResult(String code, String sourceMap, List<Diagnostic> errors,
                         List<Diagnostic> warnings, Program ast, boolean fromCache) {
        this.code = code;
        this.sourceMap = sourceMap;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.ast = ast;
        this.fromCache = fromCache;
    }

    public String getCode() {
        return code;
    }

    /** Source Map v3 JSON；未开启或编译失败时为 null */
    public String getSourceMap() {
        return sourceMap;
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    public Program getAst() {
        return ast;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /** 标记为缓存命中的副本 */
    CompileResult asCached() {
        return fromCache ? this : new CompileResult(code, sourceMap, errors, warnings, ast, true);
    }
}
