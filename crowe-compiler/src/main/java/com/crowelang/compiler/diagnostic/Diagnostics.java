package com.crowelang.compiler.diagnostic;

import com.crowelang.compiler.lexer.Token;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 诊断收集器
 *
 * <p>贯穿词法、语法、降级和语义检查各阶段，按报告顺序累积错误与警告。
 * 每次编译调用使用一个新实例（或先 {@link #clear()}）。</p>
 */
public final class Diagnostics {
    private final String fileName;
    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    // ============ 报告 ============

    public void lexicalError(String message, int line, int column) {
        add(new Diagnostic(DiagnosticKind.LEXICAL, Severity.ERROR, message,
                fileName, line, column, null, null));
    }

    public void parseError(String message, Token token, String expected) {
        int line = token != null ? token.getLine() : 1;
        int column = token != null ? token.getColumn() : 1;
        add(new Diagnostic(DiagnosticKind.PARSE, Severity.ERROR, message,
                fileName, line, column, null, expected));
    }

    public void warning(String code, String message, int line, int column) {
        add(new Diagnostic(DiagnosticKind.SEMANTIC, Severity.WARNING, message,
                fileName, line, column, code, null));
    }

    public void add(Diagnostic diagnostic) {
        entries.add(diagnostic);
    }

    public void addAll(List<Diagnostic> diagnostics) {
        entries.addAll(diagnostics);
    }

    // ============ 查询 ============

    public boolean hasErrors() {
        for (Diagnostic d : entries) {
            if (d.isError()) return true;
        }
        return false;
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (d.isError()) result.add(d);
        }
        return Collections.unmodifiableList(result);
    }

    public List<Diagnostic> getWarnings() {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (!d.isError()) result.add(d);
        }
        return Collections.unmodifiableList(result);
    }

    public List<Diagnostic> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public int errorCount(DiagnosticKind kind) {
        int count = 0;
        for (Diagnostic d : entries) {
            if (d.isError() && d.getKind() == kind) count++;
        }
        return count;
    }

    public void clear() {
        entries.clear();
    }

    // ============ 输出 ============

    /**
     * 生成完整报告：先错误后警告，最后一行汇总
     */
    public String format(String source) {
        return format(getErrors(), getWarnings(), source);
    }

    public static String format(List<Diagnostic> errors, List<Diagnostic> warnings, String source) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : errors) {
            sb.append(d.format(source)).append('\n');
        }
        for (Diagnostic d : warnings) {
            sb.append(d.format(source)).append('\n');
        }
        sb.append("Found ").append(errors.size()).append(" error(s), ")
          .append(warnings.size()).append(" warning(s)");
        return sb.toString();
    }

    /**
     * JSON 形式：{"errors": [...], "warnings": [...]}
     */
    public String toJson() {
        return toJson(getErrors(), getWarnings());
    }

    public static String toJson(List<Diagnostic> errors, List<Diagnostic> warnings) {
        JsonObject root = new JsonObject();
        JsonArray errorArray = new JsonArray();
        for (Diagnostic d : errors) {
            errorArray.add(d.toJson());
        }
        JsonArray warningArray = new JsonArray();
        for (Diagnostic d : warnings) {
            warningArray.add(d.toJson());
        }
        root.add("errors", errorArray);
        root.add("warnings", warningArray);
        return new GsonBuilder().setPrettyPrinting().create().toJson(root);
    }
}
