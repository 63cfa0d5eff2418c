package com.crowelang.compiler.diagnostic;

import com.google.gson.JsonObject;

/**
 * 单条诊断信息（错误或警告）
 *
 * <p>格式化输出示例：</p>
 * <pre>
 * error[PARSE_ERROR]: Expected ';' after trading action (found '}')
 *   --> momentum.crowe:4:21
 *    |
 *  4 |         buy(100) }
 *    |                  ^
 * </pre>
 */
public final class Diagnostic {
    private final DiagnosticKind kind;
    private final Severity severity;
    private final String message;
    private final String file;
    private final int line;
    private final int column;
    private final String code;
    private final String expected;  // 可选：期望的 token

    public Diagnostic(DiagnosticKind kind, Severity severity, String message,
                      String file, int line, int column, String code, String expected) {
        this.kind = kind;
        this.severity = severity;
        this.message = message;
        this.file = file;
        this.line = line;
        this.column = column;
        this.code = code != null ? code : kind.getDefaultCode();
        this.expected = expected;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getCode() {
        return code;
    }

    public String getExpected() {
        return expected;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * 渲染为：消息 + file:line:column + 源码摘录 + 列位置插入符
     *
     * @param source 源码（可为 null，此时不输出摘录）
     */
    public String format(String source) {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.display()).append('[').append(code).append("]: ").append(message).append('\n');
        sb.append("  --> ").append(file).append(':').append(line).append(':').append(column).append('\n');

        String lineText = sourceLine(source, line);
        if (lineText == null) {
            return sb.toString();
        }

        String lineNum = String.valueOf(line);
        String gutter = repeat(' ', lineNum.length());
        sb.append(gutter).append(" |\n");
        sb.append(lineNum).append(" | ").append(lineText).append('\n');
        sb.append(gutter).append(" | ").append(caretPadding(lineText, column)).append("^\n");
        return sb.toString();
    }

    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", kind.name());
        obj.addProperty("severity", severity.display());
        obj.addProperty("code", code);
        obj.addProperty("message", message);
        obj.addProperty("file", file);
        obj.addProperty("line", line);
        obj.addProperty("column", column);
        if (expected != null) {
            obj.addProperty("expected", expected);
        }
        return obj;
    }

    /**
     * {@link #toJson()} 的逆操作；字段缺失或取值非法时抛出 {@link IllegalArgumentException}
     */
    public static Diagnostic fromJson(JsonObject obj) {
        if (!obj.has("kind") || !obj.has("message") || !obj.has("line") || !obj.has("column")) {
            throw new IllegalArgumentException("Incomplete diagnostic entry: " + obj);
        }
        DiagnosticKind kind = DiagnosticKind.valueOf(obj.get("kind").getAsString());
        Severity severity = "error".equals(obj.has("severity") ? obj.get("severity").getAsString() : null)
                ? Severity.ERROR : Severity.WARNING;
        return new Diagnostic(kind, severity,
                obj.get("message").getAsString(),
                obj.has("file") ? obj.get("file").getAsString() : null,
                obj.get("line").getAsInt(),
                obj.get("column").getAsInt(),
                obj.has("code") ? obj.get("code").getAsString() : null,
                obj.has("expected") ? obj.get("expected").getAsString() : null);
    }

    /** 取第 line 行（1 起始），越界返回 null */
    static String sourceLine(String source, int line) {
        if (source == null || line < 1) {
            return null;
        }
        int current = 1;
        int start = 0;
        while (current < line) {
            int nl = source.indexOf('\n', start);
            if (nl < 0) {
                return null;
            }
            start = nl + 1;
            current++;
        }
        int end = source.indexOf('\n', start);
        String text = end < 0 ? source.substring(start) : source.substring(start, end);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    /** 插入符前的填充：保留制表符以对齐列 */
    private static String caretPadding(String lineText, int column) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < column - 1; i++) {
            sb.append(i < lineText.length() && lineText.charAt(i) == '\t' ? '\t' : ' ');
        }
        return sb.toString();
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d: %s: %s", file, line, column, severity.display(), message);
    }
}
