package com.crowelang.compiler.codegen;

import com.crowelang.compiler.ast.SourceSpan;

/**
 * 代码输出缓冲区，跟踪缩进层级与当前生成位置（0 基行列）
 */
public class CodeWriter {
    private static final String INDENT_UNIT = "  ";

    private final StringBuilder output = new StringBuilder();
    private final SourceMapBuilder sourceMap;
    private int indentLevel;
    private boolean atLineStart = true;
    private int line;
    private int column;

    public CodeWriter(SourceMapBuilder sourceMap) {
        this(sourceMap, 0);
    }

    private CodeWriter(SourceMapBuilder sourceMap, int indentLevel) {
        this.sourceMap = sourceMap;
        this.indentLevel = indentLevel;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）；文本中不应包含换行
     */
    public CodeWriter append(String text) {
        if (text == null || text.isEmpty()) return this;
        writeIndentIfNeeded();
        output.append(text);
        column += text.length();
        return this;
    }

    public CodeWriter newLine() {
        output.append('\n');
        line++;
        column = 0;
        atLineStart = true;
        return this;
    }

    /** 追加一整行 */
    public CodeWriter line(String text) {
        return append(text).newLine();
    }

    /**
     * 追加空行，避免连续多个空行
     */
    public void blankLine() {
        if (output.length() == 0) {
            return;
        }
        int len = output.length();
        if (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n') {
            return;
        }
        if (output.charAt(len - 1) != '\n') {
            newLine();
        }
        newLine();
    }

    /**
     * 在当前位置（缩进之后）记录一条到源位置的映射
     */
    public void mark(SourceSpan span) {
        if (sourceMap == null || span == null) return;
        int col = atLineStart ? column + indentLevel * INDENT_UNIT.length() : column;
        sourceMap.addMapping(line, col, span.getLine(), span.getColumn());
    }

    /**
     * 创建一个同缩进层级的子缓冲区；稍后可用 {@link #include(CodeWriter)} 并入
     */
    public CodeWriter fork() {
        return new CodeWriter(sourceMap != null ? new SourceMapBuilder() : null, indentLevel);
    }

    /**
     * 并入子缓冲区的文本与映射
     */
    public void include(CodeWriter nested) {
        if (nested.output.length() == 0) return;
        if (sourceMap != null && nested.sourceMap != null) {
            sourceMap.appendShifted(nested.sourceMap, line, column);
        }
        output.append(nested.output);
        if (nested.line == 0) {
            column += nested.column;
        } else {
            column = nested.column;
        }
        line += nested.line;
        atLineStart = nested.atLineStart;
    }

    public boolean isEmpty() {
        return output.length() == 0;
    }

    public String getOutput() {
        return output.toString();
    }

    private void writeIndentIfNeeded() {
        if (!atLineStart) return;
        for (int i = 0; i < indentLevel; i++) {
            output.append(INDENT_UNIT);
        }
        column += indentLevel * INDENT_UNIT.length();
        atLineStart = false;
    }
}
