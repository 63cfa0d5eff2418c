package com.crowelang.compiler.diagnostic;

import com.crowelang.compiler.ast.SourceSpan;

/**
 * 编译管道内部错误：后续阶段收到了违反既定不变量的输入。
 *
 * <p>总是意味着编译器缺陷而不是用户输入错误，因此直接中止本次调用。</p>
 */
public class InternalCompilerError extends RuntimeException {
    private final SourceSpan span;

    public InternalCompilerError(String message) {
        this(message, (SourceSpan) null);
    }

    public InternalCompilerError(String message, SourceSpan span) {
        super(message);
        this.span = span;
    }

    public InternalCompilerError(String message, Throwable cause) {
        super(message, cause);
        this.span = null;
    }

    /** 出错位置，可能为 null */
    public SourceSpan getSpan() {
        return span;
    }

    /**
     * 转换为诊断条目，供调用方统一输出
     */
    public Diagnostic toDiagnostic(String fileName) {
        int line = span != null ? span.getLine() : 1;
        int column = span != null ? span.getColumn() : 1;
        return new Diagnostic(DiagnosticKind.INTERNAL, Severity.ERROR, getMessage(),
                fileName, line, column, DiagnosticKind.INTERNAL.getDefaultCode(), null);
    }
}
