package com.crowelang.compiler.diagnostic;

/**
 * 诊断来源分类
 */
public enum DiagnosticKind {
    /** 无法识别的字符序列 */
    LEXICAL("LEX_ERROR"),
    /** 违反语法 */
    PARSE("PARSE_ERROR"),
    /** 非致命的语义建议 */
    SEMANTIC("SEMANTIC_WARNING"),
    /** 管道内部缺陷 */
    INTERNAL("INTERNAL_ERROR");

    private final String defaultCode;

    DiagnosticKind(String defaultCode) {
        this.defaultCode = defaultCode;
    }

    public String getDefaultCode() {
        return defaultCode;
    }
}
