package com.crowelang.compiler.codegen;

/**
 * 代码生成结果：目标代码与可选的 Source Map JSON
 */
public final class GeneratedCode {
    private final String code;
    private final String sourceMap;

    public GeneratedCode(String code, String sourceMap) {
        this.code = code;
        this.sourceMap = sourceMap;
    }

    public String getCode() {
        return code;
    }

    /** 未开启 Source Map 时为 null */
    public String getSourceMap() {
        return sourceMap;
    }
}
