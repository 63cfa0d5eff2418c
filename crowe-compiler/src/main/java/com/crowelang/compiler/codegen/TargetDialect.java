package com.crowelang.compiler.codegen;

/**
 * 代码生成目标方言
 */
public enum TargetDialect {
    TYPESCRIPT(".ts"),
    JAVASCRIPT(".js");

    private final String extension;

    TargetDialect(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /** 是否输出类型注解、接口与类型导入 */
    public boolean hasTypes() {
        return this == TYPESCRIPT;
    }
}
