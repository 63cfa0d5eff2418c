package com.crowelang.compiler.diagnostic;

/**
 * 诊断严重级别
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String display;

    Severity(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
