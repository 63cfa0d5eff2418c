package com.crowelang.compiler.codegen;

/**
 * 代码生成优化级别，每一级包含前一级的全部行为
 */
public enum OptimizationLevel {
    /** 按源码原样输出 */
    NONE,
    /** 省略未被引用的行情/持仓/组合绑定 */
    BASIC,
    /** 折叠数值字面量常量运算，删除条件恒为 false 的规则 */
    AGGRESSIVE;

    public boolean atLeast(OptimizationLevel other) {
        return compareTo(other) >= 0;
    }
}
