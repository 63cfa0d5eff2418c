package com.crowelang.compiler.diagnostic;

/**
 * 语法分析错误恢复状态。
 *
 * <pre>
 * NORMAL --(token 不匹配)--> RECOVERING --(到达同步 token)--> NORMAL
 * </pre>
 *
 * <p>RECOVERING 期间产生的后续错误不再重复报告。</p>
 */
public enum RecoveryState {
    NORMAL,
    RECOVERING
}
