package com.crowelang.compiler.codegen;

import com.crowelang.compiler.ast.decl.Binding;
import com.crowelang.compiler.ast.decl.StrategyDecl;
import com.crowelang.compiler.ast.decl.StrategyParam;

import java.util.*;

/**
 * 代码生成上下文：当前输出缓冲区、名称解析作用域与导入收集
 */
final class EmitContext {

    /** onBar 中从 bar 解构出的行情字段 */
    static final List<String> OHLCV = Collections.unmodifiableList(
            Arrays.asList("open", "high", "low", "close", "volume"));

    CodeWriter out;
    final String fileName;

    // 导入收集（有序，保证输出确定）
    final Set<String> runtimeTypes = new TreeSet<>();
    final Set<String> indicatorFunctions = new TreeSet<>();
    final Set<String> programIndicators = new HashSet<>();
    final Set<String> declaredTypes = new HashSet<>();

    // 当前策略
    StrategyDecl strategy;
    final Set<String> params = new HashSet<>();
    final Set<String> indicators = new HashSet<>();
    final Set<String> signals = new HashSet<>();
    final Map<String, String> riskConstants = new LinkedHashMap<>();
    boolean inRiskLimits;

    // onBar 状态
    boolean inOnBar;
    String barName = "bar";
    final Set<String> usedBarBindings = new HashSet<>();
    String symbolExpr;

    // data / portfolio / microstructure 字段所属的接收者
    String memberReceiver;
    final Set<String> memberNames = new HashSet<>();

    boolean sawAwait;

    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    EmitContext(CodeWriter out, String fileName) {
        this.out = out;
        this.fileName = fileName;
    }

    // ============ 作用域 ============

    void pushScope() {
        scopes.push(new HashSet<>());
    }

    void popScope() {
        scopes.pop();
    }

    void declareLocal(String name) {
        if (scopes.isEmpty()) {
            pushScope();
        }
        scopes.peek().add(name);
    }

    boolean isLocal(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) {
                return true;
            }
        }
        return false;
    }

    // ============ 策略 ============

    void enterStrategy(StrategyDecl node) {
        strategy = node;
        if (node.getParams() != null) {
            for (StrategyParam p : node.getParams().getParams()) {
                params.add(p.getName());
            }
        }
        if (node.getIndicators() != null) {
            for (Binding b : node.getIndicators().getBindings()) {
                indicators.add(b.getName());
            }
        }
        if (node.getSignals() != null) {
            for (Binding b : node.getSignals().getBindings()) {
                signals.add(b.getName());
            }
        }
    }

    void exitStrategy() {
        strategy = null;
        params.clear();
        indicators.clear();
        signals.clear();
        riskConstants.clear();
        scopes.clear();
        inOnBar = false;
        usedBarBindings.clear();
        symbolExpr = null;
    }

    void enterMembers(String receiver, Collection<String> names) {
        memberReceiver = receiver;
        memberNames.addAll(names);
    }

    void exitMembers() {
        memberReceiver = null;
        memberNames.clear();
        scopes.clear();
    }

    // ============ 子缓冲区 ============

    /**
     * 切换到子缓冲区，返回之前的缓冲区供 {@link #endFork(CodeWriter)} 恢复
     */
    CodeWriter beginFork() {
        CodeWriter previous = out;
        out = previous.fork();
        return previous;
    }

    CodeWriter endFork(CodeWriter previous) {
        CodeWriter forked = out;
        out = previous;
        return forked;
    }
}
