package com.crowelang.compiler.analysis;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.decl.*;
import com.crowelang.compiler.diagnostic.Diagnostics;

import java.util.HashMap;
import java.util.Map;

/**
 * 语义建议检查：只产生警告，从不阻止代码生成。
 */
public final class SemanticChecker {

    public static final String NO_RULES = "NO_RULES";
    public static final String NO_RISK_MGMT = "NO_RISK_MGMT";
    public static final String DUPLICATE_NAME = "DUPLICATE_NAME";

    private final Diagnostics diagnostics;

    public SemanticChecker(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public void check(Program program) {
        Map<String, Declaration> topLevel = new HashMap<>();
        for (Declaration decl : program.getDeclarations()) {
            if (decl instanceof ImportDecl) continue;
            checkRedefinition(topLevel, decl.getName(), decl, "Declaration");
        }
        for (StrategyDecl strategy : program.getStrategies()) {
            checkStrategy(strategy);
        }
    }

    /** 单个策略：规则、风控与命名冲突 */
    public void checkStrategy(StrategyDecl strategy) {
        RulesBlock rules = strategy.getRules();
        if (rules == null || rules.getRules().isEmpty()) {
            addWarning(NO_RULES, "Strategy '" + strategy.getName() + "' has no trading rules defined", strategy);
        }
        RiskBlock risk = strategy.getRisk();
        if (risk == null || risk.size() == 0) {
            addWarning(NO_RISK_MGMT, "Strategy '" + strategy.getName() + "' has no risk management defined", strategy);
        }

        // params / indicators / signals 共享同一命名空间
        Map<String, AstNode> names = new HashMap<>();
        if (strategy.getParams() != null) {
            for (StrategyParam p : strategy.getParams().getParams()) {
                checkRedefinition(names, p.getName(), p, "Parameter");
            }
        }
        if (strategy.getIndicators() != null) {
            for (Binding b : strategy.getIndicators().getBindings()) {
                checkRedefinition(names, b.getName(), b, "Indicator");
            }
        }
        if (strategy.getSignals() != null) {
            for (Binding b : strategy.getSignals().getBindings()) {
                checkRedefinition(names, b.getName(), b, "Signal");
            }
        }
    }

    private <T extends AstNode> void checkRedefinition(Map<String, T> seen, String name, T node, String what) {
        T existing = seen.get(name);
        if (existing == null) {
            seen.put(name, node);
            return;
        }
        addWarning(DUPLICATE_NAME, what + " '" + name + "' is already defined (first defined at line "
                + existing.getSpan().getLine() + ")", node);
    }

    private void addWarning(String code, String message, AstNode node) {
        SourceSpan span = node != null ? node.getSpan() : SourceSpan.UNKNOWN;
        diagnostics.warning(code, message, span.getLine(), span.getColumn());
    }
}
