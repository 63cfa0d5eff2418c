package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * rules { when (...) { ... } ... }
 */
public class RulesBlock extends AstNode {
    private final List<TradingRule> rules;

    public RulesBlock(SourceSpan span, List<TradingRule> rules) {
        super(span);
        this.rules = immutable(rules);
    }

    public List<TradingRule> getRules() {
        return rules;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRulesBlock(this, context);
    }
}
