package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 交易规则 when (condition) { actions }
 */
public class TradingRule extends AstNode {
    private final Expression condition;
    private final List<TradingAction> actions;

    public TradingRule(SourceSpan span, Expression condition, List<TradingAction> actions) {
        super(span);
        this.condition = condition;
        this.actions = immutable(actions);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<TradingAction> getActions() {
        return actions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTradingRule(this, context);
    }
}
