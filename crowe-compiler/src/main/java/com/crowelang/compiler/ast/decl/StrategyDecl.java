package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 策略声明
 *
 * <p>各子块均可缺省（为 null）；源码中重复出现的同类子块在降级时按顺序合并。</p>
 */
public class StrategyDecl extends Declaration {
    private final ParamsBlock params;
    private final IndicatorsBlock indicators;
    private final SignalsBlock signals;
    private final RulesBlock rules;
    private final RiskBlock risk;
    private final EventHandlersBlock eventHandlers;

    public StrategyDecl(SourceSpan span, String name, ParamsBlock params,
                        IndicatorsBlock indicators, SignalsBlock signals, RulesBlock rules,
                        RiskBlock risk, EventHandlersBlock eventHandlers) {
        super(span, name);
        this.params = params;
        this.indicators = indicators;
        this.signals = signals;
        this.rules = rules;
        this.risk = risk;
        this.eventHandlers = eventHandlers;
    }

    public ParamsBlock getParams() {
        return params;
    }

    public IndicatorsBlock getIndicators() {
        return indicators;
    }

    public SignalsBlock getSignals() {
        return signals;
    }

    public RulesBlock getRules() {
        return rules;
    }

    public RiskBlock getRisk() {
        return risk;
    }

    public EventHandlersBlock getEventHandlers() {
        return eventHandlers;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStrategyDecl(this, context);
    }
}
