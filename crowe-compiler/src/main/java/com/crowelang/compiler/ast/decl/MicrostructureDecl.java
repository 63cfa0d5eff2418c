package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 市场微观结构声明：字段、检测项、报价参数与对冲规则
 */
public class MicrostructureDecl extends Declaration {
    private final List<DataField> fields;
    private final List<Binding> detections;
    private final List<Binding> quotes;
    private final List<HedgingRule> hedgingRules;

    public MicrostructureDecl(SourceSpan span, String name, List<DataField> fields,
                              List<Binding> detections, List<Binding> quotes,
                              List<HedgingRule> hedgingRules) {
        super(span, name);
        this.fields = immutable(fields);
        this.detections = immutable(detections);
        this.quotes = immutable(quotes);
        this.hedgingRules = immutable(hedgingRules);
    }

    public List<DataField> getFields() {
        return fields;
    }

    public List<Binding> getDetections() {
        return detections;
    }

    public List<Binding> getQuotes() {
        return quotes;
    }

    public List<HedgingRule> getHedgingRules() {
        return hedgingRules;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMicrostructureDecl(this, context);
    }
}
