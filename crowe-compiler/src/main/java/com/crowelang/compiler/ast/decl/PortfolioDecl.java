package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 组合声明 portfolio Name { fields  metrics { }  constraints { } }
 */
public class PortfolioDecl extends Declaration {
    private final List<DataField> fields;
    private final List<ComputedField> metrics;
    private final List<Binding> constraints;

    public PortfolioDecl(SourceSpan span, String name, List<DataField> fields,
                         List<ComputedField> metrics, List<Binding> constraints) {
        super(span, name);
        this.fields = immutable(fields);
        this.metrics = immutable(metrics);
        this.constraints = immutable(constraints);
    }

    public List<DataField> getFields() {
        return fields;
    }

    public List<ComputedField> getMetrics() {
        return metrics;
    }

    public List<Binding> getConstraints() {
        return constraints;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPortfolioDecl(this, context);
    }
}
