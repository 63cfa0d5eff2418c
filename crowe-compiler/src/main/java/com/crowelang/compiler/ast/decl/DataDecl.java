package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 数据结构声明 data Name { fields  metrics { ... } }
 */
public class DataDecl extends Declaration {
    private final List<DataField> fields;
    private final List<ComputedField> metrics;

    public DataDecl(SourceSpan span, String name, List<DataField> fields, List<ComputedField> metrics) {
        super(span, name);
        this.fields = immutable(fields);
        this.metrics = immutable(metrics);
    }

    public List<DataField> getFields() {
        return fields;
    }

    public List<ComputedField> getMetrics() {
        return metrics;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDataDecl(this, context);
    }
}
