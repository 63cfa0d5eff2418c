package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 订单类型声明 order Name { fields }
 */
public class OrderDecl extends Declaration {
    private final List<DataField> fields;

    public OrderDecl(SourceSpan span, String name, List<DataField> fields) {
        super(span, name);
        this.fields = immutable(fields);
    }

    public List<DataField> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOrderDecl(this, context);
    }
}
