package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;
import com.crowelang.compiler.ast.type.TypeNode;

/**
 * 结构字段 name?: type = default;
 */
public class DataField extends AstNode {
    private final String name;
    private final boolean optional;
    private final TypeNode type;
    private final Expression defaultValue;  // 可选

    public DataField(SourceSpan span, String name, boolean optional, TypeNode type, Expression defaultValue) {
        super(span);
        this.name = name;
        this.optional = optional;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public boolean isOptional() {
        return optional;
    }

    public TypeNode getType() {
        return type;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDataField(this, context);
    }
}
