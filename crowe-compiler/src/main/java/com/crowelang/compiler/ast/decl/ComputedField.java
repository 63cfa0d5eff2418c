package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;
import com.crowelang.compiler.ast.type.TypeNode;

/**
 * metrics 块中的计算字段 name: type = expr;
 */
public class ComputedField extends AstNode {
    private final String name;
    private final TypeNode type;
    private final Expression value;

    public ComputedField(SourceSpan span, String name, TypeNode type, Expression value) {
        super(span);
        this.name = name;
        this.type = type;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public TypeNode getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComputedField(this, context);
    }
}
