package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;
import com.crowelang.compiler.ast.type.TypeNode;

/**
 * 函数/处理器参数 name: type = default
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeNode type;
    private final Expression defaultValue;  // 可选

    public Parameter(SourceSpan span, String name, TypeNode type, Expression defaultValue) {
        super(span);
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public TypeNode getType() {
        return type;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
