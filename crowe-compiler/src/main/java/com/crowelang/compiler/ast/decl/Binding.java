package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;

/**
 * 命名绑定 name = expr;（indicators / signals / risk 等块的条目）
 */
public class Binding extends AstNode {
    private final String name;
    private final Expression value;

    public Binding(SourceSpan span, String name, Expression value) {
        super(span);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinding(this, context);
    }
}
