package com.crowelang.compiler.ast.expr;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 列表推导 [element for variable in iterable if filter]
 */
public class ComprehensionExpr extends Expression {
    private final Expression element;
    private final String variable;
    private final Expression iterable;
    private final Expression filter;  // 可选

    public ComprehensionExpr(SourceSpan span, Expression element, String variable,
                             Expression iterable, Expression filter) {
        super(span);
        this.element = element;
        this.variable = variable;
        this.iterable = iterable;
        this.filter = filter;
    }

    public Expression getElement() {
        return element;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Expression getFilter() {
        return filter;
    }

    public boolean hasFilter() {
        return filter != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionExpr(this, context);
    }
}
