package com.crowelang.compiler.ast.expr;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * await 表达式
 */
public class AwaitExpr extends Expression {
    private final Expression operand;

    public AwaitExpr(SourceSpan span, Expression operand) {
        super(span);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAwaitExpr(this, context);
    }
}
