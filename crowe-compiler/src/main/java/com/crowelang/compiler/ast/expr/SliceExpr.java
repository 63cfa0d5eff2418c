package com.crowelang.compiler.ast.expr;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 切片 target[start:end:step]，三个部分均可省略
 */
public class SliceExpr extends Expression {
    private final Expression target;
    private final Expression start;
    private final Expression end;
    private final Expression step;

    public SliceExpr(SourceSpan span, Expression target, Expression start, Expression end, Expression step) {
        super(span);
        this.target = target;
        this.start = start;
        this.end = end;
        this.step = step;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    public Expression getStep() {
        return step;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSliceExpr(this, context);
    }
}
