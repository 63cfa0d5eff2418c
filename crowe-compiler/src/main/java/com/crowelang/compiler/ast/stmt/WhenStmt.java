package com.crowelang.compiler.ast.stmt;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;

/**
 * when 守卫语句：条件成立时执行代码块（无 else 分支）
 */
public class WhenStmt extends Statement {
    private final Expression condition;
    private final Block body;

    public WhenStmt(SourceSpan span, Expression condition, Block body) {
        super(span);
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhenStmt(this, context);
    }
}
