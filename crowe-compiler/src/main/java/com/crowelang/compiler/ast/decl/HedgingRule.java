package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;
import com.crowelang.compiler.ast.stmt.Block;

/**
 * 对冲规则 when (condition) { statements }
 */
public class HedgingRule extends AstNode {
    private final Expression condition;
    private final Block body;

    public HedgingRule(SourceSpan span, Expression condition, Block body) {
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
        return visitor.visitHedgingRule(this, context);
    }
}
