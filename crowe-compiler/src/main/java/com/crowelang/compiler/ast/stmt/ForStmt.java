package com.crowelang.compiler.ast.stmt;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;

/**
 * For-in 循环
 */
public class ForStmt extends Statement {
    private final String variable;
    private final Expression iterable;
    private final Block body;

    public ForStmt(SourceSpan span, String variable, Expression iterable, Block body) {
        super(span);
        this.variable = variable;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
