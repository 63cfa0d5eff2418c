package com.crowelang.compiler.ast.stmt;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {
    public BreakStmt(SourceSpan span) {
        super(span);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
