package com.crowelang.compiler.ast.stmt;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * Continue 语句
 */
public class ContinueStmt extends Statement {
    public ContinueStmt(SourceSpan span) {
        super(span);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContinueStmt(this, context);
    }
}
