package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * signals { name = expr; ... }
 */
public class SignalsBlock extends BindingBlock {
    public SignalsBlock(SourceSpan span, List<Binding> bindings) {
        super(span, bindings);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSignalsBlock(this, context);
    }
}
