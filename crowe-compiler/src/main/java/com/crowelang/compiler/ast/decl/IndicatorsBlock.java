package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * indicators { name = expr; ... }
 */
public class IndicatorsBlock extends BindingBlock {
    public IndicatorsBlock(SourceSpan span, List<Binding> bindings) {
        super(span, bindings);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndicatorsBlock(this, context);
    }
}
