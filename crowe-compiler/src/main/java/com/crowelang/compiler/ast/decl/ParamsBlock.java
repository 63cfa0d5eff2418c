package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * params { ... }
 */
public class ParamsBlock extends AstNode {
    private final List<StrategyParam> params;

    public ParamsBlock(SourceSpan span, List<StrategyParam> params) {
        super(span);
        this.params = immutable(params);
    }

    public List<StrategyParam> getParams() {
        return params;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParamsBlock(this, context);
    }
}
