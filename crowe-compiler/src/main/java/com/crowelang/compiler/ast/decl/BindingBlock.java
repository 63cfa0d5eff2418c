package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 由命名绑定组成的策略子块
 */
public abstract class BindingBlock extends AstNode {
    private final List<Binding> bindings;

    protected BindingBlock(SourceSpan span, List<Binding> bindings) {
        super(span);
        this.bindings = immutable(bindings);
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }
}
