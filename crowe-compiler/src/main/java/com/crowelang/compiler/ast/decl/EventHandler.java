package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 事件处理器 on_bar(bar: Bar) { ... }
 */
public class EventHandler extends AstNode {
    private final String name;
    private final List<Parameter> parameters;
    private final Block body;

    public EventHandler(SourceSpan span, String name, List<Parameter> parameters, Block body) {
        super(span);
        this.name = name;
        this.parameters = immutable(parameters);
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventHandler(this, context);
    }
}
