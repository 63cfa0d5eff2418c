package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 顶层事件处理器集合 event Name { on_fill(...) { } }
 */
public class EventDecl extends Declaration {
    private final List<EventHandler> handlers;

    public EventDecl(SourceSpan span, String name, List<EventHandler> handlers) {
        super(span, name);
        this.handlers = immutable(handlers);
    }

    public List<EventHandler> getHandlers() {
        return handlers;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventDecl(this, context);
    }
}
