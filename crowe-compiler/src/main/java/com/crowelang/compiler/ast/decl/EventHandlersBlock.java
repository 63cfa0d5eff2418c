package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 策略内的 event { on_bar(...) { } ... } 块
 */
public class EventHandlersBlock extends AstNode {
    private final List<EventHandler> handlers;

    public EventHandlersBlock(SourceSpan span, List<EventHandler> handlers) {
        super(span);
        this.handlers = immutable(handlers);
    }

    public List<EventHandler> getHandlers() {
        return handlers;
    }

    /** 按名称查找处理器，不存在返回 null */
    public EventHandler find(String name) {
        for (EventHandler h : handlers) {
            if (h.getName().equals(name)) return h;
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventHandlersBlock(this, context);
    }
}
