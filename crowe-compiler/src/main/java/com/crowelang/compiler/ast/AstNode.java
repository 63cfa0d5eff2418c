package com.crowelang.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 *
 * <p>节点构建后不可变：子节点列表在构造时复制并包装为只读。</p>
 */
public abstract class AstNode {
    protected final SourceSpan span;

    protected AstNode(SourceSpan span) {
        this.span = span;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    protected static <T> List<T> immutable(List<T> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
