package com.crowelang.compiler.ast.stmt;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {
    protected Statement(SourceSpan span) {
        super(span);
    }
}
