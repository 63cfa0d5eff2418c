package com.crowelang.compiler.ast.expr;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {
    protected Expression(SourceSpan span) {
        super(span);
    }
}
