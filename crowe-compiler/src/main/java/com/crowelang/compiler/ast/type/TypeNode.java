package com.crowelang.compiler.ast.type;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 类型注解基类
 */
public abstract class TypeNode extends AstNode {
    protected TypeNode(SourceSpan span) {
        super(span);
    }
}
