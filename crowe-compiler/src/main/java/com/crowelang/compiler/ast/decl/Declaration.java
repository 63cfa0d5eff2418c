package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 顶层声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceSpan span, String name) {
        super(span);
        this.name = name;
    }

    /** 声明名称（import 为模块路径） */
    public String getName() {
        return name;
    }
}
