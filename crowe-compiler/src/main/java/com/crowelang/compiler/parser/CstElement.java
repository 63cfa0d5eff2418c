package com.crowelang.compiler.parser;

import com.crowelang.compiler.lexer.Token;

/**
 * CST 子元素：规则节点或 token 叶子
 */
public interface CstElement {

    /** 该元素覆盖的第一个 token */
    Token firstToken();

    /** 该元素覆盖的最后一个 token */
    Token lastToken();
}
