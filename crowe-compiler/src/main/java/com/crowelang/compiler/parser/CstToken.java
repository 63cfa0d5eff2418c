package com.crowelang.compiler.parser;

import com.crowelang.compiler.lexer.Token;
import com.crowelang.compiler.lexer.TokenType;

/**
 * CST token 叶子
 */
public final class CstToken implements CstElement {
    private final Token token;

    public CstToken(Token token) {
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    public TokenType getType() {
        return token.getType();
    }

    @Override
    public Token firstToken() {
        return token;
    }

    @Override
    public Token lastToken() {
        return token;
    }

    @Override
    public String toString() {
        return "'" + token.getLexeme() + "'";
    }
}
