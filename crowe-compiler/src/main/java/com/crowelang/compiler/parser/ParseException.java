package com.crowelang.compiler.parser;

import com.crowelang.compiler.lexer.Token;
import com.crowelang.compiler.lexer.TokenType;

/**
 * 解析异常
 *
 * <p>在解析器内部抛出，由最近的可重复结构捕获并转换为诊断信息。</p>
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /**
     * 诊断用描述：消息 + 实际遇到的 token（位置信息由诊断单独给出）
     */
    public String getDescription() {
        if (token == null) {
            return super.getMessage();
        }
        if (token.getType() == TokenType.EOF) {
            return super.getMessage() + " (found end of input)";
        }
        return super.getMessage() + " (found '" + token.getLexeme() + "')";
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found '").append(token.getLexeme()).append("')");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
