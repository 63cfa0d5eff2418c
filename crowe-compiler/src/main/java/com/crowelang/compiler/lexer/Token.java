package com.crowelang.compiler.lexer;

/**
 * 词法单元
 *
 * <p>偏移为半开区间 [offset, endOffset)，行列号从 1 开始，均指向词素首字符。
 * 字符串字面量的词素包含引号，去转义后的文本放在 {@link #getLiteral()}。
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int offset;
    private final int endOffset;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, Object literal, int offset, int endOffset, int line, int column) {
        if (endOffset < offset) {
            throw new IllegalArgumentException("Token end " + endOffset + " before start " + offset);
        }
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.offset = offset;
        this.endOffset = endOffset;
        this.line = line;
        this.column = column;
    }

    /** 文件末尾的零宽词法单元 */
    public static Token eof(int offset, int line, int column) {
        return new Token(TokenType.EOF, "", null, offset, offset, line, column);
    }

    /**
     * 截取词素 [from, to) 作为新的词法单元，行号不变，列号与偏移随 from 后移。
     * 只适用于不跨行、无字面量值的运算符词素。
     */
    public Token slice(TokenType newType, int from, int to) {
        if (from < 0 || to > lexeme.length() || from >= to) {
            throw new IllegalArgumentException("Bad slice [" + from + ", " + to + ") of '" + lexeme + "'");
        }
        return new Token(newType, lexeme.substring(from, to), null,
                offset + from, offset + to, line, column + from);
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /**
     * 字面量值：数字为 {@link Double}，字符串为去转义后的文本，其余为 null
     */
    public Object getLiteral() {
        return literal;
    }

    public int getOffset() {
        return offset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int length() {
        return endOffset - offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name()).append(" '").append(lexeme).append('\'');
        if (literal != null && !lexeme.equals(String.valueOf(literal))) {
            sb.append(" = ").append(literal);
        }
        return sb.append(" @").append(line).append(':').append(column).toString();
    }
}
