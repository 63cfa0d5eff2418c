package com.crowelang.compiler.lexer;

import com.crowelang.compiler.diagnostic.Diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CroweLang 词法分析器
 *
 * <p>每次调用创建一个实例。遇到无法识别的字符序列时报告词法错误并跳过该序列，
 * 继续产出尽力而为的 token 流，以便语法分析仍可尝试恢复。</p>
 */
public class Lexer {
    private final String source;
    private final Diagnostics diagnostics;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表（硬关键词 + 软关键词）
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 顶层声明
        map.put("strategy", TokenType.KW_STRATEGY);
        map.put("indicator", TokenType.KW_INDICATOR);
        map.put("data", TokenType.KW_DATA);
        map.put("order", TokenType.KW_ORDER);
        map.put("event", TokenType.KW_EVENT);
        map.put("portfolio", TokenType.KW_PORTFOLIO);
        map.put("backtest", TokenType.KW_BACKTEST);
        map.put("microstructure", TokenType.KW_MICROSTRUCTURE);

        // 策略块
        map.put("params", TokenType.KW_PARAMS);
        map.put("indicators", TokenType.KW_INDICATORS);
        map.put("signals", TokenType.KW_SIGNALS);
        map.put("rules", TokenType.KW_RULES);
        map.put("risk", TokenType.KW_RISK);
        map.put("when", TokenType.KW_WHEN);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("elif", TokenType.KW_ELIF);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("in", TokenType.KW_IN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("return", TokenType.KW_RETURN);
        map.put("await", TokenType.KW_AWAIT);

        // 字面量 / 逻辑
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);

        // 模块
        map.put("import", TokenType.KW_IMPORT);
        map.put("from", TokenType.KW_FROM);
        map.put("as", TokenType.KW_AS);
        map.put("export", TokenType.KW_EXPORT);

        // 基本类型
        map.put("int", TokenType.KW_INT);
        map.put("float", TokenType.KW_FLOAT);
        map.put("string", TokenType.KW_STRING);
        map.put("boolean", TokenType.KW_BOOLEAN);
        map.put("datetime", TokenType.KW_DATETIME);
        map.put("void", TokenType.KW_VOID);

        // 交易动作
        map.put("signal", TokenType.SK_SIGNAL);
        map.put("rule", TokenType.SK_RULE);
        map.put("buy", TokenType.SK_BUY);
        map.put("sell", TokenType.SK_SELL);
        map.put("short", TokenType.SK_SHORT);
        map.put("cover", TokenType.SK_COVER);
        map.put("close", TokenType.SK_CLOSE);
        map.put("cancel", TokenType.SK_CANCEL);

        // 订单类型
        map.put("market", TokenType.SK_MARKET);
        map.put("limit", TokenType.SK_LIMIT);
        map.put("stop", TokenType.SK_STOP);
        map.put("stop_limit", TokenType.SK_STOP_LIMIT);
        map.put("MarketOrder", TokenType.SK_MARKET_ORDER);
        map.put("LimitOrder", TokenType.SK_LIMIT_ORDER);
        map.put("StopOrder", TokenType.SK_STOP_ORDER);

        // 行情数据类型
        map.put("Bar", TokenType.SK_BAR);
        map.put("Tick", TokenType.SK_TICK);
        map.put("OrderBook", TokenType.SK_ORDER_BOOK);
        map.put("Level", TokenType.SK_LEVEL);
        map.put("Position", TokenType.SK_POSITION);

        // 组合 / 回测子块
        map.put("metrics", TokenType.SK_METRICS);
        map.put("constraints", TokenType.SK_CONSTRAINTS);
        map.put("costs", TokenType.SK_COSTS);
        map.put("output", TokenType.SK_OUTPUT);

        // 事件
        map.put("on", TokenType.SK_ON);
        map.put("on_bar", TokenType.SK_ON_BAR);
        map.put("on_tick", TokenType.SK_ON_TICK);
        map.put("on_book", TokenType.SK_ON_BOOK);
        map.put("on_fill", TokenType.SK_ON_FILL);
        map.put("on_reject", TokenType.SK_ON_REJECT);

        // 微观结构
        map.put("detect", TokenType.SK_DETECT);
        map.put("quote", TokenType.SK_QUOTE);
        map.put("hedging", TokenType.SK_HEDGING);

        // 复合类型 / 枚举
        map.put("Array", TokenType.SK_ARRAY);
        map.put("Map", TokenType.SK_MAP);
        map.put("enum", TokenType.SK_ENUM);
        map.put("Side", TokenType.SK_SIDE);
        map.put("TimeInForce", TokenType.SK_TIME_IN_FORCE);
        map.put("OrderStatus", TokenType.SK_ORDER_STATUS);
        map.put("Frequency", TokenType.SK_FREQUENCY);
        map.put("MINUTE", TokenType.SK_MINUTE);
        map.put("HOUR", TokenType.SK_HOUR);
        map.put("DAY", TokenType.SK_DAY);
        map.put("WEEK", TokenType.SK_WEEK);

        // 标准库函数
        map.put("SMA", TokenType.SK_SMA);
        map.put("EMA", TokenType.SK_EMA);
        map.put("RSI", TokenType.SK_RSI);
        map.put("MACD", TokenType.SK_MACD);
        map.put("BollingerBands", TokenType.SK_BOLLINGER_BANDS);
        map.put("VWAP", TokenType.SK_VWAP);
        map.put("StdDev", TokenType.SK_STD_DEV);
        map.put("sum", TokenType.SK_SUM);
        map.put("avg", TokenType.SK_AVG);
        map.put("min", TokenType.SK_MIN);
        map.put("max", TokenType.SK_MAX);
        map.put("abs", TokenType.SK_ABS);
        map.put("log", TokenType.SK_LOG);
        map.put("sqrt", TokenType.SK_SQRT);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, Diagnostics diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(Token.eof(current, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '@': addToken(TokenType.AT); break;
            case '^': addToken(TokenType.BIT_XOR); break;
            case '~': addToken(TokenType.BIT_NOT); break;

            // 可能是多字符的 Token
            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else if (match('.')) {
                    addToken(TokenType.DOT_DOT);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('>')) addToken(TokenType.ARROW);
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                if (match('*')) addToken(TokenType.POWER);
                else if (match('=')) addToken(TokenType.MUL_ASSIGN);
                else addToken(TokenType.MUL);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.DIV_ASSIGN);
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.MOD);
                break;

            case '=':
                if (match('=')) addToken(TokenType.EQ);
                else if (match('>')) addToken(TokenType.FAT_ARROW);
                else addToken(TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                if (match('=')) addToken(TokenType.LE);
                else if (match('<')) addToken(TokenType.SHL);
                else addToken(TokenType.LT);
                break;

            case '>':
                if (match('=')) addToken(TokenType.GE);
                else if (match('>')) addToken(TokenType.SHR);
                else addToken(TokenType.GT);
                break;

            case '&':
                addToken(match('&') ? TokenType.AND : TokenType.BIT_AND);
                break;

            case '|':
                addToken(match('|') ? TokenType.OR : TokenType.BIT_OR);
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                newLine();
                break;

            // 字符串
            case '"':
            case '\'':
                string(c);
                break;

            default:
                if (isDigit(c)) {
                    if (isDateAhead()) {
                        date();
                    } else {
                        number();
                    }
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    unrecognized();
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char charAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    /** 能否作为某个合法 token（或空白、注释）的首字符 */
    private static boolean isTokenStart(char c) {
        if (isAlphaNumeric(c) || Character.isWhitespace(c)) return true;
        return "(){}[],;:?@^~.+-*/%=!<>&|\"'".indexOf(c) >= 0;
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, start, current, startLine, startColumn));
    }

    private void error(String message) {
        diagnostics.lexicalError(message, startLine, startColumn);
    }

    // === 复杂 Token 扫描 ===

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                error("Unterminated string literal");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string literal");
            return;
        }

        advance(); // 闭合引号
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            case 'b': return '\b';
            case 'f': return '\f';
            case '\\': return '\\';
            case '\'': return '\'';
            case '"': return '"';
            case 'u': {
                StringBuilder hex = new StringBuilder();
                for (int i = 0; i < 4 && !isAtEnd() && isHexDigit(peek()); i++) {
                    hex.append(advance());
                }
                if (hex.length() != 4) {
                    error("Invalid unicode escape: \\u" + hex);
                    return '\0';
                }
                return (char) Integer.parseInt(hex.toString(), 16);
            }
            default:
                // 未知转义保留原字符
                return c;
        }
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * 检查从 start 开始是否为 ISO 8601 日期：YYYY-MM-DD
     */
    private boolean isDateAhead() {
        int i = start;
        return isDigits(i, 4) && charAt(i + 4) == '-'
                && isDigits(i + 5, 2) && charAt(i + 7) == '-'
                && isDigits(i + 8, 2) && !isAlphaNumeric(charAt(i + 10)) || isDateTimeAhead(i);
    }

    private boolean isDateTimeAhead(int i) {
        return isDigits(i, 4) && charAt(i + 4) == '-'
                && isDigits(i + 5, 2) && charAt(i + 7) == '-'
                && isDigits(i + 8, 2) && charAt(i + 10) == 'T'
                && isDigits(i + 11, 2) && charAt(i + 13) == ':'
                && isDigits(i + 14, 2) && charAt(i + 16) == ':'
                && isDigits(i + 17, 2);
    }

    private boolean isDigits(int from, int count) {
        for (int k = 0; k < count; k++) {
            if (!isDigit(charAt(from + k))) return false;
        }
        return true;
    }

    private void date() {
        boolean withTime = isDateTimeAhead(start);
        // 已消费首个数字，日期部分共 10 个字符
        advanceTo(start + 10);
        if (withTime) {
            advanceTo(start + 19);
            if (peek() == '.' && isDigits(current + 1, 3)) {
                advanceTo(current + 4);
            }
            if (peek() == 'Z') {
                advance();
            }
        }
        addToken(TokenType.DATE_LITERAL, source.substring(start, current));
    }

    private void advanceTo(int target) {
        while (current < target && !isAtEnd()) advance();
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            char sign = peekNext();
            if (isDigit(sign)) {
                advance();
                while (isDigit(peek())) advance();
            } else if ((sign == '+' || sign == '-') && isDigit(charAt(current + 2))) {
                advance();
                advance();
                while (isDigit(peek())) advance();
            }
        }

        String text = source.substring(start, current);
        addToken(TokenType.NUMBER_LITERAL, Double.valueOf(text));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (peek() == '\n') {
                advance();
                newLine();
            } else {
                advance();
            }
        }
        error("Unterminated block comment");
    }

    /** 连续的无法识别字符合并为一个错误 */
    private void unrecognized() {
        while (!isAtEnd() && !isTokenStart(peek())) advance();
        error("Unrecognized character sequence '" + source.substring(start, current) + "'");
    }
}
