package com.crowelang.compiler.lexer;

/**
 * CroweLang 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER_LITERAL,
    STRING_LITERAL,
    DATE_LITERAL,           // 2024-01-31 / 2024-01-31T09:30:00Z

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 顶层声明 ===
    KW_STRATEGY, KW_INDICATOR, KW_DATA, KW_ORDER, KW_EVENT,
    KW_PORTFOLIO, KW_BACKTEST, KW_MICROSTRUCTURE,

    // === 关键词 - 策略块 ===
    KW_PARAMS, KW_INDICATORS, KW_SIGNALS, KW_RULES, KW_RISK, KW_WHEN,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_ELIF, KW_FOR, KW_WHILE, KW_IN,
    KW_BREAK, KW_CONTINUE, KW_RETURN, KW_AWAIT,

    // === 关键词 - 字面量 / 逻辑 ===
    KW_TRUE, KW_FALSE, KW_NULL,
    KW_AND, KW_OR, KW_NOT,

    // === 关键词 - 模块 ===
    KW_IMPORT, KW_FROM, KW_AS, KW_EXPORT,

    // === 关键词 - 基本类型 ===
    KW_INT, KW_FLOAT, KW_STRING, KW_BOOLEAN, KW_DATETIME, KW_VOID,

    // === 软关键词 - 交易动作 ===
    SK_SIGNAL, SK_RULE,
    SK_BUY, SK_SELL, SK_SHORT, SK_COVER, SK_CLOSE, SK_CANCEL,

    // === 软关键词 - 订单类型 ===
    SK_MARKET, SK_LIMIT, SK_STOP, SK_STOP_LIMIT,
    SK_MARKET_ORDER, SK_LIMIT_ORDER, SK_STOP_ORDER,

    // === 软关键词 - 行情数据类型 ===
    SK_BAR, SK_TICK, SK_ORDER_BOOK, SK_LEVEL, SK_POSITION,

    // === 软关键词 - 组合 / 回测子块 ===
    SK_METRICS, SK_CONSTRAINTS, SK_COSTS, SK_OUTPUT,

    // === 软关键词 - 事件 ===
    SK_ON, SK_ON_BAR, SK_ON_TICK, SK_ON_BOOK, SK_ON_FILL, SK_ON_REJECT,

    // === 软关键词 - 微观结构 ===
    SK_DETECT, SK_QUOTE, SK_HEDGING,

    // === 软关键词 - 复合类型 / 枚举 ===
    SK_ARRAY, SK_MAP, SK_ENUM,
    SK_SIDE, SK_TIME_IN_FORCE, SK_ORDER_STATUS, SK_FREQUENCY,
    SK_MINUTE, SK_HOUR, SK_DAY, SK_WEEK,

    // === 软关键词 - 标准库函数 ===
    SK_SMA, SK_EMA, SK_RSI, SK_MACD, SK_BOLLINGER_BANDS, SK_VWAP, SK_STD_DEV,
    SK_SUM, SK_AVG, SK_MIN, SK_MAX, SK_ABS, SK_LOG, SK_SQRT,

    // === 操作符 - 箭头 / 范围 ===
    ARROW,          // ->
    FAT_ARROW,      // =>
    ELLIPSIS,       // ...
    DOT_DOT,        // ..

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    POWER,          // **

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 位运算 ===
    BIT_AND,        // &
    BIT_OR,         // |
    BIT_XOR,        // ^
    BIT_NOT,        // ~
    SHL,            // <<
    SHR,            // >>

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=
    MOD_ASSIGN,     // %=

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;
    QUESTION,       // ?
    AT,             // @

    // === 特殊 ===
    EOF;

    /**
     * 是否为保留关键词（不可作为标识符）
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为软关键词：词法上是关键词，但在需要标识符的位置可以当作标识符使用
     */
    public boolean isSoftKeyword() {
        return name().startsWith("SK_");
    }

    /**
     * 是否可以出现在标识符位置
     */
    public boolean isIdentifierLike() {
        return this == IDENTIFIER || isSoftKeyword();
    }

    /**
     * 是否为赋值操作符
     */
    public boolean isAssignmentOp() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
            case MOD_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为交易下单动作（buy / sell / short / cover）
     */
    public boolean isOrderAction() {
        switch (this) {
            case SK_BUY:
            case SK_SELL:
            case SK_SHORT:
            case SK_COVER:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为顶层声明起始关键词
     */
    public boolean isDeclarationStart() {
        switch (this) {
            case KW_IMPORT:
            case KW_STRATEGY:
            case KW_INDICATOR:
            case KW_DATA:
            case KW_ORDER:
            case KW_EVENT:
            case KW_PORTFOLIO:
            case KW_BACKTEST:
            case KW_MICROSTRUCTURE:
                return true;
            default:
                return false;
        }
    }
}
