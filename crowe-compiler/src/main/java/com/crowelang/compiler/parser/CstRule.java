package com.crowelang.compiler.parser;

/**
 * 语法规则标签：每个 CST 节点标记其对应的文法规则
 */
public enum CstRule {
    // === 顶层 ===
    PROGRAM,
    IMPORT_DECL,
    STRATEGY_DECL,
    INDICATOR_DECL,
    DATA_DECL,
    ORDER_DECL,
    EVENT_DECL,
    PORTFOLIO_DECL,
    BACKTEST_DECL,
    MICROSTRUCTURE_DECL,

    // === 策略子块 ===
    PARAMS_BLOCK,
    STRATEGY_PARAM,
    INDICATORS_BLOCK,
    SIGNALS_BLOCK,
    RISK_BLOCK,
    BINDING,
    RULES_BLOCK,
    TRADING_RULE,
    TRADING_ACTION,
    CALL_EXPRESSION,
    EVENT_HANDLERS,
    EVENT_HANDLER,

    // === 结构体成员 ===
    DATA_FIELD,
    COMPUTED_FIELD,
    METRICS_BLOCK,
    CONSTRAINTS_BLOCK,
    COSTS_BLOCK,
    OUTPUT_BLOCK,
    DETECT_BLOCK,
    QUOTE_BLOCK,
    HEDGING_BLOCK,
    HEDGING_RULE,
    PARAMETER_LIST,
    PARAMETER,

    // === 类型 ===
    TYPE_EXPR,
    UNION_TYPE,
    PRIMARY_TYPE,

    // === 语句 ===
    BLOCK,
    STATEMENT,
    VARIABLE_DECLARATION,
    IF_STATEMENT,
    WHILE_STATEMENT,
    FOR_STATEMENT,
    RETURN_STATEMENT,
    BREAK_STATEMENT,
    CONTINUE_STATEMENT,
    WHEN_STATEMENT,
    EXPRESSION_STATEMENT,

    // === 表达式 ===
    EXPRESSION,
    ASSIGNMENT,
    CONDITIONAL,
    LOGICAL_OR,
    LOGICAL_AND,
    MEMBERSHIP,
    EQUALITY,
    RELATIONAL,
    ADDITIVE,
    MULTIPLICATIVE,
    UNARY,
    POWER,
    POSTFIX,
    INDEX_OR_SLICE,
    PRIMARY,
    ARRAY_LITERAL,
    COMPREHENSION,
    OBJECT_LITERAL,
    OBJECT_PROPERTY,
    ARGUMENT_LIST
}
