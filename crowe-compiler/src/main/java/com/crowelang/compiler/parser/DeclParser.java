package com.crowelang.compiler.parser;

import com.crowelang.compiler.lexer.TokenType;

import static com.crowelang.compiler.lexer.TokenType.*;

/**
 * 顶层声明与策略子块解析辅助类
 */
class DeclParser {

    private final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    CstNode parseDeclaration() {
        switch (parser.current().getType()) {
            case KW_IMPORT:         return parseImport();
            case KW_STRATEGY:       return parseStrategy();
            case KW_INDICATOR:      return parseIndicator();
            case KW_DATA:           return parseData();
            case KW_ORDER:          return parseOrder();
            case KW_EVENT:          return parseEventDecl();
            case KW_PORTFOLIO:      return parsePortfolio();
            case KW_BACKTEST:       return parseBacktest();
            case KW_MICROSTRUCTURE: return parseMicrostructure();
            default:
                throw new ParseException("Expected a top-level declaration", parser.current(), "declaration");
        }
    }

    // ============ import ============

    /**
     * import { A, B } from "m";  |  import A from "m";  |  import "m" as a;
     */
    private CstNode parseImport() {
        CstNode node = new CstNode(CstRule.IMPORT_DECL);
        parser.expect(node, KW_IMPORT, "Expected 'import'");
        if (parser.match(node, LBRACE)) {
            parser.expectIdentifier(node, "Expected imported name");
            while (parser.match(node, COMMA)) {
                parser.expectIdentifier(node, "Expected imported name");
            }
            parser.expect(node, RBRACE, "Expected '}' after imported names");
            parser.expect(node, KW_FROM, "Expected 'from' after import list");
            parser.expect(node, STRING_LITERAL, "Expected module path string");
        } else if (parser.check(STRING_LITERAL)) {
            node.add(parser.advance());
            if (parser.match(node, KW_AS)) {
                parser.expectIdentifier(node, "Expected alias after 'as'");
            }
        } else {
            parser.expectIdentifier(node, "Expected import name, '{' or module path");
            parser.expect(node, KW_FROM, "Expected 'from' after import name");
            parser.expect(node, STRING_LITERAL, "Expected module path string");
        }
        parser.expect(node, SEMICOLON, "Expected ';' after import");
        return node;
    }

    // ============ strategy ============

    private CstNode parseStrategy() {
        CstNode node = new CstNode(CstRule.STRATEGY_DECL);
        parser.expect(node, KW_STRATEGY, "Expected 'strategy'");
        parser.expectIdentifier(node, "Expected strategy name");
        parser.expect(node, LBRACE, "Expected '{' after strategy name");
        parser.parseRepeated(node, this::parseStrategyMember);
        parser.expectClosingBrace(node, "Expected '}' to close strategy");
        return node;
    }

    private CstNode parseStrategyMember() {
        switch (parser.current().getType()) {
            case KW_PARAMS:
                return parseParamsBlock();
            case KW_INDICATORS:
                return parseBindingBlock(CstRule.INDICATORS_BLOCK, KW_INDICATORS, "indicators");
            case KW_SIGNALS:
                return parseBindingBlock(CstRule.SIGNALS_BLOCK, KW_SIGNALS, "signals");
            case KW_RULES:
                return parseRulesBlock();
            case KW_RISK:
                return parseBindingBlock(CstRule.RISK_BLOCK, KW_RISK, "risk");
            case KW_EVENT:
                return parseEventHandlers();
            default:
                throw new ParseException(
                        "Expected strategy block (params, indicators, signals, rules, risk or event)",
                        parser.current(), "strategy block");
        }
    }

    private CstNode parseParamsBlock() {
        CstNode node = new CstNode(CstRule.PARAMS_BLOCK);
        parser.expect(node, KW_PARAMS, "Expected 'params'");
        parser.expect(node, LBRACE, "Expected '{' after 'params'");
        parser.parseRepeated(node, this::parseStrategyParam);
        parser.expectClosingBrace(node, "Expected '}' to close params block");
        return node;
    }

    // name: type = default;
    private CstNode parseStrategyParam() {
        CstNode node = new CstNode(CstRule.STRATEGY_PARAM);
        parser.expectIdentifier(node, "Expected parameter name");
        parser.expect(node, COLON, "Expected ':' after parameter name");
        node.add(parser.typeParser.parseTypeExpr());
        if (parser.match(node, ASSIGN)) {
            node.add(parser.exprParser.parseExpression());
        }
        parser.expect(node, SEMICOLON, "Expected ';' after parameter");
        return node;
    }

    /**
     * keyword '{' binding* '}'，用于 indicators / signals / risk 及其他绑定子块
     */
    private CstNode parseBindingBlock(CstRule rule, TokenType keyword, String name) {
        CstNode node = new CstNode(rule);
        parser.expect(node, keyword, "Expected '" + name + "'");
        parser.expect(node, LBRACE, "Expected '{' after '" + name + "'");
        parser.parseRepeated(node, this::parseBinding);
        parser.expectClosingBrace(node, "Expected '}' to close " + name + " block");
        return node;
    }

    // name = expr;
    private CstNode parseBinding() {
        CstNode node = new CstNode(CstRule.BINDING);
        parser.expectIdentifier(node, "Expected binding name");
        parser.expect(node, ASSIGN, "Expected '=' after binding name");
        node.add(parser.exprParser.parseExpression());
        parser.expect(node, SEMICOLON, "Expected ';' after binding");
        return node;
    }

    private CstNode parseRulesBlock() {
        CstNode node = new CstNode(CstRule.RULES_BLOCK);
        parser.expect(node, KW_RULES, "Expected 'rules'");
        parser.expect(node, LBRACE, "Expected '{' after 'rules'");
        parser.parseRepeated(node, this::parseTradingRule);
        parser.expectClosingBrace(node, "Expected '}' to close rules block");
        return node;
    }

    // when (condition) { action* }
    private CstNode parseTradingRule() {
        CstNode node = new CstNode(CstRule.TRADING_RULE);
        parser.expect(node, KW_WHEN, "Expected 'when' to start trading rule");
        parser.stmtParser.parseCondition(node, "when");
        parser.expect(node, LBRACE, "Expected '{' after rule condition");
        parser.parseRepeated(node, this::parseTradingAction);
        parser.expectClosingBrace(node, "Expected '}' to close trading rule");
        return node;
    }

    /**
     * buy/sell/short/cover(quantity[, price]);  |  name(args);
     */
    private CstNode parseTradingAction() {
        CstNode node = new CstNode(CstRule.TRADING_ACTION);
        if (parser.current().getType().isOrderAction() && parser.checkAhead(LPAREN)) {
            node.add(parser.advance());
            parser.expect(node, LPAREN, "Expected '(' after order action");
            node.add(parser.exprParser.parseExpression());
            if (parser.match(node, COMMA)) {
                node.add(parser.exprParser.parseExpression());
            }
            parser.expect(node, RPAREN, "Expected ')' after order arguments");
        } else {
            node.add(parseCallExpression());
        }
        parser.expect(node, SEMICOLON, "Expected ';' after trading action");
        return node;
    }

    // ID '(' argumentList? ')'
    private CstNode parseCallExpression() {
        CstNode node = new CstNode(CstRule.CALL_EXPRESSION);
        parser.expectIdentifier(node, "Expected trading action or function call");
        parser.expect(node, LPAREN, "Expected '(' in function call");
        if (!parser.check(RPAREN)) {
            node.add(parser.exprParser.parseArgumentList());
        }
        parser.expect(node, RPAREN, "Expected ')' after arguments");
        return node;
    }

    private CstNode parseEventHandlers() {
        CstNode node = new CstNode(CstRule.EVENT_HANDLERS);
        parser.expect(node, KW_EVENT, "Expected 'event'");
        parser.expect(node, LBRACE, "Expected '{' after 'event'");
        parser.parseRepeated(node, this::parseEventHandler);
        parser.expectClosingBrace(node, "Expected '}' to close event block");
        return node;
    }

    // on_bar(bar: Bar) { ... }
    private CstNode parseEventHandler() {
        CstNode node = new CstNode(CstRule.EVENT_HANDLER);
        parser.expectIdentifier(node, "Expected event handler name");
        parser.expect(node, LPAREN, "Expected '(' after event handler name");
        if (!parser.check(RPAREN)) {
            node.add(parseParameterList());
        }
        parser.expect(node, RPAREN, "Expected ')' after handler parameters");
        node.add(parser.stmtParser.parseBlock());
        return node;
    }

    // ============ indicator ============

    private CstNode parseIndicator() {
        CstNode node = new CstNode(CstRule.INDICATOR_DECL);
        parser.expect(node, KW_INDICATOR, "Expected 'indicator'");
        parser.expectIdentifier(node, "Expected indicator name");
        parser.expect(node, LPAREN, "Expected '(' after indicator name");
        if (!parser.check(RPAREN)) {
            node.add(parseParameterList());
        }
        parser.expect(node, RPAREN, "Expected ')' after indicator parameters");
        if (parser.match(node, ARROW)) {
            node.add(parser.typeParser.parseTypeExpr());
        }
        if (parser.match(node, ASSIGN)) {
            node.add(parser.exprParser.parseExpression());
            parser.expect(node, SEMICOLON, "Expected ';' after indicator expression");
        } else {
            node.add(parser.stmtParser.parseBlock());
        }
        return node;
    }

    CstNode parseParameterList() {
        CstNode node = new CstNode(CstRule.PARAMETER_LIST);
        node.add(parseParameter());
        while (parser.match(node, COMMA)) {
            node.add(parseParameter());
        }
        return node;
    }

    private CstNode parseParameter() {
        CstNode node = new CstNode(CstRule.PARAMETER);
        parser.expectIdentifier(node, "Expected parameter name");
        parser.expect(node, COLON, "Expected ':' after parameter name");
        node.add(parser.typeParser.parseTypeExpr());
        if (parser.match(node, ASSIGN)) {
            node.add(parser.exprParser.parseExpression());
        }
        return node;
    }

    // ============ data / order ============

    private CstNode parseData() {
        CstNode node = new CstNode(CstRule.DATA_DECL);
        parser.expect(node, KW_DATA, "Expected 'data'");
        parser.expectIdentifier(node, "Expected data name");
        parser.expect(node, LBRACE, "Expected '{' after data name");
        parseFields(node);
        if (isSubBlock(SK_METRICS)) {
            node.add(parseMetricsBlock());
        }
        parser.expectClosingBrace(node, "Expected '}' to close data declaration");
        return node;
    }

    private CstNode parseOrder() {
        CstNode node = new CstNode(CstRule.ORDER_DECL);
        parser.expect(node, KW_ORDER, "Expected 'order'");
        parser.expectIdentifier(node, "Expected order name");
        parser.expect(node, LBRACE, "Expected '{' after order name");
        parseFields(node);
        parser.expectClosingBrace(node, "Expected '}' to close order declaration");
        return node;
    }

    /**
     * 解析字段直到 '}' 或子块关键词（metrics / constraints）
     */
    private void parseFields(CstNode parent) {
        while (!parser.check(RBRACE) && !parser.isAtEnd() && !parser.atDeclarationBoundary()
                && !isSubBlock(SK_METRICS) && !isSubBlock(SK_CONSTRAINTS)) {
            try {
                parent.add(parseDataField());
            } catch (ParseException e) {
                parser.recover(e);
            }
        }
    }

    // name?: type = default;
    private CstNode parseDataField() {
        CstNode node = new CstNode(CstRule.DATA_FIELD);
        parser.expectIdentifier(node, "Expected field name");
        parser.match(node, QUESTION);
        parser.expect(node, COLON, "Expected ':' after field name");
        node.add(parser.typeParser.parseTypeExpr());
        if (parser.match(node, ASSIGN)) {
            node.add(parser.exprParser.parseExpression());
        }
        parser.expect(node, SEMICOLON, "Expected ';' after field");
        return node;
    }

    private CstNode parseMetricsBlock() {
        CstNode node = new CstNode(CstRule.METRICS_BLOCK);
        node.add(parser.advance());
        parser.expect(node, LBRACE, "Expected '{' after 'metrics'");
        parser.parseRepeated(node, this::parseComputedField);
        parser.expectClosingBrace(node, "Expected '}' to close metrics block");
        return node;
    }

    // name: type = expr;
    private CstNode parseComputedField() {
        CstNode node = new CstNode(CstRule.COMPUTED_FIELD);
        parser.expectIdentifier(node, "Expected metric name");
        parser.expect(node, COLON, "Expected ':' after metric name");
        node.add(parser.typeParser.parseTypeExpr());
        parser.expect(node, ASSIGN, "Expected '=' in computed metric");
        node.add(parser.exprParser.parseExpression());
        parser.expect(node, SEMICOLON, "Expected ';' after computed metric");
        return node;
    }

    /**
     * 软关键词后跟 '{' 才是子块；否则按字段名处理
     */
    private boolean isSubBlock(TokenType keyword) {
        return parser.check(keyword) && parser.checkAhead(LBRACE);
    }

    // ============ event ============

    private CstNode parseEventDecl() {
        CstNode node = new CstNode(CstRule.EVENT_DECL);
        parser.expect(node, KW_EVENT, "Expected 'event'");
        parser.expectIdentifier(node, "Expected event name");
        parser.expect(node, LBRACE, "Expected '{' after event name");
        parser.parseRepeated(node, this::parseEventHandler);
        parser.expectClosingBrace(node, "Expected '}' to close event declaration");
        return node;
    }

    // ============ portfolio ============

    private CstNode parsePortfolio() {
        CstNode node = new CstNode(CstRule.PORTFOLIO_DECL);
        parser.expect(node, KW_PORTFOLIO, "Expected 'portfolio'");
        parser.expectIdentifier(node, "Expected portfolio name");
        parser.expect(node, LBRACE, "Expected '{' after portfolio name");
        parseFields(node);
        if (isSubBlock(SK_METRICS)) {
            node.add(parseMetricsBlock());
        }
        if (isSubBlock(SK_CONSTRAINTS)) {
            node.add(parseBindingBlock(CstRule.CONSTRAINTS_BLOCK, SK_CONSTRAINTS, "constraints"));
        }
        parser.expectClosingBrace(node, "Expected '}' to close portfolio declaration");
        return node;
    }

    // ============ backtest ============

    private CstNode parseBacktest() {
        CstNode node = new CstNode(CstRule.BACKTEST_DECL);
        parser.expect(node, KW_BACKTEST, "Expected 'backtest'");
        parser.expectIdentifier(node, "Expected backtest name");
        parser.expect(node, LBRACE, "Expected '{' after backtest name");
        while (!parser.check(RBRACE) && !parser.isAtEnd() && !parser.atDeclarationBoundary()
                && !isSubBlock(SK_COSTS) && !isSubBlock(SK_OUTPUT)) {
            try {
                node.add(parseBinding());
            } catch (ParseException e) {
                parser.recover(e);
            }
        }
        if (isSubBlock(SK_COSTS)) {
            node.add(parseBindingBlock(CstRule.COSTS_BLOCK, SK_COSTS, "costs"));
        }
        if (isSubBlock(SK_OUTPUT)) {
            node.add(parseBindingBlock(CstRule.OUTPUT_BLOCK, SK_OUTPUT, "output"));
        }
        parser.expectClosingBrace(node, "Expected '}' to close backtest declaration");
        return node;
    }

    // ============ microstructure ============

    private CstNode parseMicrostructure() {
        CstNode node = new CstNode(CstRule.MICROSTRUCTURE_DECL);
        parser.expect(node, KW_MICROSTRUCTURE, "Expected 'microstructure'");
        parser.expectIdentifier(node, "Expected microstructure name");
        parser.expect(node, LBRACE, "Expected '{' after microstructure name");
        parser.parseRepeated(node, this::parseMicrostructureMember);
        parser.expectClosingBrace(node, "Expected '}' to close microstructure declaration");
        return node;
    }

    private CstNode parseMicrostructureMember() {
        if (isSubBlock(SK_DETECT)) {
            return parseBindingBlock(CstRule.DETECT_BLOCK, SK_DETECT, "detect");
        }
        if (isSubBlock(SK_QUOTE)) {
            return parseBindingBlock(CstRule.QUOTE_BLOCK, SK_QUOTE, "quote");
        }
        if (isSubBlock(SK_HEDGING)) {
            return parseHedgingBlock();
        }
        return parseDataField();
    }

    private CstNode parseHedgingBlock() {
        CstNode node = new CstNode(CstRule.HEDGING_BLOCK);
        node.add(parser.advance());
        parser.expect(node, LBRACE, "Expected '{' after 'hedging'");
        parser.parseRepeated(node, this::parseHedgingRule);
        parser.expectClosingBrace(node, "Expected '}' to close hedging block");
        return node;
    }

    // when (condition) { statement* }
    private CstNode parseHedgingRule() {
        CstNode node = new CstNode(CstRule.HEDGING_RULE);
        parser.expect(node, KW_WHEN, "Expected 'when' to start hedging rule");
        parser.stmtParser.parseCondition(node, "when");
        node.add(parser.stmtParser.parseBlock());
        return node;
    }
}
