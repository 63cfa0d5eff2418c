package com.crowelang.compiler.parser;

import static com.crowelang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 *
 * <p>语句位置上的 '{' 总是代码块；语句开头的 {@code ID ':'} 选择变量声明。</p>
 */
class StmtParser {

    private final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * block := '{' statement* '}'
     */
    CstNode parseBlock() {
        CstNode node = new CstNode(CstRule.BLOCK);
        parser.expect(node, LBRACE, "Expected '{' to start block");
        parser.enterNesting();
        try {
            parser.parseRepeated(node, this::parseStatement);
        } finally {
            parser.exitNesting();
        }
        parser.expectClosingBrace(node, "Expected '}' to close block");
        return node;
    }

    CstNode parseStatement() {
        CstNode node = new CstNode(CstRule.STATEMENT);
        switch (parser.current().getType()) {
            case KW_IF:       node.add(parseIf()); break;
            case KW_WHILE:    node.add(parseWhile()); break;
            case KW_FOR:      node.add(parseFor()); break;
            case KW_RETURN:   node.add(parseReturn()); break;
            case KW_BREAK:    node.add(parseJump(CstRule.BREAK_STATEMENT, "break")); break;
            case KW_CONTINUE: node.add(parseJump(CstRule.CONTINUE_STATEMENT, "continue")); break;
            case KW_WHEN:     node.add(parseWhen()); break;
            case LBRACE:      node.add(parseBlock()); break;
            default:
                if (parser.checkIdentifier() && parser.checkAhead(COLON)) {
                    node.add(parseVariableDeclaration());
                } else {
                    node.add(parseExpressionStatement());
                }
                break;
        }
        return node;
    }

    // name: type = expr;
    private CstNode parseVariableDeclaration() {
        CstNode node = new CstNode(CstRule.VARIABLE_DECLARATION);
        parser.expectIdentifier(node, "Expected variable name");
        parser.expect(node, COLON, "Expected ':' after variable name");
        node.add(parser.typeParser.parseTypeExpr());
        parser.expect(node, ASSIGN, "Expected '=' in variable declaration");
        node.add(parser.exprParser.parseExpression());
        parser.expect(node, SEMICOLON, "Expected ';' after variable declaration");
        return node;
    }

    // if (c) { } elif (c) { } else { }
    private CstNode parseIf() {
        CstNode node = new CstNode(CstRule.IF_STATEMENT);
        parser.expect(node, KW_IF, "Expected 'if'");
        parseCondition(node, "if");
        node.add(parseBlock());
        while (parser.match(node, KW_ELIF)) {
            parseCondition(node, "elif");
            node.add(parseBlock());
        }
        if (parser.match(node, KW_ELSE)) {
            node.add(parseBlock());
        }
        return node;
    }

    private CstNode parseWhile() {
        CstNode node = new CstNode(CstRule.WHILE_STATEMENT);
        parser.expect(node, KW_WHILE, "Expected 'while'");
        parseCondition(node, "while");
        node.add(parseBlock());
        return node;
    }

    // for x in xs { }
    private CstNode parseFor() {
        CstNode node = new CstNode(CstRule.FOR_STATEMENT);
        parser.expect(node, KW_FOR, "Expected 'for'");
        parser.expectIdentifier(node, "Expected loop variable after 'for'");
        parser.expect(node, KW_IN, "Expected 'in' after loop variable");
        node.add(parser.exprParser.parseExpression());
        node.add(parseBlock());
        return node;
    }

    private CstNode parseReturn() {
        CstNode node = new CstNode(CstRule.RETURN_STATEMENT);
        parser.expect(node, KW_RETURN, "Expected 'return'");
        if (!parser.check(SEMICOLON)) {
            node.add(parser.exprParser.parseExpression());
        }
        parser.expect(node, SEMICOLON, "Expected ';' after return statement");
        return node;
    }

    private CstNode parseJump(CstRule rule, String keyword) {
        CstNode node = new CstNode(rule);
        node.add(parser.advance());
        parser.expect(node, SEMICOLON, "Expected ';' after '" + keyword + "'");
        return node;
    }

    private CstNode parseWhen() {
        CstNode node = new CstNode(CstRule.WHEN_STATEMENT);
        parser.expect(node, KW_WHEN, "Expected 'when'");
        parseCondition(node, "when");
        node.add(parseBlock());
        return node;
    }

    private CstNode parseExpressionStatement() {
        CstNode node = new CstNode(CstRule.EXPRESSION_STATEMENT);
        node.add(parser.exprParser.parseExpression());
        parser.expect(node, SEMICOLON, "Expected ';' after expression");
        return node;
    }

    /**
     * '(' expr ')'
     */
    void parseCondition(CstNode node, String keyword) {
        parser.expect(node, LPAREN, "Expected '(' after '" + keyword + "'");
        node.add(parser.exprParser.parseExpression());
        parser.expect(node, RPAREN, "Expected ')' after " + keyword + " condition");
    }
}
