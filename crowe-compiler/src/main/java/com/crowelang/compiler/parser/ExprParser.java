package com.crowelang.compiler.parser;

import com.crowelang.compiler.lexer.Token;

import static com.crowelang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：赋值 → 三元 → 逻辑或 → 逻辑与 → 成员关系 → 相等 → 比较 →
 * 加减 → 乘除 → 前缀一元 → 幂 → 后缀 → 基本表达式。
 * 前缀一元运算符比 '**' 绑定更松，因此 {@code -a ** b} 解析为 {@code -(a ** b)}。</p>
 */
class ExprParser {

    private final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    CstNode parseExpression() {
        parser.enterNesting();
        try {
            CstNode node = new CstNode(CstRule.EXPRESSION);
            node.add(parseAssignment());
            return node;
        } finally {
            parser.exitNesting();
        }
    }

    // 赋值（右结合）
    private CstNode parseAssignment() {
        CstNode node = new CstNode(CstRule.ASSIGNMENT);
        node.add(parseConditional());
        if (parser.current().getType().isAssignmentOp()) {
            node.add(parser.advance());
            parser.enterNesting();
            try {
                node.add(parseAssignment());
            } finally {
                parser.exitNesting();
            }
        }
        return node;
    }

    // condition ? a : b
    private CstNode parseConditional() {
        CstNode node = new CstNode(CstRule.CONDITIONAL);
        node.add(parseLogicalOr());
        if (parser.match(node, QUESTION)) {
            node.add(parseLogicalOr());
            parser.expect(node, COLON, "Expected ':' in conditional expression");
            node.add(parseLogicalOr());
        }
        return node;
    }

    private CstNode parseLogicalOr() {
        CstNode node = new CstNode(CstRule.LOGICAL_OR);
        node.add(parseLogicalAnd());
        int links = 0;
        try {
            while (parser.checkAny(OR, KW_OR)) {
                parser.enterNesting();
                links++;
                node.add(parser.advance());
                node.add(parseLogicalAnd());
            }
        } finally {
            parser.exitNesting(links);
        }
        return node;
    }

    private CstNode parseLogicalAnd() {
        CstNode node = new CstNode(CstRule.LOGICAL_AND);
        node.add(parseMembership());
        int links = 0;
        try {
            while (parser.checkAny(AND, KW_AND)) {
                parser.enterNesting();
                links++;
                node.add(parser.advance());
                node.add(parseMembership());
            }
        } finally {
            parser.exitNesting(links);
        }
        return node;
    }

    // a in b / a not in b（不可链式）
    private CstNode parseMembership() {
        CstNode node = new CstNode(CstRule.MEMBERSHIP);
        node.add(parseEquality());
        if (parser.check(KW_IN)) {
            node.add(parser.advance());
            node.add(parseEquality());
        } else if (parser.check(KW_NOT) && parser.checkAhead(KW_IN)) {
            node.add(parser.advance());
            node.add(parser.advance());
            node.add(parseEquality());
        }
        return node;
    }

    private CstNode parseEquality() {
        CstNode node = new CstNode(CstRule.EQUALITY);
        node.add(parseRelational());
        int links = 0;
        try {
            while (parser.checkAny(EQ, NE)) {
                parser.enterNesting();
                links++;
                node.add(parser.advance());
                node.add(parseRelational());
            }
        } finally {
            parser.exitNesting(links);
        }
        return node;
    }

    private CstNode parseRelational() {
        CstNode node = new CstNode(CstRule.RELATIONAL);
        node.add(parseAdditive());
        int links = 0;
        try {
            while (parser.checkAny(LT, LE, GT, GE)) {
                parser.enterNesting();
                links++;
                node.add(parser.advance());
                node.add(parseAdditive());
            }
        } finally {
            parser.exitNesting(links);
        }
        return node;
    }

    /**
     * 左结合链在降级后成为左深的二叉树，因此每多一个操作数都计一层嵌套；
     * 其余二元运算层级与后缀链同理。
     */
    private CstNode parseAdditive() {
        CstNode node = new CstNode(CstRule.ADDITIVE);
        node.add(parseMultiplicative());
        int links = 0;
        try {
            while (parser.checkAny(PLUS, MINUS)) {
                parser.enterNesting();
                links++;
                node.add(parser.advance());
                node.add(parseMultiplicative());
            }
        } finally {
            parser.exitNesting(links);
        }
        return node;
    }

    private CstNode parseMultiplicative() {
        CstNode node = new CstNode(CstRule.MULTIPLICATIVE);
        node.add(parseUnary());
        int links = 0;
        try {
            while (parser.checkAny(MUL, DIV, MOD)) {
                parser.enterNesting();
                links++;
                node.add(parser.advance());
                node.add(parseUnary());
            }
        } finally {
            parser.exitNesting(links);
        }
        return node;
    }

    // 前缀：+ - ! not ~ await
    private CstNode parseUnary() {
        CstNode node = new CstNode(CstRule.UNARY);
        if (parser.checkAny(PLUS, MINUS, NOT, KW_NOT, BIT_NOT, KW_AWAIT)) {
            node.add(parser.advance());
            parser.enterNesting();
            try {
                node.add(parseUnary());
            } finally {
                parser.exitNesting();
            }
        } else {
            node.add(parsePower());
        }
        return node;
    }

    // postfix ('**' unary)?：右操作数经由 unary 递归回到 power，实现右结合
    private CstNode parsePower() {
        CstNode node = new CstNode(CstRule.POWER);
        node.add(parsePostfix());
        if (parser.match(node, POWER)) {
            node.add(parseUnary());
        }
        return node;
    }

    private CstNode parsePostfix() {
        CstNode node = new CstNode(CstRule.POSTFIX);
        node.add(parsePrimary());
        int links = 0;
        try {
            while (parser.checkAny(DOT, LBRACKET, LPAREN)) {
                parser.enterNesting();
                links++;
                if (parser.match(node, DOT)) {
                    Token name = parser.current();
                    if (name.getType().isIdentifierLike() || name.getType().isKeyword()) {
                        node.add(parser.advance());
                    } else {
                        throw new ParseException("Expected member name after '.'", name, IDENTIFIER.name());
                    }
                } else if (parser.match(node, LBRACKET)) {
                    node.add(parseIndexOrSlice());
                    parser.expect(node, RBRACKET, "Expected ']' after index");
                } else {
                    parser.expect(node, LPAREN, "Expected '('");
                    if (!parser.check(RPAREN)) {
                        node.add(parseArgumentList());
                    }
                    parser.expect(node, RPAREN, "Expected ')' after arguments");
                }
            }
        } finally {
            parser.exitNesting(links);
        }
        return node;
    }

    /**
     * indexOrSlice := expr | expr? ':' expr? (':' expr)?
     */
    private CstNode parseIndexOrSlice() {
        CstNode node = new CstNode(CstRule.INDEX_OR_SLICE);
        if (!parser.check(COLON)) {
            node.add(parseExpression());
        }
        if (parser.match(node, COLON)) {
            if (!parser.checkAny(COLON, RBRACKET)) {
                node.add(parseExpression());
            }
            if (parser.match(node, COLON)) {
                node.add(parseExpression());
            }
        }
        return node;
    }

    CstNode parseArgumentList() {
        CstNode node = new CstNode(CstRule.ARGUMENT_LIST);
        node.add(parseExpression());
        while (parser.match(node, COMMA)) {
            node.add(parseExpression());
        }
        return node;
    }

    private CstNode parsePrimary() {
        CstNode node = new CstNode(CstRule.PRIMARY);
        Token t = parser.current();
        switch (t.getType()) {
            case NUMBER_LITERAL:
            case STRING_LITERAL:
            case DATE_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NULL:
                node.add(parser.advance());
                return node;
            case LBRACKET:
                node.add(parseArrayOrComprehension());
                return node;
            case LBRACE:
                node.add(parseObjectLiteral());
                return node;
            case LPAREN:
                node.add(parser.advance());
                node.add(parseExpression());
                parser.expect(node, RPAREN, "Expected ')' after expression");
                return node;
            default:
                if (t.getType().isIdentifierLike()) {
                    node.add(parser.advance());
                    return node;
                }
                throw new ParseException("Expected expression", t, "expression");
        }
    }

    /**
     * 第一个元素之后出现 'for' 即为推导式，否则为数组字面量
     */
    private CstNode parseArrayOrComprehension() {
        Token open = parser.advance();
        if (parser.check(RBRACKET)) {
            CstNode array = new CstNode(CstRule.ARRAY_LITERAL);
            array.add(open);
            array.add(parser.advance());
            return array;
        }

        CstNode first = parseExpression();
        if (parser.check(KW_FOR)) {
            CstNode comp = new CstNode(CstRule.COMPREHENSION);
            comp.add(open);
            comp.add(first);
            comp.add(parser.advance());
            parser.expectIdentifier(comp, "Expected loop variable in comprehension");
            parser.expect(comp, KW_IN, "Expected 'in' in comprehension");
            comp.add(parseExpression());
            if (parser.match(comp, KW_IF)) {
                comp.add(parseExpression());
            }
            parser.expect(comp, RBRACKET, "Expected ']' after comprehension");
            return comp;
        }

        CstNode array = new CstNode(CstRule.ARRAY_LITERAL);
        array.add(open);
        array.add(first);
        while (parser.match(array, COMMA)) {
            array.add(parseExpression());
        }
        parser.expect(array, RBRACKET, "Expected ']' after array elements");
        return array;
    }

    private CstNode parseObjectLiteral() {
        CstNode node = new CstNode(CstRule.OBJECT_LITERAL);
        parser.expect(node, LBRACE, "Expected '{'");
        if (!parser.check(RBRACE)) {
            node.add(parseObjectProperty());
            while (parser.match(node, COMMA)) {
                node.add(parseObjectProperty());
            }
        }
        parser.expect(node, RBRACE, "Expected '}' after object properties");
        return node;
    }

    // key: value | "key": value | shorthand
    private CstNode parseObjectProperty() {
        CstNode node = new CstNode(CstRule.OBJECT_PROPERTY);
        if (parser.check(STRING_LITERAL)) {
            node.add(parser.advance());
            parser.expect(node, COLON, "Expected ':' after property key");
            node.add(parseExpression());
        } else {
            parser.expectIdentifier(node, "Expected property name");
            if (parser.match(node, COLON)) {
                node.add(parseExpression());
            }
        }
        return node;
    }
}
