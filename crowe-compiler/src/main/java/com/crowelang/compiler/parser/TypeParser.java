package com.crowelang.compiler.parser;

import static com.crowelang.compiler.lexer.TokenType.*;

/**
 * 类型注解解析辅助类
 *
 * <p>'&lt;' 只在类型上下文中被当作类型实参的开始；表达式从不解析类型实参。</p>
 */
class TypeParser {

    private final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * typeExpr := unionType
     */
    CstNode parseTypeExpr() {
        parser.enterNesting("Type");
        try {
            CstNode node = new CstNode(CstRule.TYPE_EXPR);
            node.add(parseUnionType());
            return node;
        } finally {
            parser.exitNesting();
        }
    }

    /**
     * unionType := primaryType ('|' primaryType)*
     */
    private CstNode parseUnionType() {
        CstNode node = new CstNode(CstRule.UNION_TYPE);
        node.add(parsePrimaryType());
        while (parser.match(node, BIT_OR)) {
            node.add(parsePrimaryType());
        }
        return node;
    }

    private CstNode parsePrimaryType() {
        CstNode node = new CstNode(CstRule.PRIMARY_TYPE);

        if (parser.checkAny(KW_INT, KW_FLOAT, KW_STRING, KW_BOOLEAN, KW_DATETIME, KW_VOID)) {
            node.add(parser.advance());
        } else if (parser.check(SK_ARRAY) && parser.checkAhead(LT)) {
            // Array<T>
            node.add(parser.advance());
            parser.expect(node, LT, "Expected '<' after 'Array'");
            node.add(parseTypeExpr());
            expectCloseAngle(node);
        } else if (parser.check(SK_MAP) && parser.checkAhead(LT)) {
            // Map<K, V>
            node.add(parser.advance());
            parser.expect(node, LT, "Expected '<' after 'Map'");
            node.add(parseTypeExpr());
            parser.expect(node, COMMA, "Expected ',' between Map key and value types");
            node.add(parseTypeExpr());
            expectCloseAngle(node);
        } else if (parser.check(LPAREN)) {
            // 函数类型 (A, B) -> R
            parser.expect(node, LPAREN, "Expected '('");
            if (!parser.check(RPAREN)) {
                node.add(parseTypeExpr());
                while (parser.match(node, COMMA)) {
                    node.add(parseTypeExpr());
                }
            }
            parser.expect(node, RPAREN, "Expected ')' after function parameter types");
            parser.expect(node, ARROW, "Expected '->' in function type");
            node.add(parseTypeExpr());
        } else if (parser.checkIdentifier()) {
            // 命名类型，可带类型实参
            node.add(parser.advance());
            if (parser.match(node, LT)) {
                node.add(parseTypeExpr());
                while (parser.match(node, COMMA)) {
                    node.add(parseTypeExpr());
                }
                expectCloseAngle(node);
            }
        } else {
            throw new ParseException("Expected type", parser.current(), "type");
        }

        parser.match(node, QUESTION);
        return node;
    }

    /**
     * 嵌套类型实参的 '&gt;&gt;' 先拆分再匹配
     */
    private void expectCloseAngle(CstNode node) {
        parser.splitShiftRight();
        parser.expect(node, GT, "Expected '>' to close type arguments");
    }
}
