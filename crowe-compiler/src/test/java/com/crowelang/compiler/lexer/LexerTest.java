package com.crowelang.compiler.lexer;

import com.crowelang.compiler.diagnostic.Diagnostic;
import com.crowelang.compiler.diagnostic.DiagnosticKind;
import com.crowelang.compiler.diagnostic.Diagnostics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    private Diagnostics diagnostics;

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        diagnostics = new Diagnostics("<test>");
        return new Lexer(source, diagnostics).scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        List<Token> result = new ArrayList<>();
        for (Token t : scan(source)) {
            if (t.getType() != TokenType.EOF) {
                result.add(t);
            }
        }
        return result;
    }

    private List<TokenType> types(String source) {
        List<TokenType> result = new ArrayList<>();
        for (Token t : tokens(source)) {
            result.add(t.getType());
        }
        return result;
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("单字符与多字符运算符")
        void testOperators() {
            assertSingleToken("+", TokenType.PLUS);
            assertSingleToken("+=", TokenType.PLUS_ASSIGN);
            assertSingleToken("**", TokenType.POWER);
            assertSingleToken("*=", TokenType.MUL_ASSIGN);
            assertSingleToken("==", TokenType.EQ);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("<=", TokenType.LE);
            assertSingleToken(">=", TokenType.GE);
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken("|", TokenType.BIT_OR);
        }

        @Test
        @DisplayName("最长匹配：a**-b")
        void testLongestMatch() {
            assertEquals(Arrays.asList(TokenType.IDENTIFIER, TokenType.POWER, TokenType.MINUS, TokenType.IDENTIFIER),
                    types("a**-b"));
        }
    }

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("硬关键词")
        void testHardKeywords() {
            assertSingleToken("strategy", TokenType.KW_STRATEGY);
            assertSingleToken("when", TokenType.KW_WHEN);
            assertSingleToken("and", TokenType.KW_AND);
            assertSingleToken("not", TokenType.KW_NOT);
            assertSingleToken("datetime", TokenType.KW_DATETIME);
        }

        @Test
        @DisplayName("软关键词可以作为标识符使用")
        void testSoftKeywords() {
            List<Token> toks = tokens("buy close SMA");
            assertEquals(TokenType.SK_BUY, toks.get(0).getType());
            assertEquals(TokenType.SK_CLOSE, toks.get(1).getType());
            assertEquals(TokenType.SK_SMA, toks.get(2).getType());
            for (Token t : toks) {
                assertTrue(t.getType().isIdentifierLike(), t.getLexeme());
            }
        }

        @Test
        @DisplayName("普通标识符")
        void testIdentifier() {
            Token t = tokens("fast_ma2").get(0);
            assertEquals(TokenType.IDENTIFIER, t.getType());
            assertEquals("fast_ma2", t.getLexeme());
        }
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("数字：整数、小数、指数")
        void testNumbers() {
            assertEquals(42.0, tokens("42").get(0).getLiteral());
            assertEquals(0.25, tokens("0.25").get(0).getLiteral());
            assertEquals(1500.0, tokens("1.5e3").get(0).getLiteral());
            assertEquals(0.001, tokens("1e-3").get(0).getLiteral());
        }

        @Test
        @DisplayName("数字后的点不是小数点")
        void testNumberFollowedByDot() {
            assertEquals(Arrays.asList(TokenType.NUMBER_LITERAL, TokenType.DOT, TokenType.IDENTIFIER),
                    types("1.x"));
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            Token t = tokens("\"a\\n\\\"b\\\"\"").get(0);
            assertEquals(TokenType.STRING_LITERAL, t.getType());
            assertEquals("a\n\"b\"", t.getLiteral());
            assertEquals("x", tokens("'x'").get(0).getLiteral());
        }

        @Test
        @DisplayName("日期与日期时间")
        void testDates() {
            Token date = tokens("2024-01-15").get(0);
            assertEquals(TokenType.DATE_LITERAL, date.getType());
            assertEquals("2024-01-15", date.getLiteral());

            Token dateTime = tokens("2024-01-15T09:30:00Z").get(0);
            assertEquals(TokenType.DATE_LITERAL, dateTime.getType());
            assertEquals("2024-01-15T09:30:00Z", dateTime.getLexeme());
        }

        @Test
        @DisplayName("不像日期的减法仍按数字处理")
        void testSubtractionIsNotDate() {
            assertEquals(Arrays.asList(TokenType.NUMBER_LITERAL, TokenType.MINUS, TokenType.NUMBER_LITERAL),
                    types("2024-1"));
        }
    }

    @Nested
    @DisplayName("位置信息")
    class PositionTests {

        @Test
        @DisplayName("行列从 1 开始，偏移量覆盖整个词素")
        void testLineColumnOffsets() {
            List<Token> toks = tokens("a\n  bc");
            Token bc = toks.get(1);
            assertEquals(2, bc.getLine());
            assertEquals(3, bc.getColumn());
            assertEquals(4, bc.getOffset());
            assertEquals(6, bc.getEndOffset());
        }

        @Test
        @DisplayName("字符串的区间包含引号，EOF 为零宽")
        void testStringAndEofSpan() {
            List<Token> toks = tokens("x = \"a\\tb\"");
            Token str = toks.get(2);
            assertEquals(TokenType.STRING_LITERAL, str.getType());
            assertEquals("a\tb", str.getLiteral());
            assertEquals(4, str.getOffset());
            assertEquals(10, str.getEndOffset());
            assertEquals(str.getLexeme().length(), str.length());

            List<Token> all = scan("x = \"a\\tb\"");
            Token eof = all.get(all.size() - 1);
            assertEquals(TokenType.EOF, eof.getType());
            assertEquals(10, eof.getOffset());
            assertEquals(0, eof.length());
        }

        @Test
        @DisplayName("'>>' 可以拆成两个 '>'")
        void testSliceShiftRight() {
            Token shr = tokens("a\n  >> b").get(1);
            assertEquals(TokenType.SHR, shr.getType());
            Token second = shr.slice(TokenType.GT, 1, 2);
            assertEquals(">", second.getLexeme());
            assertEquals(2, second.getLine());
            assertEquals(4, second.getColumn());
            assertEquals(5, second.getOffset());
            assertEquals(6, second.getEndOffset());
            assertThrows(IllegalArgumentException.class, () -> shr.slice(TokenType.GT, 1, 3));
        }

        @Test
        @DisplayName("注释被跳过，块注释中的换行计入行号")
        void testComments() {
            List<Token> toks = tokens("// line\n/* a\n b */ x");
            assertEquals(1, toks.size());
            assertEquals(3, toks.get(0).getLine());
        }

        @Test
        @DisplayName("末尾总是 EOF")
        void testEof() {
            List<Token> all = scan("");
            assertEquals(1, all.size());
            assertEquals(TokenType.EOF, all.get(0).getType());
        }
    }

    @Nested
    @DisplayName("词法错误")
    class ErrorTests {

        @Test
        @DisplayName("无法识别的字符报告错误并继续扫描")
        void testUnrecognizedCharacterRecovery() {
            List<TokenType> result = types("a $$ b");
            assertEquals(Arrays.asList(TokenType.IDENTIFIER, TokenType.IDENTIFIER), result);
            assertEquals(1, diagnostics.errorCount(DiagnosticKind.LEXICAL));
            Diagnostic d = diagnostics.getErrors().get(0);
            assertEquals(1, d.getLine());
            assertEquals(3, d.getColumn());
            assertTrue(d.getMessage().contains("$$"));
        }

        @Test
        @DisplayName("未闭合的字符串")
        void testUnterminatedString() {
            tokens("\"abc\nx");
            assertTrue(diagnostics.hasErrors());
            assertEquals("Unterminated string literal", diagnostics.getErrors().get(0).getMessage());
        }

        @Test
        @DisplayName("未闭合的块注释")
        void testUnterminatedBlockComment() {
            tokens("x /* never closed");
            assertEquals("Unterminated block comment", diagnostics.getErrors().get(0).getMessage());
        }
    }
}
