package com.crowelang.compiler.diagnostic;

import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.lexer.Token;
import com.crowelang.compiler.lexer.TokenType;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 诊断收集与格式化测试
 */
class DiagnosticsTest {

    private static final String SOURCE = "strategy S {\n  rules { when (x) { buy(100) } }\n}\n";

    private Diagnostics sample() {
        Diagnostics d = new Diagnostics("s.crowe");
        d.warning("NO_RISK_MGMT", "Strategy 'S' has no risk management defined", 1, 1);
        Token brace = new Token(TokenType.RBRACE, "}", null, 43, 44, 2, 31);
        d.parseError("Expected ';' after trading action (found '}')", brace, "SEMICOLON");
        d.lexicalError("Unrecognized character sequence '$'", 3, 1);
        return d;
    }

    @Test
    @DisplayName("错误与警告分开收集")
    void testPartition() {
        Diagnostics d = sample();
        assertThat(d.hasErrors()).isTrue();
        assertThat(d.getErrors()).hasSize(2);
        assertThat(d.getWarnings()).hasSize(1);
        assertThat(d.getAll()).hasSize(3);
        assertThat(d.errorCount(DiagnosticKind.PARSE)).isEqualTo(1);
        assertThat(d.errorCount(DiagnosticKind.LEXICAL)).isEqualTo(1);

        d.clear();
        assertThat(d.getAll()).isEmpty();
        assertThat(d.hasErrors()).isFalse();
    }

    @Test
    @DisplayName("文本报告包含位置、源码摘录与插入符")
    void testFormat() {
        String report = sample().format(SOURCE);
        assertThat(report).contains("error[PARSE_ERROR]: Expected ';' after trading action (found '}')");
        assertThat(report).contains("  --> s.crowe:2:31");
        assertThat(report).contains("2 |   rules { when (x) { buy(100) } }");
        assertThat(report).contains("  |                               ^");
        assertThat(report).contains("warning[NO_RISK_MGMT]");
        assertThat(report).endsWith("Found 2 error(s), 1 warning(s)");
        // 错误在警告之前
        assertThat(report.indexOf("error[")).isLessThan(report.indexOf("warning["));
    }

    @Test
    @DisplayName("JSON 输出可以还原为诊断")
    void testJson() {
        JsonObject root = JsonParser.parseString(sample().toJson()).getAsJsonObject();
        assertThat(root.getAsJsonArray("errors")).hasSize(2);
        assertThat(root.getAsJsonArray("warnings")).hasSize(1);

        JsonObject first = root.getAsJsonArray("errors").get(0).getAsJsonObject();
        assertThat(first.get("line").getAsInt()).isEqualTo(2);
        assertThat(first.get("expected").getAsString()).isEqualTo("SEMICOLON");

        Diagnostic restored = Diagnostic.fromJson(first);
        assertThat(restored.getKind()).isEqualTo(DiagnosticKind.PARSE);
        assertThat(restored.isError()).isTrue();
        assertThat(restored.getColumn()).isEqualTo(31);
        assertThat(restored.getFile()).isEqualTo("s.crowe");
    }

    @Test
    @DisplayName("缺少字段的 JSON 被拒绝")
    void testIncompleteJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", "PARSE");
        assertThatThrownBy(() -> Diagnostic.fromJson(obj)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("内部错误转换为诊断")
    void testInternalError() {
        Diagnostic d = new InternalCompilerError("boom").toDiagnostic("x.crowe");
        assertThat(d.getKind()).isEqualTo(DiagnosticKind.INTERNAL);
        assertThat(d.getCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(d.getLine()).isEqualTo(1);
    }

    @Test
    @DisplayName("内部错误的三种构造方式")
    void testInternalErrorConstructors() {
        assertThat(new InternalCompilerError("no span").getSpan()).isNull();

        SourceSpan span = new SourceSpan("x.crowe", 3, 7, 20, 25);
        InternalCompilerError located = new InternalCompilerError("located", span);
        assertThat(located.getSpan()).isSameAs(span);
        assertThat(located.toDiagnostic("x.crowe").getLine()).isEqualTo(3);
        assertThat(located.toDiagnostic("x.crowe").getColumn()).isEqualTo(7);

        IllegalStateException cause = new IllegalStateException("cause");
        InternalCompilerError wrapped = new InternalCompilerError("wrapped", cause);
        assertThat(wrapped.getCause()).isSameAs(cause);
        assertThat(wrapped.getSpan()).isNull();
    }
}
