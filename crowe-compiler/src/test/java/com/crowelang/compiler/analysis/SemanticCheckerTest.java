package com.crowelang.compiler.analysis;

import com.crowelang.compiler.ast.decl.Program;
import com.crowelang.compiler.diagnostic.Diagnostic;
import com.crowelang.compiler.diagnostic.DiagnosticKind;
import com.crowelang.compiler.diagnostic.Diagnostics;
import com.crowelang.compiler.diagnostic.Severity;
import com.crowelang.compiler.lexer.Lexer;
import com.crowelang.compiler.lowering.AstBuilder;
import com.crowelang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 语义检查测试
 */
class SemanticCheckerTest {

    private List<Diagnostic> check(String source) {
        Diagnostics diagnostics = new Diagnostics("sem.crowe");
        Program program = new AstBuilder("sem.crowe").build(
                new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parseProgram());
        assertThat(diagnostics.hasErrors()).isFalse();
        new SemanticChecker(diagnostics).check(program);
        return diagnostics.getWarnings();
    }

    @Test
    @DisplayName("空策略恰好产生两条警告")
    void testEmptyStrategy() {
        List<Diagnostic> warnings = check("strategy Empty { }");
        assertThat(warnings).extracting(Diagnostic::getMessage).containsExactly(
                "Strategy 'Empty' has no trading rules defined",
                "Strategy 'Empty' has no risk management defined");
        assertThat(warnings).extracting(Diagnostic::getCode).containsExactly(
                SemanticChecker.NO_RULES, SemanticChecker.NO_RISK_MGMT);
        assertThat(warnings).allSatisfy(w -> {
            assertThat(w.getKind()).isEqualTo(DiagnosticKind.SEMANTIC);
            assertThat(w.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(w.getLine()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("空的 rules / risk 块等同于缺失")
    void testEmptyBlocks() {
        List<Diagnostic> warnings = check("strategy S { rules { } risk { } }");
        assertThat(warnings).hasSize(2);
    }

    @Test
    @DisplayName("完整策略没有警告")
    void testCompleteStrategy() {
        List<Diagnostic> warnings = check(
                "strategy S {\n"
                + "  rules { when (close > 1) { buy(1); } }\n"
                + "  risk { maxPosition = 10; }\n"
                + "}");
        assertThat(warnings).isEmpty();
    }

    @Test
    @DisplayName("参数、指标、信号共享命名空间")
    void testDuplicateNames() {
        List<Diagnostic> warnings = check(
                "strategy S {\n"
                + "  params { fast: int = 5; }\n"
                + "  indicators { fast = SMA(close, 5); }\n"
                + "  signals { go = true; go = false; }\n"
                + "  rules { when (go) { buy(1); } }\n"
                + "  risk { maxPosition = 10; }\n"
                + "}");
        assertThat(warnings).extracting(Diagnostic::getMessage).containsExactly(
                "Indicator 'fast' is already defined (first defined at line 2)",
                "Signal 'go' is already defined (first defined at line 4)");
        assertThat(warnings).extracting(Diagnostic::getLine).containsExactly(3, 4);
    }

    @Test
    @DisplayName("顶层重名声明")
    void testDuplicateTopLevel() {
        List<Diagnostic> warnings = check("data Bar2 { a: float; }\norder Bar2 { b: float; }");
        assertThat(warnings).singleElement()
                .extracting(Diagnostic::getCode).isEqualTo(SemanticChecker.DUPLICATE_NAME);
    }
}
