package com.crowelang.compiler.compiler;

import com.crowelang.compiler.codegen.OptimizationLevel;
import com.crowelang.compiler.codegen.TargetDialect;
import com.crowelang.compiler.diagnostic.Diagnostic;
import com.crowelang.compiler.diagnostic.DiagnosticKind;
import com.crowelang.compiler.diagnostic.Diagnostics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 编译器入口测试
 */
class CroweCompilerTest {

    static final String STRATEGY =
            "strategy Momentum {\n"
            + "  params { fast: int = 10; }\n"
            + "  indicators { ma = SMA(close, fast); }\n"
            + "  rules { when (close > ma) { buy(10); } }\n"
            + "  risk { maxPosition = 100; }\n"
            + "}\n";

    @Nested
    @DisplayName("编译")
    class CompileTests {

        @Test
        @DisplayName("成功编译")
        void testSuccess() {
            CompileResult result = new CroweCompiler(new CompileOptions().setUseCache(false))
                    .compile(STRATEGY, "momentum.crowe");
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getErrors()).isEmpty();
            assertThat(result.getWarnings()).isEmpty();
            assertThat(result.getAst()).isNotNull();
            assertThat(result.getAst().getStrategies()).hasSize(1);
            assertThat(result.getCode()).contains("export class Momentum extends BaseStrategy {");
            assertThat(result.getSourceMap()).isNull();
        }

        @Test
        @DisplayName("语法错误时代码为空字符串")
        void testSyntaxError() {
            CompileResult result = new CroweCompiler().compile("strategy S { rules { when (x > ) { } } }", "bad.crowe");
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getCode()).isEmpty();
            assertThat(result.getErrors()).extracting(Diagnostic::getKind).contains(DiagnosticKind.PARSE);
            assertThat(result.getErrors().get(0).getFile()).isEqualTo("bad.crowe");
        }

        @Test
        @DisplayName("语义警告不阻止代码生成")
        void testWarningsOnly() {
            CompileResult result = new CroweCompiler().compile("strategy Empty { }", "empty.crowe");
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getWarnings()).hasSize(2);
            assertThat(result.getCode()).contains("export class Empty extends BaseStrategy {");
        }

        @Test
        @DisplayName("两次编译的代码与诊断完全相同")
        void testDeterminism() {
            CroweCompiler compiler = new CroweCompiler(new CompileOptions().setUseCache(false));
            String source = "strategy Empty { }\nstrategy Bad { rules { when (x > ) { } } }";
            CompileResult first = compiler.compile(source, "d.crowe");
            CompileResult second = compiler.compile(source, "d.crowe");
            assertThat(Diagnostics.toJson(second.getErrors(), second.getWarnings()))
                    .isEqualTo(Diagnostics.toJson(first.getErrors(), first.getWarnings()));

            assertThat(compiler.compile(STRATEGY, "m.crowe").getCode())
                    .isEqualTo(compiler.compile(STRATEGY, "m.crowe").getCode());
        }

        @Test
        @DisplayName("开启 Source Map")
        void testSourceMap() {
            CompileResult result = new CroweCompiler(new CompileOptions().setSourceMap(true))
                    .compile(STRATEGY, "momentum.crowe");
            assertThat(result.getSourceMap()).contains("\"version\":3");
            assertThat(result.getCode()).contains("//# sourceMappingURL=momentum.ts.map");
        }

        @Test
        @DisplayName("选项在构造时复制")
        void testOptionsCopied() {
            CompileOptions options = new CompileOptions();
            CroweCompiler compiler = new CroweCompiler(options);
            options.setTarget(TargetDialect.JAVASCRIPT);
            assertThat(compiler.getOptions().getTarget()).isEqualTo(TargetDialect.TYPESCRIPT);
            assertThat(compiler.compile(STRATEGY, "m.crowe").getCode()).contains("StrategyConfig");
        }

        @Test
        @DisplayName("嵌套深度限制")
        void testNestingDepth() {
            StringBuilder sb = new StringBuilder("indicator f() = ");
            for (int i = 0; i < 10; i++) sb.append('(');
            sb.append('1');
            for (int i = 0; i < 10; i++) sb.append(')');
            sb.append(';');

            CompileResult shallow = new CroweCompiler(new CompileOptions().setMaxNestingDepth(4))
                    .compile(sb.toString(), "deep.crowe");
            assertThat(shallow.isSuccess()).isFalse();
            assertThat(new CroweCompiler().compile(sb.toString(), "deep.crowe").isSuccess()).isTrue();
            assertThatThrownBy(() -> new CompileOptions().setMaxNestingDepth(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("缓存")
    class CacheTests {

        @Test
        @DisplayName("相同输入命中缓存且不重新解析")
        void testCacheHit() {
            CroweCompiler compiler = new CroweCompiler();
            CompileResult first = compiler.compile(STRATEGY, "m.crowe");
            CompileResult second = compiler.compile(STRATEGY, "m.crowe");

            assertThat(first.isFromCache()).isFalse();
            assertThat(second.isFromCache()).isTrue();
            assertThat(second.getCode()).isEqualTo(first.getCode());
            assertThat(compiler.getStats().getParseRuns()).isEqualTo(1);
            assertThat(compiler.getStats().getGenerateRuns()).isEqualTo(1);
            assertThat(compiler.getStats().getCacheHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("改动一个字符就重新编译")
        void testOneCharacterChange() {
            CroweCompiler compiler = new CroweCompiler();
            compiler.compile(STRATEGY, "m.crowe");
            CompileResult changed = compiler.compile(STRATEGY.replace("buy(10)", "buy(11)"), "m.crowe");

            assertThat(changed.isFromCache()).isFalse();
            assertThat(changed.getCode()).contains("this.buy(bar.symbol, 11);");
            assertThat(compiler.getStats().getParseRuns()).isEqualTo(2);
        }

        @Test
        @DisplayName("文件名参与缓存键")
        void testFileNameInKey() {
            CroweCompiler compiler = new CroweCompiler();
            compiler.compile(STRATEGY, "a.crowe");
            CompileResult other = compiler.compile(STRATEGY, "b.crowe");
            assertThat(other.isFromCache()).isFalse();
            assertThat(other.getCode()).contains("from b.crowe.");
        }

        @Test
        @DisplayName("失败结果不缓存")
        void testErrorsNotCached() {
            CroweCompiler compiler = new CroweCompiler();
            String bad = "strategy S { @ }";
            assertThat(compiler.compile(bad, "bad.crowe").isSuccess()).isFalse();
            CompileResult again = compiler.compile(bad, "bad.crowe");
            assertThat(again.isFromCache()).isFalse();
            assertThat(again.getCode()).isEmpty();
            assertThat(compiler.getStats().getParseRuns()).isEqualTo(2);
        }

        @Test
        @DisplayName("不同优化级别使用不同的缓存项")
        void testOptionsInKey(@TempDir Path directory) {
            CompileOptions options = new CompileOptions().setCacheDirectory(directory);
            new CroweCompiler(options).compile(STRATEGY, "m.crowe");

            CroweCompiler aggressive = new CroweCompiler(options.copy().setOptimization(OptimizationLevel.AGGRESSIVE));
            assertThat(aggressive.compile(STRATEGY, "m.crowe").isFromCache()).isFalse();

            CroweCompiler reopened = new CroweCompiler(options);
            CompileResult fromDisk = reopened.compile(STRATEGY, "m.crowe");
            assertThat(fromDisk.isFromCache()).isTrue();
            assertThat(fromDisk.getAst()).isNull();
            assertThat(reopened.getStats().getParseRuns()).isZero();
        }

        @Test
        @DisplayName("关闭缓存时每次都编译")
        void testNoCache() {
            CroweCompiler compiler = new CroweCompiler(new CompileOptions().setUseCache(false));
            compiler.compile(STRATEGY, "m.crowe");
            assertThat(compiler.compile(STRATEGY, "m.crowe").isFromCache()).isFalse();
            assertThat(compiler.getStats().getParseRuns()).isEqualTo(2);
            assertThat(compiler.getStats().getCacheHits()).isZero();
        }
    }

    @Nested
    @DisplayName("只检查")
    class ParseTests {

        @Test
        @DisplayName("返回 AST 与诊断，不生成代码")
        void testParseWithDiagnostics() {
            CroweCompiler compiler = new CroweCompiler();
            ParseOutcome outcome = compiler.parseWithDiagnostics("strategy Empty { }", "e.crowe");
            assertThat(outcome.hasErrors()).isFalse();
            assertThat(outcome.getAst().getStrategies()).hasSize(1);
            assertThat(outcome.getWarnings()).hasSize(2);
            assertThat(compiler.getStats().getGenerateRuns()).isZero();
        }

        @Test
        @DisplayName("存在错误时仍尽力返回 AST")
        void testParseErrors() {
            ParseOutcome outcome = new CroweCompiler().parseWithDiagnostics(
                    "strategy A { rules { when (close > 1) { buy(1) } } }\nstrategy B { }", "e.crowe");
            assertThat(outcome.hasErrors()).isTrue();
            assertThat(outcome.getErrors().get(0).getKind()).isEqualTo(DiagnosticKind.PARSE);
        }
    }

    @Nested
    @DisplayName("并发")
    class ConcurrencyTests {

        private static final int THREADS = 8;
        private static final int CALLS = 32;

        private List<CompileResult> compileConcurrently(CroweCompiler compiler, List<String> sources,
                                                        List<String> fileNames) throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(THREADS);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<CompileResult>> futures = new ArrayList<>();
                for (int i = 0; i < sources.size(); i++) {
                    String source = sources.get(i);
                    String fileName = fileNames.get(i);
                    futures.add(pool.submit(() -> {
                        start.await();
                        return compiler.compile(source, fileName);
                    }));
                }
                start.countDown();
                List<CompileResult> results = new ArrayList<>();
                for (Future<CompileResult> f : futures) {
                    results.add(f.get(30, TimeUnit.SECONDS));
                }
                return results;
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("同一源码的并发请求只编译一次")
        void testSingleFlight() throws Exception {
            CroweCompiler compiler = new CroweCompiler();
            List<String> sources = new ArrayList<>();
            List<String> fileNames = new ArrayList<>();
            for (int i = 0; i < CALLS; i++) {
                sources.add(STRATEGY);
                fileNames.add("same.crowe");
            }
            List<CompileResult> results = compileConcurrently(compiler, sources, fileNames);

            String expected = results.get(0).getCode();
            assertThat(results).allSatisfy(r -> {
                assertThat(r.isSuccess()).isTrue();
                assertThat(r.getCode()).isEqualTo(expected);
            });
            assertThat(results).filteredOn(r -> !r.isFromCache()).hasSize(1);

            CompileStats stats = compiler.getStats();
            assertThat(stats.getGenerateRuns()).isEqualTo(1);
            assertThat(stats.getParseRuns()).isEqualTo(1);
            assertThat(stats.getCacheMisses()).isEqualTo(1);
            assertThat(stats.getCacheHits() + stats.getCacheMisses()).isEqualTo(CALLS);
        }

        @Test
        @DisplayName("并发编译不同源码与顺序编译结果一致")
        void testIndependentSources() throws Exception {
            List<String> sources = new ArrayList<>();
            List<String> fileNames = new ArrayList<>();
            for (int i = 0; i < CALLS; i++) {
                sources.add(STRATEGY.replace("buy(10)", "buy(" + (i + 1) + ")"));
                fileNames.add("c" + (i % 4) + ".crowe");
            }
            CroweCompiler compiler = new CroweCompiler(new CompileOptions().setUseCache(false));
            List<CompileResult> results = compileConcurrently(compiler, sources, fileNames);

            CroweCompiler sequential = new CroweCompiler(new CompileOptions().setUseCache(false));
            for (int i = 0; i < CALLS; i++) {
                assertThat(results.get(i).getCode())
                        .isEqualTo(sequential.compile(sources.get(i), fileNames.get(i)).getCode())
                        .contains("this.buy(bar.symbol, " + (i + 1) + ");");
            }
            assertThat(compiler.getStats().getGenerateRuns()).isEqualTo(CALLS);
        }
    }

    @Nested
    @DisplayName("超长输入")
    class LargeInputTests {

        private String repeat(String text, int times) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < times; i++) sb.append(text);
            return sb.toString();
        }

        @Test
        @DisplayName("超长运算链返回语法错误而不是栈溢出")
        void testLongChains() {
            CroweCompiler compiler = new CroweCompiler(new CompileOptions().setUseCache(false));

            CompileResult additive = compiler.compile("indicator f() = 1" + repeat(" + x", 20000) + ";", "long.crowe");
            assertThat(additive.isSuccess()).isFalse();
            assertThat(additive.getCode()).isEmpty();
            assertThat(additive.getErrors().get(0).getMessage()).contains("nesting too deep");

            CompileResult member = compiler.compile("indicator f() = a" + repeat(".b", 20000) + ";", "long.crowe");
            assertThat(member.isSuccess()).isFalse();
            assertThat(member.getErrors().get(0).getKind()).isEqualTo(DiagnosticKind.PARSE);
        }

        @Test
        @DisplayName("深层类型返回语法错误")
        void testDeepType() {
            CompileResult result = new CroweCompiler().compile(
                    "data D { x: " + repeat("Array<", 20000) + "int" + repeat(">", 20000) + "; }", "deep.crowe");
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors().get(0).getMessage()).contains("Type nesting too deep");
        }

        @Test
        @DisplayName("上限以内的长链可以生成并折叠")
        void testChainWithinLimit() {
            String source = "indicator f() = 1" + repeat(" + 1", 199) + ";";
            CompileResult plain = new CroweCompiler().compile(source, "sum.crowe");
            assertThat(plain.isSuccess()).isTrue();
            assertThat(plain.getCode()).contains("return 1" + repeat(" + 1", 199) + ";");

            CompileResult folded = new CroweCompiler(new CompileOptions().setOptimization(OptimizationLevel.AGGRESSIVE))
                    .compile(source, "sum.crowe");
            assertThat(folded.getCode()).contains("return 200;");
        }
    }
}
