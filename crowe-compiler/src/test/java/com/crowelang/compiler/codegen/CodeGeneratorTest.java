package com.crowelang.compiler.codegen;

import com.crowelang.compiler.ast.decl.Program;
import com.crowelang.compiler.compiler.CompileOptions;
import com.crowelang.compiler.diagnostic.Diagnostics;
import com.crowelang.compiler.lexer.Lexer;
import com.crowelang.compiler.lowering.AstBuilder;
import com.crowelang.compiler.parser.Parser;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TypeScript / JavaScript 代码生成测试
 */
class CodeGeneratorTest {

    static final String MEAN_REVERSION =
            "strategy MeanReversion {\n"
            + "  params {\n"
            + "    lookback: int = 20;\n"
            + "    threshold: float = 2.0;\n"
            + "  }\n"
            + "  indicators {\n"
            + "    sma = SMA(close, lookback);\n"
            + "    rsi = RSI(close, 14);\n"
            + "  }\n"
            + "  signals {\n"
            + "    oversold = rsi < 30;\n"
            + "    overbought = rsi > 70;\n"
            + "  }\n"
            + "  rules {\n"
            + "    when (oversold and position.quantity == 0) {\n"
            + "      buy(100);\n"
            + "    }\n"
            + "    when (overbought) {\n"
            + "      sell(100, close * 1.01);\n"
            + "    }\n"
            + "  }\n"
            + "  risk {\n"
            + "    maxPosition = 1000;\n"
            + "    stopLoss = 0.02;\n"
            + "  }\n"
            + "}\n";

    private GeneratedCode generate(String source, CompileOptions options) {
        Diagnostics diagnostics = new Diagnostics("mean.crowe");
        Program program = new AstBuilder("mean.crowe").build(
                new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parseProgram());
        assertThat(diagnostics.getErrors()).isEmpty();
        return new CodeGenerator(options).generate(program, "mean.crowe", source);
    }

    private String ts(String source) {
        return generate(source, new CompileOptions()).getCode();
    }

    private String js(String source) {
        return generate(source, new CompileOptions().setTarget(TargetDialect.JAVASCRIPT)).getCode();
    }

    /** 生成一个表达式体指标的 return 语句内容 */
    private String expr(String params, String expression) {
        String code = ts("indicator f(" + params + ") = " + expression + ";");
        int start = code.indexOf("return ") + "return ".length();
        return code.substring(start, code.indexOf(";\n", start));
    }

    @Nested
    @DisplayName("策略类")
    class StrategyTests {

        @Test
        @DisplayName("文件头与运行时导入")
        void testHeaderAndImports() {
            String code = ts(MEAN_REVERSION);
            assertThat(code).startsWith("// Generated by the CroweLang compiler from mean.crowe. Do not edit.\n");
            assertThat(code).contains("import { BaseStrategy, StrategyConfig, Bar } from '@crowelang/runtime';");
            assertThat(code).contains("import { RSI, SMA } from '@crowelang/runtime/indicators';");
        }

        @Test
        @DisplayName("参数接口与默认值")
        void testParams() {
            String code = ts(MEAN_REVERSION);
            assertThat(code).contains("export interface MeanReversionParams {\n  lookback: number;\n  threshold: number;\n}");
            assertThat(code).contains("export class MeanReversion extends BaseStrategy {");
            assertThat(code).contains("constructor(config: StrategyConfig, params: Partial<MeanReversionParams> = {}) {");
            assertThat(code).contains("lookback: params.lookback ?? 20,");
            assertThat(code).contains("threshold: params.threshold ?? 2,");
        }

        @Test
        @DisplayName("风控限额变成静态常量")
        void testRiskLimits() {
            String code = ts(MEAN_REVERSION);
            assertThat(code).contains("static readonly MAX_POSITION = 1000;");
            assertThat(code).contains("static readonly STOP_LOSS = 0.02;");
            assertThat(code).contains("getRiskLimits(): Record<string, number> {");
            assertThat(code).contains("maxPosition: MeanReversion.MAX_POSITION,");
        }

        @Test
        @DisplayName("后面的限额可以引用前面的限额")
        void testRiskReferences() {
            String code = ts("strategy S { risk { maxPosition = 1000; maxOrder = maxPosition / 10; } }");
            assertThat(code).contains("static readonly MAX_ORDER = S.MAX_POSITION / 10;");
        }

        @Test
        @DisplayName("onBar 依次计算指标、信号与规则")
        void testOnBarOrder() {
            String code = ts(MEAN_REVERSION);
            assertThat(code).contains("async onBar(bar: Bar): Promise<void> {");
            assertThat(code).contains("const sma = SMA(close, this.params.lookback);\n    this.setIndicator('sma', sma);");
            assertThat(code).contains("const oversold = rsi < 30;\n    this.setSignal('oversold', oversold);");
            assertThat(code).contains("if (oversold && position.quantity === 0) {\n      this.buy(bar.symbol, 100);\n    }");
            assertThat(code).contains("this.sell(bar.symbol, 100, close * 1.01);");

            int indicator = code.indexOf("const rsi");
            int signal = code.indexOf("const overbought");
            int rule = code.indexOf("if (overbought)");
            assertThat(indicator).isLessThan(signal);
            assertThat(signal).isLessThan(rule);
        }

        @Test
        @DisplayName("单条规则的最小示例")
        void testSingleRule() {
            String code = ts("strategy S { indicators { rsi = RSI(close, 14); } rules { when (rsi < 30) { buy(100); } } }");
            assertThat(code).contains("if (rsi < 30) {");
            assertThat(code).contains("this.buy(bar.symbol, 100);");
        }

        @Test
        @DisplayName("事件处理器的方法名与 position 解析")
        void testEventHandlers() {
            String code = ts(
                    "strategy S {\n"
                    + "  rules { when (true) { buy(1); } }\n"
                    + "  event {\n"
                    + "    on_fill(fill: Fill) { x: float = position.quantity; }\n"
                    + "    on_risk_breach() { return; }\n"
                    + "  }\n"
                    + "}");
            assertThat(code).contains("onFill(fill: Fill): void {");
            assertThat(code).contains("let x: number = this.getPosition(fill.symbol).quantity;");
            assertThat(code).contains("onRiskBreach(): void {");
            assertThat(code).contains("import { BaseStrategy, StrategyConfig, Bar, Fill } from '@crowelang/runtime';");
        }

        @Test
        @DisplayName("用户 on_bar 主体追加在规则之后，并使用其参数名")
        void testUserOnBar() {
            String code = ts(
                    "strategy S {\n"
                    + "  rules { when (close > 1) { buy(1); } }\n"
                    + "  event { on_bar(b: Bar) { if (close > 2) { notify(close); } } }\n"
                    + "}");
            assertThat(code).contains("async onBar(b: Bar): Promise<void> {");
            assertThat(code).contains("const close = b.close;");
            assertThat(code).contains("this.buy(b.symbol, 1);");
            assertThat(code.indexOf("this.buy")).isLessThan(code.indexOf("notify(close);"));
            assertThat(code).doesNotContain("async onBar(bar");
        }

        @Test
        @DisplayName("await 使处理器变为 async")
        void testAwaitMakesAsync() {
            String code = ts("strategy S { event { on_fill(fill: Fill) { await sync(fill); } } }");
            assertThat(code).contains("async onFill(fill: Fill): Promise<void> {");
            assertThat(code).contains("await sync(fill);");
        }

        @Test
        @DisplayName("运行时参数类型检查")
        void testRuntimeTypeChecks() {
            String code = generate(MEAN_REVERSION, new CompileOptions().setRuntimeTypeChecks(true)).getCode();
            assertThat(code).contains("if (typeof this.params.lookback !== 'number') {");
            assertThat(code).contains("throw new TypeError('Parameter \\'lookback\\' must be of type int');");
            assertThat(ts(MEAN_REVERSION)).doesNotContain("TypeError");
        }
    }

    @Nested
    @DisplayName("JavaScript 方言")
    class JavaScriptTests {

        @Test
        @DisplayName("不输出任何类型标注")
        void testNoTypes() {
            String code = js(MEAN_REVERSION + "data Quote2 { bid: float; ask: float = 1; }\n");
            assertThat(code).doesNotContain(": number", "interface", "readonly", "Partial<", "Promise<");
            assertThat(code).contains("import { BaseStrategy } from '@crowelang/runtime';");
            assertThat(code).contains("constructor(config, params = {}) {");
            assertThat(code).contains("static MAX_POSITION = 1000;");
            assertThat(code).contains("async onBar(bar) {");
            assertThat(code).contains("export const Quote2Defaults = {");
        }

        @Test
        @DisplayName("输出文件名")
        void testOutputFileName() {
            assertThat(CodeGenerator.outputFileName("strategies/mean.crowe", TargetDialect.JAVASCRIPT)).isEqualTo("mean.js");
            assertThat(CodeGenerator.outputFileName("C:\\s\\mean.crowe", TargetDialect.TYPESCRIPT)).isEqualTo("mean.ts");
            assertThat(CodeGenerator.outputFileName("noext", TargetDialect.TYPESCRIPT)).isEqualTo("noext.ts");
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("根据优先级插入括号")
        void testParentheses() {
            assertThat(expr("a: float, b: float, c: float", "a - (b - c)")).isEqualTo("a - (b - c)");
            assertThat(expr("a: float, b: float, c: float", "(a - b) - c")).isEqualTo("a - b - c");
            assertThat(expr("a: float, b: float, c: float", "(a + b) * c")).isEqualTo("(a + b) * c");
            assertThat(expr("a: float, b: float", "not (a > b)")).isEqualTo("!(a > b)");
        }

        @Test
        @DisplayName("** 的一元操作数总是加括号")
        void testPowerOperands() {
            assertThat(expr("a: float, b: float", "-a ** b")).isEqualTo("-(a ** b)");
            assertThat(expr("a: float, b: float", "(-a) ** b")).isEqualTo("(-a) ** b");
            assertThat(expr("a: float, b: float", "a ** -b")).isEqualTo("a ** (-b)");
            assertThat(expr("a: float, b: float, c: float", "(a ** b) ** c")).isEqualTo("(a ** b) ** c");
            assertThat(expr("a: float, b: float, c: float", "a ** b ** c")).isEqualTo("a ** b ** c");
        }

        @Test
        @DisplayName("相等与成员运算映射")
        void testOperatorMapping() {
            assertThat(expr("a: float, b: float", "a == b or a != b")).isEqualTo("a === b || a !== b");
            assertThat(expr("x: float, xs: Array<float>", "x in xs")).isEqualTo("xs.includes(x)");
            assertThat(expr("x: float", "x not in [1, 2]")).isEqualTo("![1, 2].includes(x)");
        }

        @Test
        @DisplayName("切片与推导式")
        void testSliceAndComprehension() {
            assertThat(expr("xs: Array<float>", "xs[1:3]")).isEqualTo("xs.slice(1, 3)");
            assertThat(expr("xs: Array<float>", "xs[:3]")).isEqualTo("xs.slice(0, 3)");
            assertThat(expr("xs: Array<float>", "xs[-5:]")).isEqualTo("xs.slice(-5)");
            assertThat(expr("xs: Array<float>", "xs[::2]")).isEqualTo("xs.slice().filter((_, i) => i % 2 === 0)");
            assertThat(expr("xs: Array<float>", "[x * 2 for x in xs if x > 0]"))
                    .isEqualTo("xs.filter((x) => x > 0).map((x) => x * 2)");
            assertThat(expr("xs: Array<float>", "[x for x in xs if x > 0]")).isEqualTo("xs.filter((x) => x > 0)");
        }

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            assertThat(expr("", "2024-01-15")).isEqualTo("new Date('2024-01-15')");
            assertThat(expr("", "\"it's\"")).isEqualTo("'it\\'s'");
            assertThat(expr("", "1.50")).isEqualTo("1.5");
            assertThat(expr("a: float", "{ a, b: 2 }")).isEqualTo("{ a, b: 2 }");
        }
    }

    @Nested
    @DisplayName("其他声明")
    class DeclarationTests {

        @Test
        @DisplayName("data 声明：接口、默认值、计算指标")
        void testDataDecl() {
            String code = ts("data Trade2 {\n  price: float;\n  qty?: int = 1;\n"
                    + "  metrics { notional: float = price * qty; }\n}");
            assertThat(code).contains("export interface Trade2 {\n  price: number;\n  qty?: number;\n}");
            assertThat(code).contains("export const Trade2Defaults: Partial<Trade2> = {\n  qty: 1,\n};");
            assertThat(code).contains("export function computeTrade2Metrics(data: Trade2): Trade2Metrics {");
            assertThat(code).contains("const notional = data.price * data.qty;");
            assertThat(code).contains("return { notional };");
        }

        @Test
        @DisplayName("程序内指标不从运行时导入")
        void testProgramIndicator() {
            String code = ts("indicator twice(x: float) -> float = x * 2;\n"
                    + "strategy S { indicators { t = twice(close); } rules { when (t > 1) { buy(1); } } }");
            assertThat(code).contains("export function twice(x: number): number {\n  return x * 2;\n}");
            assertThat(code).contains("const t = twice(close);");
            assertThat(code).doesNotContain("/indicators';");
        }

        @Test
        @DisplayName("用户 import 转换为 ES import")
        void testImports() {
            String code = ts("import { helper } from \"./util\";\nimport lib from \"./lib\";\n"
                    + "import \"./common\" as common;\nimport \"./setup\";\n");
            assertThat(code).contains("import { helper } from './util';");
            assertThat(code).contains("import lib from './lib';");
            assertThat(code).contains("import * as common from './common';");
            assertThat(code).contains("import './setup';");
        }

        @Test
        @DisplayName("微观结构类")
        void testMicrostructure() {
            String code = ts("microstructure Maker {\n"
                    + "  spread: float = 0.01;\n"
                    + "  detect { wide = spread > 0.05; }\n"
                    + "  quote { bid = 1; }\n"
                    + "  hedging { when (wide) { spread = 0.02; } }\n"
                    + "}");
            assertThat(code).contains("export class Maker {");
            assertThat(code).contains("spread: number = 0.01;");
            assertThat(code).contains("wide(): boolean {\n    return this.spread > 0.05;\n  }");
            assertThat(code).contains("getQuotes(): Record<string, number> {");
            assertThat(code).contains("applyHedging(): void {\n    if (wide) {\n      this.spread = 0.02;\n    }");
        }

        @Test
        @DisplayName("回测配置常量")
        void testBacktest() {
            String code = ts("backtest B { start = 2024-01-01; costs { commission = 0.001; } output { report = \"html\"; } }");
            assertThat(code).contains("export const B = {\n  start: new Date('2024-01-01'),\n  costs: {\n    commission: 0.001,\n  },");
            assertThat(code).contains("output: {\n    report: 'html',\n  },\n};");
        }
    }

    @Nested
    @DisplayName("优化级别")
    class OptimizationTests {

        @Test
        @DisplayName("NONE 输出全部行情绑定，BASIC 只输出用到的")
        void testBindingPruning() {
            String none = generate(MEAN_REVERSION, new CompileOptions().setOptimization(OptimizationLevel.NONE)).getCode();
            assertThat(none).contains("const open = bar.open;", "const volume = bar.volume;",
                    "const portfolio = this.getPortfolio();");

            String basic = ts(MEAN_REVERSION);
            assertThat(basic).contains("const close = bar.close;", "const position = this.getPosition(bar.symbol);");
            assertThat(basic).doesNotContain("const open = bar.open;", "const portfolio");
        }

        @Test
        @DisplayName("AGGRESSIVE 折叠常量并删除恒假规则")
        void testAggressive() {
            String source = "strategy S {\n"
                    + "  signals { hot = close > 2 * 50 + 1; }\n"
                    + "  rules {\n"
                    + "    when (false) { buy(1); }\n"
                    + "    when (hot) { sell(1); }\n"
                    + "  }\n"
                    + "}";
            String aggressive = generate(source,
                    new CompileOptions().setOptimization(OptimizationLevel.AGGRESSIVE)).getCode();
            assertThat(aggressive).contains("const hot = close > 101;");
            assertThat(aggressive).doesNotContain("if (false)", "this.buy");
            assertThat(aggressive).contains("this.sell(bar.symbol, 1);");

            String basic = ts(source);
            assertThat(basic).contains("const hot = close > 2 * 50 + 1;", "if (false) {");
        }

        @Test
        @DisplayName("除零不折叠")
        void testNoFoldingOnDivisionByZero() {
            String code = generate("indicator f() = 1 / 0;",
                    new CompileOptions().setOptimization(OptimizationLevel.AGGRESSIVE)).getCode();
            assertThat(code).contains("return 1 / 0;");
        }
    }

    @Nested
    @DisplayName("确定性与 Source Map")
    class OutputTests {

        @Test
        @DisplayName("相同输入产生逐字节相同的输出")
        void testDeterminism() {
            assertThat(ts(MEAN_REVERSION)).isEqualTo(ts(MEAN_REVERSION));
        }

        @Test
        @DisplayName("Source Map v3")
        void testSourceMap() {
            GeneratedCode generated = generate(MEAN_REVERSION, new CompileOptions().setSourceMap(true));
            assertThat(generated.getCode()).endsWith("//# sourceMappingURL=mean.ts.map\n");

            JsonObject map = JsonParser.parseString(generated.getSourceMap()).getAsJsonObject();
            assertThat(map.get("version").getAsInt()).isEqualTo(3);
            assertThat(map.get("file").getAsString()).isEqualTo("mean.ts");
            assertThat(map.getAsJsonArray("sources").get(0).getAsString()).isEqualTo("mean.crowe");
            assertThat(map.getAsJsonArray("sourcesContent").get(0).getAsString()).isEqualTo(MEAN_REVERSION);
            assertThat(map.get("mappings").getAsString()).isNotEmpty().contains(";");
        }

        @Test
        @DisplayName("未开启时没有 Source Map")
        void testNoSourceMap() {
            GeneratedCode generated = generate(MEAN_REVERSION, new CompileOptions());
            assertThat(generated.getSourceMap()).isNull();
            assertThat(generated.getCode()).doesNotContain("sourceMappingURL");
        }

        @Test
        @DisplayName("常量名转换")
        void testConstantName() {
            assertThat(CodeGenerator.constantName("maxPosition")).isEqualTo("MAX_POSITION");
            assertThat(CodeGenerator.constantName("max_position")).isEqualTo("MAX_POSITION");
            assertThat(CodeGenerator.constantName("VaR")).isEqualTo("VA_R");
        }
    }
}
