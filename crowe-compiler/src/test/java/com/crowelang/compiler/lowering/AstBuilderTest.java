package com.crowelang.compiler.lowering;

import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.decl.*;
import com.crowelang.compiler.ast.expr.BinaryExpr;
import com.crowelang.compiler.ast.expr.Identifier;
import com.crowelang.compiler.ast.expr.Literal;
import com.crowelang.compiler.ast.expr.ObjectLiteral;
import com.crowelang.compiler.ast.stmt.Block;
import com.crowelang.compiler.ast.stmt.IfStmt;
import com.crowelang.compiler.ast.stmt.ReturnStmt;
import com.crowelang.compiler.diagnostic.Diagnostics;
import com.crowelang.compiler.diagnostic.InternalCompilerError;
import com.crowelang.compiler.lexer.Lexer;
import com.crowelang.compiler.parser.CstNode;
import com.crowelang.compiler.parser.CstRule;
import com.crowelang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CST → AST 降级测试
 */
class AstBuilderTest {

    private Program build(String source) {
        Diagnostics diagnostics = new Diagnostics("lower.crowe");
        CstNode cst = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parseProgram();
        assertThat(diagnostics.getErrors()).isEmpty();
        return new AstBuilder("lower.crowe").build(cst);
    }

    @Nested
    @DisplayName("源码位置")
    class SpanTests {

        @Test
        @DisplayName("节点位置来自首尾 token")
        void testSpans() {
            Program program = build("\n  strategy S {\n    risk { maxDrawdown = 0.1; }\n  }");
            StrategyDecl s = program.getStrategies().get(0);
            assertThat(s.getSpan().getFile()).isEqualTo("lower.crowe");
            assertThat(s.getSpan().getLine()).isEqualTo(2);
            assertThat(s.getSpan().getColumn()).isEqualTo(3);
            assertThat(s.getSpan().getOffset()).isEqualTo(3);

            Binding limit = s.getRisk().getBindings().get(0);
            SourceSpan span = limit.getSpan();
            assertThat(span.getLine()).isEqualTo(3);
            assertThat(span.getColumn()).isEqualTo(12);
            assertThat(span.getLength()).isEqualTo("maxDrawdown = 0.1;".length());
        }
    }

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("三种 import 形式")
        void testImportKinds() {
            Program program = build(
                    "import { a, b } from \"./m\";\n"
                    + "import lib from \"./lib\";\n"
                    + "import \"./common\" as common;\n"
                    + "import \"./side-effect\";\n");
            ImportDecl named = program.getImports().get(0);
            assertThat(named.getKind()).isEqualTo(ImportDecl.ImportKind.NAMED);
            assertThat(named.getNames()).containsExactly("a", "b");
            assertThat(named.getModule()).isEqualTo("./m");

            ImportDecl def = program.getImports().get(1);
            assertThat(def.getKind()).isEqualTo(ImportDecl.ImportKind.DEFAULT);
            assertThat(def.getDefaultName()).isEqualTo("lib");

            ImportDecl module = program.getImports().get(2);
            assertThat(module.getKind()).isEqualTo(ImportDecl.ImportKind.MODULE);
            assertThat(module.getAlias()).isEqualTo("common");

            assertThat(program.getImports().get(3).getAlias()).isNull();
        }

        @Test
        @DisplayName("重复的策略子块按顺序合并")
        void testRepeatedBlocksMerge() {
            Program program = build(
                    "strategy S {\n"
                    + "  indicators { a = SMA(close, 5); }\n"
                    + "  rules { when (a > 1) { buy(1); } }\n"
                    + "  indicators { b = EMA(close, 10); }\n"
                    + "}");
            StrategyDecl s = program.getStrategies().get(0);
            assertThat(s.getIndicators().getBindings()).extracting(Binding::getName).containsExactly("a", "b");
            assertThat(s.getIndicators().getSpan().getLine()).isEqualTo(2);
        }

        @Test
        @DisplayName("交易动作的种类与价格")
        void testTradingActions() {
            Program program = build("strategy S { rules { when (true) { short(5, 99.5); cover(5); hedge(); } } }");
            TradingRule rule = program.getStrategies().get(0).getRules().getRules().get(0);
            assertThat(rule.getActions()).extracting(TradingAction::getKind).containsExactly(
                    TradingAction.ActionKind.SHORT, TradingAction.ActionKind.COVER, TradingAction.ActionKind.CALL);
            assertThat(rule.getActions().get(0).isMarketOrder()).isFalse();
            assertThat(rule.getActions().get(1).isMarketOrder()).isTrue();
            assertThat(rule.getActions().get(2).getCall().getCalleeName()).isEqualTo("hedge");
        }

        @Test
        @DisplayName("微观结构与回测子块")
        void testMicrostructureAndBacktest() {
            Program program = build(
                    "microstructure Maker {\n"
                    + "  spread: float = 0.01;\n"
                    + "  detect { wide = spread > 0.05; }\n"
                    + "  quote { bid = 1; ask = 2; }\n"
                    + "  hedging { when (wide) { x: int = 1; } }\n"
                    + "}\n"
                    + "backtest B {\n"
                    + "  start = 2024-01-01;\n"
                    + "  costs { commission = 0.001; }\n"
                    + "  output { report = \"html\"; }\n"
                    + "}");
            MicrostructureDecl m = program.getMicrostructures().get(0);
            assertThat(m.getFields()).extracting(DataField::getName).containsExactly("spread");
            assertThat(m.getDetections()).extracting(Binding::getName).containsExactly("wide");
            assertThat(m.getQuotes()).extracting(Binding::getName).containsExactly("bid", "ask");
            assertThat(m.getHedgingRules()).hasSize(1);

            BacktestDecl b = program.getBacktests().get(0);
            assertThat(b.getSettings()).extracting(Binding::getName).containsExactly("start");
            assertThat(((Literal) b.getSettings().get(0).getValue()).getKind()).isEqualTo(Literal.LiteralKind.DATE);
            assertThat(b.getCosts()).extracting(Binding::getName).containsExactly("commission");
            assertThat(b.getOutput()).extracting(Binding::getName).containsExactly("report");
        }
    }

    @Nested
    @DisplayName("语句与表达式")
    class StatementTests {

        @Test
        @DisplayName("elif 链变成嵌套的 else 分支")
        void testElifChain() {
            Program program = build(
                    "indicator sign(x: float) -> int {\n"
                    + "  if (x > 0) { return 1; } elif (x < 0) { return -1; } else { return 0; }\n"
                    + "}");
            IndicatorDecl decl = program.getIndicators().get(0);
            IfStmt top = (IfStmt) decl.getBody().getStatements().get(0);
            assertThat(top.getElseBranch()).isInstanceOf(IfStmt.class);
            IfStmt elif = (IfStmt) top.getElseBranch();
            assertThat(elif.getElseBranch()).isInstanceOf(Block.class);
            ReturnStmt last = (ReturnStmt) ((Block) elif.getElseBranch()).getStatements().get(0);
            assertThat(((Literal) last.getValue()).asNumber()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("关键字形式与符号形式的逻辑运算相同")
        void testKeywordOperators() {
            Program program = build("indicator f(a: boolean, b: boolean) = a and b;\n"
                    + "indicator g(a: boolean, b: boolean) = a && b;");
            BinaryExpr f = (BinaryExpr) program.getIndicators().get(0).getExpressionBody();
            BinaryExpr g = (BinaryExpr) program.getIndicators().get(1).getExpressionBody();
            assertThat(f.getOperator()).isEqualTo(BinaryExpr.BinaryOp.AND).isEqualTo(g.getOperator());
        }

        @Test
        @DisplayName("对象字面量的简写属性")
        void testShorthandProperty() {
            Program program = build("indicator f(a: float) = { a, \"b c\": 2 };");
            ObjectLiteral obj = (ObjectLiteral) program.getIndicators().get(0).getExpressionBody();
            ObjectLiteral.Property a = obj.getProperties().get(0);
            assertThat(a.isShorthand()).isTrue();
            assertThat(((Identifier) a.getValue()).getName()).isEqualTo("a");
            ObjectLiteral.Property bc = obj.getProperties().get(1);
            assertThat(bc.isQuotedKey()).isTrue();
            assertThat(bc.getKey()).isEqualTo("b c");
        }
    }

    @Test
    @DisplayName("形状不符的 CST 触发内部错误")
    void testMalformedCst() {
        assertThatThrownBy(() -> new AstBuilder("x.crowe").build(new CstNode(CstRule.BLOCK)))
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("Malformed CST");
    }
}
