package com.crowelang.compiler.codegen;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.decl.*;
import com.crowelang.compiler.ast.expr.*;
import com.crowelang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.crowelang.compiler.ast.stmt.*;
import com.crowelang.compiler.ast.type.*;
import com.crowelang.compiler.compiler.CompileOptions;

import java.util.*;
import java.util.logging.Logger;

/**
 * AST → TypeScript / JavaScript 代码生成器
 *
 * <p>声明与语句直接写入上下文中的 {@link CodeWriter} 并返回 null；
 * 表达式与类型返回渲染后的文本，由调用方决定写入位置。</p>
 *
 * <p>输出只取决于 AST 与选项：所有遍历按源码顺序或排序顺序进行。</p>
 */
public class CodeGenerator implements AstVisitor<String, EmitContext> {

    private static final Logger LOGGER = Logger.getLogger(CodeGenerator.class.getName());

    private static final Set<String> RUNTIME_TYPES = new HashSet<>(Arrays.asList(
            "Bar", "Tick", "Fill", "Order", "OrderBook", "Position", "Portfolio", "Quote", "Trade"));

    private static final Map<String, String> HANDLER_METHODS = new HashMap<>();

    /** 运行时基类中声明为 async 的回调 */
    private static final Set<String> ASYNC_HANDLERS = new HashSet<>(Arrays.asList("onBar", "onTick"));

    static {
        HANDLER_METHODS.put("on_bar", "onBar");
        HANDLER_METHODS.put("on_tick", "onTick");
        HANDLER_METHODS.put("on_book", "onBook");
        HANDLER_METHODS.put("on_fill", "onFill");
        HANDLER_METHODS.put("on_reject", "onReject");
        HANDLER_METHODS.put("on_risk_breach", "onRiskBreach");
    }

    // 目标语言中的优先级（与 BinaryOp.precedence 同一刻度）
    private static final int PREC_ASSIGN = 1;
    private static final int PREC_CONDITIONAL = 2;
    private static final int PREC_UNARY = 11;
    private static final int PREC_POSTFIX = 13;

    private static final String DEFAULT_SYMBOL = "this.config.symbols[0]";

    private final CompileOptions options;
    private final boolean types;
    private final OptimizationLevel optimization;

    public CodeGenerator(CompileOptions options) {
        this.options = options;
        this.types = options.getTarget().hasTypes();
        this.optimization = options.getOptimization();
    }

    // ============ 公共入口 ============

    public GeneratedCode generate(Program program, String fileName, String source) {
        SourceMapBuilder sourceMap = options.isSourceMap() ? new SourceMapBuilder() : null;
        CodeWriter writer = new CodeWriter(sourceMap);
        EmitContext ctx = new EmitContext(writer, fileName);
        visitProgram(program, ctx);

        String outputName = outputFileName(fileName, options.getTarget());
        String map = null;
        if (sourceMap != null) {
            writer.line("//# sourceMappingURL=" + outputName + ".map");
            map = sourceMap.build(outputName, fileName, source);
        }
        String code = writer.getOutput();
        LOGGER.fine("Generated " + code.length() + " characters for " + fileName);
        return new GeneratedCode(code, map);
    }

    /**
     * 源文件名对应的输出文件名：替换扩展名为目标方言的扩展名
     */
    public static String outputFileName(String fileName, TargetDialect target) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String base = fileName.substring(slash + 1);
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return base + target.getExtension();
    }

    // ============ 声明 ============

    @Override
    public String visitProgram(Program node, EmitContext ctx) {
        for (Declaration decl : node.getDeclarations()) {
            if (decl instanceof IndicatorDecl) {
                ctx.programIndicators.add(decl.getName());
            } else if (decl instanceof DataDecl || decl instanceof OrderDecl
                    || decl instanceof PortfolioDecl || decl instanceof MicrostructureDecl) {
                ctx.declaredTypes.add(decl.getName());
            }
        }

        // 先生成声明主体，收集到需要的导入后再输出文件头
        CodeWriter header = ctx.beginFork();
        boolean first = true;
        for (Declaration decl : node.getDeclarations()) {
            if (decl instanceof ImportDecl) continue;
            if (!first) {
                ctx.out.blankLine();
            }
            decl.accept(this, ctx);
            first = false;
        }
        CodeWriter body = ctx.endFork(header);

        CodeWriter out = ctx.out;
        out.line("// Generated by the CroweLang compiler from " + ctx.fileName + ". Do not edit.");
        out.newLine();

        List<String> runtimeNames = new ArrayList<>();
        if (!node.getStrategies().isEmpty()) {
            runtimeNames.add("BaseStrategy");
            if (types) {
                runtimeNames.add("StrategyConfig");
            }
        }
        if (types) {
            runtimeNames.addAll(ctx.runtimeTypes);
        }
        boolean anyImport = false;
        if (!runtimeNames.isEmpty()) {
            out.line("import { " + join(runtimeNames) + " } from " + quote(options.getRuntimeModule()) + ";");
            anyImport = true;
        }
        if (!ctx.indicatorFunctions.isEmpty()) {
            out.line("import { " + join(new ArrayList<>(ctx.indicatorFunctions)) + " } from "
                    + quote(options.getRuntimeModule() + "/indicators") + ";");
            anyImport = true;
        }
        for (ImportDecl imp : node.getImports()) {
            imp.accept(this, ctx);
            anyImport = true;
        }
        if (anyImport) {
            out.newLine();
        }
        out.include(body);
        return null;
    }

    @Override
    public String visitImportDecl(ImportDecl node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        String module = quote(node.getModule());
        switch (node.getKind()) {
            case NAMED:
                ctx.out.line("import { " + join(node.getNames()) + " } from " + module + ";");
                break;
            case DEFAULT:
                ctx.out.line("import " + node.getDefaultName() + " from " + module + ";");
                break;
            case MODULE:
            default:
                if (node.getAlias() != null) {
                    ctx.out.line("import * as " + node.getAlias() + " from " + module + ";");
                } else {
                    ctx.out.line("import " + module + ";");
                }
                break;
        }
        return null;
    }

    @Override
    public String visitStrategyDecl(StrategyDecl node, EmitContext ctx) {
        ctx.enterStrategy(node);
        try {
            CodeWriter out = ctx.out;
            String name = node.getName();
            out.mark(node.getSpan());

            if (types && node.getParams() != null) {
                node.getParams().accept(this, ctx);
                out.blankLine();
            }

            out.line("export class " + name + " extends BaseStrategy {");
            out.indent();

            if (node.getRisk() != null) {
                node.getRisk().accept(this, ctx);
                out.blankLine();
            }
            if (node.getParams() != null) {
                if (types) {
                    out.line("protected readonly params: " + name + "Params;");
                    out.blankLine();
                }
                writeConstructor(node, ctx);
                out.blankLine();
            }
            if (node.getRisk() != null) {
                writeRiskLimitsAccessor(node, ctx);
                out.blankLine();
            }

            writeOnBar(node, ctx);

            if (node.getEventHandlers() != null) {
                node.getEventHandlers().accept(this, ctx);
            }

            out.dedent();
            out.line("}");
        } finally {
            ctx.exitStrategy();
        }
        return null;
    }

    private void writeConstructor(StrategyDecl node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        String name = node.getName();
        out.mark(node.getParams().getSpan());
        if (types) {
            out.line("constructor(config: StrategyConfig, params: Partial<" + name + "Params> = {}) {");
        } else {
            out.line("constructor(config, params = {}) {");
        }
        out.indent();
        out.line("super(config);");
        out.line("this.params = {");
        out.indent();
        for (StrategyParam p : node.getParams().getParams()) {
            out.mark(p.getSpan());
            String supplied = "params." + p.getName();
            if (p.getDefaultValue() != null) {
                out.line(p.getName() + ": " + supplied + " ?? " + expr(p.getDefaultValue(), ctx) + ",");
            } else if (types) {
                out.line(p.getName() + ": " + supplied + " as " + p.getType().accept(this, ctx) + ",");
            } else {
                out.line(p.getName() + ": " + supplied + ",");
            }
        }
        out.dedent();
        out.line("};");

        if (options.isRuntimeTypeChecks()) {
            for (StrategyParam p : node.getParams().getParams()) {
                String value = "this.params." + p.getName();
                String invalid = invalidTypeCheck(p.getType(), value);
                if (invalid == null) continue;
                out.line("if (" + invalid + ") {");
                out.indent();
                out.line("throw new TypeError(" + quote("Parameter '" + p.getName() + "' must be of type "
                        + describeType(p.getType())) + ");");
                out.dedent();
                out.line("}");
            }
        }
        out.dedent();
        out.line("}");
    }

    /**
     * 值不符合声明类型时为真的运行时检查表达式；无法检查的类型返回 null
     */
    private String invalidTypeCheck(TypeNode type, String value) {
        if (type instanceof PrimitiveType) {
            switch (((PrimitiveType) type).getKind()) {
                case INT:
                case FLOAT:    return "typeof " + value + " !== 'number'";
                case STRING:   return "typeof " + value + " !== 'string'";
                case BOOLEAN:  return "typeof " + value + " !== 'boolean'";
                case DATETIME: return "!(" + value + " instanceof Date)";
                default:       return null;
            }
        }
        if (type instanceof ArrayType) {
            return "!Array.isArray(" + value + ")";
        }
        if (type instanceof OptionalType) {
            String inner = invalidTypeCheck(((OptionalType) type).getInnerType(), value);
            return inner == null ? null : value + " != null && " + inner;
        }
        return null;
    }

    private String describeType(TypeNode type) {
        if (type instanceof PrimitiveType) {
            return ((PrimitiveType) type).getKind().keyword();
        }
        if (type instanceof OptionalType) {
            return describeType(((OptionalType) type).getInnerType()) + "?";
        }
        return "array";
    }

    private void writeRiskLimitsAccessor(StrategyDecl node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        out.line(types ? "getRiskLimits(): Record<string, number> {" : "getRiskLimits() {");
        out.indent();
        out.line("return {");
        out.indent();
        for (Map.Entry<String, String> e : ctx.riskConstants.entrySet()) {
            out.line(e.getKey() + ": " + node.getName() + "." + e.getValue() + ",");
        }
        out.dedent();
        out.line("};");
        out.dedent();
        out.line("}");
    }

    /**
     * onBar：行情绑定 → 指标 → 信号 → 规则 → 用户 on_bar 主体
     */
    private void writeOnBar(StrategyDecl node, EmitContext ctx) {
        EventHandler userOnBar = node.getEventHandlers() != null ? node.getEventHandlers().find("on_bar") : null;
        Parameter barParam = userOnBar != null && !userOnBar.getParameters().isEmpty()
                ? userOnBar.getParameters().get(0) : null;

        ctx.barName = barParam != null ? barParam.getName() : "bar";
        ctx.symbolExpr = ctx.barName + ".symbol";
        ctx.inOnBar = true;
        ctx.sawAwait = false;
        ctx.pushScope();
        if (userOnBar != null) {
            for (Parameter p : userOnBar.getParameters()) {
                ctx.declareLocal(p.getName());
            }
        }

        ctx.out.indent();
        CodeWriter outer = ctx.beginFork();
        if (node.getIndicators() != null) {
            node.getIndicators().accept(this, ctx);
        }
        if (node.getSignals() != null) {
            node.getSignals().accept(this, ctx);
        }
        if (node.getRules() != null) {
            node.getRules().accept(this, ctx);
        }
        if (userOnBar != null) {
            writeStatements(userOnBar.getBody(), ctx);
        }
        CodeWriter body = ctx.endFork(outer);
        ctx.out.dedent();

        CodeWriter out = ctx.out;
        String barType = "Bar";
        if (types) {
            if (barParam != null && barParam.getType() != null) {
                barType = barParam.getType().accept(this, ctx);
            } else {
                ctx.runtimeTypes.add("Bar");
            }
        }
        out.mark(userOnBar != null ? userOnBar.getSpan() : node.getSpan());
        out.line(types
                ? "async onBar(" + ctx.barName + ": " + barType + "): Promise<void> {"
                : "async onBar(" + ctx.barName + ") {");
        out.indent();

        boolean pruneUnused = optimization.atLeast(OptimizationLevel.BASIC);
        for (String field : EmitContext.OHLCV) {
            if (!pruneUnused || ctx.usedBarBindings.contains(field)) {
                out.line("const " + field + " = " + ctx.barName + "." + field + ";");
            }
        }
        if (!pruneUnused || ctx.usedBarBindings.contains("position")) {
            out.line("const position = this.getPosition(" + ctx.symbolExpr + ");");
        }
        if (!pruneUnused || ctx.usedBarBindings.contains("portfolio")) {
            out.line("const portfolio = this.getPortfolio();");
        }
        out.include(body);
        out.dedent();
        out.line("}");

        ctx.popScope();
        ctx.inOnBar = false;
        ctx.symbolExpr = null;
    }

    @Override
    public String visitParamsBlock(ParamsBlock node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        out.mark(node.getSpan());
        out.line("export interface " + ctx.strategy.getName() + "Params {");
        out.indent();
        for (StrategyParam p : node.getParams()) {
            out.mark(p.getSpan());
            out.line(p.accept(this, ctx) + ";");
        }
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public String visitStrategyParam(StrategyParam node, EmitContext ctx) {
        return node.getName() + ": " + node.getType().accept(this, ctx);
    }

    @Override
    public String visitIndicatorsBlock(IndicatorsBlock node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        for (Binding b : node.getBindings()) {
            Expression value = b.getValue();
            if (value instanceof CallExpr && ((CallExpr) value).getCallee() instanceof Identifier) {
                String fn = ((CallExpr) value).getCalleeName();
                if (!ctx.programIndicators.contains(fn) && !ctx.isLocal(fn)) {
                    ctx.indicatorFunctions.add(fn);
                }
            }
            out.mark(b.getSpan());
            out.line("const " + b.getName() + " = " + expr(value, ctx) + ";");
            out.line("this.setIndicator(" + quote(b.getName()) + ", " + b.getName() + ");");
            ctx.declareLocal(b.getName());
        }
        return null;
    }

    @Override
    public String visitSignalsBlock(SignalsBlock node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        for (Binding b : node.getBindings()) {
            out.mark(b.getSpan());
            out.line("const " + b.getName() + " = " + expr(b.getValue(), ctx) + ";");
            out.line("this.setSignal(" + quote(b.getName()) + ", " + b.getName() + ");");
            ctx.declareLocal(b.getName());
        }
        return null;
    }

    @Override
    public String visitRulesBlock(RulesBlock node, EmitContext ctx) {
        for (TradingRule rule : node.getRules()) {
            if (optimization.atLeast(OptimizationLevel.AGGRESSIVE) && isLiteralFalse(rule.getCondition())) {
                LOGGER.fine("Dropping rule with constant false condition at line " + rule.getSpan().getLine());
                continue;
            }
            rule.accept(this, ctx);
        }
        return null;
    }

    private static boolean isLiteralFalse(Expression e) {
        return e instanceof Literal && ((Literal) e).getKind() == Literal.LiteralKind.BOOLEAN
                && Boolean.FALSE.equals(((Literal) e).getValue());
    }

    @Override
    public String visitTradingRule(TradingRule node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        out.mark(node.getSpan());
        out.line("if (" + expr(node.getCondition(), ctx) + ") {");
        out.indent();
        for (TradingAction action : node.getActions()) {
            action.accept(this, ctx);
        }
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public String visitTradingAction(TradingAction node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        if (node.getKind() == TradingAction.ActionKind.CALL) {
            CallExpr call = node.getCall();
            String fn = call.getCalleeName();
            String receiver = ctx.programIndicators.contains(fn) ? "" : "this.";
            ctx.out.line(receiver + fn + "(" + exprList(call.getArguments(), ctx) + ");");
            return null;
        }
        String symbol = ctx.symbolExpr != null ? ctx.symbolExpr : DEFAULT_SYMBOL;
        StringBuilder sb = new StringBuilder("this.").append(node.getKind().method())
                .append('(').append(symbol).append(", ").append(expr(node.getQuantity(), ctx));
        if (!node.isMarketOrder()) {
            sb.append(", ").append(expr(node.getPrice(), ctx));
        }
        ctx.out.line(sb.append(");").toString());
        return null;
    }

    /**
     * 风控限额输出为类的静态常量；后面的限额可以引用前面的限额
     */
    @Override
    public String visitRiskBlock(RiskBlock node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        ctx.inRiskLimits = true;
        try {
            for (Binding b : node.getBindings()) {
                String constant = constantName(b.getName());
                out.mark(b.getSpan());
                out.line((types ? "static readonly " : "static ") + constant + " = " + expr(b.getValue(), ctx) + ";");
                ctx.riskConstants.put(b.getName(), constant);
            }
        } finally {
            ctx.inRiskLimits = false;
        }
        return null;
    }

    /** maxPosition / max_position → MAX_POSITION */
    static String constantName(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c) && i > 0 && Character.isLetterOrDigit(name.charAt(i - 1))
                    && !Character.isUpperCase(name.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(Character.isLetterOrDigit(c) ? Character.toUpperCase(c) : '_');
        }
        return sb.toString();
    }

    @Override
    public String visitEventHandlersBlock(EventHandlersBlock node, EmitContext ctx) {
        for (EventHandler handler : node.getHandlers()) {
            if ("on_bar".equals(handler.getName())) continue;
            ctx.out.blankLine();
            handler.accept(this, ctx);
        }
        return null;
    }

    @Override
    public String visitEventHandler(EventHandler node, EmitContext ctx) {
        writeHandler(node, ctx, "}");
        return null;
    }

    private void writeHandler(EventHandler node, EmitContext ctx, String closing) {
        String method = HANDLER_METHODS.containsKey(node.getName()) ? HANDLER_METHODS.get(node.getName()) : node.getName();
        List<Parameter> params = node.getParameters();

        String savedSymbol = ctx.symbolExpr;
        boolean savedAwait = ctx.sawAwait;
        ctx.symbolExpr = params.isEmpty() ? DEFAULT_SYMBOL : params.get(0).getName() + ".symbol";
        ctx.sawAwait = false;
        ctx.pushScope();
        List<String> rendered = new ArrayList<>();
        for (Parameter p : params) {
            rendered.add(p.accept(this, ctx));
            ctx.declareLocal(p.getName());
        }

        ctx.out.indent();
        CodeWriter outer = ctx.beginFork();
        writeStatements(node.getBody(), ctx);
        CodeWriter body = ctx.endFork(outer);
        ctx.out.dedent();

        boolean async = ctx.sawAwait || ASYNC_HANDLERS.contains(method);
        String returnType = types ? (async ? ": Promise<void>" : ": void") : "";
        CodeWriter out = ctx.out;
        out.mark(node.getSpan());
        out.line((async ? "async " : "") + method + "(" + join(rendered) + ")" + returnType + " {");
        out.indent();
        out.include(body);
        out.dedent();
        out.line(closing);

        ctx.popScope();
        ctx.symbolExpr = savedSymbol;
        ctx.sawAwait = savedAwait;
    }

    @Override
    public String visitBinding(Binding node, EmitContext ctx) {
        return node.getName() + ": " + expr(node.getValue(), ctx);
    }

    @Override
    public String visitParameter(Parameter node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder(node.getName());
        if (types && node.getType() != null) {
            sb.append(": ").append(node.getType().accept(this, ctx));
        }
        if (node.hasDefaultValue()) {
            sb.append(" = ").append(expr(node.getDefaultValue(), ctx));
        }
        return sb.toString();
    }

    @Override
    public String visitIndicatorDecl(IndicatorDecl node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        ctx.pushScope();
        List<String> params = new ArrayList<>();
        for (Parameter p : node.getParameters()) {
            params.add(p.accept(this, ctx));
            ctx.declareLocal(p.getName());
        }
        String returnType = types && node.getReturnType() != null ? ": " + node.getReturnType().accept(this, ctx) : "";

        out.mark(node.getSpan());
        out.line("export function " + node.getName() + "(" + join(params) + ")" + returnType + " {");
        out.indent();
        if (node.isExpressionBody()) {
            out.mark(node.getExpressionBody().getSpan());
            out.line("return " + expr(node.getExpressionBody(), ctx) + ";");
        } else {
            writeStatements(node.getBody(), ctx);
        }
        out.dedent();
        out.line("}");
        ctx.popScope();
        return null;
    }

    @Override
    public String visitDataDecl(DataDecl node, EmitContext ctx) {
        writeRecord(node, node.getName(), node.getFields(), node.getMetrics(), ctx);
        return null;
    }

    @Override
    public String visitOrderDecl(OrderDecl node, EmitContext ctx) {
        writeRecord(node, node.getName(), node.getFields(), Collections.emptyList(), ctx);
        return null;
    }

    /**
     * 记录类声明：接口（仅 TS）、默认值常量、计算指标函数
     */
    private void writeRecord(Declaration node, String name, List<DataField> fields,
                             List<ComputedField> metrics, EmitContext ctx) {
        CodeWriter out = ctx.out;
        out.mark(node.getSpan());
        if (types) {
            out.line("export interface " + name + " {");
            out.indent();
            for (DataField f : fields) {
                f.accept(this, ctx);
            }
            out.dedent();
            out.line("}");
        }

        List<DataField> withDefaults = new ArrayList<>();
        for (DataField f : fields) {
            if (f.getDefaultValue() != null) {
                withDefaults.add(f);
            }
        }
        if (!withDefaults.isEmpty()) {
            out.blankLine();
            out.line("export const " + name + "Defaults" + (types ? ": Partial<" + name + ">" : "") + " = {");
            out.indent();
            for (DataField f : withDefaults) {
                out.mark(f.getSpan());
                out.line(f.getName() + ": " + expr(f.getDefaultValue(), ctx) + ",");
            }
            out.dedent();
            out.line("};");
        }

        if (!metrics.isEmpty()) {
            out.blankLine();
            writeMetrics(name, fields, metrics, ctx);
        }
    }

    private void writeMetrics(String name, List<DataField> fields, List<ComputedField> metrics, EmitContext ctx) {
        CodeWriter out = ctx.out;
        if (types) {
            out.line("export interface " + name + "Metrics {");
            out.indent();
            for (ComputedField m : metrics) {
                out.line(m.getName() + ": " + m.getType().accept(this, ctx) + ";");
            }
            out.dedent();
            out.line("}");
            out.blankLine();
        }

        List<String> fieldNames = new ArrayList<>();
        for (DataField f : fields) {
            fieldNames.add(f.getName());
        }
        ctx.enterMembers("data", fieldNames);
        ctx.pushScope();
        try {
            out.line(types
                    ? "export function compute" + name + "Metrics(data: " + name + "): " + name + "Metrics {"
                    : "export function compute" + name + "Metrics(data) {");
            out.indent();
            List<String> names = new ArrayList<>();
            for (ComputedField m : metrics) {
                m.accept(this, ctx);
                names.add(m.getName());
            }
            out.line("return { " + join(names) + " };");
            out.dedent();
            out.line("}");
        } finally {
            ctx.popScope();
            ctx.exitMembers();
        }
    }

    @Override
    public String visitDataField(DataField node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        ctx.out.line(node.getName() + (node.isOptional() ? "?: " : ": ") + node.getType().accept(this, ctx) + ";");
        return null;
    }

    @Override
    public String visitComputedField(ComputedField node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        ctx.out.line("const " + node.getName() + " = " + expr(node.getValue(), ctx) + ";");
        ctx.declareLocal(node.getName());
        return null;
    }

    @Override
    public String visitEventDecl(EventDecl node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        out.mark(node.getSpan());
        out.line("export const " + node.getName() + " = {");
        out.indent();
        for (EventHandler handler : node.getHandlers()) {
            writeHandler(handler, ctx, "},");
        }
        out.dedent();
        out.line("};");
        return null;
    }

    @Override
    public String visitPortfolioDecl(PortfolioDecl node, EmitContext ctx) {
        writeRecord(node, node.getName(), node.getFields(), node.getMetrics(), ctx);
        if (!node.getConstraints().isEmpty()) {
            ctx.out.blankLine();
            ctx.out.line("export const " + node.getName() + "Constraints = {");
            writeObjectEntries(node.getConstraints(), ctx);
            ctx.out.line("};");
        }
        return null;
    }

    @Override
    public String visitBacktestDecl(BacktestDecl node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        out.mark(node.getSpan());
        out.line("export const " + node.getName() + " = {");
        writeObjectEntries(node.getSettings(), ctx);
        out.indent();
        if (!node.getCosts().isEmpty()) {
            out.line("costs: {");
            writeObjectEntries(node.getCosts(), ctx);
            out.line("},");
        }
        if (!node.getOutput().isEmpty()) {
            out.line("output: {");
            writeObjectEntries(node.getOutput(), ctx);
            out.line("},");
        }
        out.dedent();
        out.line("};");
        return null;
    }

    private void writeObjectEntries(List<Binding> bindings, EmitContext ctx) {
        ctx.out.indent();
        for (Binding b : bindings) {
            ctx.out.mark(b.getSpan());
            ctx.out.line(b.accept(this, ctx) + ",");
        }
        ctx.out.dedent();
    }

    /**
     * 微观结构：字段 → 类属性，detect → 布尔方法，quote → getQuotes()，hedging → applyHedging()
     */
    @Override
    public String visitMicrostructureDecl(MicrostructureDecl node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        List<String> fieldNames = new ArrayList<>();
        for (DataField f : node.getFields()) {
            fieldNames.add(f.getName());
        }

        out.mark(node.getSpan());
        out.line("export class " + node.getName() + " {");
        out.indent();
        ctx.enterMembers("this", fieldNames);
        try {
            for (DataField f : node.getFields()) {
                out.mark(f.getSpan());
                StringBuilder sb = new StringBuilder(f.getName());
                if (types) {
                    boolean optional = f.isOptional() || f.getDefaultValue() == null;
                    sb.append(optional ? "?: " : ": ").append(f.getType().accept(this, ctx));
                }
                if (f.getDefaultValue() != null) {
                    sb.append(" = ").append(expr(f.getDefaultValue(), ctx));
                }
                out.line(sb.append(';').toString());
            }

            for (Binding d : node.getDetections()) {
                out.blankLine();
                out.mark(d.getSpan());
                out.line(d.getName() + "()" + (types ? ": boolean" : "") + " {");
                out.indent();
                out.line("return " + expr(d.getValue(), ctx) + ";");
                out.dedent();
                out.line("}");
            }

            if (!node.getQuotes().isEmpty()) {
                out.blankLine();
                out.line("getQuotes()" + (types ? ": Record<string, number>" : "") + " {");
                out.indent();
                out.line("return {");
                writeObjectEntries(node.getQuotes(), ctx);
                out.line("};");
                out.dedent();
                out.line("}");
            }

            if (!node.getHedgingRules().isEmpty()) {
                out.blankLine();
                out.line("applyHedging()" + (types ? ": void" : "") + " {");
                out.indent();
                for (HedgingRule rule : node.getHedgingRules()) {
                    rule.accept(this, ctx);
                }
                out.dedent();
                out.line("}");
            }
        } finally {
            ctx.exitMembers();
        }
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public String visitHedgingRule(HedgingRule node, EmitContext ctx) {
        writeConditional("if", node.getCondition(), node.getBody(), node, ctx);
        return null;
    }

    // ============ 语句 ============

    private void writeStatements(Block block, EmitContext ctx) {
        ctx.pushScope();
        for (Statement s : block.getStatements()) {
            s.accept(this, ctx);
        }
        ctx.popScope();
    }

    private void writeConditional(String keyword, Expression condition, Block body,
                                  AstNode node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        ctx.out.line(keyword + " (" + expr(condition, ctx) + ") {");
        ctx.out.indent();
        writeStatements(body, ctx);
        ctx.out.dedent();
        ctx.out.line("}");
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        ctx.out.line(expr(node.getExpression(), ctx) + ";");
        return null;
    }

    @Override
    public String visitVarDeclStmt(VarDeclStmt node, EmitContext ctx) {
        String init = expr(node.getInitializer(), ctx);
        String type = types ? ": " + node.getType().accept(this, ctx) : "";
        ctx.out.mark(node.getSpan());
        ctx.out.line("let " + node.getName() + type + " = " + init + ";");
        ctx.declareLocal(node.getName());
        return null;
    }

    @Override
    public String visitBlock(Block node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        ctx.out.line("{");
        ctx.out.indent();
        writeStatements(node, ctx);
        ctx.out.dedent();
        ctx.out.line("}");
        return null;
    }

    @Override
    public String visitIfStmt(IfStmt node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        out.mark(node.getSpan());
        out.line("if (" + expr(node.getCondition(), ctx) + ") {");
        out.indent();
        writeStatements(node.getThenBranch(), ctx);
        out.dedent();

        Statement alternate = node.getElseBranch();
        while (alternate instanceof IfStmt) {
            IfStmt elif = (IfStmt) alternate;
            out.line("} else if (" + expr(elif.getCondition(), ctx) + ") {");
            out.indent();
            writeStatements(elif.getThenBranch(), ctx);
            out.dedent();
            alternate = elif.getElseBranch();
        }
        if (alternate instanceof Block) {
            out.line("} else {");
            out.indent();
            writeStatements((Block) alternate, ctx);
            out.dedent();
        }
        out.line("}");
        return null;
    }

    @Override
    public String visitWhileStmt(WhileStmt node, EmitContext ctx) {
        writeConditional("while", node.getCondition(), node.getBody(), node, ctx);
        return null;
    }

    @Override
    public String visitForStmt(ForStmt node, EmitContext ctx) {
        CodeWriter out = ctx.out;
        String iterable = expr(node.getIterable(), ctx);
        out.mark(node.getSpan());
        out.line("for (const " + node.getVariable() + " of " + iterable + ") {");
        out.indent();
        ctx.pushScope();
        ctx.declareLocal(node.getVariable());
        writeStatements(node.getBody(), ctx);
        ctx.popScope();
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public String visitReturnStmt(ReturnStmt node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        ctx.out.line(node.hasValue() ? "return " + expr(node.getValue(), ctx) + ";" : "return;");
        return null;
    }

    @Override
    public String visitBreakStmt(BreakStmt node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        ctx.out.line("break;");
        return null;
    }

    @Override
    public String visitContinueStmt(ContinueStmt node, EmitContext ctx) {
        ctx.out.mark(node.getSpan());
        ctx.out.line("continue;");
        return null;
    }

    @Override
    public String visitWhenStmt(WhenStmt node, EmitContext ctx) {
        writeConditional("if", node.getCondition(), node.getBody(), node, ctx);
        return null;
    }

    // ============ 表达式 ============

    private String expr(Expression e, EmitContext ctx) {
        return e.accept(this, ctx);
    }

    private String exprList(List<Expression> list, EmitContext ctx) {
        List<String> parts = new ArrayList<>();
        for (Expression e : list) {
            parts.add(expr(e, ctx));
        }
        return join(parts);
    }

    /**
     * 子表达式优先级低于 minPrecedence 时加括号
     */
    private String operand(Expression e, int minPrecedence, EmitContext ctx) {
        String s = expr(e, ctx);
        return precedenceOf(e) < minPrecedence ? "(" + s + ")" : s;
    }

    private static int precedenceOf(Expression e) {
        if (e instanceof BinaryExpr) {
            BinaryOp op = ((BinaryExpr) e).getOperator();
            if (op == BinaryOp.IN) return PREC_POSTFIX;
            if (op == BinaryOp.NOT_IN) return PREC_UNARY;
            return op.precedence();
        }
        if (e instanceof UnaryExpr || e instanceof AwaitExpr) return PREC_UNARY;
        if (e instanceof ConditionalExpr) return PREC_CONDITIONAL;
        if (e instanceof AssignExpr) return PREC_ASSIGN;
        return PREC_POSTFIX;
    }

    private static boolean isUnary(Expression e) {
        return e instanceof UnaryExpr || e instanceof AwaitExpr;
    }

    @Override
    public String visitLiteral(Literal node, EmitContext ctx) {
        switch (node.getKind()) {
            case NUMBER:  return ConstantFolder.formatNumber(node.asNumber());
            case STRING:  return quote((String) node.getValue());
            case BOOLEAN: return String.valueOf(node.getValue());
            case DATE:    return "new Date(" + quote(node.getRaw()) + ")";
            case NULL:
            default:      return "null";
        }
    }

    /**
     * 名称解析：局部变量 → 风控常量 → 策略参数/指标/信号 → 行情绑定 → 记录字段 → 原样
     */
    @Override
    public String visitIdentifier(Identifier node, EmitContext ctx) {
        String name = node.getName();
        if (ctx.isLocal(name)) {
            return name;
        }
        if (ctx.inRiskLimits) {
            String constant = ctx.riskConstants.get(name);
            return constant != null ? ctx.strategy.getName() + "." + constant : name;
        }
        if (ctx.strategy != null) {
            if (ctx.params.contains(name)) {
                return "this.params." + name;
            }
            if (ctx.indicators.contains(name)) {
                return "this.getIndicator(" + quote(name) + ")";
            }
            if (ctx.signals.contains(name)) {
                return "this.getSignal(" + quote(name) + ")";
            }
            if ("position".equals(name)) {
                if (ctx.inOnBar) {
                    ctx.usedBarBindings.add(name);
                    return name;
                }
                return "this.getPosition(" + (ctx.symbolExpr != null ? ctx.symbolExpr : DEFAULT_SYMBOL) + ")";
            }
            if ("portfolio".equals(name)) {
                if (ctx.inOnBar) {
                    ctx.usedBarBindings.add(name);
                    return name;
                }
                return "this.getPortfolio()";
            }
            if (ctx.inOnBar && EmitContext.OHLCV.contains(name)) {
                ctx.usedBarBindings.add(name);
                return name;
            }
        }
        if (ctx.memberReceiver != null && ctx.memberNames.contains(name)) {
            return ctx.memberReceiver + "." + name;
        }
        return name;
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, EmitContext ctx) {
        BinaryOp op = node.getOperator();
        if (optimization.atLeast(OptimizationLevel.AGGRESSIVE) && ConstantFolder.isArithmetic(op)) {
            Double folded = ConstantFolder.evaluate(node);
            if (folded != null) {
                return ConstantFolder.formatNumber(folded);
            }
        }

        switch (op) {
            case IN:
                return operand(node.getRight(), PREC_POSTFIX, ctx) + ".includes(" + expr(node.getLeft(), ctx) + ")";
            case NOT_IN:
                return "!" + operand(node.getRight(), PREC_POSTFIX, ctx) + ".includes(" + expr(node.getLeft(), ctx) + ")";
            default:
                break;
        }

        int prec = op.precedence();
        String left;
        String right;
        if (op.isRightAssociative()) {
            // JavaScript 不允许一元表达式直接作为 ** 的操作数
            left = isUnary(node.getLeft()) ? "(" + expr(node.getLeft(), ctx) + ")" : operand(node.getLeft(), prec + 1, ctx);
            right = isUnary(node.getRight()) ? "(" + expr(node.getRight(), ctx) + ")" : operand(node.getRight(), prec, ctx);
        } else {
            left = operand(node.getLeft(), prec, ctx);
            right = operand(node.getRight(), prec + 1, ctx);
        }
        return left + " " + targetOperator(op) + " " + right;
    }

    private static String targetOperator(BinaryOp op) {
        switch (op) {
            case EQ: return "===";
            case NE: return "!==";
            default: return op.toSourceString();
        }
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, EmitContext ctx) {
        if (optimization.atLeast(OptimizationLevel.AGGRESSIVE)) {
            Double folded = ConstantFolder.evaluate(node);
            if (folded != null) {
                return ConstantFolder.formatNumber(folded);
            }
        }
        String op = node.getOperator().toSourceString();
        String inner = operand(node.getOperand(), PREC_UNARY, ctx);
        // 避免 "- -x" 被拼成 "--x"
        if ((op.equals("-") || op.equals("+")) && inner.startsWith(op)) {
            inner = "(" + inner + ")";
        }
        return op + inner;
    }

    @Override
    public String visitCallExpr(CallExpr node, EmitContext ctx) {
        return operand(node.getCallee(), PREC_POSTFIX, ctx) + "(" + exprList(node.getArguments(), ctx) + ")";
    }

    @Override
    public String visitMemberExpr(MemberExpr node, EmitContext ctx) {
        return postfixTarget(node.getTarget(), ctx) + "." + node.getMember();
    }

    @Override
    public String visitIndexExpr(IndexExpr node, EmitContext ctx) {
        return postfixTarget(node.getTarget(), ctx) + "[" + expr(node.getIndex(), ctx) + "]";
    }

    /**
     * 切片映射为 Array.prototype.slice；步长通过下标过滤实现
     */
    @Override
    public String visitSliceExpr(SliceExpr node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder(postfixTarget(node.getTarget(), ctx)).append(".slice(");
        if (node.getStart() != null) {
            sb.append(expr(node.getStart(), ctx));
        } else if (node.getEnd() != null) {
            sb.append('0');
        }
        if (node.getEnd() != null) {
            sb.append(", ").append(expr(node.getEnd(), ctx));
        }
        sb.append(')');
        if (node.getStep() != null) {
            sb.append(".filter((_, i) => i % ").append(operand(node.getStep(), BinaryOp.MOD.precedence() + 1, ctx))
                    .append(" === 0)");
        }
        return sb.toString();
    }

    private String postfixTarget(Expression target, EmitContext ctx) {
        String s = operand(target, PREC_POSTFIX, ctx);
        if (target instanceof Literal && ((Literal) target).isNumber()) {
            return "(" + s + ")";
        }
        return s;
    }

    @Override
    public String visitConditionalExpr(ConditionalExpr node, EmitContext ctx) {
        return operand(node.getCondition(), PREC_CONDITIONAL + 1, ctx)
                + " ? " + operand(node.getThenExpr(), PREC_CONDITIONAL, ctx)
                + " : " + operand(node.getElseExpr(), PREC_CONDITIONAL, ctx);
    }

    @Override
    public String visitAssignExpr(AssignExpr node, EmitContext ctx) {
        return expr(node.getTarget(), ctx) + " " + node.getOperator().toSourceString() + " "
                + operand(node.getValue(), PREC_ASSIGN, ctx);
    }

    @Override
    public String visitArrayLiteral(ArrayLiteral node, EmitContext ctx) {
        return "[" + exprList(node.getElements(), ctx) + "]";
    }

    @Override
    public String visitObjectLiteral(ObjectLiteral node, EmitContext ctx) {
        if (node.getProperties().isEmpty()) {
            return "{}";
        }
        List<String> parts = new ArrayList<>();
        for (ObjectLiteral.Property p : node.getProperties()) {
            String key = p.isQuotedKey() ? quote(p.getKey()) : p.getKey();
            String value = expr(p.getValue(), ctx);
            parts.add(p.isShorthand() && value.equals(key) ? key : key + ": " + value);
        }
        return "{ " + join(parts) + " }";
    }

    /**
     * [e for x in xs if c] → xs.filter((x) => c).map((x) => e)
     */
    @Override
    public String visitComprehensionExpr(ComprehensionExpr node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder(postfixTarget(node.getIterable(), ctx));
        String param = "(" + node.getVariable() + ") => ";
        ctx.pushScope();
        ctx.declareLocal(node.getVariable());
        try {
            if (node.hasFilter()) {
                sb.append(".filter(").append(param).append(arrowBody(node.getFilter(), ctx)).append(')');
            }
            boolean identity = node.getElement() instanceof Identifier
                    && ((Identifier) node.getElement()).getName().equals(node.getVariable());
            if (!identity) {
                sb.append(".map(").append(param).append(arrowBody(node.getElement(), ctx)).append(')');
            } else if (!node.hasFilter()) {
                sb.append(".slice()");
            }
        } finally {
            ctx.popScope();
        }
        return sb.toString();
    }

    private String arrowBody(Expression e, EmitContext ctx) {
        String s = operand(e, PREC_ASSIGN + 1, ctx);
        return s.startsWith("{") ? "(" + s + ")" : s;
    }

    @Override
    public String visitAwaitExpr(AwaitExpr node, EmitContext ctx) {
        ctx.sawAwait = true;
        return "await " + operand(node.getOperand(), PREC_UNARY, ctx);
    }

    // ============ 类型 ============

    @Override
    public String visitPrimitiveType(PrimitiveType node, EmitContext ctx) {
        switch (node.getKind()) {
            case INT:
            case FLOAT:    return "number";
            case STRING:   return "string";
            case BOOLEAN:  return "boolean";
            case DATETIME: return "Date";
            case VOID:
            default:       return "void";
        }
    }

    @Override
    public String visitArrayType(ArrayType node, EmitContext ctx) {
        TypeNode element = node.getElementType();
        String s = element.accept(this, ctx);
        return needsTypeParens(element) ? "(" + s + ")[]" : s + "[]";
    }

    @Override
    public String visitMapType(MapType node, EmitContext ctx) {
        return "Map<" + node.getKeyType().accept(this, ctx) + ", " + node.getValueType().accept(this, ctx) + ">";
    }

    @Override
    public String visitNamedType(NamedType node, EmitContext ctx) {
        String name = node.getName();
        if (RUNTIME_TYPES.contains(name) && !ctx.declaredTypes.contains(name)) {
            ctx.runtimeTypes.add(name);
        }
        if (node.getTypeArguments().isEmpty()) {
            return name;
        }
        List<String> args = new ArrayList<>();
        for (TypeNode t : node.getTypeArguments()) {
            args.add(t.accept(this, ctx));
        }
        return name + "<" + join(args) + ">";
    }

    @Override
    public String visitFunctionType(FunctionType node, EmitContext ctx) {
        List<String> params = new ArrayList<>();
        List<TypeNode> paramTypes = node.getParameterTypes();
        for (int i = 0; i < paramTypes.size(); i++) {
            params.add("arg" + i + ": " + paramTypes.get(i).accept(this, ctx));
        }
        return "(" + join(params) + ") => " + node.getReturnType().accept(this, ctx);
    }

    @Override
    public String visitUnionType(UnionType node, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (TypeNode member : node.getMembers()) {
            if (sb.length() > 0) sb.append(" | ");
            String s = member.accept(this, ctx);
            sb.append(member instanceof FunctionType ? "(" + s + ")" : s);
        }
        return sb.toString();
    }

    @Override
    public String visitOptionalType(OptionalType node, EmitContext ctx) {
        TypeNode inner = node.getInnerType();
        String s = inner.accept(this, ctx);
        return (inner instanceof FunctionType ? "(" + s + ")" : s) + " | null";
    }

    private static boolean needsTypeParens(TypeNode type) {
        return type instanceof UnionType || type instanceof FunctionType || type instanceof OptionalType;
    }

    // ============ 工具 ============

    private static String join(List<String> parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parts.get(i));
        }
        return sb.toString();
    }

    /**
     * 单引号 JavaScript 字符串字面量
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder("'");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\'': sb.append("\\'"); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20 || c == 0x2028 || c == 0x2029) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                    break;
            }
        }
        return sb.append('\'').toString();
    }
}
