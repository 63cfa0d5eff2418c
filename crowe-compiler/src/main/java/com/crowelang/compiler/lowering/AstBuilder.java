package com.crowelang.compiler.lowering;

import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.decl.*;
import com.crowelang.compiler.ast.expr.*;
import com.crowelang.compiler.ast.expr.AssignExpr.AssignOp;
import com.crowelang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.crowelang.compiler.ast.expr.Literal.LiteralKind;
import com.crowelang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.crowelang.compiler.ast.stmt.*;
import com.crowelang.compiler.ast.type.*;
import com.crowelang.compiler.diagnostic.InternalCompilerError;
import com.crowelang.compiler.lexer.Token;
import com.crowelang.compiler.lexer.TokenType;
import com.crowelang.compiler.parser.CstElement;
import com.crowelang.compiler.parser.CstNode;
import com.crowelang.compiler.parser.CstRule;
import com.crowelang.compiler.parser.CstToken;

import java.util.ArrayList;
import java.util.List;

/**
 * CST → AST 降级
 *
 * <p>纯函数式转换：每条文法规则对应一个 AST 构造；位置信息直接取自 token。
 * 左结合的运算链向左折叠，'**' 向右嵌套；elif 链变为嵌套的 IfStmt。
 * CST 形状不符合文法时抛出 {@link InternalCompilerError}。</p>
 */
public class AstBuilder {

    private final String fileName;

    public AstBuilder(String fileName) {
        this.fileName = fileName;
    }

    // ========== 公共入口 ==========

    public Program build(CstNode program) {
        expectRule(program, CstRule.PROGRAM);
        List<Declaration> declarations = new ArrayList<>();
        for (CstNode child : program.childNodes()) {
            declarations.add(declaration(child));
        }
        return new Program(span(program), declarations);
    }

    // ========== 位置 ==========

    private SourceSpan span(CstElement element) {
        Token first = element.firstToken();
        Token last = element.lastToken();
        if (first == null || last == null) {
            throw new InternalCompilerError("Empty CST node has no source position");
        }
        return new SourceSpan(fileName, first.getLine(), first.getColumn(),
                first.getOffset(), last.getEndOffset());
    }

    private SourceSpan span(Token token) {
        return new SourceSpan(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getEndOffset());
    }

    private SourceSpan spanOrUnknown(CstNode node) {
        return node.firstToken() != null ? span(node) : SourceSpan.UNKNOWN;
    }

    // ========== 形状检查 ==========

    private void expectRule(CstNode node, CstRule rule) {
        if (node == null || !node.is(rule)) {
            throw new InternalCompilerError("Malformed CST: expected " + rule
                    + " but found " + (node == null ? "nothing" : node.getRule()),
                    node == null ? null : spanOrUnknown(node));
        }
    }

    private CstNode require(CstNode parent, CstRule rule) {
        CstNode child = parent.node(rule);
        if (child == null) {
            throw new InternalCompilerError("Malformed CST: " + parent.getRule()
                    + " is missing " + rule, spanOrUnknown(parent));
        }
        return child;
    }

    private Token requireIdentifier(CstNode parent) {
        Token id = parent.identifier();
        if (id == null) {
            throw new InternalCompilerError("Malformed CST: " + parent.getRule()
                    + " is missing its name", spanOrUnknown(parent));
        }
        return id;
    }

    private Token requireToken(CstNode parent, TokenType type) {
        Token t = parent.token(type);
        if (t == null) {
            throw new InternalCompilerError("Malformed CST: " + parent.getRule()
                    + " is missing " + type, spanOrUnknown(parent));
        }
        return t;
    }

    private InternalCompilerError unexpected(CstNode parent, Object what) {
        return new InternalCompilerError("Malformed CST: unexpected " + what
                + " in " + parent.getRule(), spanOrUnknown(parent));
    }

    // ========== 声明 ==========

    private Declaration declaration(CstNode node) {
        switch (node.getRule()) {
            case IMPORT_DECL:         return importDecl(node);
            case STRATEGY_DECL:       return strategy(node);
            case INDICATOR_DECL:      return indicator(node);
            case DATA_DECL:           return data(node);
            case ORDER_DECL:          return order(node);
            case EVENT_DECL:          return eventDecl(node);
            case PORTFOLIO_DECL:      return portfolio(node);
            case BACKTEST_DECL:       return backtest(node);
            case MICROSTRUCTURE_DECL: return microstructure(node);
            default:
                throw unexpected(node, node.getRule());
        }
    }

    private ImportDecl importDecl(CstNode node) {
        String module = (String) requireToken(node, TokenType.STRING_LITERAL).getLiteral();
        if (node.has(TokenType.LBRACE)) {
            List<String> names = new ArrayList<>();
            for (Token t : node.identifiers()) {
                names.add(t.getLexeme());
            }
            return new ImportDecl(span(node), ImportDecl.ImportKind.NAMED, module, names, null, null);
        }
        CstElement second = node.getChildren().size() > 1 ? node.getChildren().get(1) : null;
        if (second instanceof CstToken && ((CstToken) second).getType() == TokenType.STRING_LITERAL) {
            Token alias = node.identifier();
            return new ImportDecl(span(node), ImportDecl.ImportKind.MODULE, module, null, null,
                    alias != null ? alias.getLexeme() : null);
        }
        return new ImportDecl(span(node), ImportDecl.ImportKind.DEFAULT, module, null,
                requireIdentifier(node).getLexeme(), null);
    }

    /**
     * 重复出现的同类子块按源码顺序合并
     */
    private StrategyDecl strategy(CstNode node) {
        String name = requireIdentifier(node).getLexeme();

        List<StrategyParam> params = new ArrayList<>();
        List<Binding> indicators = new ArrayList<>();
        List<Binding> signals = new ArrayList<>();
        List<TradingRule> rules = new ArrayList<>();
        List<Binding> risk = new ArrayList<>();
        List<EventHandler> handlers = new ArrayList<>();
        SourceSpan paramsSpan = null, indicatorsSpan = null, signalsSpan = null;
        SourceSpan rulesSpan = null, riskSpan = null, eventsSpan = null;

        for (CstNode member : node.childNodes()) {
            SourceSpan s = span(member);
            switch (member.getRule()) {
                case PARAMS_BLOCK:
                    for (CstNode p : member.nodes(CstRule.STRATEGY_PARAM)) {
                        params.add(strategyParam(p));
                    }
                    paramsSpan = merge(paramsSpan, s);
                    break;
                case INDICATORS_BLOCK:
                    indicators.addAll(bindings(member));
                    indicatorsSpan = merge(indicatorsSpan, s);
                    break;
                case SIGNALS_BLOCK:
                    signals.addAll(bindings(member));
                    signalsSpan = merge(signalsSpan, s);
                    break;
                case RULES_BLOCK:
                    for (CstNode r : member.nodes(CstRule.TRADING_RULE)) {
                        rules.add(tradingRule(r));
                    }
                    rulesSpan = merge(rulesSpan, s);
                    break;
                case RISK_BLOCK:
                    risk.addAll(bindings(member));
                    riskSpan = merge(riskSpan, s);
                    break;
                case EVENT_HANDLERS:
                    for (CstNode h : member.nodes(CstRule.EVENT_HANDLER)) {
                        handlers.add(eventHandler(h));
                    }
                    eventsSpan = merge(eventsSpan, s);
                    break;
                default:
                    throw unexpected(node, member.getRule());
            }
        }

        return new StrategyDecl(span(node), name,
                paramsSpan != null ? new ParamsBlock(paramsSpan, params) : null,
                indicatorsSpan != null ? new IndicatorsBlock(indicatorsSpan, indicators) : null,
                signalsSpan != null ? new SignalsBlock(signalsSpan, signals) : null,
                rulesSpan != null ? new RulesBlock(rulesSpan, rules) : null,
                riskSpan != null ? new RiskBlock(riskSpan, risk) : null,
                eventsSpan != null ? new EventHandlersBlock(eventsSpan, handlers) : null);
    }

    private static SourceSpan merge(SourceSpan existing, SourceSpan next) {
        return existing == null ? next : existing.to(next);
    }

    private StrategyParam strategyParam(CstNode node) {
        CstNode defaultValue = node.node(CstRule.EXPRESSION);
        return new StrategyParam(span(node), requireIdentifier(node).getLexeme(),
                type(require(node, CstRule.TYPE_EXPR)),
                defaultValue != null ? expression(defaultValue) : null);
    }

    private List<Binding> bindings(CstNode block) {
        List<Binding> result = new ArrayList<>();
        if (block == null) {
            return result;
        }
        for (CstNode b : block.nodes(CstRule.BINDING)) {
            result.add(binding(b));
        }
        return result;
    }

    private Binding binding(CstNode node) {
        return new Binding(span(node), requireIdentifier(node).getLexeme(),
                expression(require(node, CstRule.EXPRESSION)));
    }

    private TradingRule tradingRule(CstNode node) {
        List<TradingAction> actions = new ArrayList<>();
        for (CstNode a : node.nodes(CstRule.TRADING_ACTION)) {
            actions.add(tradingAction(a));
        }
        return new TradingRule(span(node), expression(require(node, CstRule.EXPRESSION)), actions);
    }

    private TradingAction tradingAction(CstNode node) {
        CstNode call = node.node(CstRule.CALL_EXPRESSION);
        if (call != null) {
            Token name = requireIdentifier(call);
            CallExpr expr = new CallExpr(span(call), new Identifier(span(name), name.getLexeme()),
                    arguments(call.node(CstRule.ARGUMENT_LIST)));
            return new TradingAction(span(node), expr);
        }

        Token action = node.firstToken();
        TradingAction.ActionKind kind;
        switch (action.getType()) {
            case SK_BUY:   kind = TradingAction.ActionKind.BUY; break;
            case SK_SELL:  kind = TradingAction.ActionKind.SELL; break;
            case SK_SHORT: kind = TradingAction.ActionKind.SHORT; break;
            case SK_COVER: kind = TradingAction.ActionKind.COVER; break;
            default:
                throw unexpected(node, "'" + action.getLexeme() + "'");
        }
        List<CstNode> args = node.nodes(CstRule.EXPRESSION);
        if (args.isEmpty() || args.size() > 2) {
            throw unexpected(node, args.size() + " order arguments");
        }
        return new TradingAction(span(node), kind, expression(args.get(0)),
                args.size() > 1 ? expression(args.get(1)) : null);
    }

    private EventHandler eventHandler(CstNode node) {
        return new EventHandler(span(node), requireIdentifier(node).getLexeme(),
                parameters(node.node(CstRule.PARAMETER_LIST)),
                block(require(node, CstRule.BLOCK)));
    }

    private List<Parameter> parameters(CstNode list) {
        List<Parameter> result = new ArrayList<>();
        if (list == null) {
            return result;
        }
        for (CstNode p : list.nodes(CstRule.PARAMETER)) {
            CstNode defaultValue = p.node(CstRule.EXPRESSION);
            result.add(new Parameter(span(p), requireIdentifier(p).getLexeme(),
                    type(require(p, CstRule.TYPE_EXPR)),
                    defaultValue != null ? expression(defaultValue) : null));
        }
        return result;
    }

    private IndicatorDecl indicator(CstNode node) {
        CstNode returnType = node.node(CstRule.TYPE_EXPR);
        CstNode body = node.node(CstRule.BLOCK);
        CstNode exprBody = node.node(CstRule.EXPRESSION);
        if ((body == null) == (exprBody == null)) {
            throw unexpected(node, "indicator body");
        }
        return new IndicatorDecl(span(node), requireIdentifier(node).getLexeme(),
                parameters(node.node(CstRule.PARAMETER_LIST)),
                returnType != null ? type(returnType) : null,
                body != null ? block(body) : null,
                exprBody != null ? expression(exprBody) : null);
    }

    private DataDecl data(CstNode node) {
        return new DataDecl(span(node), requireIdentifier(node).getLexeme(),
                fields(node), metrics(node.node(CstRule.METRICS_BLOCK)));
    }

    private OrderDecl order(CstNode node) {
        return new OrderDecl(span(node), requireIdentifier(node).getLexeme(), fields(node));
    }

    private List<DataField> fields(CstNode parent) {
        List<DataField> result = new ArrayList<>();
        for (CstNode f : parent.nodes(CstRule.DATA_FIELD)) {
            CstNode defaultValue = f.node(CstRule.EXPRESSION);
            result.add(new DataField(span(f), requireIdentifier(f).getLexeme(),
                    f.has(TokenType.QUESTION), type(require(f, CstRule.TYPE_EXPR)),
                    defaultValue != null ? expression(defaultValue) : null));
        }
        return result;
    }

    private List<ComputedField> metrics(CstNode block) {
        List<ComputedField> result = new ArrayList<>();
        if (block == null) {
            return result;
        }
        for (CstNode m : block.nodes(CstRule.COMPUTED_FIELD)) {
            result.add(new ComputedField(span(m), requireIdentifier(m).getLexeme(),
                    type(require(m, CstRule.TYPE_EXPR)), expression(require(m, CstRule.EXPRESSION))));
        }
        return result;
    }

    private EventDecl eventDecl(CstNode node) {
        List<EventHandler> handlers = new ArrayList<>();
        for (CstNode h : node.nodes(CstRule.EVENT_HANDLER)) {
            handlers.add(eventHandler(h));
        }
        return new EventDecl(span(node), requireIdentifier(node).getLexeme(), handlers);
    }

    private PortfolioDecl portfolio(CstNode node) {
        return new PortfolioDecl(span(node), requireIdentifier(node).getLexeme(), fields(node),
                metrics(node.node(CstRule.METRICS_BLOCK)),
                bindings(node.node(CstRule.CONSTRAINTS_BLOCK)));
    }

    private BacktestDecl backtest(CstNode node) {
        List<Binding> settings = new ArrayList<>();
        for (CstNode b : node.nodes(CstRule.BINDING)) {
            settings.add(binding(b));
        }
        return new BacktestDecl(span(node), requireIdentifier(node).getLexeme(), settings,
                bindings(node.node(CstRule.COSTS_BLOCK)),
                bindings(node.node(CstRule.OUTPUT_BLOCK)));
    }

    private MicrostructureDecl microstructure(CstNode node) {
        List<Binding> detections = new ArrayList<>();
        List<Binding> quotes = new ArrayList<>();
        List<HedgingRule> hedging = new ArrayList<>();
        for (CstNode d : node.nodes(CstRule.DETECT_BLOCK)) {
            detections.addAll(bindings(d));
        }
        for (CstNode q : node.nodes(CstRule.QUOTE_BLOCK)) {
            quotes.addAll(bindings(q));
        }
        for (CstNode h : node.nodes(CstRule.HEDGING_BLOCK)) {
            for (CstNode r : h.nodes(CstRule.HEDGING_RULE)) {
                hedging.add(new HedgingRule(span(r), expression(require(r, CstRule.EXPRESSION)),
                        block(require(r, CstRule.BLOCK))));
            }
        }
        return new MicrostructureDecl(span(node), requireIdentifier(node).getLexeme(),
                fields(node), detections, quotes, hedging);
    }

    // ========== 类型 ==========

    private TypeNode type(CstNode node) {
        expectRule(node, CstRule.TYPE_EXPR);
        CstNode union = require(node, CstRule.UNION_TYPE);
        List<CstNode> members = union.nodes(CstRule.PRIMARY_TYPE);
        if (members.isEmpty()) {
            throw unexpected(union, "empty union");
        }
        if (members.size() == 1) {
            return primaryType(members.get(0));
        }
        List<TypeNode> types = new ArrayList<>();
        for (CstNode m : members) {
            types.add(primaryType(m));
        }
        return new UnionType(span(union), types);
    }

    private TypeNode primaryType(CstNode node) {
        Token first = node.firstToken();
        List<CstNode> args = node.nodes(CstRule.TYPE_EXPR);
        SourceSpan s = span(node);
        TypeNode base;

        switch (first.getType()) {
            case KW_INT:      base = new PrimitiveType(s, PrimitiveType.Kind.INT); break;
            case KW_FLOAT:    base = new PrimitiveType(s, PrimitiveType.Kind.FLOAT); break;
            case KW_STRING:   base = new PrimitiveType(s, PrimitiveType.Kind.STRING); break;
            case KW_BOOLEAN:  base = new PrimitiveType(s, PrimitiveType.Kind.BOOLEAN); break;
            case KW_DATETIME: base = new PrimitiveType(s, PrimitiveType.Kind.DATETIME); break;
            case KW_VOID:     base = new PrimitiveType(s, PrimitiveType.Kind.VOID); break;
            case LPAREN: {
                if (args.isEmpty()) throw unexpected(node, "function type without return type");
                List<TypeNode> paramTypes = new ArrayList<>();
                for (int i = 0; i < args.size() - 1; i++) {
                    paramTypes.add(type(args.get(i)));
                }
                base = new FunctionType(s, paramTypes, type(args.get(args.size() - 1)));
                break;
            }
            default:
                if (!first.getType().isIdentifierLike()) {
                    throw unexpected(node, "'" + first.getLexeme() + "'");
                }
                if (first.getType() == TokenType.SK_ARRAY && node.has(TokenType.LT)) {
                    if (args.size() != 1) throw unexpected(node, "Array type arguments");
                    base = new ArrayType(s, type(args.get(0)));
                } else if (first.getType() == TokenType.SK_MAP && node.has(TokenType.LT)) {
                    if (args.size() != 2) throw unexpected(node, "Map type arguments");
                    base = new MapType(s, type(args.get(0)), type(args.get(1)));
                } else {
                    List<TypeNode> typeArgs = new ArrayList<>();
                    for (CstNode a : args) {
                        typeArgs.add(type(a));
                    }
                    base = new NamedType(s, first.getLexeme(), typeArgs);
                }
                break;
        }

        return node.has(TokenType.QUESTION) ? new OptionalType(s, base) : base;
    }

    // ========== 语句 ==========

    private Block block(CstNode node) {
        expectRule(node, CstRule.BLOCK);
        List<Statement> statements = new ArrayList<>();
        for (CstNode s : node.nodes(CstRule.STATEMENT)) {
            statements.add(statement(s));
        }
        return new Block(span(node), statements);
    }

    private Statement statement(CstNode wrapper) {
        List<CstNode> children = wrapper.childNodes();
        if (children.size() != 1) {
            throw unexpected(wrapper, children.size() + " children");
        }
        CstNode node = children.get(0);
        SourceSpan s = span(node);
        switch (node.getRule()) {
            case VARIABLE_DECLARATION:
                return new VarDeclStmt(s, requireIdentifier(node).getLexeme(),
                        type(require(node, CstRule.TYPE_EXPR)), expression(require(node, CstRule.EXPRESSION)));
            case IF_STATEMENT:
                return ifStatement(node);
            case WHILE_STATEMENT:
                return new WhileStmt(s, expression(require(node, CstRule.EXPRESSION)), block(require(node, CstRule.BLOCK)));
            case FOR_STATEMENT:
                return new ForStmt(s, requireIdentifier(node).getLexeme(),
                        expression(require(node, CstRule.EXPRESSION)), block(require(node, CstRule.BLOCK)));
            case RETURN_STATEMENT: {
                CstNode value = node.node(CstRule.EXPRESSION);
                return new ReturnStmt(s, value != null ? expression(value) : null);
            }
            case BREAK_STATEMENT:
                return new BreakStmt(s);
            case CONTINUE_STATEMENT:
                return new ContinueStmt(s);
            case WHEN_STATEMENT:
                return new WhenStmt(s, expression(require(node, CstRule.EXPRESSION)), block(require(node, CstRule.BLOCK)));
            case EXPRESSION_STATEMENT:
                return new ExpressionStmt(s, expression(require(node, CstRule.EXPRESSION)));
            case BLOCK:
                return block(node);
            default:
                throw unexpected(wrapper, node.getRule());
        }
    }

    /**
     * if / elif* / else?：从末尾向前折叠为嵌套的 IfStmt
     */
    private IfStmt ifStatement(CstNode node) {
        List<CstNode> conditions = node.nodes(CstRule.EXPRESSION);
        List<CstNode> blocks = node.nodes(CstRule.BLOCK);
        List<Token> elifs = node.tokens(TokenType.KW_ELIF);
        boolean hasElse = blocks.size() == conditions.size() + 1;
        if (conditions.isEmpty() || (!hasElse && blocks.size() != conditions.size())
                || elifs.size() != conditions.size() - 1) {
            throw unexpected(node, "if/elif/else structure");
        }

        Statement elseBranch = hasElse ? block(blocks.get(blocks.size() - 1)) : null;
        for (int i = conditions.size() - 1; i >= 1; i--) {
            Block then = block(blocks.get(i));
            SourceSpan s = span(elifs.get(i - 1)).to(elseBranch != null ? elseBranch.getSpan() : then.getSpan());
            elseBranch = new IfStmt(s, expression(conditions.get(i)), then, elseBranch);
        }
        return new IfStmt(span(node), expression(conditions.get(0)), block(blocks.get(0)), elseBranch);
    }

    // ========== 表达式 ==========

    private Expression expression(CstNode node) {
        switch (node.getRule()) {
            case EXPRESSION:
                return expression(require(node, CstRule.ASSIGNMENT));
            case ASSIGNMENT:
                return assignment(node);
            case CONDITIONAL:
                return conditional(node);
            case LOGICAL_OR:
            case LOGICAL_AND:
            case EQUALITY:
            case RELATIONAL:
            case ADDITIVE:
            case MULTIPLICATIVE:
                return leftAssociative(node);
            case MEMBERSHIP:
                return membership(node);
            case UNARY:
                return unary(node);
            case POWER:
                return power(node);
            case POSTFIX:
                return postfix(node);
            case PRIMARY:
                return primary(node);
            default:
                throw unexpected(node, node.getRule());
        }
    }

    private Expression assignment(CstNode node) {
        List<CstElement> children = node.getChildren();
        Expression target = expression(require(node, CstRule.CONDITIONAL));
        if (children.size() == 1) {
            return target;
        }
        Token op = ((CstToken) children.get(1)).getToken();
        Expression value = expression(require(node, CstRule.ASSIGNMENT));
        return new AssignExpr(span(node), target, assignOp(node, op), value);
    }

    private AssignOp assignOp(CstNode node, Token op) {
        switch (op.getType()) {
            case ASSIGN:       return AssignOp.ASSIGN;
            case PLUS_ASSIGN:  return AssignOp.ADD_ASSIGN;
            case MINUS_ASSIGN: return AssignOp.SUB_ASSIGN;
            case MUL_ASSIGN:   return AssignOp.MUL_ASSIGN;
            case DIV_ASSIGN:   return AssignOp.DIV_ASSIGN;
            case MOD_ASSIGN:   return AssignOp.MOD_ASSIGN;
            default:
                throw unexpected(node, "assignment operator '" + op.getLexeme() + "'");
        }
    }

    private Expression conditional(CstNode node) {
        List<CstNode> parts = node.nodes(CstRule.LOGICAL_OR);
        if (parts.size() == 1) {
            return expression(parts.get(0));
        }
        if (parts.size() != 3) {
            throw unexpected(node, parts.size() + " conditional operands");
        }
        return new ConditionalExpr(span(node), expression(parts.get(0)),
                expression(parts.get(1)), expression(parts.get(2)));
    }

    /**
     * operand (op operand)* 向左折叠
     */
    private Expression leftAssociative(CstNode node) {
        List<CstElement> children = node.getChildren();
        Expression left = expression((CstNode) children.get(0));
        for (int i = 1; i + 1 < children.size(); i += 2) {
            Token op = ((CstToken) children.get(i)).getToken();
            Expression right = expression((CstNode) children.get(i + 1));
            left = new BinaryExpr(left.getSpan().to(right.getSpan()), left, binaryOp(node, op), right);
        }
        return left;
    }

    private BinaryOp binaryOp(CstNode node, Token op) {
        switch (op.getType()) {
            case OR:
            case KW_OR:   return BinaryOp.OR;
            case AND:
            case KW_AND:  return BinaryOp.AND;
            case EQ:      return BinaryOp.EQ;
            case NE:      return BinaryOp.NE;
            case LT:      return BinaryOp.LT;
            case LE:      return BinaryOp.LE;
            case GT:      return BinaryOp.GT;
            case GE:      return BinaryOp.GE;
            case PLUS:    return BinaryOp.ADD;
            case MINUS:   return BinaryOp.SUB;
            case MUL:     return BinaryOp.MUL;
            case DIV:     return BinaryOp.DIV;
            case MOD:     return BinaryOp.MOD;
            default:
                throw unexpected(node, "operator '" + op.getLexeme() + "'");
        }
    }

    private Expression membership(CstNode node) {
        List<CstNode> operands = node.nodes(CstRule.EQUALITY);
        Expression left = expression(operands.get(0));
        if (operands.size() == 1) {
            return left;
        }
        Expression right = expression(operands.get(1));
        BinaryOp op = node.has(TokenType.KW_NOT) ? BinaryOp.NOT_IN : BinaryOp.IN;
        return new BinaryExpr(left.getSpan().to(right.getSpan()), left, op, right);
    }

    private Expression unary(CstNode node) {
        CstElement first = node.getChildren().get(0);
        if (first instanceof CstNode) {
            return expression(require(node, CstRule.POWER));
        }
        Token op = ((CstToken) first).getToken();
        Expression operand = expression(require(node, CstRule.UNARY));
        SourceSpan s = span(node);
        switch (op.getType()) {
            case KW_AWAIT: return new AwaitExpr(s, operand);
            case PLUS:     return new UnaryExpr(s, UnaryOp.PLUS, operand);
            case MINUS:    return new UnaryExpr(s, UnaryOp.NEG, operand);
            case NOT:
            case KW_NOT:   return new UnaryExpr(s, UnaryOp.NOT, operand);
            case BIT_NOT:  return new UnaryExpr(s, UnaryOp.BIT_NOT, operand);
            default:
                throw unexpected(node, "unary operator '" + op.getLexeme() + "'");
        }
    }

    // '**' 的右操作数是 UNARY，其内部可能再次包含 POWER，形成右结合
    private Expression power(CstNode node) {
        Expression base = expression(require(node, CstRule.POSTFIX));
        CstNode exponent = node.node(CstRule.UNARY);
        if (exponent == null) {
            return base;
        }
        return new BinaryExpr(span(node), base, BinaryOp.POW, expression(exponent));
    }

    private Expression postfix(CstNode node) {
        List<CstElement> children = node.getChildren();
        Expression result = expression(require(node, CstRule.PRIMARY));
        SourceSpan start = result.getSpan();

        int i = 1;
        while (i < children.size()) {
            Token op = ((CstToken) children.get(i)).getToken();
            switch (op.getType()) {
                case DOT: {
                    Token name = ((CstToken) children.get(i + 1)).getToken();
                    result = new MemberExpr(start.to(span(name)), result, name.getLexeme());
                    i += 2;
                    break;
                }
                case LBRACKET: {
                    CstNode inner = (CstNode) children.get(i + 1);
                    Token close = ((CstToken) children.get(i + 2)).getToken();
                    result = indexOrSlice(start.to(span(close)), result, inner);
                    i += 3;
                    break;
                }
                case LPAREN: {
                    CstElement next = children.get(i + 1);
                    List<Expression> args;
                    if (next instanceof CstNode) {
                        args = arguments((CstNode) next);
                        i += 1;
                    } else {
                        args = new ArrayList<>();
                    }
                    Token close = ((CstToken) children.get(i + 1)).getToken();
                    result = new CallExpr(start.to(span(close)), result, args);
                    i += 2;
                    break;
                }
                default:
                    throw unexpected(node, "'" + op.getLexeme() + "'");
            }
        }
        return result;
    }

    /**
     * 按 ':' 分段：第 0 段 start，第 1 段 end，第 2 段 step
     */
    private Expression indexOrSlice(SourceSpan s, Expression target, CstNode node) {
        expectRule(node, CstRule.INDEX_OR_SLICE);
        if (!node.has(TokenType.COLON)) {
            return new IndexExpr(s, target, expression(require(node, CstRule.EXPRESSION)));
        }
        Expression[] parts = new Expression[3];
        int segment = 0;
        for (CstElement e : node.getChildren()) {
            if (e instanceof CstToken) {
                segment++;
            } else {
                parts[segment] = expression((CstNode) e);
            }
        }
        return new SliceExpr(s, target, parts[0], parts[1], parts[2]);
    }

    private List<Expression> arguments(CstNode list) {
        List<Expression> result = new ArrayList<>();
        if (list == null) {
            return result;
        }
        for (CstNode e : list.nodes(CstRule.EXPRESSION)) {
            result.add(expression(e));
        }
        return result;
    }

    private Expression primary(CstNode node) {
        CstElement first = node.getChildren().get(0);
        if (first instanceof CstNode) {
            CstNode inner = (CstNode) first;
            switch (inner.getRule()) {
                case ARRAY_LITERAL:
                    return new ArrayLiteral(span(inner), arguments(inner));
                case COMPREHENSION:
                    return comprehension(inner);
                case OBJECT_LITERAL:
                    return objectLiteral(inner);
                default:
                    throw unexpected(node, inner.getRule());
            }
        }

        Token t = ((CstToken) first).getToken();
        SourceSpan s = span(t);
        switch (t.getType()) {
            case NUMBER_LITERAL:
                return new Literal(s, t.getLiteral(), LiteralKind.NUMBER, t.getLexeme());
            case STRING_LITERAL:
                return new Literal(s, t.getLiteral(), LiteralKind.STRING, t.getLexeme());
            case DATE_LITERAL:
                return new Literal(s, t.getLexeme(), LiteralKind.DATE, t.getLexeme());
            case KW_TRUE:
                return new Literal(s, Boolean.TRUE, LiteralKind.BOOLEAN, t.getLexeme());
            case KW_FALSE:
                return new Literal(s, Boolean.FALSE, LiteralKind.BOOLEAN, t.getLexeme());
            case KW_NULL:
                return new Literal(s, null, LiteralKind.NULL, t.getLexeme());
            case LPAREN:
                // 括号只影响结构，不产生节点
                return expression(require(node, CstRule.EXPRESSION));
            default:
                if (t.getType().isIdentifierLike()) {
                    return new Identifier(s, t.getLexeme());
                }
                throw unexpected(node, "'" + t.getLexeme() + "'");
        }
    }

    private ComprehensionExpr comprehension(CstNode node) {
        List<CstNode> parts = node.nodes(CstRule.EXPRESSION);
        if (parts.size() < 2 || parts.size() > 3) {
            throw unexpected(node, parts.size() + " comprehension parts");
        }
        return new ComprehensionExpr(span(node), expression(parts.get(0)),
                requireIdentifier(node).getLexeme(), expression(parts.get(1)),
                parts.size() == 3 ? expression(parts.get(2)) : null);
    }

    private ObjectLiteral objectLiteral(CstNode node) {
        List<ObjectLiteral.Property> properties = new ArrayList<>();
        for (CstNode p : node.nodes(CstRule.OBJECT_PROPERTY)) {
            Token key = p.firstToken();
            CstNode value = p.node(CstRule.EXPRESSION);
            if (key.getType() == TokenType.STRING_LITERAL) {
                properties.add(new ObjectLiteral.Property((String) key.getLiteral(), true,
                        expression(require(p, CstRule.EXPRESSION)), false));
            } else if (value != null) {
                properties.add(new ObjectLiteral.Property(key.getLexeme(), false, expression(value), false));
            } else {
                properties.add(new ObjectLiteral.Property(key.getLexeme(), false,
                        new Identifier(span(key), key.getLexeme()), true));
            }
        }
        return new ObjectLiteral(span(node), properties);
    }
}
