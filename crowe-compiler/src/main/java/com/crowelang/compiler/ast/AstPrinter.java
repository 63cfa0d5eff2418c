package com.crowelang.compiler.ast;

import com.crowelang.compiler.ast.decl.*;
import com.crowelang.compiler.ast.expr.*;
import com.crowelang.compiler.ast.stmt.*;
import com.crowelang.compiler.ast.type.*;

import java.util.List;

/**
 * AST 的 S 表达式打印器
 *
 * <p>表达式输出为完全加括号的前缀形式，例如 {@code a + b * c} 打印为 {@code (+ a (* b c))}；
 * 类型按源码语法打印。主要用于测试和调试输出。</p>
 */
public class AstPrinter implements AstVisitor<String, Void> {

    public String print(AstNode node) {
        return node == null ? "_" : node.accept(this, null);
    }

    private String list(String head, List<? extends AstNode> nodes) {
        StringBuilder sb = new StringBuilder("(").append(head);
        for (AstNode n : nodes) {
            sb.append(' ').append(print(n));
        }
        return sb.append(')').toString();
    }

    private String joinTypes(List<TypeNode> types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(print(types.get(i)));
        }
        return sb.toString();
    }

    // ============ 声明 ============

    @Override
    public String visitProgram(Program node, Void ctx) {
        return list("program", node.getDeclarations());
    }

    @Override
    public String visitImportDecl(ImportDecl node, Void ctx) {
        switch (node.getKind()) {
            case NAMED:
                return "(import " + node.getNames() + " \"" + node.getModule() + "\")";
            case DEFAULT:
                return "(import " + node.getDefaultName() + " \"" + node.getModule() + "\")";
            default:
                return "(import \"" + node.getModule() + "\""
                        + (node.getAlias() != null ? " as " + node.getAlias() : "") + ")";
        }
    }

    @Override
    public String visitStrategyDecl(StrategyDecl node, Void ctx) {
        StringBuilder sb = new StringBuilder("(strategy ").append(node.getName());
        AstNode[] blocks = {node.getParams(), node.getIndicators(), node.getSignals(),
                node.getRules(), node.getRisk(), node.getEventHandlers()};
        for (AstNode block : blocks) {
            if (block != null) sb.append(' ').append(print(block));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitParamsBlock(ParamsBlock node, Void ctx) {
        return list("params", node.getParams());
    }

    @Override
    public String visitStrategyParam(StrategyParam node, Void ctx) {
        return "(param " + node.getName() + " " + print(node.getType())
                + (node.getDefaultValue() != null ? " " + print(node.getDefaultValue()) : "") + ")";
    }

    @Override
    public String visitIndicatorsBlock(IndicatorsBlock node, Void ctx) {
        return list("indicators", node.getBindings());
    }

    @Override
    public String visitSignalsBlock(SignalsBlock node, Void ctx) {
        return list("signals", node.getBindings());
    }

    @Override
    public String visitRulesBlock(RulesBlock node, Void ctx) {
        return list("rules", node.getRules());
    }

    @Override
    public String visitTradingRule(TradingRule node, Void ctx) {
        return list("when " + print(node.getCondition()), node.getActions());
    }

    @Override
    public String visitTradingAction(TradingAction node, Void ctx) {
        if (node.getKind() == TradingAction.ActionKind.CALL) {
            return print(node.getCall());
        }
        return "(" + node.getKind().method() + " " + print(node.getQuantity())
                + (node.getPrice() != null ? " " + print(node.getPrice()) : "") + ")";
    }

    @Override
    public String visitRiskBlock(RiskBlock node, Void ctx) {
        return list("risk", node.getBindings());
    }

    @Override
    public String visitEventHandlersBlock(EventHandlersBlock node, Void ctx) {
        return list("event", node.getHandlers());
    }

    @Override
    public String visitEventHandler(EventHandler node, Void ctx) {
        return "(" + node.getName() + " " + list("params", node.getParameters()) + " " + print(node.getBody()) + ")";
    }

    @Override
    public String visitBinding(Binding node, Void ctx) {
        return "(" + node.getName() + " " + print(node.getValue()) + ")";
    }

    @Override
    public String visitParameter(Parameter node, Void ctx) {
        return node.getName() + ":" + print(node.getType());
    }

    @Override
    public String visitIndicatorDecl(IndicatorDecl node, Void ctx) {
        String body = node.isExpressionBody() ? print(node.getExpressionBody()) : print(node.getBody());
        return "(indicator " + node.getName() + " " + list("params", node.getParameters())
                + " " + print(node.getReturnType()) + " " + body + ")";
    }

    @Override
    public String visitDataDecl(DataDecl node, Void ctx) {
        return "(data " + node.getName() + " " + list("fields", node.getFields())
                + " " + list("metrics", node.getMetrics()) + ")";
    }

    @Override
    public String visitDataField(DataField node, Void ctx) {
        return node.getName() + (node.isOptional() ? "?" : "") + ":" + print(node.getType());
    }

    @Override
    public String visitComputedField(ComputedField node, Void ctx) {
        return "(" + node.getName() + ":" + print(node.getType()) + " " + print(node.getValue()) + ")";
    }

    @Override
    public String visitOrderDecl(OrderDecl node, Void ctx) {
        return "(order " + node.getName() + " " + list("fields", node.getFields()) + ")";
    }

    @Override
    public String visitEventDecl(EventDecl node, Void ctx) {
        return list("event " + node.getName(), node.getHandlers());
    }

    @Override
    public String visitPortfolioDecl(PortfolioDecl node, Void ctx) {
        return "(portfolio " + node.getName() + " " + list("fields", node.getFields())
                + " " + list("metrics", node.getMetrics())
                + " " + list("constraints", node.getConstraints()) + ")";
    }

    @Override
    public String visitBacktestDecl(BacktestDecl node, Void ctx) {
        return "(backtest " + node.getName() + " " + list("settings", node.getSettings())
                + " " + list("costs", node.getCosts()) + " " + list("output", node.getOutput()) + ")";
    }

    @Override
    public String visitMicrostructureDecl(MicrostructureDecl node, Void ctx) {
        return "(microstructure " + node.getName() + " " + list("fields", node.getFields())
                + " " + list("detect", node.getDetections()) + " " + list("quote", node.getQuotes())
                + " " + list("hedging", node.getHedgingRules()) + ")";
    }

    @Override
    public String visitHedgingRule(HedgingRule node, Void ctx) {
        return "(when " + print(node.getCondition()) + " " + print(node.getBody()) + ")";
    }

    // ============ 语句 ============

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return print(node.getExpression());
    }

    @Override
    public String visitVarDeclStmt(VarDeclStmt node, Void ctx) {
        return "(let " + node.getName() + ":" + print(node.getType()) + " " + print(node.getInitializer()) + ")";
    }

    @Override
    public String visitBlock(Block node, Void ctx) {
        return list("block", node.getStatements());
    }

    @Override
    public String visitIfStmt(IfStmt node, Void ctx) {
        return "(if " + print(node.getCondition()) + " " + print(node.getThenBranch())
                + (node.hasElse() ? " " + print(node.getElseBranch()) : "") + ")";
    }

    @Override
    public String visitWhileStmt(WhileStmt node, Void ctx) {
        return "(while " + print(node.getCondition()) + " " + print(node.getBody()) + ")";
    }

    @Override
    public String visitForStmt(ForStmt node, Void ctx) {
        return "(for " + node.getVariable() + " " + print(node.getIterable()) + " " + print(node.getBody()) + ")";
    }

    @Override
    public String visitReturnStmt(ReturnStmt node, Void ctx) {
        return node.hasValue() ? "(return " + print(node.getValue()) + ")" : "(return)";
    }

    @Override
    public String visitBreakStmt(BreakStmt node, Void ctx) {
        return "(break)";
    }

    @Override
    public String visitContinueStmt(ContinueStmt node, Void ctx) {
        return "(continue)";
    }

    @Override
    public String visitWhenStmt(WhenStmt node, Void ctx) {
        return "(when " + print(node.getCondition()) + " " + print(node.getBody()) + ")";
    }

    // ============ 表达式 ============

    @Override
    public String visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case STRING:
                return "\"" + node.getValue() + "\"";
            case DATE:
                return "#" + node.getValue();
            default:
                return node.getRaw();
        }
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        return node.getName();
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        return "(" + node.getOperator().toSourceString() + " " + print(node.getLeft()) + " " + print(node.getRight()) + ")";
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        return "(" + node.getOperator().toSourceString() + " " + print(node.getOperand()) + ")";
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        return list("call " + print(node.getCallee()), node.getArguments());
    }

    @Override
    public String visitMemberExpr(MemberExpr node, Void ctx) {
        return "(. " + print(node.getTarget()) + " " + node.getMember() + ")";
    }

    @Override
    public String visitIndexExpr(IndexExpr node, Void ctx) {
        return "(index " + print(node.getTarget()) + " " + print(node.getIndex()) + ")";
    }

    @Override
    public String visitSliceExpr(SliceExpr node, Void ctx) {
        return "(slice " + print(node.getTarget()) + " " + print(node.getStart()) + " "
                + print(node.getEnd()) + " " + print(node.getStep()) + ")";
    }

    @Override
    public String visitConditionalExpr(ConditionalExpr node, Void ctx) {
        return "(? " + print(node.getCondition()) + " " + print(node.getThenExpr()) + " " + print(node.getElseExpr()) + ")";
    }

    @Override
    public String visitAssignExpr(AssignExpr node, Void ctx) {
        return "(" + node.getOperator().toSourceString() + " " + print(node.getTarget()) + " " + print(node.getValue()) + ")";
    }

    @Override
    public String visitArrayLiteral(ArrayLiteral node, Void ctx) {
        return list("array", node.getElements());
    }

    @Override
    public String visitObjectLiteral(ObjectLiteral node, Void ctx) {
        StringBuilder sb = new StringBuilder("(object");
        for (ObjectLiteral.Property p : node.getProperties()) {
            sb.append(" (").append(p.getKey()).append(' ').append(print(p.getValue())).append(')');
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitComprehensionExpr(ComprehensionExpr node, Void ctx) {
        return "(comprehension " + print(node.getElement()) + " " + node.getVariable() + " "
                + print(node.getIterable()) + " " + print(node.getFilter()) + ")";
    }

    @Override
    public String visitAwaitExpr(AwaitExpr node, Void ctx) {
        return "(await " + print(node.getOperand()) + ")";
    }

    // ============ 类型 ============

    @Override
    public String visitPrimitiveType(PrimitiveType node, Void ctx) {
        return node.getKind().keyword();
    }

    @Override
    public String visitArrayType(ArrayType node, Void ctx) {
        return "Array<" + print(node.getElementType()) + ">";
    }

    @Override
    public String visitMapType(MapType node, Void ctx) {
        return "Map<" + print(node.getKeyType()) + ", " + print(node.getValueType()) + ">";
    }

    @Override
    public String visitNamedType(NamedType node, Void ctx) {
        if (node.getTypeArguments().isEmpty()) {
            return node.getName();
        }
        return node.getName() + "<" + joinTypes(node.getTypeArguments()) + ">";
    }

    @Override
    public String visitFunctionType(FunctionType node, Void ctx) {
        return "(" + joinTypes(node.getParameterTypes()) + ") -> " + print(node.getReturnType());
    }

    @Override
    public String visitUnionType(UnionType node, Void ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < node.getMembers().size(); i++) {
            if (i > 0) sb.append(" | ");
            sb.append(print(node.getMembers().get(i)));
        }
        return sb.toString();
    }

    @Override
    public String visitOptionalType(OptionalType node, Void ctx) {
        return print(node.getInnerType()) + "?";
    }
}
