package com.crowelang.compiler.ast;

import com.crowelang.compiler.ast.decl.*;
import com.crowelang.compiler.ast.expr.*;
import com.crowelang.compiler.ast.stmt.*;
import com.crowelang.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>每种具体节点对应一个抽象方法，没有默认实现：新增节点类型时，所有实现类都必须在编译期补齐处理。</p>
 *
 * @param <R> 返回值类型
 * @param <C> 上下文类型
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitProgram(Program node, C ctx);

    R visitImportDecl(ImportDecl node, C ctx);

    R visitStrategyDecl(StrategyDecl node, C ctx);

    R visitParamsBlock(ParamsBlock node, C ctx);

    R visitStrategyParam(StrategyParam node, C ctx);

    R visitIndicatorsBlock(IndicatorsBlock node, C ctx);

    R visitSignalsBlock(SignalsBlock node, C ctx);

    R visitRulesBlock(RulesBlock node, C ctx);

    R visitTradingRule(TradingRule node, C ctx);

    R visitTradingAction(TradingAction node, C ctx);

    R visitRiskBlock(RiskBlock node, C ctx);

    R visitEventHandlersBlock(EventHandlersBlock node, C ctx);

    R visitEventHandler(EventHandler node, C ctx);

    R visitBinding(Binding node, C ctx);

    R visitParameter(Parameter node, C ctx);

    R visitIndicatorDecl(IndicatorDecl node, C ctx);

    R visitDataDecl(DataDecl node, C ctx);

    R visitDataField(DataField node, C ctx);

    R visitComputedField(ComputedField node, C ctx);

    R visitOrderDecl(OrderDecl node, C ctx);

    R visitEventDecl(EventDecl node, C ctx);

    R visitPortfolioDecl(PortfolioDecl node, C ctx);

    R visitBacktestDecl(BacktestDecl node, C ctx);

    R visitMicrostructureDecl(MicrostructureDecl node, C ctx);

    R visitHedgingRule(HedgingRule node, C ctx);

    // ============ 语句 ============

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitVarDeclStmt(VarDeclStmt node, C ctx);

    R visitBlock(Block node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitWhenStmt(WhenStmt node, C ctx);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitSliceExpr(SliceExpr node, C ctx);

    R visitConditionalExpr(ConditionalExpr node, C ctx);

    R visitAssignExpr(AssignExpr node, C ctx);

    R visitArrayLiteral(ArrayLiteral node, C ctx);

    R visitObjectLiteral(ObjectLiteral node, C ctx);

    R visitComprehensionExpr(ComprehensionExpr node, C ctx);

    R visitAwaitExpr(AwaitExpr node, C ctx);

    // ============ 类型 ============

    R visitPrimitiveType(PrimitiveType node, C ctx);

    R visitArrayType(ArrayType node, C ctx);

    R visitMapType(MapType node, C ctx);

    R visitNamedType(NamedType node, C ctx);

    R visitFunctionType(FunctionType node, C ctx);

    R visitUnionType(UnionType node, C ctx);

    R visitOptionalType(OptionalType node, C ctx);
}
