package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.CallExpr;
import com.crowelang.compiler.ast.expr.Expression;

/**
 * 交易动作：下单 buy/sell/short/cover(quantity[, price])，或任意函数调用
 *
 * <p>price 缺省表示市价单。kind 为 CALL 时只有 {@link #getCall()} 有效。</p>
 */
public class TradingAction extends AstNode {
    private final ActionKind kind;
    private final Expression quantity;
    private final Expression price;   // 可选
    private final CallExpr call;      // 仅 CALL

    public TradingAction(SourceSpan span, ActionKind kind, Expression quantity, Expression price) {
        super(span);
        this.kind = kind;
        this.quantity = quantity;
        this.price = price;
        this.call = null;
    }

    public TradingAction(SourceSpan span, CallExpr call) {
        super(span);
        this.kind = ActionKind.CALL;
        this.quantity = null;
        this.price = null;
        this.call = call;
    }

    public ActionKind getKind() {
        return kind;
    }

    public Expression getQuantity() {
        return quantity;
    }

    public Expression getPrice() {
        return price;
    }

    public boolean isMarketOrder() {
        return kind != ActionKind.CALL && price == null;
    }

    public CallExpr getCall() {
        return call;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTradingAction(this, context);
    }

    public enum ActionKind {
        BUY("buy"),
        SELL("sell"),
        SHORT("short"),
        COVER("cover"),
        CALL(null);

        private final String method;

        ActionKind(String method) {
            this.method = method;
        }

        /** 运行时下单入口方法名 */
        public String method() {
            return method;
        }
    }
}
