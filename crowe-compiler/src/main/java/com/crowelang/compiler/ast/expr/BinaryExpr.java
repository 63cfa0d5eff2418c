package com.crowelang.compiler.ast.expr;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceSpan span, Expression left, BinaryOp operator, Expression right) {
        super(span);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     *
     * <p>precedence 数值越大绑定越紧，与语法中的优先级阶梯一致。</p>
     */
    public enum BinaryOp {
        // 逻辑
        OR("||", 3),
        AND("&&", 4),

        // 成员关系
        IN("in", 5),
        NOT_IN("not in", 5),

        // 相等
        EQ("==", 6),
        NE("!=", 6),

        // 比较
        LT("<", 7),
        GT(">", 7),
        LE("<=", 7),
        GE(">=", 7),

        // 算术
        ADD("+", 8),
        SUB("-", 8),
        MUL("*", 9),
        DIV("/", 9),
        MOD("%", 9),
        POW("**", 10);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回 CroweLang 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public int precedence() {
            return precedence;
        }

        public boolean isRightAssociative() {
            return this == POW;
        }
    }
}
