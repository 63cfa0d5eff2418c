package com.crowelang.compiler.codegen;

import com.crowelang.compiler.ast.expr.BinaryExpr;
import com.crowelang.compiler.ast.expr.Expression;
import com.crowelang.compiler.ast.expr.Literal;
import com.crowelang.compiler.ast.expr.UnaryExpr;

import java.math.BigDecimal;

/**
 * 数值字面量常量折叠
 */
final class ConstantFolder {

    private ConstantFolder() {
    }

    /**
     * 表达式仅由数值字面量与算术运算组成时返回其值，否则返回 null；
     * 结果非有限值（除零、溢出）时同样返回 null。
     */
    static Double evaluate(Expression expr) {
        Double value = eval(expr);
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return value;
    }

    private static Double eval(Expression expr) {
        if (expr instanceof Literal) {
            Literal lit = (Literal) expr;
            return lit.isNumber() ? lit.asNumber() : null;
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            Double operand = eval(unary.getOperand());
            if (operand == null) return null;
            switch (unary.getOperator()) {
                case PLUS: return operand;
                case NEG:  return -operand;
                default:   return null;
            }
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            if (!isArithmetic(bin.getOperator())) return null;
            Double left = eval(bin.getLeft());
            if (left == null) return null;
            Double right = eval(bin.getRight());
            if (right == null) return null;
            switch (bin.getOperator()) {
                case ADD: return left + right;
                case SUB: return left - right;
                case MUL: return left * right;
                case DIV: return right == 0 ? null : left / right;
                case MOD: return right == 0 ? null : left % right;
                case POW: return Math.pow(left, right);
                default:  return null;
            }
        }
        return null;
    }

    static boolean isArithmetic(BinaryExpr.BinaryOp op) {
        switch (op) {
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case MOD:
            case POW:
                return true;
            default:
                return false;
        }
    }

    /**
     * 数值的 JavaScript 字面量形式：整数不带小数点，其余使用最短的十进制表示
     */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }
}
