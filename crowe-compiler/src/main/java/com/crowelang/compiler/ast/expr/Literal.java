package com.crowelang.compiler.ast.expr;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 字面量表达式
 *
 * <p>值类型：NUMBER 为 {@link Double}，STRING / DATE 为 {@link String}，
 * BOOLEAN 为 {@link Boolean}，NULL 为 null。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;
    private final String raw;

    public Literal(SourceSpan span, Object value, LiteralKind kind, String raw) {
        super(span);
        this.value = value;
        this.kind = kind;
        this.raw = raw;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    /** 源码中的原始写法 */
    public String getRaw() {
        return raw;
    }

    public boolean isNumber() {
        return kind == LiteralKind.NUMBER;
    }

    public double asNumber() {
        return ((Double) value).doubleValue();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        STRING,
        BOOLEAN,
        NULL,
        DATE
    }
}
