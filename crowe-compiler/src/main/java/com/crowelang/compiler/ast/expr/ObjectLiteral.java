package com.crowelang.compiler.ast.expr;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 对象字面量 { key: value, "quoted": value, shorthand }
 */
public class ObjectLiteral extends Expression {
    private final List<Property> properties;

    public ObjectLiteral(SourceSpan span, List<Property> properties) {
        super(span);
        this.properties = immutable(properties);
    }

    public List<Property> getProperties() {
        return properties;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectLiteral(this, context);
    }

    /**
     * 对象属性；简写形式 {@code { x }} 的 value 为同名标识符
     */
    public static final class Property {
        private final String key;
        private final boolean quotedKey;
        private final Expression value;
        private final boolean shorthand;

        public Property(String key, boolean quotedKey, Expression value, boolean shorthand) {
            this.key = key;
            this.quotedKey = quotedKey;
            this.value = value;
            this.shorthand = shorthand;
        }

        public String getKey() {
            return key;
        }

        public boolean isQuotedKey() {
            return quotedKey;
        }

        public Expression getValue() {
            return value;
        }

        public boolean isShorthand() {
            return shorthand;
        }
    }
}
