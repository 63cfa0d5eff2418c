package com.crowelang.compiler.ast.type;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 基本类型 int / float / string / boolean / datetime / void
 */
public class PrimitiveType extends TypeNode {
    private final Kind kind;

    public PrimitiveType(SourceSpan span, Kind kind) {
        super(span);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrimitiveType(this, context);
    }

    public enum Kind {
        INT("int"),
        FLOAT("float"),
        STRING("string"),
        BOOLEAN("boolean"),
        DATETIME("datetime"),
        VOID("void");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public boolean isNumeric() {
            return this == INT || this == FLOAT;
        }
    }
}
