package com.crowelang.compiler.ast.type;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * 可选类型 T?
 */
public class OptionalType extends TypeNode {
    private final TypeNode innerType;

    public OptionalType(SourceSpan span, TypeNode innerType) {
        super(span);
        this.innerType = innerType;
    }

    public TypeNode getInnerType() {
        return innerType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOptionalType(this, context);
    }
}
