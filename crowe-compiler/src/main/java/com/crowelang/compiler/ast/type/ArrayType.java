package com.crowelang.compiler.ast.type;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * Array&lt;T&gt;
 */
public class ArrayType extends TypeNode {
    private final TypeNode elementType;

    public ArrayType(SourceSpan span, TypeNode elementType) {
        super(span);
        this.elementType = elementType;
    }

    public TypeNode getElementType() {
        return elementType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayType(this, context);
    }
}
