package com.crowelang.compiler.ast.type;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

/**
 * Map&lt;K, V&gt;
 */
public class MapType extends TypeNode {
    private final TypeNode keyType;
    private final TypeNode valueType;

    public MapType(SourceSpan span, TypeNode keyType, TypeNode valueType) {
        super(span);
        this.keyType = keyType;
        this.valueType = valueType;
    }

    public TypeNode getKeyType() {
        return keyType;
    }

    public TypeNode getValueType() {
        return valueType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMapType(this, context);
    }
}
