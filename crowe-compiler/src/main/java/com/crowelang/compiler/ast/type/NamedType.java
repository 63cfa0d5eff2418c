package com.crowelang.compiler.ast.type;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 命名类型引用，可带类型实参：Bar、Series&lt;float&gt;
 */
public class NamedType extends TypeNode {
    private final String name;
    private final List<TypeNode> typeArguments;

    public NamedType(SourceSpan span, String name, List<TypeNode> typeArguments) {
        super(span);
        this.name = name;
        this.typeArguments = immutable(typeArguments);
    }

    public String getName() {
        return name;
    }

    public List<TypeNode> getTypeArguments() {
        return typeArguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedType(this, context);
    }
}
