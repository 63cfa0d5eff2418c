package com.crowelang.compiler.ast.type;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 函数类型 (A, B) -&gt; R
 */
public class FunctionType extends TypeNode {
    private final List<TypeNode> parameterTypes;
    private final TypeNode returnType;

    public FunctionType(SourceSpan span, List<TypeNode> parameterTypes, TypeNode returnType) {
        super(span);
        this.parameterTypes = immutable(parameterTypes);
        this.returnType = returnType;
    }

    public List<TypeNode> getParameterTypes() {
        return parameterTypes;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionType(this, context);
    }
}
