package com.crowelang.compiler.ast.type;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 联合类型 A | B
 */
public class UnionType extends TypeNode {
    private final List<TypeNode> members;

    public UnionType(SourceSpan span, List<TypeNode> members) {
        super(span);
        this.members = immutable(members);
    }

    public List<TypeNode> getMembers() {
        return members;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnionType(this, context);
    }
}
