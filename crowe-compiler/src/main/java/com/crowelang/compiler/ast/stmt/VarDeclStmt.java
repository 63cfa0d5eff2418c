package com.crowelang.compiler.ast.stmt;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;
import com.crowelang.compiler.ast.type.TypeNode;

/**
 * 变量声明 name: type = initializer;
 */
public class VarDeclStmt extends Statement {
    private final String name;
    private final TypeNode type;
    private final Expression initializer;

    public VarDeclStmt(SourceSpan span, String name, TypeNode type, Expression initializer) {
        super(span);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public TypeNode getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDeclStmt(this, context);
    }
}
