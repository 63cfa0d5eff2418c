package com.crowelang.compiler.ast.expr;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 函数调用
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public CallExpr(SourceSpan span, Expression callee, List<Expression> arguments) {
        super(span);
        this.callee = callee;
        this.arguments = immutable(arguments);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    /** 被调用者为简单标识符时返回其名称，否则 null */
    public String getCalleeName() {
        return callee instanceof Identifier ? ((Identifier) callee).getName() : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
