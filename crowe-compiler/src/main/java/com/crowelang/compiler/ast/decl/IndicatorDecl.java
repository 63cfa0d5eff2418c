package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;
import com.crowelang.compiler.ast.expr.Expression;
import com.crowelang.compiler.ast.stmt.Block;
import com.crowelang.compiler.ast.type.TypeNode;

import java.util.List;

/**
 * 自定义指标函数
 *
 * <pre>
 * indicator Momentum(prices: Array&lt;float&gt;, period: int) -&gt; float { ... }
 * indicator Spread(a: float, b: float) -&gt; float = a - b;
 * </pre>
 *
 * <p>body 与 expressionBody 恰有一个非 null。</p>
 */
public class IndicatorDecl extends Declaration {
    private final List<Parameter> parameters;
    private final TypeNode returnType;       // 可选
    private final Block body;
    private final Expression expressionBody;

    public IndicatorDecl(SourceSpan span, String name, List<Parameter> parameters,
                         TypeNode returnType, Block body, Expression expressionBody) {
        super(span, name);
        this.parameters = immutable(parameters);
        this.returnType = returnType;
        this.body = body;
        this.expressionBody = expressionBody;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public Expression getExpressionBody() {
        return expressionBody;
    }

    public boolean isExpressionBody() {
        return expressionBody != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndicatorDecl(this, context);
    }
}
