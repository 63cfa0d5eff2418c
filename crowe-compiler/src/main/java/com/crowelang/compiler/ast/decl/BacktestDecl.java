package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 回测配置 backtest Name { settings  costs { }  output { } }
 */
public class BacktestDecl extends Declaration {
    private final List<Binding> settings;
    private final List<Binding> costs;
    private final List<Binding> output;

    public BacktestDecl(SourceSpan span, String name, List<Binding> settings,
                        List<Binding> costs, List<Binding> output) {
        super(span, name);
        this.settings = immutable(settings);
        this.costs = immutable(costs);
        this.output = immutable(output);
    }

    public List<Binding> getSettings() {
        return settings;
    }

    public List<Binding> getCosts() {
        return costs;
    }

    public List<Binding> getOutput() {
        return output;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBacktestDecl(this, context);
    }
}
