package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstNode;
import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）
 *
 * <p>{@link #getDeclarations()} 保持源码中的声明顺序；按类别的列表由其派生，类别内顺序同样与源码一致。</p>
 */
public class Program extends AstNode {
    private final List<Declaration> declarations;

    public Program(SourceSpan span, List<Declaration> declarations) {
        super(span);
        this.declarations = immutable(declarations);
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public List<ImportDecl> getImports() {
        return ofType(ImportDecl.class);
    }

    public List<StrategyDecl> getStrategies() {
        return ofType(StrategyDecl.class);
    }

    public List<IndicatorDecl> getIndicators() {
        return ofType(IndicatorDecl.class);
    }

    public List<DataDecl> getDataDecls() {
        return ofType(DataDecl.class);
    }

    public List<OrderDecl> getOrders() {
        return ofType(OrderDecl.class);
    }

    public List<EventDecl> getEvents() {
        return ofType(EventDecl.class);
    }

    public List<PortfolioDecl> getPortfolios() {
        return ofType(PortfolioDecl.class);
    }

    public List<BacktestDecl> getBacktests() {
        return ofType(BacktestDecl.class);
    }

    public List<MicrostructureDecl> getMicrostructures() {
        return ofType(MicrostructureDecl.class);
    }

    private <T extends Declaration> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Declaration decl : declarations) {
            if (type.isInstance(decl)) {
                result.add(type.cast(decl));
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
