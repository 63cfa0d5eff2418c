package com.crowelang.compiler.ast.decl;

import com.crowelang.compiler.ast.AstVisitor;
import com.crowelang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 导入声明
 *
 * <pre>
 * import { SMA, EMA } from "indicators";   // NAMED
 * import ta from "ta-lib";                 // DEFAULT
 * import "./common" as common;             // MODULE
 * </pre>
 */
public class ImportDecl extends Declaration {
    private final ImportKind kind;
    private final List<String> names;
    private final String defaultName;
    private final String alias;

    public ImportDecl(SourceSpan span, ImportKind kind, String module,
                      List<String> names, String defaultName, String alias) {
        super(span, module);
        this.kind = kind;
        this.names = immutable(names);
        this.defaultName = defaultName;
        this.alias = alias;
    }

    public ImportKind getKind() {
        return kind;
    }

    public String getModule() {
        return name;
    }

    public List<String> getNames() {
        return names;
    }

    public String getDefaultName() {
        return defaultName;
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }

    public enum ImportKind {
        NAMED,
        DEFAULT,
        MODULE
    }
}
