package com.crowelang.compiler.compiler;

import com.crowelang.compiler.ast.decl.Program;
import com.crowelang.compiler.diagnostic.Diagnostic;

import java.util.Collections;
import java.util.List;

/**
 * 只解析不生成代码的结果；存在语法错误时 AST 为尽力构建的部分结果，可能为 null
 */
public final class ParseOutcome {
    private final Program ast;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;

    public ParseOutcome(Program ast, List<Diagnostic> errors, List<Diagnostic> warnings) {
        this.ast = ast;
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public Program getAst() {
        return ast;
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
