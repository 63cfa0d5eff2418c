package com.crowelang.compiler.parser;

import com.crowelang.compiler.diagnostic.Diagnostics;
import com.crowelang.compiler.diagnostic.RecoveryState;
import com.crowelang.compiler.lexer.Token;
import com.crowelang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.crowelang.compiler.lexer.TokenType.*;

/**
 * CroweLang 语法分析器（递归下降，最多两个 token 的前瞻）
 *
 * <p>每次解析创建一个实例。语法错误以 {@link ParseException} 抛出，
 * 由最近的可重复结构（声明、块成员、语句、绑定、交易动作、字段）捕获：
 * 记录一条诊断，进入 {@link RecoveryState#RECOVERING}，跳到同步点后恢复为 NORMAL。
 * 恢复期间产生的级联错误不再重复报告。</p>
 */
public class Parser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private final Diagnostics diagnostics;
    private final int maxNestingDepth;

    private int pos = 0;
    private int nestingDepth = 0;
    private RecoveryState state = RecoveryState.NORMAL;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final ExprParser exprParser = new ExprParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final DeclParser declParser = new DeclParser(this);

    public Parser(List<Token> tokens, Diagnostics diagnostics) {
        this(tokens, diagnostics, DEFAULT_MAX_NESTING_DEPTH);
    }

    public Parser(List<Token> tokens, Diagnostics diagnostics, int maxNestingDepth) {
        // 复制一份：拆分 '>>' 时需要改写 token 列表
        this.tokens = new ArrayList<>(tokens);
        if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).getType() != EOF) {
            this.tokens.add(Token.eof(0, 1, 1));
        }
        this.diagnostics = diagnostics;
        this.maxNestingDepth = maxNestingDepth;
    }

    public RecoveryState getState() {
        return state;
    }

    // ============ 基础方法 ============

    Token current() {
        return tokens.get(pos);
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        int next = Math.min(pos + 1, tokens.size() - 1);
        return tokens.get(next);
    }

    Token advance() {
        Token t = tokens.get(pos);
        if (t.getType() != EOF) {
            pos++;
        }
        return t;
    }

    boolean isAtEnd() {
        return current().getType() == EOF;
    }

    boolean check(TokenType type) {
        return current().getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 当前 token 是否可作为标识符（IDENTIFIER 或软关键词）
     */
    boolean checkIdentifier() {
        return current().getType().isIdentifierLike();
    }

    /**
     * 如果当前 token 匹配，则前进并记入 node
     */
    boolean match(CstNode node, TokenType type) {
        if (check(type)) {
            node.add(advance());
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则抛出 ParseException
     */
    Token expect(CstNode node, TokenType type, String message) {
        if (check(type)) {
            Token t = advance();
            node.add(t);
            return t;
        }
        throw new ParseException(message, current(), type.name());
    }

    Token expectIdentifier(CstNode node, String message) {
        if (checkIdentifier()) {
            Token t = advance();
            node.add(t);
            return t;
        }
        throw new ParseException(message, current(), IDENTIFIER.name());
    }

    /**
     * 期望闭合的 '}'。缺失时只报告不抛出，保留已解析的部分；
     * 此时只可能位于 EOF 或下一个顶层声明处。
     */
    void expectClosingBrace(CstNode node, String message) {
        if (match(node, RBRACE)) {
            return;
        }
        report(new ParseException(message, current(), RBRACE.name()));
        state = RecoveryState.RECOVERING;
    }

    /**
     * 类型实参闭合处遇到 '>>' 时拆成两个 '>'
     */
    void splitShiftRight() {
        Token t = current();
        if (t.getType() != SHR) return;
        tokens.set(pos, t.slice(GT, 0, 1));
        tokens.add(pos + 1, t.slice(GT, 1, 2));
    }

    // ============ 嵌套深度 ============

    void enterNesting() {
        enterNesting("Expression");
    }

    /**
     * 进入一层嵌套；超过上限时抛出 {@link ParseException}，计数保持不变
     *
     * @param construct 报错信息中的结构名称（Expression / Type）
     */
    void enterNesting(String construct) {
        if (++nestingDepth > maxNestingDepth) {
            nestingDepth--;
            throw new ParseException(construct + " nesting too deep (limit " + maxNestingDepth + ")", current());
        }
    }

    void exitNesting() {
        nestingDepth--;
    }

    void exitNesting(int levels) {
        nestingDepth -= levels;
    }

    // ============ 程序解析 ============

    /**
     * 解析完整程序，返回 PROGRAM 节点（语法错误已记入诊断收集器）
     */
    public CstNode parseProgram() {
        CstNode program = new CstNode(CstRule.PROGRAM);
        while (!isAtEnd()) {
            if (current().getType().isDeclarationStart()) {
                // 顶层声明关键词本身是同步点
                state = RecoveryState.NORMAL;
                try {
                    program.add(declParser.parseDeclaration());
                } catch (ParseException e) {
                    // 声明头部出错：关键词已消费，整体跳到下一个顶层声明
                    report(e);
                    state = RecoveryState.RECOVERING;
                    synchronizeTopLevel();
                }
            } else {
                report(new ParseException("Expected a top-level declaration", current(), "declaration"));
                state = RecoveryState.RECOVERING;
                advance();
                synchronizeTopLevel();
            }
        }
        program.add(current());
        return program;
    }

    /**
     * 解析 '{' 之后的重复成员直到 '}'、EOF 或下一个顶层声明；每个成员独立捕获错误
     */
    void parseRepeated(CstNode parent, Supplier<CstNode> item) {
        while (!check(RBRACE) && !isAtEnd() && !atDeclarationBoundary()) {
            try {
                parent.add(item.get());
            } catch (ParseException e) {
                recover(e);
            }
        }
    }

    // ============ 错误恢复 ============

    void recover(ParseException e) {
        report(e);
        state = RecoveryState.RECOVERING;
        synchronize();
    }

    private void report(ParseException e) {
        if (state == RecoveryState.RECOVERING) {
            return;
        }
        diagnostics.parseError(e.getDescription(), e.getToken(), e.getExpected());
    }

    /**
     * 跳到同步点：深度 0 的 ';'（消费）、闭合出错结构的 '}'（消费）、
     * 未匹配的 '}'（不消费）、下一个顶层声明或 EOF。到达 EOF 时保持 RECOVERING。
     */
    private void synchronize() {
        int depth = 0;
        while (!isAtEnd()) {
            TokenType type = current().getType();
            if (type == SEMICOLON && depth == 0) {
                advance();
                state = RecoveryState.NORMAL;
                return;
            }
            if (type == RBRACE) {
                if (depth == 0) {
                    state = RecoveryState.NORMAL;
                    return;
                }
                advance();
                if (--depth == 0) {
                    state = RecoveryState.NORMAL;
                    return;
                }
                continue;
            }
            if (depth == 0 && atDeclarationBoundary()) {
                state = RecoveryState.NORMAL;
                return;
            }
            if (type == LBRACE) {
                depth++;
            }
            advance();
        }
    }

    /**
     * 顶层同步：跳过所有内容（包括游离的 '}'）直到下一个顶层声明或 EOF
     */
    private void synchronizeTopLevel() {
        int depth = 0;
        while (!isAtEnd()) {
            if (depth <= 0 && current().getType().isDeclarationStart()) {
                state = RecoveryState.NORMAL;
                return;
            }
            if (check(LBRACE)) depth++;
            else if (check(RBRACE)) depth--;
            advance();
        }
    }

    /**
     * 当前是否位于顶层声明的起点：import，或声明关键词后跟名称。
     * 'event {' 是策略内的事件块，不算。
     */
    boolean atDeclarationBoundary() {
        TokenType type = current().getType();
        if (type == KW_IMPORT) return true;
        return type.isDeclarationStart() && peek().getType().isIdentifierLike();
    }
}
