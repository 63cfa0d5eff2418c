package com.crowelang.compiler.parser;

import com.crowelang.compiler.lexer.Token;
import com.crowelang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 具体语法树节点
 *
 * <p>每进入一次文法规则产生一个节点，子元素按源码顺序排列（规则节点或 token 叶子）。
 * 节点不持有父引用；只有解析器在构建期间追加子元素。</p>
 */
public final class CstNode implements CstElement {
    private final CstRule rule;
    private final List<CstElement> children = new ArrayList<>();

    public CstNode(CstRule rule) {
        this.rule = rule;
    }

    public CstRule getRule() {
        return rule;
    }

    public boolean is(CstRule rule) {
        return this.rule == rule;
    }

    public List<CstElement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void add(CstElement child) {
        children.add(child);
    }

    void add(Token token) {
        children.add(new CstToken(token));
    }

    // ============ 类型化查询 ============

    /** 第一个指定规则的子节点，不存在返回 null */
    public CstNode node(CstRule childRule) {
        for (CstElement e : children) {
            if (e instanceof CstNode && ((CstNode) e).rule == childRule) {
                return (CstNode) e;
            }
        }
        return null;
    }

    /** 所有指定规则的直接子节点 */
    public List<CstNode> nodes(CstRule childRule) {
        List<CstNode> result = new ArrayList<>();
        for (CstElement e : children) {
            if (e instanceof CstNode && ((CstNode) e).rule == childRule) {
                result.add((CstNode) e);
            }
        }
        return result;
    }

    /** 所有直接子节点（忽略 token） */
    public List<CstNode> childNodes() {
        List<CstNode> result = new ArrayList<>();
        for (CstElement e : children) {
            if (e instanceof CstNode) {
                result.add((CstNode) e);
            }
        }
        return result;
    }

    /** 第一个指定类型的直接 token 子元素，不存在返回 null */
    public Token token(TokenType type) {
        for (CstElement e : children) {
            if (e instanceof CstToken && ((CstToken) e).getType() == type) {
                return ((CstToken) e).getToken();
            }
        }
        return null;
    }

    public List<Token> tokens(TokenType type) {
        List<Token> result = new ArrayList<>();
        for (CstElement e : children) {
            if (e instanceof CstToken && ((CstToken) e).getType() == type) {
                result.add(((CstToken) e).getToken());
            }
        }
        return result;
    }

    /** 所有可作标识符的直接 token（IDENTIFIER 与软关键词） */
    public List<Token> identifiers() {
        List<Token> result = new ArrayList<>();
        for (CstElement e : children) {
            if (e instanceof CstToken && ((CstToken) e).getType().isIdentifierLike()) {
                result.add(((CstToken) e).getToken());
            }
        }
        return result;
    }

    /** 第一个可作标识符的直接 token，不存在返回 null */
    public Token identifier() {
        for (CstElement e : children) {
            if (e instanceof CstToken && ((CstToken) e).getType().isIdentifierLike()) {
                return ((CstToken) e).getToken();
            }
        }
        return null;
    }

    public boolean has(TokenType type) {
        return token(type) != null;
    }

    @Override
    public Token firstToken() {
        return children.isEmpty() ? null : children.get(0).firstToken();
    }

    @Override
    public Token lastToken() {
        return children.isEmpty() ? null : children.get(children.size() - 1).lastToken();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(rule);
        for (CstElement e : children) {
            sb.append(' ').append(e);
        }
        return sb.append(')').toString();
    }
}
