package com.termui.compiler.parser;

import com.termui.compiler.ast.Program;
import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;
import com.termui.compiler.ast.stmt.Statement;
import com.termui.compiler.lexer.Token;
import com.termui.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.termui.compiler.lexer.TokenType.*;

/**
 * UI 脚本语法分析器（递归下降）
 *
 * <p>输入为 {@link com.termui.compiler.lexer.Lexer#nextBlock()} 返回的 token 列表，
 * 开头的 BLOCK_START 会被跳过，遇到 '}' 或 EOF 时停止。</p>
 */
public class Parser {

    /** 表达式与语句的最大嵌套层数 */
    static final int MAX_NESTING_DEPTH = 200;

    final List<Token> tokens;
    final String fileName;
    Token current;
    Token previous;
    private int position;
    private int depth;

    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName) {
        this.tokens = new ArrayList<Token>(tokens);
        this.fileName = fileName != null ? fileName : "<block>";
        if (this.tokens.isEmpty() || !this.tokens.get(this.tokens.size() - 1).is(EOF)) {
            Token last = this.tokens.isEmpty() ? null : this.tokens.get(this.tokens.size() - 1);
            this.tokens.add(last == null
                    ? new Token(EOF, "", 1, 1, 0)
                    : new Token(EOF, "", last.getLine(), last.getColumn(), last.getOffset()));
        }
        this.current = this.tokens.get(0);
        if (check(BLOCK_START)) {
            advance();
        }
    }

    public Parser(List<Token> tokens) {
        this(tokens, null);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current);
    }

    /**
     * 块内容是否结束（EOF 或未配对的 '}'）
     */
    boolean isAtEnd() {
        return check(EOF) || check(RBRACE);
    }

    /**
     * 当前 token 是否为语句起始关键词
     */
    boolean isStatementStart() {
        return checkAny(KW_VAR, KW_IF, KW_WHILE, KW_RETURN);
    }

    /**
     * 进入一层嵌套，超过 {@link #MAX_NESTING_DEPTH} 时报错。
     * 必须与 {@link #exitNesting()} 在 finally 中配对。
     */
    void enterNesting() {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new ParseException("Expression nested too deeply", current);
        }
        depth++;
    }

    void exitNesting() {
        depth--;
    }

    SourceLocation location() {
        return SourceLocation.of(fileName, current);
    }

    // ============ 入口 ============

    /**
     * 严格解析：遇到第一个语法错误即抛出 {@link ParseException}
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        while (!isAtEnd()) {
            if (match(SEMICOLON)) continue;
            statements.add(parseStatement());
        }
        return new Program(loc, statements);
    }

    /**
     * 容错解析：遇到错误时同步到下一条语句继续解析。
     * 返回的 ParseResult 包含已成功解析的语句和收集到的错误列表。
     */
    public ParseResult parseTolerant() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        List<ParseError> errors = new ArrayList<ParseError>();
        while (!isAtEnd()) {
            if (match(SEMICOLON)) continue;
            try {
                statements.add(parseStatement());
            } catch (ParseException e) {
                errors.add(ParseError.from(e, fileName));
                synchronize();
            }
        }
        return new ParseResult(new Program(loc, statements), errors);
    }

    /**
     * 错误恢复：跳过 token 直到语句终止符之后或下一个语句起始关键词。
     */
    private void synchronize() {
        advance(); // 跳过触发错误的 token
        while (!check(EOF)) {
            if (previous != null && previous.is(SEMICOLON)) return;
            if (isStatementStart()) return;
            advance();
        }
    }

    // ============ 委托 ============

    Statement parseStatement() {
        return stmtParser.parseStatement();
    }

    Expression parseExpression() {
        return exprParser.parseExpression();
    }
}
