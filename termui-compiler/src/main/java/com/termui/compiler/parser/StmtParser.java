package com.termui.compiler.parser;

import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;
import com.termui.compiler.ast.stmt.*;
import com.termui.compiler.lexer.Token;
import com.termui.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.termui.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        parser.enterNesting();
        try {
            return parseStatementInner();
        } finally {
            parser.exitNesting();
        }
    }

    private Statement parseStatementInner() {
        if (parser.check(KW_VAR)) {
            return parseVarDecl();
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        return parseExpressionStmt();
    }

    /**
     * var name [= expr] [;]
     */
    private Statement parseVarDecl() {
        SourceLocation loc = parser.location();
        parser.advance();
        Token name = parser.expect(IDENTIFIER, "Expected variable name after 'var'");
        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.parseExpression();
        }
        parser.match(SEMICOLON);
        return new VarDeclStmt(loc, name.getLexeme(), initializer);
    }

    /**
     * if cond then ... [else if cond then ...]* [else ...] end if
     */
    private Statement parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression condition = parser.parseExpression();
        parser.expect(KW_THEN, "Expected 'then' after if condition");
        List<Statement> thenBranch = parseBody(KW_ELSE_IF, KW_ELSE, KW_END_IF);

        List<ElseIfBranch> elseIfs = new ArrayList<ElseIfBranch>();
        while (parser.check(KW_ELSE_IF)) {
            SourceLocation branchLoc = parser.location();
            parser.advance();
            Expression branchCond = parser.parseExpression();
            parser.expect(KW_THEN, "Expected 'then' after else if condition");
            elseIfs.add(new ElseIfBranch(branchLoc, branchCond, parseBody(KW_ELSE_IF, KW_ELSE, KW_END_IF)));
        }

        List<Statement> elseBranch = null;
        if (parser.match(KW_ELSE)) {
            elseBranch = parseBody(KW_END_IF);
        }

        parser.expect(KW_END_IF, "Expected 'end if'");
        parser.match(SEMICOLON);
        return new IfStmt(loc, condition, thenBranch, elseIfs, elseBranch);
    }

    /**
     * while cond do ... end while
     */
    private Statement parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression condition = parser.parseExpression();
        parser.expect(KW_DO, "Expected 'do' after while condition");
        List<Statement> body = parseBody(KW_END_WHILE);
        parser.expect(KW_END_WHILE, "Expected 'end while'");
        parser.match(SEMICOLON);
        return new WhileStmt(loc, condition, body);
    }

    /**
     * return [expr] [;]
     */
    private Statement parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression value = null;
        if (!isStatementEnd()) {
            value = parser.parseExpression();
        }
        parser.match(SEMICOLON);
        return new ReturnStmt(loc, value);
    }

    /**
     * expr [= expr] [;]
     *
     * <p>赋值在完整解析左侧表达式之后识别，左侧必须是标识符或成员访问。</p>
     */
    private Statement parseExpressionStmt() {
        SourceLocation loc = parser.location();
        Expression expr = parser.parseExpression();
        if (parser.check(ASSIGN)) {
            Token assign = parser.advance();
            if (!expr.isAssignable()) {
                throw new ParseException("Invalid assignment target", assign);
            }
            Expression value = parser.parseExpression();
            parser.match(SEMICOLON);
            return new AssignStmt(loc, expr, value);
        }
        parser.match(SEMICOLON);
        return new ExpressionStmt(loc, expr);
    }

    /**
     * 解析语句序列直到遇到任一终止关键词（不消费终止词）
     */
    private List<Statement> parseBody(TokenType... terminators) {
        List<Statement> body = new ArrayList<Statement>();
        while (!parser.checkAny(terminators) && !parser.isAtEnd()) {
            if (parser.match(SEMICOLON)) continue;
            body.add(parseStatement());
        }
        return body;
    }

    private boolean isStatementEnd() {
        return parser.isAtEnd()
                || parser.isStatementStart()
                || parser.checkAny(SEMICOLON, KW_ELSE, KW_ELSE_IF, KW_END_IF, KW_END_WHILE);
    }
}
