package com.termui.compiler.parser;

import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.*;
import com.termui.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.termui.compiler.ast.expr.Literal.LiteralKind;
import com.termui.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.termui.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.termui.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高: or → and → 相等 → 比较 → 加减 → 乘除模 → 一元 → 后缀 → 基本表达式</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        parser.enterNesting();
        try {
            return parseOr();
        } finally {
            parser.exitNesting();
        }
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (parser.check(OR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression right = parseAnd();
            left = new BinaryExpr(loc, left, BinaryOp.OR, right);
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (parser.check(AND)) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression right = parseEquality();
            left = new BinaryExpr(loc, left, BinaryOp.AND, right);
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseComparison();
        while (parser.checkAny(EQ, NE)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(EQ) ? BinaryOp.EQ : BinaryOp.NE;
            Expression right = parseComparison();
            left = new BinaryExpr(loc, left, op, right);
        }
        return left;
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();
        while (parser.current.getType().isComparisonOp()) {
            SourceLocation loc = parser.location();
            Token opToken = parser.advance();
            BinaryOp op;
            switch (opToken.getType()) {
                case LT: op = BinaryOp.LT; break;
                case GT: op = BinaryOp.GT; break;
                case LE: op = BinaryOp.LE; break;
                default: op = BinaryOp.GE; break;
            }
            Expression right = parseAdditive();
            left = new BinaryExpr(loc, left, op, right);
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            Expression right = parseMultiplicative();
            left = new BinaryExpr(loc, left, op, right);
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (parser.checkAny(MUL, DIV, MOD)) {
            SourceLocation loc = parser.location();
            Token opToken = parser.advance();
            BinaryOp op = opToken.is(MUL) ? BinaryOp.MUL : opToken.is(DIV) ? BinaryOp.DIV : BinaryOp.MOD;
            Expression right = parseUnary();
            left = new BinaryExpr(loc, left, op, right);
        }
        return left;
    }

    private Expression parseUnary() {
        if (!parser.checkAny(NOT, MINUS)) {
            return parsePostfix();
        }
        SourceLocation loc = parser.location();
        UnaryOp op = parser.advance().is(NOT) ? UnaryOp.NOT : UnaryOp.NEGATE;
        parser.enterNesting();
        try {
            return new UnaryExpr(loc, op, parseUnary());
        } finally {
            parser.exitNesting();
        }
    }

    /**
     * 后缀链: primary ( '.' name | '(' args ')' )*
     */
    private Expression parsePostfix() {
        Expression expr = parsePrimary();
        while (true) {
            if (parser.check(DOT)) {
                SourceLocation loc = parser.location();
                parser.advance();
                String member = parseMemberName();
                expr = new MemberExpr(loc, expr, member);
            } else if (parser.check(LPAREN)) {
                SourceLocation loc = parser.location();
                parser.advance();
                List<Expression> args = new ArrayList<Expression>();
                if (!parser.check(RPAREN)) {
                    do {
                        args.add(parseExpression());
                    } while (parser.match(COMMA));
                }
                parser.expect(RPAREN, "Expected ')' after arguments");
                expr = new CallExpr(loc, expr, args);
            } else {
                return expr;
            }
        }
    }

    /**
     * 解析成员名：标识符或单词关键词（.后允许关键词作为成员名，如 Sound.do）
     */
    private String parseMemberName() {
        Token token = parser.current;
        if (token.is(IDENTIFIER)
                || (token.getType().isKeyword() && !token.getType().isCompoundKeyword())) {
            parser.advance();
            return token.getLexeme();
        }
        throw new ParseException("Expected member name after '.'", token);
    }

    private Expression parsePrimary() {
        Token token = parser.current;
        SourceLocation loc = parser.location();
        switch (token.getType()) {
            case NUMBER_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), LiteralKind.NUMBER);
            case STRING_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLexeme(), LiteralKind.STRING);
            case KW_TRUE:
                parser.advance();
                return new Literal(loc, Boolean.TRUE, LiteralKind.BOOLEAN);
            case KW_FALSE:
                parser.advance();
                return new Literal(loc, Boolean.FALSE, LiteralKind.BOOLEAN);
            case KW_NULL:
                parser.advance();
                return new Literal(loc, null, LiteralKind.NULL);
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')' after expression");
                return new GroupExpr(loc, inner);
            }
            case ERROR:
                // 词法错误在这里转为语法错误
                throw new ParseException(String.valueOf(token.getLiteral()), token);
            default:
                throw new ParseException("Expected expression", token);
        }
    }
}
