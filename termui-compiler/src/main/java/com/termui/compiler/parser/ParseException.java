package com.termui.compiler.parser;

import com.termui.compiler.lexer.Token;
import com.termui.compiler.lexer.TokenType;

/**
 * 语法错误，携带出错位置的 token
 */
public class ParseException extends RuntimeException {
    private final Token token;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    /** 不含位置信息的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (token == null) {
            return super.getMessage();
        }
        String found = token.getType() == TokenType.EOF ? "end of block" : "'" + token.getLexeme() + "'";
        return super.getMessage() + " at line " + token.getLine() + ", column " + token.getColumn()
                + " (found " + found + ")";
    }
}
