package com.termui.compiler.parser;

import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.lexer.Token;

/**
 * 容错解析收集到的一条语法错误
 *
 * <p>位置带所属块的来源名和块内偏移，多个会话的错误混在一起时仍能区分。</p>
 */
public final class ParseError {
    private final String message;
    private final SourceLocation location;

    public ParseError(String message, SourceLocation location) {
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    static ParseError from(ParseException e, String sourceName) {
        Token token = e.getToken();
        SourceLocation loc = token != null
                ? SourceLocation.of(sourceName, token)
                : new SourceLocation(sourceName, 0, 0, 0, 0);
        return new ParseError(e.getMessage(), loc);
    }

    public String getMessage() {
        return message;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getSourceName() {
        return location.getFile();
    }

    public int getLine() {
        return location.getLine();
    }

    public int getColumn() {
        return location.getColumn();
    }

    /** 出错 token 在块源码中的字符偏移 */
    public int getOffset() {
        return location.getOffset();
    }

    @Override
    public String toString() {
        return location + ": " + message;
    }
}
