package com.termui.compiler.lexer;

/**
 * 词法单元
 *
 * <p>字符串 token 的 lexeme 是解码后的文本；数值 token 的 literal 为 {@link Double}。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public Token(TokenType type, String lexeme, int line, int column, int offset) {
        this(type, lexeme, null, line, column, offset);
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' " + line + ":" + column;
    }
}
