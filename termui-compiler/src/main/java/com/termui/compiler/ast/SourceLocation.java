package com.termui.compiler.ast;

import com.termui.compiler.lexer.Token;

/**
 * 源码位置信息
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    /** 以 token 起点构造位置 */
    public static SourceLocation of(String file, Token token) {
        return new SourceLocation(file, token.getLine(), token.getColumn(), token.getOffset(),
                token.getLexeme() != null ? token.getLexeme().length() : 0);
    }

    public String getFile() {
        return file;
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

    public int getLength() {
        return length;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
