package com.termui.compiler.codegen;

import com.termui.compiler.ast.SourceLocation;

/**
 * 编译异常
 */
public class CompileException extends RuntimeException {
    private final SourceLocation location;

    public CompileException(String message) {
        this(message, null);
    }

    public CompileException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (location == null || location == SourceLocation.UNKNOWN) {
            return super.getMessage();
        }
        return super.getMessage() + " at line " + location.getLine() + ", column " + location.getColumn();
    }
}
