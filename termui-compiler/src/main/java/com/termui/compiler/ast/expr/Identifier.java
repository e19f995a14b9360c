package com.termui.compiler.ast.expr;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;

/**
 * 标识符
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isAssignable() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
