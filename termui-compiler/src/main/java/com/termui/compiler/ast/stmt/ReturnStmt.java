package com.termui.compiler.ast.stmt;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;

/**
 * Return 语句
 */
public class ReturnStmt extends Statement {
    private final Expression value;

    public ReturnStmt(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
