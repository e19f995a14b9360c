package com.termui.compiler.ast.expr;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;

/**
 * 括号表达式
 */
public class GroupExpr extends Expression {
    private final Expression expression;

    public GroupExpr(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGroupExpr(this, context);
    }
}
