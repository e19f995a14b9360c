package com.termui.compiler.ast.stmt;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;

/**
 * 表达式语句
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
