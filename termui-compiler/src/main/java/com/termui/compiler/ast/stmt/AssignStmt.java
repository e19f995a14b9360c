package com.termui.compiler.ast.stmt;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;

/**
 * 赋值语句，目标为 {@link com.termui.compiler.ast.expr.Identifier} 或
 * {@link com.termui.compiler.ast.expr.MemberExpr}
 */
public class AssignStmt extends Statement {
    private final Expression target;
    private final Expression value;

    public AssignStmt(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
