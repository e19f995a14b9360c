package com.termui.compiler.ast.stmt;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * While 语句
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final List<Statement> body;

    public WhileStmt(SourceLocation location, Expression condition, List<Statement> body) {
        super(location);
        this.condition = condition;
        this.body = Collections.unmodifiableList(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
