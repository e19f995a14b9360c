package com.termui.compiler.ast.stmt;

import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * else if 分支
 */
public final class ElseIfBranch {
    private final SourceLocation location;
    private final Expression condition;
    private final List<Statement> body;

    public ElseIfBranch(SourceLocation location, Expression condition, List<Statement> body) {
        this.location = location;
        this.condition = condition;
        this.body = Collections.unmodifiableList(body);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }
}
