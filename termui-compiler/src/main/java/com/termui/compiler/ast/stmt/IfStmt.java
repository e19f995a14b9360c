package com.termui.compiler.ast.stmt;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * If 语句: if cond then ... [else if cond then ...]* [else ...] end if
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final List<Statement> thenBranch;
    private final List<ElseIfBranch> elseIfBranches;
    private final List<Statement> elseBranch;

    public IfStmt(SourceLocation location, Expression condition, List<Statement> thenBranch,
                  List<ElseIfBranch> elseIfBranches, List<Statement> elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = Collections.unmodifiableList(thenBranch);
        this.elseIfBranches = Collections.unmodifiableList(elseIfBranches);
        this.elseBranch = elseBranch != null ? Collections.unmodifiableList(elseBranch) : null;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getThenBranch() {
        return thenBranch;
    }

    public List<ElseIfBranch> getElseIfBranches() {
        return elseIfBranches;
    }

    /** else 分支，没有 else 时为 null */
    public List<Statement> getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
