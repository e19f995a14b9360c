package com.termui.compiler.ast.expr;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;

/**
 * 成员访问: target.member
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;

    public MemberExpr(SourceLocation location, Expression target, String member) {
        super(location);
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    @Override
    public boolean isAssignable() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
