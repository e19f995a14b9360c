package com.termui.compiler.ast.expr;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 调用表达式
 *
 * <p>callee 为 {@link MemberExpr} 时编译为方法调用，否则为自由函数调用。</p>
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(args);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public boolean isMethodCall() {
        return callee instanceof MemberExpr;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
