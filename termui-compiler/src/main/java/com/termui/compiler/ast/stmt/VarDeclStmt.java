package com.termui.compiler.ast.stmt;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;
import com.termui.compiler.ast.expr.Expression;

/**
 * 变量声明: var name [= initializer]
 */
public class VarDeclStmt extends Statement {
    private final String name;
    private final Expression initializer;

    public VarDeclStmt(SourceLocation location, String name, Expression initializer) {
        super(location);
        this.name = name;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    /** 初始化表达式，可为 null */
    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDeclStmt(this, context);
    }
}
