package com.termui.compiler.ast;

import com.termui.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 程序（一个脚本块的语句序列）
 */
public class Program extends AstNode {
    private final List<Statement> statements;

    public Program(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(statements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
