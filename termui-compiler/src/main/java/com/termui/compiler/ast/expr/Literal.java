package com.termui.compiler.ast.expr;

import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 *
 * <p>NUMBER 的值为 {@link Double}，STRING 为 {@link String}，BOOLEAN 为 {@link Boolean}，NULL 为 null。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        STRING,
        BOOLEAN,
        NULL
    }
}
