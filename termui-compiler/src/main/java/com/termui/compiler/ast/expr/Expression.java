package com.termui.compiler.ast.expr;

import com.termui.compiler.ast.AstNode;
import com.termui.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    /** 是否可作为赋值目标 */
    public boolean isAssignable() {
        return false;
    }
}
