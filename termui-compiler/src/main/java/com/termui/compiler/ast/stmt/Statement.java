package com.termui.compiler.ast.stmt;

import com.termui.compiler.ast.AstNode;
import com.termui.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
