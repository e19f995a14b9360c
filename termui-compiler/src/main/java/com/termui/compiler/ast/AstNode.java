package com.termui.compiler.ast;

/**
 * UI 脚本语法树节点
 *
 * <p>没有位置的节点记为 {@link SourceLocation#UNKNOWN}。</p>
 */
public abstract class AstNode {
    private final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 节点所在块的来源名，即会话标识或脚本文件名 */
    public String getSourceName() {
        return location.getFile();
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
