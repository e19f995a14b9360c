package com.termui.compiler.ast;

import com.termui.compiler.ast.expr.*;
import com.termui.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    default R visitProgram(Program node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitVarDeclStmt(VarDeclStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitMemberExpr(MemberExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitGroupExpr(GroupExpr node, C ctx) { return null; }
}
