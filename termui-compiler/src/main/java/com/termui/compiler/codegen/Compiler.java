package com.termui.compiler.codegen;

import com.termui.compiler.ast.AstNode;
import com.termui.compiler.ast.AstVisitor;
import com.termui.compiler.ast.Program;
import com.termui.compiler.ast.expr.*;
import com.termui.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 字节码编译器
 *
 * <p>每个表达式在操作数栈上恰好留下一个值；除 return 外每条语句保持栈深度不变。
 * 一个 Compiler 实例可以重复使用，每次 {@link #compile} 使用新的构建器。</p>
 */
public class Compiler implements AstVisitor<Void, Void> {

    private ChunkBuilder chunk;

    public CompiledChunk compile(Program program) {
        return compile(program, program.getSourceName());
    }

    public CompiledChunk compile(Program program, String sourceName) {
        chunk = new ChunkBuilder(sourceName != null ? sourceName : "<block>");
        try {
            for (Statement stmt : program.getStatements()) {
                compileNode(stmt);
            }
            chunk.emit(OpCode.HALT);
            CompiledChunk result = chunk.build();
            ChunkVerifier.verify(result);
            return result;
        } finally {
            chunk = null;
        }
    }

    private void compileNode(AstNode node) {
        node.accept(this, null);
    }

    private void compileBody(List<Statement> body) {
        for (Statement stmt : body) {
            compileNode(stmt);
        }
    }

    // ============ 语句 ============

    @Override
    public Void visitProgram(Program node, Void ctx) {
        compileBody(node.getStatements());
        return null;
    }

    @Override
    public Void visitVarDeclStmt(VarDeclStmt node, Void ctx) {
        if (node.hasInitializer()) {
            compileNode(node.getInitializer());
        } else {
            chunk.emit(OpCode.PUSH_NULL);
        }
        chunk.emitWithIndex(OpCode.STORE_VAR, chunk.addName(node.getName()));
        chunk.emit(OpCode.POP);
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, Void ctx) {
        Expression target = node.getTarget();
        if (target instanceof Identifier) {
            compileNode(node.getValue());
            chunk.emitWithIndex(OpCode.STORE_VAR, chunk.addName(((Identifier) target).getName()));
        } else if (target instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) target;
            compileNode(member.getTarget());
            compileNode(node.getValue());
            chunk.emitWithIndex(OpCode.SET_MEMBER, chunk.addName(member.getMember()));
        } else {
            throw new CompileException("Invalid assignment target", node.getLocation());
        }
        chunk.emit(OpCode.POP);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        compileNode(node.getExpression());
        chunk.emit(OpCode.POP);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        List<Integer> endJumps = new ArrayList<Integer>();

        compileNode(node.getCondition());
        int nextJump = chunk.emitJump(OpCode.JUMP_IF_FALSE);
        chunk.emit(OpCode.POP);
        compileBody(node.getThenBranch());
        endJumps.add(chunk.emitJump(OpCode.JUMP));
        chunk.patchJump(nextJump);
        chunk.emit(OpCode.POP);

        for (ElseIfBranch branch : node.getElseIfBranches()) {
            compileNode(branch.getCondition());
            int branchJump = chunk.emitJump(OpCode.JUMP_IF_FALSE);
            chunk.emit(OpCode.POP);
            compileBody(branch.getBody());
            endJumps.add(chunk.emitJump(OpCode.JUMP));
            chunk.patchJump(branchJump);
            chunk.emit(OpCode.POP);
        }

        if (node.hasElse()) {
            compileBody(node.getElseBranch());
        }

        for (int jump : endJumps) {
            chunk.patchJump(jump);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        int loopStart = chunk.currentOffset();
        compileNode(node.getCondition());
        int exitJump = chunk.emitJump(OpCode.JUMP_IF_FALSE);
        chunk.emit(OpCode.POP);
        compileBody(node.getBody());
        chunk.emitLoop(loopStart);
        chunk.patchJump(exitJump);
        chunk.emit(OpCode.POP);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        if (node.hasValue()) {
            compileNode(node.getValue());
            chunk.emit(OpCode.RETURN_VALUE);
        } else {
            chunk.emit(OpCode.RETURN);
        }
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case NULL:
                chunk.emit(OpCode.PUSH_NULL);
                break;
            case BOOLEAN:
                chunk.emit(Boolean.TRUE.equals(node.getValue()) ? OpCode.PUSH_TRUE : OpCode.PUSH_FALSE);
                break;
            case NUMBER:
                chunk.emitWithIndex(OpCode.PUSH_CONST,
                        chunk.addConstant(((Number) node.getValue()).doubleValue()));
                break;
            case STRING:
                chunk.emitWithIndex(OpCode.PUSH_CONST, chunk.addConstant(node.getValue()));
                break;
            default:
                throw new CompileException("Unknown literal kind: " + node.getKind(), node.getLocation());
        }
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, Void ctx) {
        chunk.emitWithIndex(OpCode.LOAD_VAR, chunk.addName(node.getName()));
        return null;
    }

    /**
     * 左结合链沿左侧展开后逐层编译，链长不占用调用栈。
     */
    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        List<BinaryExpr> spine = new ArrayList<BinaryExpr>();
        Expression leftmost = node;
        while (leftmost instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) leftmost;
            spine.add(binary);
            leftmost = binary.getLeft();
        }

        compileNode(leftmost);
        for (int i = spine.size() - 1; i >= 0; i--) {
            BinaryExpr current = spine.get(i);
            BinaryExpr.BinaryOp op = current.getOperator();
            if (op.isLogical()) {
                // 短路：跳转时左值留在栈上作为结果
                int endJump = chunk.emitJump(op == BinaryExpr.BinaryOp.AND ? OpCode.JUMP_IF_FALSE : OpCode.JUMP_IF_TRUE);
                chunk.emit(OpCode.POP);
                compileNode(current.getRight());
                chunk.patchJump(endJump);
            } else {
                compileNode(current.getRight());
                chunk.emit(toOpCode(current));
            }
        }
        return null;
    }

    private static OpCode toOpCode(BinaryExpr node) {
        switch (node.getOperator()) {
            case ADD: return OpCode.ADD;
            case SUB: return OpCode.SUB;
            case MUL: return OpCode.MUL;
            case DIV: return OpCode.DIV;
            case MOD: return OpCode.MOD;
            case EQ: return OpCode.EQ;
            case NE: return OpCode.NE;
            case LT: return OpCode.LT;
            case GT: return OpCode.GT;
            case LE: return OpCode.LE;
            case GE: return OpCode.GE;
            default:
                throw new CompileException("Unknown binary operator: " + node.getOperator().toSourceString(), node.getLocation());
        }
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
        compileNode(node.getOperand());
        switch (node.getOperator()) {
            case NOT:
                chunk.emit(OpCode.NOT);
                break;
            case NEGATE:
                chunk.emit(OpCode.NEG);
                break;
            default:
                throw new CompileException("Unknown unary operator: " + node.getOperator(), node.getLocation());
        }
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, Void ctx) {
        compileNode(node.getTarget());
        chunk.emitWithIndex(OpCode.GET_MEMBER, chunk.addName(node.getMember()));
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Void ctx) {
        if (node.getArgs().size() > ChunkBuilder.MAX_ARGS) {
            throw new CompileException("Too many arguments (max " + ChunkBuilder.MAX_ARGS + ")", node.getLocation());
        }
        if (node.isMethodCall()) {
            MemberExpr member = (MemberExpr) node.getCallee();
            compileNode(member.getTarget());
            for (Expression arg : node.getArgs()) {
                compileNode(arg);
            }
            chunk.emitCallMethod(chunk.addName(member.getMember()), node.getArgs().size());
        } else {
            compileNode(node.getCallee());
            for (Expression arg : node.getArgs()) {
                compileNode(arg);
            }
            chunk.emitCall(node.getArgs().size());
        }
        return null;
    }

    @Override
    public Void visitGroupExpr(GroupExpr node, Void ctx) {
        compileNode(node.getExpression());
        return null;
    }
}
