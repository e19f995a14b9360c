package com.termui.compiler.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * 字节码块结构校验
 *
 * <p>只检查结构一致性：操作码合法、操作数完整、池索引在范围内、
 * 跳转目标落在块内的指令边界上。不做栈深度推导。</p>
 */
public final class ChunkVerifier {
    private ChunkVerifier() {}

    public static void verify(CompiledChunk chunk) {
        int length = chunk.getCodeLength();
        if (length == 0) {
            throw invalid("empty code");
        }

        boolean[] boundaries = new boolean[length];
        List<int[]> jumps = new ArrayList<int[]>(); // {指令偏移, 目标偏移}

        int pc = 0;
        OpCode last = null;
        while (pc < length) {
            boundaries[pc] = true;
            int start = pc;
            OpCode op = OpCode.fromByte(chunk.readU8(pc));
            if (op == null) {
                throw invalid("unknown opcode " + chunk.readU8(pc) + " at " + start);
            }
            if (start + op.getSize() > length) {
                throw invalid("truncated operands for " + op + " at " + start);
            }
            pc++;
            for (OpCode.OperandKind kind : op.getOperands()) {
                switch (kind) {
                    case CONST: {
                        int index = chunk.readU16(pc);
                        if (index >= chunk.getConstants().size()) {
                            throw invalid("constant index " + index + " out of range (constants="
                                    + chunk.getConstants().size() + ") at " + start);
                        }
                        break;
                    }
                    case NAME: {
                        int index = chunk.readU16(pc);
                        if (index >= chunk.getNames().size()) {
                            throw invalid("name index " + index + " out of range (names="
                                    + chunk.getNames().size() + ") at " + start);
                        }
                        break;
                    }
                    case JUMP:
                        jumps.add(new int[]{start, pc + 2 + chunk.readS16(pc)});
                        break;
                    default:
                        break;
                }
                pc += kind.getWidth();
            }
            last = op;
        }

        for (int[] jump : jumps) {
            int target = jump[1];
            if (target < 0 || target >= length || !boundaries[target]) {
                throw invalid("jump at " + jump[0] + " targets " + target
                        + " which is not an instruction boundary");
            }
        }

        if (last != OpCode.HALT && last != OpCode.RETURN && last != OpCode.RETURN_VALUE) {
            throw invalid("chunk does not end with HALT or RETURN (last=" + last + ")");
        }
    }

    private static CompileException invalid(String detail) {
        return new CompileException("Invalid chunk: " + detail);
    }
}
