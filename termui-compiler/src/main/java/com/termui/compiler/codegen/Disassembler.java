package com.termui.compiler.codegen;

/**
 * 字节码反汇编，输出可读的指令列表
 *
 * <pre>
 * == &lt;block&gt; ==
 * 0000  PUSH_CONST        0  ; 10
 * 0003  STORE_VAR         0  ; x
 * 0006  POP
 * </pre>
 */
public final class Disassembler {
    private Disassembler() {}

    public static String disassemble(CompiledChunk chunk) {
        StringBuilder sb = new StringBuilder();
        sb.append("== ").append(chunk.getSourceName()).append(" ==\n");
        int pc = 0;
        while (pc < chunk.getCodeLength()) {
            pc = disassembleInstruction(chunk, pc, sb);
        }
        return sb.toString();
    }

    /**
     * 反汇编一条指令
     *
     * @return 下一条指令的偏移
     */
    public static int disassembleInstruction(CompiledChunk chunk, int pc, StringBuilder sb) {
        sb.append(String.format("%04d  ", pc));
        OpCode op = OpCode.fromByte(chunk.readU8(pc));
        if (op == null) {
            sb.append("<unknown ").append(chunk.readU8(pc)).append(">\n");
            return pc + 1;
        }
        if (pc + op.getSize() > chunk.getCodeLength()) {
            sb.append(op.name()).append(" <truncated>\n");
            return chunk.getCodeLength();
        }

        switch (op) {
            case PUSH_CONST: {
                int index = chunk.readU16(pc + 1);
                sb.append(String.format("%-16s %4d  ; %s", op.name(), index, formatConstant(chunk, index)));
                break;
            }
            case LOAD_VAR:
            case STORE_VAR:
            case GET_MEMBER:
            case SET_MEMBER: {
                int index = chunk.readU16(pc + 1);
                sb.append(String.format("%-16s %4d  ; %s", op.name(), index, formatName(chunk, index)));
                break;
            }
            case CALL:
                sb.append(String.format("%-16s %4d", op.name(), chunk.readU8(pc + 1)));
                break;
            case CALL_METHOD: {
                int index = chunk.readU16(pc + 1);
                int argc = chunk.readU8(pc + 3);
                sb.append(String.format("%-16s %4d %d  ; %s", op.name(), index, argc, formatName(chunk, index)));
                break;
            }
            case JUMP:
            case JUMP_IF_FALSE:
            case JUMP_IF_TRUE: {
                int offset = chunk.readS16(pc + 1);
                sb.append(String.format("%-16s %4d  -> %04d", op.name(), offset, pc + 3 + offset));
                break;
            }
            default:
                sb.append(op.name());
                break;
        }
        sb.append('\n');
        return pc + op.getSize();
    }

    private static String formatConstant(CompiledChunk chunk, int index) {
        if (index >= chunk.getConstants().size()) {
            return "<invalid>";
        }
        Object value = chunk.getConstant(index);
        if (value instanceof String) {
            return "\"" + ((String) value).replace("\n", "\\n") + "\"";
        }
        double d = (Double) value;
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return String.valueOf((long) d);
        }
        return String.valueOf(d);
    }

    private static String formatName(CompiledChunk chunk, int index) {
        return index < chunk.getNames().size() ? chunk.getName(index) : "<invalid>";
    }
}
