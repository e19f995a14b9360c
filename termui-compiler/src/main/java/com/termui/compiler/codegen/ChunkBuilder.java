package com.termui.compiler.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 字节码块构建器
 *
 * <p>跳转采用两遍回填：{@link #emitJump(OpCode)} 写入占位偏移并返回操作数位置，
 * 目标确定后调用 {@link #patchJump(int)} 写入真实偏移。</p>
 */
public class ChunkBuilder {

    /** 池索引上限（u16） */
    public static final int MAX_POOL_SIZE = 0xFFFF + 1;
    /** 参数个数上限（u8） */
    public static final int MAX_ARGS = 0xFF;

    private final String sourceName;
    private byte[] code = new byte[64];
    private int size;

    private final List<Object> constants = new ArrayList<Object>();
    private final Map<Object, Integer> constantIndex = new HashMap<Object, Integer>();
    private final List<String> names = new ArrayList<String>();
    private final Map<String, Integer> nameIndex = new HashMap<String, Integer>();

    public ChunkBuilder(String sourceName) {
        this.sourceName = sourceName;
    }

    public ChunkBuilder() {
        this("<block>");
    }

    /** 当前写入位置（下一条指令的偏移） */
    public int currentOffset() {
        return size;
    }

    // ============ 常量与名字池 ============

    /**
     * 添加常量（数值或字符串），相同值复用同一槽位
     */
    public int addConstant(Object value) {
        if (!(value instanceof Double) && !(value instanceof String)) {
            throw new CompileException("Unsupported constant type: "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        Integer index = constantIndex.get(value);
        if (index != null) {
            return index;
        }
        if (constants.size() >= MAX_POOL_SIZE) {
            throw new CompileException("Too many constants in one block (max " + MAX_POOL_SIZE + ")");
        }
        int newIndex = constants.size();
        constants.add(value);
        constantIndex.put(value, newIndex);
        return newIndex;
    }

    /**
     * 添加名字（变量名/成员名），相同名字复用同一槽位
     */
    public int addName(String name) {
        Integer index = nameIndex.get(name);
        if (index != null) {
            return index;
        }
        if (names.size() >= MAX_POOL_SIZE) {
            throw new CompileException("Too many names in one block (max " + MAX_POOL_SIZE + ")");
        }
        int newIndex = names.size();
        names.add(name);
        nameIndex.put(name, newIndex);
        return newIndex;
    }

    // ============ 指令 ============

    public void emit(OpCode op) {
        if (op.getOperandWidth() != 0) {
            throw new CompileException("Opcode " + op + " requires operands");
        }
        writeByte(op.code());
    }

    /** 带一个池索引操作数的指令 */
    public void emitWithIndex(OpCode op, int index) {
        if (op.getOperandWidth() != 2 || op.isJump()) {
            throw new CompileException("Opcode " + op + " does not take a pool index");
        }
        writeByte(op.code());
        writeU16(index);
    }

    public void emitCall(int argCount) {
        checkArgCount(argCount);
        writeByte(OpCode.CALL.code());
        writeByte((byte) argCount);
    }

    public void emitCallMethod(int nameIdx, int argCount) {
        checkArgCount(argCount);
        writeByte(OpCode.CALL_METHOD.code());
        writeU16(nameIdx);
        writeByte((byte) argCount);
    }

    /**
     * 写入占位跳转
     *
     * @return 偏移操作数所在位置，用于 {@link #patchJump(int)}
     */
    public int emitJump(OpCode op) {
        if (!op.isJump()) {
            throw new CompileException("Not a jump opcode: " + op);
        }
        writeByte(op.code());
        int operandPos = size;
        writeU16(0xFFFF);
        return operandPos;
    }

    /**
     * 回填跳转，目标为当前写入位置
     */
    public void patchJump(int operandPos) {
        int offset = size - (operandPos + 2);
        checkJump(offset);
        code[operandPos] = (byte) ((offset >> 8) & 0xFF);
        code[operandPos + 1] = (byte) (offset & 0xFF);
    }

    /**
     * 向回跳转到 loopStart
     */
    public void emitLoop(int loopStart) {
        writeByte(OpCode.JUMP.code());
        int offset = loopStart - (size + 2);
        checkJump(offset);
        writeU16(offset & 0xFFFF);
    }

    public CompiledChunk build() {
        return new CompiledChunk(sourceName, Arrays.copyOf(code, size),
                new ArrayList<Object>(constants), new ArrayList<String>(names));
    }

    // ============ 底层写入 ============

    private void writeByte(byte b) {
        if (size == code.length) {
            code = Arrays.copyOf(code, code.length * 2);
        }
        code[size++] = b;
    }

    private void writeU16(int value) {
        writeByte((byte) ((value >> 8) & 0xFF));
        writeByte((byte) (value & 0xFF));
    }

    private static void checkArgCount(int argCount) {
        if (argCount < 0 || argCount > MAX_ARGS) {
            throw new CompileException("Too many arguments (max " + MAX_ARGS + ")");
        }
    }

    private static void checkJump(int offset) {
        if (offset < Short.MIN_VALUE || offset > Short.MAX_VALUE) {
            throw new CompileException("Jump too large: " + offset);
        }
    }
}
