package com.termui.compiler.codegen;

/**
 * 字节码操作码
 *
 * <p>操作数编码：池索引为无符号 16 位（大端），参数个数为无符号 8 位，
 * 跳转偏移为有符号 16 位，相对于操作数之后的下一字节。</p>
 */
public enum OpCode {
    // === 栈操作 ===
    PUSH_CONST(OperandKind.CONST),      // PUSH_CONST <u16 常量索引>
    PUSH_NULL,
    PUSH_TRUE,
    PUSH_FALSE,
    POP,

    // === 变量 ===
    LOAD_VAR(OperandKind.NAME),         // 先查变量，再查全局；都没有时压入名字本身
    STORE_VAR(OperandKind.NAME),        // 写入变量，栈顶保留

    // === 算术 ===
    ADD,
    SUB,
    MUL,
    DIV,
    MOD,
    NEG,

    // === 比较 ===
    EQ,
    NE,
    LT,
    GT,
    LE,
    GE,

    // === 逻辑 ===
    NOT,

    // === 跳转（条件跳转只查看栈顶，不弹出） ===
    JUMP(OperandKind.JUMP),
    JUMP_IF_FALSE(OperandKind.JUMP),
    JUMP_IF_TRUE(OperandKind.JUMP),

    // === 调用与成员 ===
    CALL(OperandKind.ARG_COUNT),        // CALL <u8 参数个数>
    CALL_METHOD(OperandKind.NAME, OperandKind.ARG_COUNT),
    GET_MEMBER(OperandKind.NAME),
    SET_MEMBER(OperandKind.NAME),       // 弹出值和目标，写入后把值压回

    // === 结束 ===
    RETURN,
    RETURN_VALUE,
    HALT;

    /**
     * 操作数类型
     */
    public enum OperandKind {
        CONST(2),
        NAME(2),
        JUMP(2),
        ARG_COUNT(1);

        private final int width;

        OperandKind(int width) {
            this.width = width;
        }

        public int getWidth() {
            return width;
        }
    }

    private static final OpCode[] VALUES = values();

    private final OperandKind[] operands;
    private final int operandWidth;

    OpCode(OperandKind... operands) {
        this.operands = operands;
        int width = 0;
        for (OperandKind kind : operands) {
            width += kind.getWidth();
        }
        this.operandWidth = width;
    }

    public byte code() {
        return (byte) ordinal();
    }

    /** 操作数类型（按编码顺序） */
    public OperandKind[] getOperands() {
        return operands.clone();
    }

    /** 所有操作数的总字节数 */
    public int getOperandWidth() {
        return operandWidth;
    }

    /** 指令总长度（含操作码） */
    public int getSize() {
        return 1 + operandWidth;
    }

    public boolean isJump() {
        return this == JUMP || this == JUMP_IF_FALSE || this == JUMP_IF_TRUE;
    }

    /**
     * 从字节解码
     *
     * @return 对应操作码，未知字节返回 null
     */
    public static OpCode fromByte(int b) {
        int index = b & 0xFF;
        return index < VALUES.length ? VALUES[index] : null;
    }
}
