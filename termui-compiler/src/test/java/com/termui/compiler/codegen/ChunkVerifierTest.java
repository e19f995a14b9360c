package com.termui.compiler.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

/**
 * ChunkVerifier 单元测试
 */
class ChunkVerifierTest {

    private static final List<Object> NO_CONSTANTS = Collections.emptyList();
    private static final List<String> NO_NAMES = Collections.emptyList();

    private CompiledChunk chunk(List<Object> constants, List<String> names, int... code) {
        byte[] bytes = new byte[code.length];
        for (int i = 0; i < code.length; i++) {
            bytes[i] = (byte) code[i];
        }
        return new CompiledChunk("<test>", bytes, constants, names);
    }

    private int op(OpCode op) {
        return op.code();
    }

    @Test
    @DisplayName("构建器生成的块通过校验")
    void testBuilderOutputVerifies() {
        ChunkBuilder builder = new ChunkBuilder();
        int loopStart = builder.currentOffset();
        builder.emitWithIndex(OpCode.LOAD_VAR, builder.addName("c"));
        int exit = builder.emitJump(OpCode.JUMP_IF_FALSE);
        builder.emit(OpCode.POP);
        builder.emitWithIndex(OpCode.PUSH_CONST, builder.addConstant(1.0));
        builder.emit(OpCode.POP);
        builder.emitLoop(loopStart);
        builder.patchJump(exit);
        builder.emit(OpCode.POP);
        builder.emit(OpCode.HALT);
        assertDoesNotThrow(() -> ChunkVerifier.verify(builder.build()));
    }

    @Test
    @DisplayName("空代码")
    void testEmptyCode() {
        assertThatThrownBy(() -> ChunkVerifier.verify(chunk(NO_CONSTANTS, NO_NAMES)))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("empty code");
    }

    @Test
    @DisplayName("未知操作码")
    void testUnknownOpcode() {
        assertThatThrownBy(() -> ChunkVerifier.verify(chunk(NO_CONSTANTS, NO_NAMES, 200, op(OpCode.HALT))))
                .hasMessageContaining("unknown opcode 200");
    }

    @Test
    @DisplayName("操作数不完整")
    void testTruncatedOperand() {
        assertThatThrownBy(() -> ChunkVerifier.verify(
                chunk(Arrays.<Object>asList(1.0), NO_NAMES, op(OpCode.PUSH_CONST), 0)))
                .hasMessageContaining("truncated");
    }

    @Test
    @DisplayName("常量索引越界")
    void testConstantOutOfRange() {
        assertThatThrownBy(() -> ChunkVerifier.verify(
                chunk(Arrays.<Object>asList(1.0), NO_NAMES, op(OpCode.PUSH_CONST), 0, 1, op(OpCode.HALT))))
                .hasMessageContaining("constant index 1 out of range");
    }

    @Test
    @DisplayName("名字索引越界")
    void testNameOutOfRange() {
        assertThatThrownBy(() -> ChunkVerifier.verify(
                chunk(NO_CONSTANTS, NO_NAMES, op(OpCode.LOAD_VAR), 0, 0, op(OpCode.HALT))))
                .hasMessageContaining("name index 0 out of range");
    }

    @Test
    @DisplayName("跳转到指令中间")
    void testJumpIntoInstruction() {
        CompiledChunk bad = chunk(Arrays.<Object>asList(1.0), NO_NAMES,
                op(OpCode.JUMP), 0, 1,
                op(OpCode.PUSH_CONST), 0, 0,
                op(OpCode.HALT));
        assertThatThrownBy(() -> ChunkVerifier.verify(bad))
                .hasMessageContaining("not an instruction boundary");
    }

    @Test
    @DisplayName("跳转到块外")
    void testJumpOutOfChunk() {
        CompiledChunk bad = chunk(NO_CONSTANTS, NO_NAMES, op(OpCode.JUMP), 0x7F, 0x00, op(OpCode.HALT));
        assertThatThrownBy(() -> ChunkVerifier.verify(bad))
                .hasMessageContaining("targets");
        CompiledChunk backwards = chunk(NO_CONSTANTS, NO_NAMES, op(OpCode.JUMP), 0xFF, 0x00, op(OpCode.HALT));
        assertThatThrownBy(() -> ChunkVerifier.verify(backwards))
                .hasMessageContaining("targets");
    }

    @Test
    @DisplayName("缺少结束指令")
    void testMissingHalt() {
        assertThatThrownBy(() -> ChunkVerifier.verify(chunk(NO_CONSTANTS, NO_NAMES, op(OpCode.PUSH_NULL))))
                .hasMessageContaining("does not end with HALT");
    }

    @Test
    @DisplayName("错误消息带统一前缀")
    void testMessagePrefix() {
        try {
            ChunkVerifier.verify(chunk(NO_CONSTANTS, NO_NAMES, op(OpCode.POP)));
        } catch (CompileException e) {
            assertThat(e.getMessage()).startsWith("Invalid chunk: ");
            return;
        }
        throw new AssertionError("Expected CompileException");
    }
}
