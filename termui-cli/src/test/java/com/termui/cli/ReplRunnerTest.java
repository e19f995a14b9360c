package com.termui.cli;

import termui.runtime.UiNumber;
import termui.runtime.vm.ExecutionLimits;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * REPL 输入处理测试
 */
class ReplRunnerTest {

    private ByteArrayOutputStream outBytes;
    private ReplRunner repl;
    private StringBuilder buffer;

    @BeforeEach
    void setUp() throws Exception {
        outBytes = new ByteArrayOutputStream();
        repl = new ReplRunner(ExecutionLimits.defaults(),
                new PrintStream(outBytes, true, "UTF-8"),
                new PrintStream(new ByteArrayOutputStream(), true, "UTF-8"));
        buffer = new StringBuilder();
    }

    private String output() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("续行判断")
    void testNeedsMoreInput() {
        assertTrue(ReplRunner.needsMoreInput("if x then"));
        assertTrue(ReplRunner.needsMoreInput("while i < 3 do"));
        assertTrue(ReplRunner.needsMoreInput("max(1,"));
        assertTrue(ReplRunner.needsMoreInput("if a then else if b then"));
        assertFalse(ReplRunner.needsMoreInput("if x then y = 1 end if"));
        assertFalse(ReplRunner.needsMoreInput("if a then else if b then end if"));
        assertFalse(ReplRunner.needsMoreInput("print('if while (')"));
    }

    @Test
    @DisplayName("变量跨行保留")
    void testVariablesPersist() {
        assertTrue(repl.accept("var x = 5", buffer));
        assertTrue(repl.accept("x = x * 2", buffer));
        assertTrue(repl.accept(":vars", buffer));
        assertThat(output()).contains("x = 10");
    }

    @Test
    @DisplayName("多行 if")
    void testMultiline() {
        repl.accept("if true then", buffer);
        assertTrue(buffer.length() > 0);
        repl.accept("var y = 1", buffer);
        repl.accept("end if", buffer);
        assertEquals(0, buffer.length());
        assertEquals(UiNumber.of(1), repl.getSession().getContext().getVariable("y"));
    }

    @Test
    @DisplayName("打印返回值")
    void testReturnValue() {
        repl.accept("return 'ok'", buffer);
        assertThat(output()).contains("\"ok\"");
    }

    @Test
    @DisplayName("命令")
    void testCommands() {
        repl.accept("var x = 1", buffer);
        assertTrue(repl.handleReplCommand(":reset"));
        assertFalse(repl.getSession().getContext().hasVariable("x"));
        assertTrue(repl.handleReplCommand(":disasm"));
        assertThat(output()).contains("字节码输出: 开");
        assertTrue(repl.handleReplCommand(":bogus"));
        assertThat(output()).contains("未知命令: :bogus");
        assertFalse(repl.handleReplCommand(":quit"));
    }
}
