package com.termui.cli;

import picocli.CommandLine;
import termui.runtime.vm.ExecutionLimits;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行参数测试
 */
class MainTest {

    @Test
    @DisplayName("限制级别与覆盖项")
    void testResolveLimits() {
        assertEquals(ExecutionLimits.Level.DEFAULT, Main.resolveLimits(null, null, null).getLevel());
        assertEquals(ExecutionLimits.Level.STRICT, Main.resolveLimits("STRICT", null, null).getLevel());

        ExecutionLimits limits = Main.resolveLimits("relaxed", 123L, 45L);
        assertEquals(123, limits.getMaxIterations());
        assertEquals(45, limits.getMaxExecutionTimeMs());
        assertEquals(1000, limits.getMaxVariables());

        assertThatThrownBy(() -> Main.resolveLimits("huge", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("huge");
    }

    @Test
    @DisplayName("-e 执行代码片段")
    void testExpression() throws Exception {
        ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        Main main = new Main(new PrintStream(outBytes, true, "UTF-8"), new PrintStream(errBytes, true, "UTF-8"));

        int code = new CommandLine(main).execute("-e", "return 6 * 7");

        assertEquals(0, code);
        assertEquals("42", new String(outBytes.toByteArray(), StandardCharsets.UTF_8).trim());
    }

    @Test
    @DisplayName("迭代上限选项生效")
    void testMaxIterationsOption() throws Exception {
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        Main main = new Main(new PrintStream(new ByteArrayOutputStream(), true, "UTF-8"),
                new PrintStream(errBytes, true, "UTF-8"));

        int code = new CommandLine(main).execute("--max-iterations", "50", "-e", "while true do end while");

        assertEquals(1, code);
        assertThat(new String(errBytes.toByteArray(), StandardCharsets.UTF_8)).contains("possible infinite loop");
    }

    @Test
    @DisplayName("未知限制级别返回 2")
    void testUnknownLimits() throws Exception {
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        Main main = new Main(new PrintStream(new ByteArrayOutputStream(), true, "UTF-8"),
                new PrintStream(errBytes, true, "UTF-8"));

        assertEquals(2, new CommandLine(main).execute("--limits", "huge", "-e", "var a = 1"));
        assertThat(new String(errBytes.toByteArray(), StandardCharsets.UTF_8)).contains("未知限制级别");
    }
}
