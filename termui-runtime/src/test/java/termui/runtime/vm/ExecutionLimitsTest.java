package termui.runtime.vm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 执行限制配置测试
 */
class ExecutionLimitsTest {

    @Test
    @DisplayName("默认限制")
    void testDefaults() {
        ExecutionLimits limits = ExecutionLimits.defaults();
        assertEquals(ExecutionLimits.Level.DEFAULT, limits.getLevel());
        assertEquals(100, limits.getMaxVariables());
        assertEquals(102_400, limits.getMaxStringLength());
        assertEquals(40_000, limits.getMaxIterations());
        assertEquals(500, limits.getMaxExecutionTimeMs());
        assertEquals(1024, limits.getMaxStackSize());
        assertEquals(1000, limits.getTimeCheckInterval());
    }

    @Test
    @DisplayName("严格与宽松预设")
    void testPresets() {
        ExecutionLimits strict = ExecutionLimits.strict();
        assertEquals(ExecutionLimits.Level.STRICT, strict.getLevel());
        assertEquals(50, strict.getMaxVariables());
        assertEquals(10_000, strict.getMaxIterations());
        assertEquals(100, strict.getMaxExecutionTimeMs());
        assertEquals(256, strict.getMaxStackSize());

        ExecutionLimits relaxed = ExecutionLimits.relaxed();
        assertEquals(1000, relaxed.getMaxVariables());
        assertEquals(1_048_576, relaxed.getMaxStringLength());
        assertEquals(5000, relaxed.getMaxExecutionTimeMs());
    }

    @Test
    @DisplayName("自定义并基于已有限制修改")
    void testCustom() {
        ExecutionLimits limits = ExecutionLimits.custom().maxIterations(7).build();
        assertEquals(ExecutionLimits.Level.CUSTOM, limits.getLevel());
        assertEquals(7, limits.getMaxIterations());
        assertEquals(100, limits.getMaxVariables());

        ExecutionLimits derived = ExecutionLimits.strict().toBuilder().maxExecutionTime(999).build();
        assertEquals(999, derived.getMaxExecutionTimeMs());
        assertEquals(50, derived.getMaxVariables());
    }

    @Test
    @DisplayName("非正数被拒绝")
    void testRejectsNonPositive() {
        assertThatThrownBy(() -> ExecutionLimits.custom().maxVariables(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxVariables must be positive");
        assertThatThrownBy(() -> ExecutionLimits.custom().maxExecutionTime(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
