package termui.runtime.vm;

/**
 * 执行资源限制
 *
 * <p>约束单次 {@link VirtualMachine#execute} 的迭代次数和耗时，
 * 以及 {@link VMContext} 的变量个数和字符串长度。</p>
 *
 * <pre>
 * // 预定义级别
 * VirtualMachine vm = new VirtualMachine(registry, ExecutionLimits.strict());
 *
 * // 自定义
 * ExecutionLimits limits = ExecutionLimits.custom()
 *     .maxIterations(100_000)
 *     .maxExecutionTime(1000)
 *     .build();
 * </pre>
 */
public final class ExecutionLimits {

    /** 限制级别 */
    public enum Level { DEFAULT, STRICT, RELAXED, CUSTOM }

    private final Level level;

    // --- 上下文 ---
    private final int maxVariables;
    private final int maxStringLength;

    // --- 单次执行 ---
    private final long maxIterations;
    private final long maxExecutionTimeMs;
    private final int maxStackSize;
    private final int timeCheckInterval;   // 每隔多少次迭代检查一次耗时

    private ExecutionLimits(Builder builder) {
        this.level = builder.level;
        this.maxVariables = builder.maxVariables;
        this.maxStringLength = builder.maxStringLength;
        this.maxIterations = builder.maxIterations;
        this.maxExecutionTimeMs = builder.maxExecutionTimeMs;
        this.maxStackSize = builder.maxStackSize;
        this.timeCheckInterval = builder.timeCheckInterval;
    }

    // ============ 预定义工厂方法 ============

    /** 默认限制 */
    public static ExecutionLimits defaults() {
        return new Builder(Level.DEFAULT).build();
    }

    /** 严格模式：适合不可信的高频脚本 */
    public static ExecutionLimits strict() {
        return new Builder(Level.STRICT)
                .maxVariables(50)
                .maxStringLength(16_384)
                .maxIterations(10_000)
                .maxExecutionTime(100)
                .maxStackSize(256)
                .build();
    }

    /** 宽松模式：本地调试用 */
    public static ExecutionLimits relaxed() {
        return new Builder(Level.RELAXED)
                .maxVariables(1000)
                .maxStringLength(1_048_576)
                .maxIterations(1_000_000)
                .maxExecutionTime(5000)
                .maxStackSize(4096)
                .build();
    }

    /** 自定义模式 Builder（初始值同 {@link #defaults()}） */
    public static Builder custom() {
        return new Builder(Level.CUSTOM);
    }

    /** 以当前限制为基础创建 Builder */
    public Builder toBuilder() {
        return new Builder(Level.CUSTOM)
                .maxVariables(maxVariables)
                .maxStringLength(maxStringLength)
                .maxIterations(maxIterations)
                .maxExecutionTime(maxExecutionTimeMs)
                .maxStackSize(maxStackSize)
                .timeCheckInterval(timeCheckInterval);
    }

    // ============ 查询方法 ============

    public Level getLevel() {
        return level;
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    public int getMaxStringLength() {
        return maxStringLength;
    }

    public long getMaxIterations() {
        return maxIterations;
    }

    public long getMaxExecutionTimeMs() {
        return maxExecutionTimeMs;
    }

    public int getMaxStackSize() {
        return maxStackSize;
    }

    public int getTimeCheckInterval() {
        return timeCheckInterval;
    }

    @Override
    public String toString() {
        return "ExecutionLimits{" + level
                + ", variables=" + maxVariables
                + ", string=" + maxStringLength
                + ", iterations=" + maxIterations
                + ", time=" + maxExecutionTimeMs + "ms"
                + ", stack=" + maxStackSize + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private final Level level;
        private int maxVariables = 100;
        private int maxStringLength = 102_400;
        private long maxIterations = 40_000;
        private long maxExecutionTimeMs = 500;
        private int maxStackSize = 1024;
        private int timeCheckInterval = 1000;

        Builder(Level level) {
            this.level = level;
        }

        public Builder maxVariables(int max) {
            this.maxVariables = requirePositive(max, "maxVariables");
            return this;
        }

        public Builder maxStringLength(int max) {
            this.maxStringLength = requirePositive(max, "maxStringLength");
            return this;
        }

        public Builder maxIterations(long max) {
            this.maxIterations = requirePositive(max, "maxIterations");
            return this;
        }

        public Builder maxExecutionTime(long ms) {
            this.maxExecutionTimeMs = requirePositive(ms, "maxExecutionTime");
            return this;
        }

        public Builder maxStackSize(int size) {
            this.maxStackSize = requirePositive(size, "maxStackSize");
            return this;
        }

        public Builder timeCheckInterval(int interval) {
            this.timeCheckInterval = requirePositive(interval, "timeCheckInterval");
            return this;
        }

        public ExecutionLimits build() {
            return new ExecutionLimits(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static long requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
