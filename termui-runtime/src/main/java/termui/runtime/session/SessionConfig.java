package termui.runtime.session;

import termui.runtime.vm.ExecutionLimits;

import java.util.concurrent.Executor;

/**
 * 会话管理配置
 *
 * <pre>
 * SessionConfig config = SessionConfig.builder()
 *     .limits(ExecutionLimits.strict())
 *     .batchInterval(33)
 *     .preemptStaleRuns(true)
 *     .build();
 * </pre>
 */
public final class SessionConfig {

    private final ExecutionLimits limits;
    private final long batchIntervalMs;
    private final boolean enabled;
    private final long chunkCacheSize;
    private final boolean preemptStaleRuns;
    private final Executor executor;   // null = 由 SessionManager 创建

    private SessionConfig(Builder builder) {
        this.limits = builder.limits;
        this.batchIntervalMs = builder.batchIntervalMs;
        this.enabled = builder.enabled;
        this.chunkCacheSize = builder.chunkCacheSize;
        this.preemptStaleRuns = builder.preemptStaleRuns;
        this.executor = builder.executor;
    }

    public static SessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecutionLimits getLimits() {
        return limits;
    }

    /** 同一会话两次批量执行之间的最小间隔（毫秒） */
    public long getBatchIntervalMs() {
        return batchIntervalMs;
    }

    /** 关闭时只剥离脚本块，不执行 */
    public boolean isEnabled() {
        return enabled;
    }

    public long getChunkCacheSize() {
        return chunkCacheSize;
    }

    /** 新块到达时是否停止仍在运行的旧执行 */
    public boolean isPreemptStaleRuns() {
        return preemptStaleRuns;
    }

    public Executor getExecutor() {
        return executor;
    }

    // ============ Builder ============

    public static final class Builder {
        private ExecutionLimits limits = ExecutionLimits.defaults();
        private long batchIntervalMs = 16;   // 约 60 次/秒
        private boolean enabled = true;
        private long chunkCacheSize = 256;
        private boolean preemptStaleRuns = false;
        private Executor executor;

        Builder() {
        }

        public Builder limits(ExecutionLimits limits) {
            if (limits == null) {
                throw new IllegalArgumentException("limits must not be null");
            }
            this.limits = limits;
            return this;
        }

        public Builder batchInterval(long ms) {
            if (ms < 0) {
                throw new IllegalArgumentException("batchInterval must not be negative");
            }
            this.batchIntervalMs = ms;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder chunkCacheSize(long size) {
            if (size <= 0) {
                throw new IllegalArgumentException("chunkCacheSize must be positive");
            }
            this.chunkCacheSize = size;
            return this;
        }

        public Builder preemptStaleRuns(boolean preempt) {
            this.preemptStaleRuns = preempt;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(this);
        }
    }
}
