package termui.runtime.session;

import com.termui.compiler.lexer.BlockDetector;
import termui.runtime.cache.ChunkCache;
import termui.runtime.intrinsic.IntrinsicRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * 会话管理器
 *
 * <p>宿主把每段输出交给 {@link #processOutput}：其中的脚本块排入对应会话，
 * 返回剥离脚本块后的文本。宿主定期调用 {@link #tick} 按批量间隔执行各会话的积压块。
 * 所有会话共享同一个分派表和编译缓存。</p>
 *
 * <pre>
 * try (SessionManager manager = new SessionManager(registry, SessionConfig.defaults())) {
 *     String visible = manager.processOutput(output, "tty1");
 *     ...
 *     manager.tick();
 * }
 * </pre>
 */
public class SessionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SessionManager.class.getName());

    private final IntrinsicRegistry registry;
    private final SessionConfig config;
    private final SessionListener listener;
    private final ChunkCache chunkCache;
    private final Executor executor;
    private final ExecutorService ownedExecutor;   // 配置未提供执行器时自建，close 时关闭

    private final Map<String, ScriptSession> sessions = new ConcurrentHashMap<>();

    public SessionManager(IntrinsicRegistry registry, SessionConfig config) {
        this(registry, config, SessionListener.NONE);
    }

    public SessionManager(IntrinsicRegistry registry, SessionConfig config, SessionListener listener) {
        this.registry = registry;
        this.config = config != null ? config : SessionConfig.defaults();
        this.listener = listener != null ? listener : SessionListener.NONE;
        this.chunkCache = new ChunkCache(this.config.getChunkCacheSize());
        if (this.config.getExecutor() != null) {
            this.executor = this.config.getExecutor();
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(new WorkerThreadFactory());
            this.executor = ownedExecutor;
        }
    }

    /**
     * 处理一段输出
     *
     * @param output    可能含有脚本块的文本
     * @param sessionId 会话 ID（例如终端标识）
     * @return 剥离所有脚本块后的文本；不含脚本块时原样返回
     * @throws IllegalArgumentException sessionId 为 null
     */
    public String processOutput(String output, String sessionId) {
        requireSessionId(sessionId);
        if (output == null || output.isEmpty() || !BlockDetector.containsBlock(output)) {
            return output;
        }
        if (!config.isEnabled()) {
            return BlockDetector.stripBlocks(output);
        }

        List<String> blocks = BlockDetector.extractBlocks(output);
        if (!blocks.isEmpty()) {
            ScriptSession session = getOrCreateSession(sessionId);
            if (config.isPreemptStaleRuns() && session.isExecuting()) {
                LOG.fine("新块到达，停止会话 " + sessionId + " 的旧执行");
                session.stop();
            }
            session.enqueueAll(blocks);
            // 首批块立即执行，之后由 tick 按间隔调度
            if (!session.hasExecuted()) {
                session.execute();
            }
        }
        return BlockDetector.stripBlocks(output);
    }

    /** 以当前时间调度 */
    public List<CompletableFuture<List<BlockOutcome>>> tick() {
        return tick(System.currentTimeMillis());
    }

    /**
     * 执行所有到达批量间隔且有积压块的会话
     *
     * @return 本次启动的执行
     */
    public List<CompletableFuture<List<BlockOutcome>>> tick(long nowMs) {
        List<CompletableFuture<List<BlockOutcome>>> started = new ArrayList<>();
        for (ScriptSession session : sessions.values()) {
            if (session.shouldExecute(nowMs)) {
                started.add(session.execute());
            }
        }
        return started;
    }

    // ============ 会话 ============

    public ScriptSession getOrCreateSession(String sessionId) {
        requireSessionId(sessionId);
        return sessions.computeIfAbsent(sessionId, id -> {
            LOG.fine("创建会话: " + id);
            return new ScriptSession(id, registry, config, chunkCache, executor, listener);
        });
    }

    public ScriptSession getSession(String sessionId) {
        requireSessionId(sessionId);
        return sessions.get(sessionId);
    }

    public Collection<ScriptSession> getSessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public int getSessionCount() {
        return sessions.size();
    }

    public boolean destroySession(String sessionId) {
        requireSessionId(sessionId);
        ScriptSession session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        session.destroy();
        return true;
    }

    public void destroyAll() {
        for (String id : new ArrayList<>(sessions.keySet())) {
            destroySession(id);
        }
        LOG.fine("已销毁全部会话");
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId must not be null");
        }
    }

    public ChunkCache getChunkCache() {
        return chunkCache;
    }

    public IntrinsicRegistry getRegistry() {
        return registry;
    }

    public SessionConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        destroyAll();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /** 守护线程，不阻止宿主退出 */
    private static final class WorkerThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "termui-session-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
