package termui.runtime.session;

import com.termui.compiler.codegen.CompileException;
import com.termui.compiler.codegen.CompiledChunk;
import com.termui.compiler.codegen.Compiler;
import com.termui.compiler.lexer.Lexer;
import com.termui.compiler.lexer.Token;
import com.termui.compiler.parser.ParseError;
import com.termui.compiler.parser.ParseResult;
import com.termui.compiler.parser.Parser;
import termui.runtime.UiHandle;
import termui.runtime.cache.ChunkCache;
import termui.runtime.intrinsic.IntrinsicObject;
import termui.runtime.intrinsic.IntrinsicRegistry;
import termui.runtime.vm.VMContext;
import termui.runtime.vm.VMResult;
import termui.runtime.vm.VirtualMachine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 脚本会话：一个逻辑终端对应一个会话
 *
 * <p>持有一个虚拟机和一个持久上下文，以及待执行块的队列。每次批量执行取出
 * 队列中的全部块，按顺序逐个编译执行；某个块失败只记录并通知监听器，
 * 不影响后续块。同一会话同一时刻最多一次批量执行。</p>
 */
public class ScriptSession {

    private static final Logger LOG = Logger.getLogger(ScriptSession.class.getName());

    /** 上下文内部状态中保存会话 ID 的键 */
    public static final String SESSION_ID_KEY = "sessionId";

    private static final long NEVER = Long.MIN_VALUE;

    private final String id;
    private final VirtualMachine vm;
    private final VMContext context;
    private final ChunkCache chunkCache;
    private final Executor executor;
    private final SessionListener listener;
    private final long batchIntervalMs;

    private final Deque<String> pendingBlocks = new ArrayDeque<>();
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private volatile long lastExecuteTime = NEVER;
    private volatile boolean destroyed;

    public ScriptSession(String id, IntrinsicRegistry registry, SessionConfig config,
                         ChunkCache chunkCache, Executor executor, SessionListener listener) {
        this.id = id;
        this.vm = new VirtualMachine(registry, config.getLimits());
        this.context = new VMContext(config.getLimits());
        this.chunkCache = chunkCache;
        this.executor = executor;
        this.listener = listener != null ? listener : SessionListener.NONE;
        this.batchIntervalMs = config.getBatchIntervalMs();

        // 每个注册对象以句柄形式注入全局绑定
        for (IntrinsicObject object : registry.getObjects()) {
            context.setGlobal(object.getName(), UiHandle.of(object.getName()));
        }
        context.setInternal(SESSION_ID_KEY, id);
    }

    // ============ 队列 ============

    /** 追加一个块（原始文本，含起始标记） */
    public void enqueue(String blockSource) {
        if (destroyed) {
            return;
        }
        synchronized (pendingBlocks) {
            pendingBlocks.addLast(blockSource);
        }
    }

    public void enqueueAll(Collection<String> blockSources) {
        for (String source : blockSources) {
            enqueue(source);
        }
    }

    public boolean hasPendingBlocks() {
        synchronized (pendingBlocks) {
            return !pendingBlocks.isEmpty();
        }
    }

    public int getPendingCount() {
        synchronized (pendingBlocks) {
            return pendingBlocks.size();
        }
    }

    private List<String> drainPending() {
        synchronized (pendingBlocks) {
            List<String> blocks = new ArrayList<>(pendingBlocks);
            pendingBlocks.clear();
            return blocks;
        }
    }

    // ============ 调度 ============

    /**
     * 是否应该开始新的批量执行：有待执行块、当前没有执行，并且距上次执行已过批量间隔。
     * 从未执行过的会话立即执行。
     */
    public boolean shouldExecute(long nowMs) {
        if (destroyed || executing.get() || !hasPendingBlocks()) {
            return false;
        }
        long last = lastExecuteTime;
        return last == NEVER || nowMs - last >= batchIntervalMs;
    }

    /**
     * 在调用线程上执行所有待执行块
     *
     * @return 每个块的结果；会话正忙或已销毁时返回空列表
     */
    public List<BlockOutcome> executeNow() {
        if (destroyed || !executing.compareAndSet(false, true)) {
            return Collections.emptyList();
        }
        Batch batch = claimBatch();
        return runBatch(batch);
    }

    /**
     * 在会话的执行器上执行所有待执行块。批次内容和停止代数在调用时确定，
     * 之后到达的块进入下一批。
     */
    public CompletableFuture<List<BlockOutcome>> execute() {
        if (destroyed || !executing.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(Collections.<BlockOutcome>emptyList());
        }
        Batch batch = claimBatch();
        try {
            return CompletableFuture.supplyAsync(() -> runBatch(batch), executor);
        } catch (RuntimeException e) {
            // 执行器拒绝任务
            executing.set(false);
            throw e;
        }
    }

    /**
     * 停止当前批次：正在运行的块中止，批次中剩余的块不再执行。
     * 已认领但尚未开始运行的批次同样被停止。
     */
    public void stop() {
        vm.stop();
    }

    public void destroy() {
        destroyed = true;
        synchronized (pendingBlocks) {
            pendingBlocks.clear();
        }
        vm.stop();
        listener.onSessionDestroyed(this);
        LOG.fine("会话已销毁: " + id);
    }

    // ============ 执行 ============

    /** 一次批量执行：认领时取出的块和当时的停止代数 */
    private static final class Batch {
        final List<String> blocks;
        final long generation;

        Batch(List<String> blocks, long generation) {
            this.blocks = blocks;
            this.generation = generation;
        }
    }

    private Batch claimBatch() {
        lastExecuteTime = System.currentTimeMillis();
        return new Batch(drainPending(), vm.getStopGeneration());
    }

    private List<BlockOutcome> runBatch(Batch batch) {
        try {
            List<String> blocks = batch.blocks;
            List<BlockOutcome> outcomes = new ArrayList<>(blocks.size());
            for (int i = 0; i < blocks.size() && !destroyed; i++) {
                if (vm.getStopGeneration() != batch.generation) {
                    LOG.fine("会话 " + id + " 的批次已被停止，跳过剩余 " + (blocks.size() - i) + " 个块");
                    break;
                }
                BlockOutcome outcome = runBlock(i, blocks.get(i), batch.generation);
                outcomes.add(outcome);
                if (outcome.isSuccess()) {
                    listener.onBlockCompleted(this, outcome);
                } else {
                    LOG.warning("会话 " + id + " 的脚本块 #" + i + " 出错: " + outcome.getError());
                    listener.onBlockFailed(this, outcome);
                }
            }
            return outcomes;
        } finally {
            executing.set(false);
        }
    }

    private BlockOutcome runBlock(int index, String source, long generation) {
        List<ParseError> parseErrors = Collections.emptyList();
        CompiledChunk chunk = chunkCache.get(source, id);
        if (chunk == null) {
            try {
                List<Token> tokens = new Lexer(source).nextBlock();
                if (tokens == null) {
                    return BlockOutcome.compileFailed(index, source, parseErrors, "No script block found");
                }
                ParseResult parsed = new Parser(tokens, id).parseTolerant();
                parseErrors = parsed.getErrors();
                chunk = new Compiler().compile(parsed.getProgram(), id);
                if (!parsed.hasErrors()) {
                    chunkCache.put(source, chunk);
                }
            } catch (CompileException e) {
                return BlockOutcome.compileFailed(index, source, parseErrors, e.getMessage());
            } catch (StackOverflowError e) {
                LOG.warning("脚本块嵌套过深，无法编译: " + id + " #" + index);
                return BlockOutcome.compileFailed(index, source, parseErrors, "Block too deeply nested to compile");
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "编译脚本块时出现内部错误: " + id + " #" + index, e);
                return BlockOutcome.compileFailed(index, source, parseErrors, "Internal compiler error: " + e);
            }
        } else if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("编译缓存命中: " + id + " #" + index);
        }

        VMResult result = vm.execute(chunk, context, generation);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("会话 " + id + " 块 #" + index + ": " + result);
        }
        return BlockOutcome.executed(index, source, parseErrors, result);
    }

    // ============ 访问器 ============

    public String getId() {
        return id;
    }

    public VMContext getContext() {
        return context;
    }

    public VirtualMachine getVirtualMachine() {
        return vm;
    }

    public boolean isExecuting() {
        return executing.get();
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /** 是否至少开始过一次批量执行 */
    public boolean hasExecuted() {
        return lastExecuteTime != NEVER;
    }

    /** 上次批量执行开始的时间（毫秒），从未执行时为 {@link Long#MIN_VALUE} */
    public long getLastExecuteTime() {
        return lastExecuteTime;
    }
}
