package termui.runtime.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.termui.compiler.codegen.CompiledChunk;

/**
 * 编译结果缓存，键为块的原始文本
 *
 * <p>基于 Caffeine（Window TinyLfu 淘汰），线程安全，可在多个会话之间共享。
 * 只缓存没有语法错误的块。同一段文本在不同会话中编译结果相同，
 * 取出时换成请求方的来源名。</p>
 */
public final class ChunkCache {

    private final Cache<String, CompiledChunk> cache;
    private final long maximumSize;

    /**
     * @param maximumSize 最大条目数
     */
    public ChunkCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * @param source     块的原始文本
     * @param sourceName 请求方的来源名（会话 ID）
     * @return 以 sourceName 标记的缓存结果，未命中时为 null
     */
    public CompiledChunk get(String source, String sourceName) {
        CompiledChunk chunk = cache.getIfPresent(source);
        return chunk != null ? chunk.withSourceName(sourceName) : null;
    }

    public void put(String source, CompiledChunk chunk) {
        cache.put(source, chunk);
    }

    /** 条目数，先执行待处理的淘汰 */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(),
                cache.estimatedSize(), maximumSize);
    }
}
