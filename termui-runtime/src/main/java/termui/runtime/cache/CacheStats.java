package termui.runtime.cache;

/**
 * 编译缓存的统计快照
 *
 * <p>命中表示脚本块跳过了词法、语法分析和编译。</p>
 */
public final class CacheStats {

    private final long hitCount;
    private final long missCount;
    private final long evictionCount;
    private final long entries;
    private final long capacity;

    CacheStats(long hitCount, long missCount, long evictionCount, long entries, long capacity) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
        this.entries = entries;
        this.capacity = capacity;
    }

    public long getHitCount() {
        return hitCount;
    }

    public long getMissCount() {
        return missCount;
    }

    /** 查询总次数 */
    public long getRequestCount() {
        return hitCount + missCount;
    }

    /** 没有任何查询时为 0 */
    public double getHitRate() {
        long requests = getRequestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }

    public long getEvictionCount() {
        return evictionCount;
    }

    /** 当前条目数（近似值） */
    public long getEstimatedSize() {
        return entries;
    }

    public long getMaximumSize() {
        return capacity;
    }

    @Override
    public String toString() {
        return "CacheStats{hits=" + hitCount + ", misses=" + missCount
                + ", hitRate=" + String.format("%.1f%%", getHitRate() * 100)
                + ", evictions=" + evictionCount + ", size=" + entries + "/" + capacity + "}";
    }
}
