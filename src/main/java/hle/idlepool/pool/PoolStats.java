package hle.idlepool.pool;

/**
 * Point-in-time counters of a {@link ResourcePool}.
 *
 * <p>Each field is read atomically but the snapshot as a whole is not; under
 * concurrent traffic the idle count and the counters may disagree slightly.
 */
public final class PoolStats {
    private final long hits;
    private final long misses;
    private final int idle;
    private final long staleEvictions;
    private final long evictionFailures;
    private final long overflowCloses;

    PoolStats(long hits, long misses, int idle, long staleEvictions, long evictionFailures, long overflowCloses) {
        this.hits = hits;
        this.misses = misses;
        this.idle = idle;
        this.staleEvictions = staleEvictions;
        this.evictionFailures = evictionFailures;
        this.overflowCloses = overflowCloses;
    }

    /**
     * Number of acquires served from the idle buffer.
     */
    public long getHits() {
        return hits;
    }

    /**
     * Number of acquires served by the factory.
     */
    public long getMisses() {
        return misses;
    }

    /**
     * Number of resources sitting in the idle buffer.
     */
    public int getIdle() {
        return idle;
    }

    /**
     * Number of idle resources discarded on acquire because they outlived the idle timeout.
     */
    public long getStaleEvictions() {
        return staleEvictions;
    }

    /**
     * Number of stale evictions whose closer threw. These failures are not reported to the acquiring caller.
     */
    public long getEvictionFailures() {
        return evictionFailures;
    }

    /**
     * Number of released resources closed because the idle buffer was full.
     */
    public long getOverflowCloses() {
        return overflowCloses;
    }

    public long getAcquires() {
        return hits + misses;
    }

    @Override
    public String toString() {
        return String.format("PoolStats[hits=%d, misses=%d, idle=%d, staleEvictions=%d, evictionFailures=%d, overflowCloses=%d]",
                hits, misses, idle, staleEvictions, evictionFailures, overflowCloses);
    }
}
