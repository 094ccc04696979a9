package hle.idlepool.demo;

import hle.idlepool.pool.PoolStats;

/**
 * Outcome of a {@link CycleRunner} run: how many cycles ran, how long they took
 * and what the pool counters looked like afterwards.
 */
public final class RunResult {
    private final long cycles;
    private final long failures;
    private final long totalTimeNanos;
    private final PoolStats poolStats;

    RunResult(long cycles, long failures, long totalTimeNanos, PoolStats poolStats) {
        this.cycles = cycles;
        this.failures = failures;
        this.totalTimeNanos = totalTimeNanos;
        this.poolStats = poolStats;
    }

    public long getCycles() {
        return cycles;
    }

    public long getFailures() {
        return failures;
    }

    public long getTotalTimeNanos() {
        return totalTimeNanos;
    }

    public double getThroughputPerSec() {
        return totalTimeNanos > 0 ? cycles * 1_000_000_000.0 / totalTimeNanos : 0.0;
    }

    /**
     * Share of acquires served from the idle buffer, between 0 and 1.
     */
    public double getHitRatio() {
        long acquires = poolStats.getHits() + poolStats.getMisses();
        return acquires > 0 ? (double) poolStats.getHits() / acquires : 0.0;
    }

    public PoolStats getPoolStats() {
        return poolStats;
    }
}
