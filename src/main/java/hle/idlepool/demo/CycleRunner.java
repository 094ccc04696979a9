package hle.idlepool.demo;

import hle.idlepool.pool.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Drives acquire/return cycles against a pool from several threads and times them.
 *
 * @param <T> the type of resource managed by the pool
 */
public final class CycleRunner<T> {

    private static final Logger logger = LoggerFactory.getLogger(CycleRunner.class);

    /**
     * What a cycle does with the resource after acquiring it.
     */
    public enum Mode {
        /** Hand the resource back with {@link ResourcePool#release(Object)} */
        GET_PUT,
        /** Discard the resource with {@link ResourcePool#close(Object)} */
        GET_CLOSE
    }

    /**
     * Work done with a resource between acquiring and returning it.
     */
    @FunctionalInterface
    public interface ResourceTask<T> {
        void execute(T resource) throws Exception;
    }

    private final ResourcePool<T> pool;

    public CycleRunner(ResourcePool<T> pool) {
        this.pool = pool;
    }

    /**
     * Runs {@code threads * cyclesPerThread} cycles and waits for all of them.
     *
     * @param threads         the number of threads cycling in parallel
     * @param cyclesPerThread the number of cycles each thread performs
     * @param mode            how each cycle returns its resource
     * @param task            the work done with each acquired resource
     * @return cycle counts, elapsed time and a snapshot of the pool counters
     * @throws IllegalArgumentException if threads or cyclesPerThread is not positive,
     *                                  or their product does not fit in an {@code int}
     * @throws InterruptedException if the run is interrupted
     */
    public RunResult run(int threads,
                         int cyclesPerThread,
                         Mode mode,
                         ResourceTask<T> task) throws InterruptedException {
        int cycles = totalCycles(threads, cyclesPerThread);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        LongAdder failures = new LongAdder();

        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < cyclesPerThread; i++) {
                        if (!cycle(mode, task)) {
                            failures.increment();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        long startNanos = System.nanoTime();
        start.countDown();
        try {
            done.await();
        } finally {
            executor.shutdown();
            executor.awaitTermination(30, TimeUnit.SECONDS);
        }
        long totalTimeNanos = System.nanoTime() - startNanos;

        return new RunResult(cycles, failures.sum(), totalTimeNanos, pool.getStats());
    }

    static int totalCycles(int threads, int cyclesPerThread) {
        if (threads <= 0 || cyclesPerThread <= 0) {
            throw new IllegalArgumentException("threads and cyclesPerThread must be > 0");
        }
        try {
            return Math.multiplyExact(threads, cyclesPerThread);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "threads * cyclesPerThread is too large: " + threads + " * " + cyclesPerThread, e);
        }
    }

    private boolean cycle(Mode mode, ResourceTask<T> task) {
        T resource;
        try {
            resource = pool.acquire();
        } catch (Exception e) {
            logger.warn("Acquire failed: {}", e.getMessage());
            return false;
        }

        boolean ok = true;
        try {
            task.execute(resource);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.warn("Task failed: {}", e.getMessage());
            ok = false;
        }

        try {
            if (mode == Mode.GET_CLOSE || !ok) {
                pool.close(resource);
            } else {
                pool.release(resource);
            }
        } catch (Exception e) {
            logger.warn("Returning resource failed: {}", e.getMessage());
            ok = false;
        }
        return ok;
    }
}
