package hle.idlepool.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A generic, thread-safe pool that keeps a bounded number of idle resources
 * around for reuse, such as network connections.
 *
 * <p>Key features:
 * <ul>
 *   <li>Never blocks: an empty pool creates a resource, a full pool closes the returned one</li>
 *   <li>Lazy idle timeout: resources idle for too long are closed when acquire finds them</li>
 *   <li>Every discarded resource goes through {@link #close(Object)}</li>
 *   <li>Hit and miss counters for monitoring</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * ResourcePool<Socket> pool = new ResourcePool<>(
 *     ResourcePoolConfig.<Socket>builder()
 *         .factory(() -> new Socket(host, port))
 *         .closer(Socket::close)
 *         .maxCapacity(10)
 *         .idleTimeout(Duration.ofSeconds(15))
 *         .build()
 * );
 *
 * Socket socket = pool.acquire();
 * try {
 *     // use the socket
 * } finally {
 *     pool.release(socket);
 * }
 *
 * pool.shutdown();
 * }</pre>
 *
 * <p>There is no limit on the number of resources handed out at once; the
 * capacity only bounds how many are kept idle. The pool runs no threads of its
 * own, so the factory and closer always run on the calling thread.
 *
 * @param <T> the type of resource managed by this pool
 */
public class ResourcePool<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ResourcePool.class);

    private final Object lock = new Object();
    private final int maxCapacity;
    private final ResourceCloser<T> closer;
    private final Duration idleTimeout;
    private final boolean idleTimeoutEnabled;
    private final Clock clock;

    // Guarded by lock. Both are cleared by shutdown.
    private BlockingQueue<IdleEntry<T>> idle;
    private ResourceFactory<T> factory;

    // Statistics
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong staleEvictions = new AtomicLong(0);
    private final AtomicLong evictionFailures = new AtomicLong(0);
    private final AtomicLong overflowCloses = new AtomicLong(0);

    /**
     * Creates a new pool from the given configuration.
     *
     * @param config pool configuration
     * @throws ResourcePoolException if an initial size is configured and the factory fails while filling the pool
     */
    public ResourcePool(ResourcePoolConfig<T> config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.maxCapacity = config.getEffectiveMaxCapacity();
        this.closer = config.getCloser();
        this.idleTimeout = config.getIdleTimeout();
        this.idleTimeoutEnabled = config.isIdleTimeoutEnabled();
        this.clock = config.getClock();
        this.idle = new ArrayBlockingQueue<>(maxCapacity);
        this.factory = config.getFactory();

        if (config.getInitialSize() > 0) {
            fill(config.getInitialSize());
        }
        logger.debug("Created pool with {}", config);
    }

    private void fill(int initialSize) {
        for (int i = 0; i < initialSize; i++) {
            T resource;
            try {
                resource = createResource(factory);
            } catch (Exception e) {
                try {
                    shutdown();
                } catch (ResourcePoolException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw new ResourcePoolException("factory is not able to fill the pool", e);
            }
            idle.offer(new IdleEntry<>(resource, clock.instant()));
        }
    }

    /**
     * Takes an idle resource from the pool, or creates a new one when none is available.
     *
     * <p>Idle resources older than the idle timeout are closed and skipped. A failure
     * to close such a resource is logged and counted, not thrown.
     *
     * @return a resource for the exclusive use of the caller
     * @throws PoolClosedException if the pool has been shut down
     * @throws Exception whatever the factory throws, unchanged
     */
    public T acquire() throws Exception {
        BlockingQueue<IdleEntry<T>> conns;
        ResourceFactory<T> create;
        synchronized (lock) {
            conns = idle;
            create = factory;
        }
        if (conns == null) {
            throw new PoolClosedException();
        }

        while (true) {
            IdleEntry<T> entry = conns.poll();
            if (entry == null) {
                T resource = createResource(create);
                misses.incrementAndGet();
                return resource;
            }
            if (idleTimeoutEnabled && entry.isStale(idleTimeout, clock.instant())) {
                evictStale(entry);
                continue;
            }
            hits.incrementAndGet();
            return entry.getResource();
        }
    }

    private T createResource(ResourceFactory<T> create) throws Exception {
        T resource = create.create();
        if (resource == null) {
            throw new ResourcePoolException("factory returned a null resource");
        }
        return resource;
    }

    private void evictStale(IdleEntry<T> entry) {
        staleEvictions.incrementAndGet();
        try {
            close(entry.getResource());
        } catch (Exception e) {
            evictionFailures.incrementAndGet();
            logger.warn("Failed to close stale resource idle since {}: {}", entry.getEnteredIdleAt(), e.getMessage());
        }
    }

    /**
     * Returns a resource to the pool.
     *
     * <p>The resource is closed instead of kept when the idle buffer is full or the
     * pool has been shut down.
     *
     * @param resource the resource to return
     * @throws NullPointerException if resource is null
     * @throws Exception whatever the closer throws when the resource is closed instead of kept
     */
    public void release(T resource) throws Exception {
        Objects.requireNonNull(resource, "resource cannot be null");

        BlockingQueue<IdleEntry<T>> conns = idleBuffer();
        if (conns == null) {
            close(resource);
            return;
        }

        IdleEntry<T> entry = new IdleEntry<>(resource, clock.instant());
        if (!conns.offer(entry)) {
            overflowCloses.incrementAndGet();
            close(resource);
            return;
        }

        // A shutdown may have drained the buffer between the read and the offer.
        // Whoever takes the entry out first closes it.
        if (idleBuffer() == null && conns.remove(entry)) {
            close(resource);
        }
    }

    /**
     * Closes a resource without returning it to the pool, e.g. when it is known to be broken.
     * Every resource the pool discards passes through here.
     *
     * @param resource the resource to close
     * @throws NullPointerException if resource is null
     * @throws Exception whatever the closer throws
     */
    public void close(T resource) throws Exception {
        Objects.requireNonNull(resource, "resource cannot be null");
        if (closer != null) {
            closer.close(resource);
        }
    }

    /**
     * Shuts the pool down and closes every idle resource.
     *
     * <p>After this call {@link #acquire()} fails with {@link PoolClosedException} and
     * {@link #release(Object)} closes the resources it is given. Calling it again has no effect.
     *
     * @throws ResourcePoolException if the closer failed for one or more idle resources;
     *                               the remaining resources are still closed
     */
    public void shutdown() {
        BlockingQueue<IdleEntry<T>> conns;
        synchronized (lock) {
            conns = idle;
            idle = null;
            factory = null;
        }
        if (conns == null) {
            return;
        }

        List<IdleEntry<T>> drained = new ArrayList<>(conns.size());
        conns.drainTo(drained);

        ResourcePoolException failure = null;
        for (IdleEntry<T> entry : drained) {
            try {
                close(entry.getResource());
            } catch (Exception e) {
                if (failure == null) {
                    failure = new ResourcePoolException("Failed to close idle resource during shutdown", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        logger.debug("Pool shut down, closed {} idle resources", drained.size());
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Same as {@link #shutdown()}.
     */
    @Override
    public void close() {
        shutdown();
    }

    private BlockingQueue<IdleEntry<T>> idleBuffer() {
        synchronized (lock) {
            return idle;
        }
    }

    public boolean isClosed() {
        return idleBuffer() == null;
    }

    /**
     * Gets the number of idle resources in the pool.
     */
    public int size() {
        BlockingQueue<IdleEntry<T>> conns = idleBuffer();
        return conns != null ? conns.size() : 0;
    }

    /**
     * Gets the maximum number of idle resources the pool keeps.
     */
    public int getMaxCapacity() {
        return maxCapacity;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public PoolStats getStats() {
        return new PoolStats(
                hits.get(),
                misses.get(),
                size(),
                staleEvictions.get(),
                evictionFailures.get(),
                overflowCloses.get());
    }

    /**
     * Logs the current statistics at INFO level.
     */
    public void logStats() {
        PoolStats stats = getStats();
        logger.info("Idle resources: {}", stats.getIdle());
        logger.info("Hits: {}\tMisses: {}\tStale evictions: {}\tOverflow closes: {}",
                stats.getHits(), stats.getMisses(), stats.getStaleEvictions(), stats.getOverflowCloses());
        if (stats.getEvictionFailures() > 0) {
            logger.warn("Stale evictions with closer failures: {}", stats.getEvictionFailures());
        }
    }
}
