package hle.idlepool.pool;

import org.apache.commons.pool2.PooledObjectFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link ResourcePool}.
 * Uses the builder pattern; instances are immutable once built.
 *
 * <p>Only the factory is required. Example:
 * <pre>{@code
 * ResourcePoolConfig<Socket> config = ResourcePoolConfig.<Socket>builder()
 *     .factory(() -> new Socket("db.internal", 5432))
 *     .closer(Socket::close)
 *     .maxCapacity(20)
 *     .idleTimeout(Duration.ofSeconds(15))
 *     .build();
 * }</pre>
 *
 * @param <T> the type of resource the configured pool manages
 */
public final class ResourcePoolConfig<T> {

    /**
     * Capacity used when the configured value is zero or negative.
     */
    public static final int DEFAULT_MAX_CAPACITY = 10;

    private final int maxCapacity;
    private final ResourceFactory<T> factory;
    private final ResourceCloser<T> closer;
    private final Duration idleTimeout;
    private final int initialSize;
    private final Clock clock;

    private ResourcePoolConfig(Builder<T> builder) {
        this.maxCapacity = builder.maxCapacity;
        this.factory = builder.factory;
        this.closer = builder.closer;
        this.idleTimeout = builder.idleTimeout;
        this.initialSize = builder.initialSize;
        this.clock = builder.clock;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Gets the configured capacity as given, before the pool normalizes it.
     */
    public int getMaxCapacity() {
        return maxCapacity;
    }

    /**
     * Gets the capacity a pool built from this configuration uses.
     */
    public int getEffectiveMaxCapacity() {
        return normalizeCapacity(maxCapacity);
    }

    public ResourceFactory<T> getFactory() {
        return factory;
    }

    /**
     * Gets the closer, or null when discarded resources need no cleanup.
     */
    public ResourceCloser<T> getCloser() {
        return closer;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    /**
     * Whether idle resources are checked for staleness on acquire.
     */
    public boolean isIdleTimeoutEnabled() {
        return !idleTimeout.isZero();
    }

    public int getInitialSize() {
        return initialSize;
    }

    public Clock getClock() {
        return clock;
    }

    private static int normalizeCapacity(int maxCapacity) {
        return maxCapacity > 0 ? maxCapacity : DEFAULT_MAX_CAPACITY;
    }

    @Override
    public String toString() {
        return String.format("ResourcePoolConfig[maxCapacity=%d, idleTimeout=%s, initialSize=%d, closer=%s]",
                getEffectiveMaxCapacity(), idleTimeout, initialSize, closer != null ? "set" : "none");
    }

    public static final class Builder<T> {
        private int maxCapacity = DEFAULT_MAX_CAPACITY;
        private ResourceFactory<T> factory;
        private ResourceCloser<T> closer;
        private Duration idleTimeout = Duration.ZERO;
        private int initialSize = 0;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the maximum number of idle resources kept for reuse.
         * Zero or negative values fall back to {@value ResourcePoolConfig#DEFAULT_MAX_CAPACITY}.
         * Default: 10
         */
        public Builder<T> maxCapacity(int maxCapacity) {
            this.maxCapacity = maxCapacity;
            return this;
        }

        /**
         * Sets the factory used when no idle resource is available. Required.
         */
        public Builder<T> factory(ResourceFactory<T> factory) {
            this.factory = Objects.requireNonNull(factory, "factory cannot be null");
            return this;
        }

        /**
         * Sets the closer invoked for every resource the pool discards.
         * Null means discarded resources are simply dropped.
         * Default: null
         */
        public Builder<T> closer(ResourceCloser<T> closer) {
            this.closer = closer;
            return this;
        }

        /**
         * Uses a Commons Pool 2 factory both to create and to destroy resources.
         */
        public Builder<T> pooledObjectFactory(PooledObjectFactory<T> pooledObjectFactory) {
            PooledObjectFactoryAdapter<T> adapter = new PooledObjectFactoryAdapter<>(pooledObjectFactory);
            this.factory = adapter;
            this.closer = adapter;
            return this;
        }

        /**
         * Sets how long a resource may sit idle before acquire discards it instead of reusing it.
         * Null, zero or negative disables the check and is stored as {@link Duration#ZERO}.
         * Default: disabled
         */
        public Builder<T> idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout == null || idleTimeout.isNegative() ? Duration.ZERO : idleTimeout;
            return this;
        }

        /**
         * Sets how many resources are created and parked in the pool at construction.
         * Default: 0
         */
        public Builder<T> initialSize(int initialSize) {
            if (initialSize < 0) {
                throw new IllegalArgumentException("initialSize must be >= 0");
            }
            this.initialSize = initialSize;
            return this;
        }

        /**
         * Sets the clock used to stamp and age idle resources.
         * Default: system UTC clock
         */
        public Builder<T> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public ResourcePoolConfig<T> build() {
            if (factory == null) {
                throw new IllegalStateException("factory must be set");
            }
            if (initialSize > normalizeCapacity(maxCapacity)) {
                throw new IllegalArgumentException("initialSize cannot be greater than maxCapacity");
            }
            return new ResourcePoolConfig<>(this);
        }
    }
}
