package hle.idlepool.pool;

/**
 * Thrown by {@link ResourcePool#acquire()} once the pool has been shut down.
 */
public class PoolClosedException extends ResourcePoolException {

    public PoolClosedException() {
        super("Pool is closed");
    }
}
