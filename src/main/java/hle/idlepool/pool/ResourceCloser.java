package hle.idlepool.pool;

/**
 * Releases the underlying state of a resource that the pool discards.
 *
 * <p>Called from whichever thread triggers the discard. Implementations must not
 * call back into the pool.
 *
 * @param <T> the type of resource closed by this closer
 */
@FunctionalInterface
public interface ResourceCloser<T> {

    /**
     * Closes the given resource.
     *
     * @param resource the resource to close, never null
     * @throws Exception if closing fails
     */
    void close(T resource) throws Exception;
}
