package hle.idlepool.pool;

/**
 * Creates the resources handed out by a {@link ResourcePool}.
 * The pool calls this on a miss, on the acquiring thread.
 *
 * <p>Implementations must be safe to call from several threads at once.
 *
 * @param <T> the type of resource created by this factory
 */
@FunctionalInterface
public interface ResourceFactory<T> {

    /**
     * Creates a new resource instance.
     *
     * @return a new resource, never null
     * @throws Exception if the resource cannot be created; the pool rethrows it unchanged
     */
    T create() throws Exception;
}
