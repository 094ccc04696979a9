package hle.idlepool.pool;

import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.PooledObjectFactory;
import org.apache.commons.pool2.impl.DefaultPooledObject;

import java.util.Objects;

/**
 * Adapts an Apache Commons Pool 2 {@link PooledObjectFactory} to the factory and
 * closer a {@link ResourcePool} expects, so existing Commons Pool factories can be reused.
 *
 * <p>Only {@code makeObject} and {@code destroyObject} are called. Validation,
 * activation and passivation hooks are not part of this pool's lifecycle.
 *
 * @param <T> the type of resource produced by the wrapped factory
 */
public final class PooledObjectFactoryAdapter<T> implements ResourceFactory<T>, ResourceCloser<T> {

    private final PooledObjectFactory<T> delegate;

    public PooledObjectFactoryAdapter(PooledObjectFactory<T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
    }

    @Override
    public T create() throws Exception {
        PooledObject<T> pooledObject = delegate.makeObject();
        return pooledObject.getObject();
    }

    @Override
    public void close(T resource) throws Exception {
        delegate.destroyObject(new DefaultPooledObject<>(resource));
    }
}
