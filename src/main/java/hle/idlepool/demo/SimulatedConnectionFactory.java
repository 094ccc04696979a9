package hle.idlepool.demo;

import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens {@link SimulatedConnection}s, optionally sleeping to mimic a dial.
 */
public final class SimulatedConnectionFactory extends BasePooledObjectFactory<SimulatedConnection> {
    private final AtomicInteger idGenerator = new AtomicInteger();
    private final AtomicInteger closedCount = new AtomicInteger();
    private final int dialMs;

    public SimulatedConnectionFactory(int dialMs) {
        this.dialMs = dialMs;
    }

    @Override
    public SimulatedConnection create() throws InterruptedException {
        if (dialMs > 0) {
            Thread.sleep(dialMs);
        }
        return new SimulatedConnection(idGenerator.incrementAndGet());
    }

    @Override
    public PooledObject<SimulatedConnection> wrap(SimulatedConnection obj) {
        return new DefaultPooledObject<>(obj);
    }

    @Override
    public void destroyObject(PooledObject<SimulatedConnection> p) {
        if (p.getObject().close()) {
            closedCount.incrementAndGet();
        }
    }

    public int getCreatedCount() {
        return idGenerator.get();
    }

    public int getClosedCount() {
        return closedCount.get();
    }
}
