package hle.idlepool.demo;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stand-in for a network connection: it has an id, can be used until it is closed,
 * and costs a configurable amount of time to open.
 */
public final class SimulatedConnection {
    private final int id;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    SimulatedConnection(int id) {
        this.id = id;
    }

    public void send(int sleepMs) throws InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("Connection " + id + " is closed");
        }
        if (sleepMs > 0) {
            Thread.sleep(sleepMs);
        }
    }

    /**
     * Closes the connection. Returns false if it was already closed.
     */
    public boolean close() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int getId() {
        return id;
    }

    @Override
    public String toString() {
        return "SimulatedConnection[" + id + (closed.get() ? ", closed]" : "]");
    }
}
