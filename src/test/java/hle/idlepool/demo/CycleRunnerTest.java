package hle.idlepool.demo;

import hle.idlepool.pool.PoolStats;
import hle.idlepool.pool.ResourcePool;
import hle.idlepool.pool.ResourcePoolConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the CycleRunner load driver.
 */
class CycleRunnerTest {

    private ResourcePool<SimulatedConnection> pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private ResourcePool<SimulatedConnection> createPool(SimulatedConnectionFactory connections, int maxCapacity) {
        return new ResourcePool<>(ResourcePoolConfig.<SimulatedConnection>builder()
                .pooledObjectFactory(connections)
                .maxCapacity(maxCapacity)
                .build());
    }

    @Test
    @Timeout(30)
    void shouldReuseConnectionsInGetPutMode() throws Exception {
        SimulatedConnectionFactory connections = new SimulatedConnectionFactory(0);
        pool = createPool(connections, 4);

        RunResult result = new CycleRunner<>(pool).run(4, 250, CycleRunner.Mode.GET_PUT, connection -> connection.send(0));

        PoolStats stats = result.getPoolStats();
        assertEquals(0, result.getFailures());
        assertEquals(1000, result.getCycles());
        assertEquals(1000, stats.getHits() + stats.getMisses());
        assertEquals(connections.getCreatedCount(), stats.getMisses());
        assertTrue(stats.getHits() > 0);
        assertTrue(stats.getIdle() <= 4);
        assertEquals((double) stats.getHits() / 1000, result.getHitRatio(), 1e-9);
    }

    @Test
    @Timeout(30)
    void shouldCreateAndCloseEveryConnectionInGetCloseMode() throws Exception {
        SimulatedConnectionFactory connections = new SimulatedConnectionFactory(0);
        pool = createPool(connections, 4);

        RunResult result = new CycleRunner<>(pool).run(2, 50, CycleRunner.Mode.GET_CLOSE, connection -> connection.send(0));

        assertEquals(0, result.getFailures());
        assertEquals(100, result.getPoolStats().getMisses());
        assertEquals(0, result.getPoolStats().getHits());
        assertEquals(0.0, result.getHitRatio());
        assertEquals(100, connections.getCreatedCount());
        assertEquals(100, connections.getClosedCount());
    }

    @Test
    @Timeout(30)
    void shouldCountFailedTasksAndDiscardTheirConnections() throws Exception {
        SimulatedConnectionFactory connections = new SimulatedConnectionFactory(0);
        pool = createPool(connections, 2);

        RunResult result = new CycleRunner<>(pool).run(1, 10, CycleRunner.Mode.GET_PUT, connection -> {
            throw new IllegalStateException("remote error");
        });

        assertEquals(10, result.getFailures());
        assertEquals(10, connections.getClosedCount());
        assertEquals(0, pool.size());
    }

    @Test
    @Timeout(30)
    void shouldCountAcquireFailuresAfterShutdown() throws Exception {
        SimulatedConnectionFactory connections = new SimulatedConnectionFactory(0);
        pool = createPool(connections, 2);
        pool.shutdown();

        RunResult result = new CycleRunner<>(pool).run(2, 5, CycleRunner.Mode.GET_PUT, connection -> connection.send(0));

        assertEquals(10, result.getFailures());
        assertEquals(0, connections.getCreatedCount());
    }

    @Test
    void shouldRejectCycleCountThatOverflows() {
        SimulatedConnectionFactory connections = new SimulatedConnectionFactory(0);
        pool = createPool(connections, 2);
        CycleRunner<SimulatedConnection> runner = new CycleRunner<>(pool);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> runner.run(2, 1 << 30, CycleRunner.Mode.GET_PUT, connection -> { }));

        assertTrue(e.getMessage().contains("too large"));
        assertEquals(0, connections.getCreatedCount());
    }

    @Test
    void shouldRejectNonPositiveThreadsOrCycles() {
        pool = createPool(new SimulatedConnectionFactory(0), 2);
        CycleRunner<SimulatedConnection> runner = new CycleRunner<>(pool);

        assertThrows(IllegalArgumentException.class,
                () -> runner.run(0, 10, CycleRunner.Mode.GET_PUT, connection -> { }));
        assertThrows(IllegalArgumentException.class,
                () -> runner.run(2, -1, CycleRunner.Mode.GET_PUT, connection -> { }));
    }
}
