package hle.idlepool.pool;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IdleEntryTest {

    private static final Instant RETURNED_AT = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void shouldMeasureIdleTime() {
        IdleEntry<String> entry = new IdleEntry<>("conn", RETURNED_AT);

        assertEquals(Duration.ofMillis(250), entry.idleFor(RETURNED_AT.plusMillis(250)));
        assertEquals("conn", entry.getResource());
    }

    @Test
    void shouldBeStaleOnlyPastTheTimeout() {
        IdleEntry<String> entry = new IdleEntry<>("conn", RETURNED_AT);
        Duration timeout = Duration.ofSeconds(10);

        assertFalse(entry.isStale(timeout, RETURNED_AT.plusSeconds(9)));
        assertFalse(entry.isStale(timeout, RETURNED_AT.plusSeconds(10)));
        assertTrue(entry.isStale(timeout, RETURNED_AT.plusSeconds(10).plusNanos(1)));
    }
}
