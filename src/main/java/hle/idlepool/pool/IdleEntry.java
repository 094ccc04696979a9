package hle.idlepool.pool;

import java.time.Duration;
import java.time.Instant;

/**
 * A resource sitting in the idle buffer, stamped with the time it was returned.
 *
 * @param <T> the resource type
 */
final class IdleEntry<T> {
    private final T resource;
    private final Instant enteredIdleAt;

    IdleEntry(T resource, Instant enteredIdleAt) {
        this.resource = resource;
        this.enteredIdleAt = enteredIdleAt;
    }

    T getResource() {
        return resource;
    }

    Instant getEnteredIdleAt() {
        return enteredIdleAt;
    }

    Duration idleFor(Instant now) {
        return Duration.between(enteredIdleAt, now);
    }

    /**
     * An entry is stale when it has been idle strictly longer than the timeout.
     */
    boolean isStale(Duration idleTimeout, Instant now) {
        return idleFor(now).compareTo(idleTimeout) > 0;
    }
}
