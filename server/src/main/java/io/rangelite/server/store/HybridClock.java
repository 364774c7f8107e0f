// file: server/src/main/java/io/rangelite/server/store/HybridClock.java
package io.rangelite.server.store;

import io.rangelite.core.Timestamp;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Hybrid-logical clock over a physical {@link Clock}.
 * Successive calls to {@link #now()} never go backwards, even if the physical clock does.
 */
public final class HybridClock {
    private final Clock physical;
    private final Duration maxOffset;
    private Timestamp last = Timestamp.ZERO;

    public HybridClock(Clock physical, Duration maxOffset) {
        this.physical = Objects.requireNonNull(physical, "physical");
        this.maxOffset = Objects.requireNonNull(maxOffset, "maxOffset");
    }

    public synchronized Timestamp now() {
        long wall = physicalNanos();
        if (wall > last.wallTime()) {
            last = new Timestamp(wall, 0);
        } else {
            last = last.next();
        }
        return last;
    }

    public Instant physicalNow() {
        return physical.instant();
    }

    public Duration maxOffset() {
        return maxOffset;
    }

    private long physicalNanos() {
        Instant i = physical.instant();
        return i.getEpochSecond() * 1_000_000_000L + i.getNano();
    }
}
