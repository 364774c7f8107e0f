// file: core/src/main/java/io/rangelite/core/Timestamp.java
package io.rangelite.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Hybrid-logical timestamp: wall time in nanoseconds plus a logical counter
 * that orders events sharing the same wall time.
 * <p>
 * The zero timestamp means "unset" wherever a timestamp is optional
 * (GC thresholds, lease bounds of an empty lease).
 */
public record Timestamp(long wallTime, int logical) implements Comparable<Timestamp> {

    public static final Timestamp ZERO = new Timestamp(0L, 0);

    public Timestamp {
        if (wallTime < 0 || logical < 0) {
            throw new IllegalArgumentException("timestamp components must be >= 0");
        }
    }

    @JsonIgnore
    public boolean isZero() {
        return wallTime == 0L && logical == 0;
    }

    public boolean less(Timestamp other) {
        return compareTo(other) < 0;
    }

    /** The larger of this and {@code other}; watermarks only ever move forward. */
    public Timestamp forward(Timestamp other) {
        return less(other) ? other : this;
    }

    public Timestamp addWall(long nanos) {
        return new Timestamp(wallTime + nanos, logical);
    }

    public Timestamp next() {
        return new Timestamp(wallTime, logical + 1);
    }

    @Override
    public int compareTo(Timestamp o) {
        int cmp = Long.compare(wallTime, o.wallTime);
        return cmp != 0 ? cmp : Integer.compare(logical, o.logical);
    }

    @Override
    public String toString() {
        return wallTime + "," + logical;
    }
}
