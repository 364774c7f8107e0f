// file: server/src/main/java/io/rangelite/server/replica/TimestampCache.java
package io.rangelite.server.replica;

import io.rangelite.core.Timestamp;

import java.util.HashMap;
import java.util.Map;

/**
 * Latest read timestamp per key, served by the current lease holder so that
 * no write lands below a read it already served.
 * <p>
 * Keys not in the cache report the low-water mark.
 */
public final class TimestampCache {
    private final Map<String, Timestamp> reads = new HashMap<>();
    private Timestamp lowWater = Timestamp.ZERO;

    public synchronized void add(String key, Timestamp ts) {
        if (ts.less(lowWater)) {
            return;
        }
        reads.merge(key, ts, Timestamp::forward);
    }

    public synchronized Timestamp get(String key) {
        Timestamp ts = reads.get(key);
        return ts == null ? lowWater : ts.forward(lowWater);
    }

    /** Raise the low-water mark; it never moves back. */
    public synchronized void setLowWater(Timestamp ts) {
        lowWater = lowWater.forward(ts);
        reads.values().removeIf(t -> t.less(lowWater));
    }

    /** Forget every entry and start over with {@code now} as the low-water mark. */
    public synchronized void clear(Timestamp now) {
        reads.clear();
        lowWater = now;
    }

    public synchronized Timestamp lowWater() {
        return lowWater;
    }

    public synchronized int size() {
        return reads.size();
    }
}
