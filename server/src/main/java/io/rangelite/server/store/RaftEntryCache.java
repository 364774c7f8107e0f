// file: server/src/main/java/io/rangelite/server/store/RaftEntryCache.java
package io.rangelite.server.store;

import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Store-wide cache of recently appended raft log entries, per range.
 */
public final class RaftEntryCache {
    private final Map<Long, NavigableMap<Long, byte[]>> byRange = new ConcurrentHashMap<>();

    public void add(long rangeId, long index, byte[] entry) {
        byRange.computeIfAbsent(rangeId, id -> new ConcurrentSkipListMap<>()).put(index, entry);
    }

    public byte[] get(long rangeId, long index) {
        NavigableMap<Long, byte[]> entries = byRange.get(rangeId);
        return entries == null ? null : entries.get(index);
    }

    /** Drop every entry of the range with an index up to and including {@code index}. */
    public void clearTo(long rangeId, long index) {
        NavigableMap<Long, byte[]> entries = byRange.get(rangeId);
        if (entries != null) {
            entries.headMap(index, true).clear();
        }
    }

    public void dropRange(long rangeId) {
        byRange.remove(rangeId);
    }

    public int size(long rangeId) {
        NavigableMap<Long, byte[]> entries = byRange.get(rangeId);
        return entries == null ? 0 : entries.size();
    }
}
