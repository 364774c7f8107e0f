// file: server/src/main/java/io/rangelite/server/checksum/RangeSnapshotData.java
package io.rangelite.server.checksum;

import java.util.List;

/** The user data a checksum was computed over, kept for diagnosing mismatches. */
public record RangeSnapshotData(long rangeId, List<KeyValue> entries) {

    public RangeSnapshotData {
        entries = List.copyOf(entries);
    }

    public record KeyValue(String key, byte[] value) {
    }
}
