// file: storage/src/main/java/io/rangelite/storage/EngineSnapshot.java
package io.rangelite.storage;

import java.util.SortedMap;

/** Point-in-time, read-only view of a {@link StorageEngine}. */
public interface EngineSnapshot extends AutoCloseable {

    byte[] get(String key);

    /** All entries whose key starts with {@code prefix}, in key order. */
    SortedMap<String, byte[]> scanPrefix(String prefix);

    @Override
    void close();
}
