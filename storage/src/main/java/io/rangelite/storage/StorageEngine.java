// file: storage/src/main/java/io/rangelite/storage/StorageEngine.java
package io.rangelite.storage;

/**
 * Ordered key-value engine with atomic batches and point-in-time snapshots.
 * <p>
 * A committed batch is durable once commit() returns.
 */
public interface StorageEngine extends AutoCloseable {

    /** Current value of the key, or null if absent. */
    byte[] get(String key);

    WriteBatch newBatch();

    void commit(WriteBatch batch);

    /** Read-only view of the engine as of this call; later commits are not visible in it. */
    EngineSnapshot newSnapshot();
}
