// file: storage/src/main/java/io/rangelite/storage/Wal.java
package io.rangelite.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record before returning, so that if the process
 *    crashes after append() returns, recovery will see the record.
 * <p>
 * One record holds one committed engine batch, so a batch is either replayed
 * whole or not at all.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /**
     * Rotate log segment if configured thresholds are hit.
     * Called by the engine after each commit.
     */
    void rotateIfNeeded();

    /**
     * Open a sequential reader over the WAL, from the earliest segment,
     * stopping at the first corrupt header, truncated payload or end of log.
     */
    WalReader openReader();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null at EOF
         *         or when corruption/truncation is detected at the tail.
         */
        byte[] next();
    }
}
