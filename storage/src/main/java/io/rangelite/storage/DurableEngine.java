// file: storage/src/main/java/io/rangelite/storage/DurableEngine.java
package io.rangelite.storage;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Logger;

/**
 * WAL-backed storage engine.
 * <p>
 * Responsibilities:
 *  - Maintain an ordered in-memory map: key -> value bytes.
 *  - On commit:
 *      1) Serialize the whole batch into one WAL record.
 *      2) Append+fsync to WAL.
 *      3) Apply the batch to memory.
 *      4) Rotate WAL segment if needed.
 *  - On startup: replay every WAL record in order.
 * <p>
 * Snapshots copy the map under the commit lock, so a snapshot never observes
 * half of a batch.
 */
public class DurableEngine implements StorageEngine {
    private static final Logger log = Logger.getLogger(DurableEngine.class.getName());

    private final ConcurrentSkipListMap<String, byte[]> mem = new ConcurrentSkipListMap<>();
    private final Wal wal;

    public DurableEngine(Wal wal) {
        this.wal = wal;
        recover();
    }

    /** Engine backed by an {@link InMemoryWal}. */
    public static DurableEngine inMemory() {
        return new DurableEngine(new InMemoryWal());
    }

    @Override
    public byte[] get(String key) {
        byte[] v = mem.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public WriteBatch newBatch() {
        return new WriteBatch();
    }

    @Override
    public synchronized void commit(WriteBatch batch) {
        batch.markCommitted();
        if (batch.isEmpty()) {
            return;
        }
        wal.append(RecordCodec.encode(batch.ops()));
        applyToMemory(batch);
        wal.rotateIfNeeded();
    }

    @Override
    public synchronized EngineSnapshot newSnapshot() {
        return new Snapshot(new TreeMap<>(mem));
    }

    @Override
    public void close() throws Exception {
        wal.close();
    }

    private void recover() {
        int batches = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                WriteBatch replayed = new WriteBatch();
                replayed.ops().addAll(RecordCodec.decode(payload));
                applyToMemory(replayed);
                batches++;
            }
        } catch (Exception e) {
            throw new RuntimeException("Recovery Failed", e);
        }
        if (batches > 0) {
            int replayed = batches;
            log.fine(() -> "replayed " + replayed + " batches from WAL, " + mem.size() + " keys");
        }
    }

    private void applyToMemory(WriteBatch batch) {
        for (WriteBatch.Op op : batch.ops()) {
            if (op.isDelete()) {
                mem.remove(op.key());
            } else {
                mem.put(op.key(), op.value());
            }
        }
    }

    private static final class Snapshot implements EngineSnapshot {
        private final NavigableMap<String, byte[]> data;

        Snapshot(NavigableMap<String, byte[]> data) {
            this.data = data;
        }

        @Override
        public byte[] get(String key) {
            byte[] v = data.get(key);
            return v == null ? null : v.clone();
        }

        @Override
        public SortedMap<String, byte[]> scanPrefix(String prefix) {
            return Collections.unmodifiableSortedMap(data.subMap(prefix, true, prefix + Character.MAX_VALUE, false));
        }

        @Override
        public void close() {
        }
    }
}
