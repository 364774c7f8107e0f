// file: storage/src/main/java/io/rangelite/storage/InMemoryWal.java
package io.rangelite.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * WAL kept in memory, for engines whose durability ends with the process.
 * Records are validated on read exactly as FileWal validates them.
 */
public final class InMemoryWal implements Wal {
    private final List<byte[]> records = new ArrayList<>();

    @Override
    public synchronized void append(byte[] serializedRecord) {
        records.add(serializedRecord.clone());
    }

    @Override
    public void rotateIfNeeded() {
    }

    @Override
    public synchronized WalReader openReader() {
        List<byte[]> copy = List.copyOf(records);
        return new WalReader() {
            private int i = 0;

            @Override
            public byte[] next() {
                if (i >= copy.size()) return null;
                return RecordCodec.payloadOf(copy.get(i++));
            }

            @Override
            public void close() {
            }
        };
    }

    @Override
    public void close() {
    }
}
