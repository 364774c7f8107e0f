// file: storage/src/main/java/io/rangelite/storage/WriteBatch.java
package io.rangelite.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered set of puts and deletes committed atomically by {@link StorageEngine#commit}.
 * Later operations on the same key win.
 */
public final class WriteBatch {

    /** A put, or a delete when {@code value} is null. */
    record Op(String key, byte[] value) {
        boolean isDelete() {
            return value == null;
        }
    }

    private final List<Op> ops = new ArrayList<>();
    private boolean committed;

    public WriteBatch put(String key, byte[] value) {
        checkOpen();
        ops.add(new Op(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value").clone()));
        return this;
    }

    public WriteBatch delete(String key) {
        checkOpen();
        ops.add(new Op(Objects.requireNonNull(key, "key"), null));
        return this;
    }

    public int size() {
        return ops.size();
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    List<Op> ops() {
        return ops;
    }

    void markCommitted() {
        checkOpen();
        committed = true;
    }

    private void checkOpen() {
        if (committed) {
            throw new IllegalStateException("batch already committed");
        }
    }
}
