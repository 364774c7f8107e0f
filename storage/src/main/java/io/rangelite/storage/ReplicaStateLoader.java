// file: storage/src/main/java/io/rangelite/storage/ReplicaStateLoader.java
package io.rangelite.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rangelite.core.Lease;
import io.rangelite.core.MvccStats;
import io.rangelite.core.RangeDescriptor;
import io.rangelite.core.Timestamp;
import io.rangelite.core.TruncatedState;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes a range's persisted replica state.
 * <p>
 * Each piece lives under its own key so that a command touching only the
 * applied indexes and stats rewrites only that key. Values are JSON.
 */
public final class ReplicaStateLoader {

    /** Applied indexes and stats travel together; they change with every command. */
    public record AppliedState(long raftAppliedIndex, long leaseAppliedIndex, MvccStats stats) {
    }

    private final ObjectMapper mapper;

    public ReplicaStateLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ReplicaStateLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Ids of every range with a persisted descriptor, ascending. */
    public List<Long> loadRangeIds(StorageEngine engine) {
        List<Long> ids = new ArrayList<>();
        try (EngineSnapshot snap = engine.newSnapshot()) {
            for (String key : snap.scanPrefix("r/").keySet()) {
                long id = KeyLayout.rangeIdOf(key, KeyLayout.DESCRIPTOR);
                if (id > 0) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }

    /**
     * Load the state of a range, or null when the engine holds no descriptor for it.
     */
    public PersistedReplicaState load(StorageEngine engine, long rangeId) {
        RangeDescriptor desc = read(engine, rangeId, KeyLayout.DESCRIPTOR, RangeDescriptor.class);
        if (desc == null) {
            return null;
        }
        AppliedState applied = read(engine, rangeId, KeyLayout.APPLIED_STATE, AppliedState.class);
        if (applied == null) {
            applied = new AppliedState(0, 0, MvccStats.EMPTY);
        }
        Lease lease = read(engine, rangeId, KeyLayout.LEASE, Lease.class);
        TruncatedState truncated = read(engine, rangeId, KeyLayout.TRUNCATED_STATE, TruncatedState.class);
        Timestamp gc = read(engine, rangeId, KeyLayout.GC_THRESHOLD, Timestamp.class);
        Timestamp txnGc = read(engine, rangeId, KeyLayout.TXN_SPAN_GC_THRESHOLD, Timestamp.class);
        Boolean frozen = read(engine, rangeId, KeyLayout.FROZEN, Boolean.class);
        return new PersistedReplicaState(
                applied.raftAppliedIndex(),
                applied.leaseAppliedIndex(),
                applied.stats(),
                desc,
                lease == null ? Lease.none() : lease,
                truncated == null ? new TruncatedState(0, 0) : truncated,
                gc == null ? Timestamp.ZERO : gc,
                txnGc == null ? Timestamp.ZERO : txnGc,
                frozen != null && frozen
        );
    }

    /** Stage every piece of the state into the batch. */
    public void stageAll(WriteBatch batch, PersistedReplicaState s) {
        long id = s.descriptor().rangeId();
        stageAppliedState(batch, id, s.raftAppliedIndex(), s.leaseAppliedIndex(), s.stats());
        stageDescriptor(batch, s.descriptor());
        write(batch, id, KeyLayout.LEASE, s.lease());
        write(batch, id, KeyLayout.TRUNCATED_STATE, s.truncatedState());
        write(batch, id, KeyLayout.GC_THRESHOLD, s.gcThreshold());
        write(batch, id, KeyLayout.TXN_SPAN_GC_THRESHOLD, s.txnSpanGcThreshold());
        write(batch, id, KeyLayout.FROZEN, s.frozen());
    }

    public void stageAppliedState(WriteBatch batch, long rangeId, long raftIndex, long leaseIndex, MvccStats stats) {
        write(batch, rangeId, KeyLayout.APPLIED_STATE, new AppliedState(raftIndex, leaseIndex, stats));
    }

    public void stageDescriptor(WriteBatch batch, RangeDescriptor desc) {
        write(batch, desc.rangeId(), KeyLayout.DESCRIPTOR, desc);
    }

    public void stageLease(WriteBatch batch, long rangeId, Lease lease) {
        write(batch, rangeId, KeyLayout.LEASE, lease);
    }

    public void stageTruncatedState(WriteBatch batch, long rangeId, TruncatedState ts) {
        write(batch, rangeId, KeyLayout.TRUNCATED_STATE, ts);
    }

    public void stageGcThreshold(WriteBatch batch, long rangeId, Timestamp ts) {
        write(batch, rangeId, KeyLayout.GC_THRESHOLD, ts);
    }

    public void stageTxnSpanGcThreshold(WriteBatch batch, long rangeId, Timestamp ts) {
        write(batch, rangeId, KeyLayout.TXN_SPAN_GC_THRESHOLD, ts);
    }

    public void stageFrozen(WriteBatch batch, long rangeId, boolean frozen) {
        write(batch, rangeId, KeyLayout.FROZEN, frozen);
    }

    /** Delete every state key of the range. */
    public void stageClear(WriteBatch batch, long rangeId) {
        for (String suffix : new String[]{
                KeyLayout.APPLIED_STATE, KeyLayout.DESCRIPTOR, KeyLayout.LEASE, KeyLayout.TRUNCATED_STATE,
                KeyLayout.GC_THRESHOLD, KeyLayout.TXN_SPAN_GC_THRESHOLD, KeyLayout.FROZEN}) {
            batch.delete(KeyLayout.rangeStateKey(rangeId, suffix));
        }
    }

    private void write(WriteBatch batch, long rangeId, String suffix, Object value) {
        try {
            batch.put(KeyLayout.rangeStateKey(rangeId, suffix), mapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + suffix + " of range " + rangeId, e);
        }
    }

    private <T> T read(StorageEngine engine, long rangeId, String suffix, Class<T> type) {
        byte[] raw = engine.get(KeyLayout.rangeStateKey(rangeId, suffix));
        if (raw == null) {
            return null;
        }
        try {
            return mapper.readValue(raw, type);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot decode " + suffix + " of range " + rangeId, e);
        }
    }
}
