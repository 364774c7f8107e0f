// file: server/src/main/java/io/rangelite/server/replica/ReplicaState.java
package io.rangelite.server.replica;

import io.rangelite.core.Lease;
import io.rangelite.core.MvccStats;
import io.rangelite.core.RangeDescriptor;
import io.rangelite.core.Timestamp;
import io.rangelite.core.TruncatedState;
import io.rangelite.storage.PersistedReplicaState;

/**
 * In-memory state of a replica. Every field is guarded by the replica lock.
 * All fields but raftLogSize are replicated and mirror what is persisted.
 */
public final class ReplicaState {
    long raftAppliedIndex;
    long leaseAppliedIndex;
    MvccStats stats;
    RangeDescriptor descriptor;
    Lease lease;
    TruncatedState truncatedState;
    Timestamp gcThreshold;
    Timestamp txnSpanGcThreshold;
    boolean frozen;
    long raftLogSize;

    ReplicaState(PersistedReplicaState s) {
        this.raftAppliedIndex = s.raftAppliedIndex();
        this.leaseAppliedIndex = s.leaseAppliedIndex();
        this.stats = s.stats();
        this.descriptor = s.descriptor();
        this.lease = s.lease();
        this.truncatedState = s.truncatedState();
        this.gcThreshold = s.gcThreshold();
        this.txnSpanGcThreshold = s.txnSpanGcThreshold();
        this.frozen = s.frozen();
    }

    public PersistedReplicaState toPersisted() {
        return new PersistedReplicaState(
                raftAppliedIndex, leaseAppliedIndex, stats, descriptor, lease,
                truncatedState, gcThreshold, txnSpanGcThreshold, frozen);
    }

    public long raftAppliedIndex() { return raftAppliedIndex; }
    public long leaseAppliedIndex() { return leaseAppliedIndex; }
    public MvccStats stats() { return stats; }
    public RangeDescriptor descriptor() { return descriptor; }
    public Lease lease() { return lease; }
    public TruncatedState truncatedState() { return truncatedState; }
    public Timestamp gcThreshold() { return gcThreshold; }
    public Timestamp txnSpanGcThreshold() { return txnSpanGcThreshold; }
    public boolean frozen() { return frozen; }
    public long raftLogSize() { return raftLogSize; }

    public void setAppliedIndexes(long raftIndex, long leaseIndex) {
        if (raftIndex != 0) raftAppliedIndex = raftIndex;
        if (leaseIndex != 0) leaseAppliedIndex = leaseIndex;
    }

    public void setStats(MvccStats stats) { this.stats = stats; }
    public void setLease(Lease lease) { this.lease = lease; }
    public void setTruncatedState(TruncatedState ts) { this.truncatedState = ts; }
    public void setGcThreshold(Timestamp ts) { this.gcThreshold = ts; }
    public void setTxnSpanGcThreshold(Timestamp ts) { this.txnSpanGcThreshold = ts; }
    public void setFrozen(boolean frozen) { this.frozen = frozen; }
    public void setRaftLogSize(long size) { this.raftLogSize = size; }
}
