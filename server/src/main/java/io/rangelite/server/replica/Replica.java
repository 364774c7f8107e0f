// file: server/src/main/java/io/rangelite/server/replica/Replica.java
package io.rangelite.server.replica;

import io.rangelite.core.KeyTokens;
import io.rangelite.core.Lease;
import io.rangelite.core.RangeDescriptor;
import io.rangelite.core.ReplicaDescriptor;
import io.rangelite.core.Timestamp;
import io.rangelite.core.TokenRange;
import io.rangelite.server.checksum.ChecksumCoordinator;
import io.rangelite.server.store.Store;
import io.rangelite.storage.KeyLayout;
import io.rangelite.storage.PersistedReplicaState;
import io.rangelite.storage.WriteBatch;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * One replica of a range hosted on the local store.
 * <p>
 * Locks:
 *  - mu guards {@link ReplicaState} and the checksum table. It is held only
 *    around reads and writes of that state, never across gossip, leadership
 *    transfer or task submission.
 *  - readOnlyCmdMu: read-only commands hold the read side; applying a command
 *    that blocks reads holds the write side.
 *  - raftMu guards the raft group against concurrent destruction.
 */
public final class Replica {
    private static final Logger log = Logger.getLogger(Replica.class.getName());

    private final Store store;
    private final long rangeId;
    private final ReentrantLock mu = new ReentrantLock();
    private final ReentrantReadWriteLock readOnlyCmdMu = new ReentrantReadWriteLock();
    private final ReentrantLock raftMu = new ReentrantLock();
    private final ReplicaState state;
    private final TimestampCache tsCache = new TimestampCache();
    private final ChecksumCoordinator checksums;
    private final RaftGroup raftGroup;
    private boolean destroyed;

    public Replica(Store store, PersistedReplicaState initial, RaftGroup raftGroup) {
        this.store = Objects.requireNonNull(store, "store");
        this.state = new ReplicaState(Objects.requireNonNull(initial, "initial"));
        this.rangeId = initial.descriptor().rangeId();
        this.raftGroup = Objects.requireNonNull(raftGroup, "raftGroup");
        this.checksums = new ChecksumCoordinator(this);
    }

    public long rangeId() {
        return rangeId;
    }

    public Store store() {
        return store;
    }

    public void lock() {
        mu.lock();
    }

    public void unlock() {
        mu.unlock();
    }

    /** The replica state; the caller must hold the replica lock. */
    public ReplicaState stateLocked() {
        if (!mu.isHeldByCurrentThread()) {
            throw new IllegalStateException("replica lock not held");
        }
        return state;
    }

    public ReentrantReadWriteLock readOnlyCmdLock() {
        return readOnlyCmdMu;
    }

    public TimestampCache tsCache() {
        return tsCache;
    }

    public ChecksumCoordinator checksums() {
        return checksums;
    }

    public RangeDescriptor descriptor() {
        mu.lock();
        try {
            return state.descriptor;
        } finally {
            mu.unlock();
        }
    }

    public Lease lease() {
        mu.lock();
        try {
            return state.lease;
        } finally {
            mu.unlock();
        }
    }

    public long raftLogSize() {
        mu.lock();
        try {
            return state.raftLogSize;
        } finally {
            mu.unlock();
        }
    }

    /** Copy of the replicated part of the state. */
    public PersistedReplicaState persistedState() {
        mu.lock();
        try {
            return state.toPersisted();
        } finally {
            mu.unlock();
        }
    }

    /** This store's member of the range, or NONE when the store is not (or no longer) a member. */
    public ReplicaDescriptor replicaDescriptorLocked() {
        ReplicaDescriptor self = stateLocked().descriptor.replicaOnStore(store.storeId());
        return self == null ? ReplicaDescriptor.NONE : self;
    }

    public boolean needsSplitBySizeLocked() {
        return stateLocked().stats.totalBytes() > store.config().rangeMaxBytes();
    }

    /**
     * Persist and install a new descriptor.
     *
     * @throws IllegalArgumentException if the descriptor belongs to another range
     */
    public void setDesc(RangeDescriptor desc) {
        if (desc.rangeId() != rangeId) {
            throw new IllegalArgumentException(
                    "replica r" + rangeId + " cannot take descriptor of range " + desc.rangeId());
        }
        mu.lock();
        try {
            WriteBatch batch = store.engine().newBatch();
            store.stateLoader().stageDescriptor(batch, desc);
            store.engine().commit(batch);
            state.descriptor = desc;
        } finally {
            mu.unlock();
        }
    }

    /** Write the applied indexes and stats as they are in memory. Caller holds the lock. */
    public void persistAppliedStateLocked() {
        ReplicaState s = stateLocked();
        WriteBatch batch = store.engine().newBatch();
        store.stateLoader().stageAppliedState(batch, rangeId, s.raftAppliedIndex, s.leaseAppliedIndex, s.stats);
        store.engine().commit(batch);
    }

    /**
     * Run {@code fn} against the raft group.
     *
     * @throws ReplicaDestroyedException if the replica was destroyed
     */
    public <T> T withRaftGroup(Function<RaftGroup, T> fn) throws ReplicaDestroyedException {
        raftMu.lock();
        try {
            if (destroyed) {
                throw new ReplicaDestroyedException(rangeId);
            }
            return fn.apply(raftGroup);
        } finally {
            raftMu.unlock();
        }
    }

    /** Mark the replica destroyed. Its raft group is unusable afterwards. */
    public void destroy() {
        raftMu.lock();
        try {
            destroyed = true;
        } finally {
            raftMu.unlock();
        }
    }

    public boolean isDestroyed() {
        raftMu.lock();
        try {
            return destroyed;
        } finally {
            raftMu.unlock();
        }
    }

    /** True when this store holds a lease usable at {@code now}. */
    public boolean hasValidLease(Timestamp now) {
        mu.lock();
        try {
            return state.lease.ownedBy(store.storeId()) && state.lease.covers(now);
        } finally {
            mu.unlock();
        }
    }

    /** Gossip the first range's descriptor if this replica holds its lease. */
    public void maybeGossipFirstRange() {
        RangeDescriptor desc = descriptor();
        if (!desc.isFirstRange()) {
            return;
        }
        if (!hasValidLease(store.clock().now())) {
            log.fine(() -> "r" + rangeId + ": not gossiping first range without the lease");
            return;
        }
        store.gossip().publishFirstRange(desc);
    }

    /** Gossip the cluster configuration if this replica's range holds it and has the lease. */
    public void maybeGossipClusterConfig() {
        if (!descriptor().span().containsKey(KeyTokens.CLUSTER_CONFIG_KEY)) {
            return;
        }
        if (!hasValidLease(store.clock().now())) {
            return;
        }
        byte[] config = store.engine().get(KeyLayout.userKey(KeyTokens.CLUSTER_CONFIG_KEY));
        if (config == null) {
            log.fine(() -> "r" + rangeId + ": no cluster config to gossip");
            return;
        }
        store.gossip().publishClusterConfig(config);
    }

    /** Gossip node liveness for {@code span} if this replica's range contains it and has the lease. */
    public void maybeGossipNodeLiveness(TokenRange span) {
        if (!descriptor().span().containsRange(span)) {
            return;
        }
        if (!hasValidLease(store.clock().now())) {
            return;
        }
        store.gossip().publishNodeLiveness(rangeId, span);
    }

    @Override
    public String toString() {
        return "r" + rangeId + "/s" + store.storeId();
    }
}
