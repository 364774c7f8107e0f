// file: server/src/main/java/io/rangelite/server/apply/ReplicatedEffectsApplier.java
package io.rangelite.server.apply;

import io.rangelite.core.ChangeReplicasTrigger;
import io.rangelite.core.FrozenStatus;
import io.rangelite.core.Lease;
import io.rangelite.core.MvccStats;
import io.rangelite.core.ReplicaCorruptionException;
import io.rangelite.core.ReplicaDescriptor;
import io.rangelite.core.ReplicatedEffects;
import io.rangelite.core.Timestamp;
import io.rangelite.core.UnhandledEffectsException;
import io.rangelite.server.replica.LeaseTransitionHandler;
import io.rangelite.server.replica.Replica;
import io.rangelite.server.replica.ReplicaState;
import io.rangelite.server.store.QueueFullException;
import io.rangelite.server.store.Store;

import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the replicated side effects of a command to the in-memory replica
 * state, field by field, resetting each field once handled. The command's
 * writes and persisted state were already committed to the engine.
 * <p>
 * Steps run in a fixed order: stats and indexes, then queue checks, then the
 * structural triggers (split before merge before descriptor), lease,
 * truncation, GC thresholds and checksum. A field still set at the end is a
 * bug and fails the replica.
 */
public final class ReplicatedEffectsApplier {
    private static final Logger log = Logger.getLogger(ReplicatedEffectsApplier.class.getName());

    private final Store store;
    private final LeaseTransitionHandler leaseHandler;

    public ReplicatedEffectsApplier(Store store, LeaseTransitionHandler leaseHandler) {
        this.store = store;
        this.leaseHandler = leaseHandler;
    }

    /**
     * @return true when a nontrivial effect was applied and the replica state should be checked
     * @throws ReplicaCorruptionException when an effect cannot be applied or is left unhandled
     */
    public boolean apply(Replica r, ReplicatedEffects rResult) {
        // Markers with nothing to do at apply time.
        rResult.leaseRequest = false;
        rResult.consistencyRelated = false;
        rResult.freeze = false;
        rResult.timestamp = Timestamp.ZERO;

        Lock readBlock = null;
        if (rResult.blockReads) {
            readBlock = r.readOnlyCmdLock().writeLock();
            readBlock.lock();
            rResult.blockReads = false;
        }
        try {
            return applyLocked(r, rResult);
        } finally {
            if (readBlock != null) {
                readBlock.unlock();
            }
        }
    }

    private boolean applyLocked(Replica r, ReplicatedEffects rResult) {
        boolean needsSplitBySize;
        r.lock();
        try {
            ReplicaState s = r.stateLocked();
            s.setStats(s.stats().plus(rResult.delta));
            s.setAppliedIndexes(rResult.raftAppliedIndex, rResult.leaseAppliedIndex);
            needsSplitBySize = r.needsSplitBySizeLocked();
        } finally {
            r.unlock();
        }
        store.metrics().addMvccStats(rResult.delta);
        rResult.delta = MvccStats.EMPTY;

        long checkFreq = store.config().raftLogCheckFrequency();
        if (rResult.raftAppliedIndex != 0 && rResult.raftAppliedIndex % checkFreq == 1 % checkFreq) {
            store.raftLogQueue().maybeAdd(r, store.clock().now());
        }
        if (needsSplitBySize) {
            store.splitQueue().maybeAdd(r, store.clock().now());
        }
        rResult.raftAppliedIndex = 0;
        rResult.leaseAppliedIndex = 0;

        // Stats and indexes change with every command; only what is left is worth an assertion.
        boolean shouldAssert = !rResult.isEmpty();

        if (rResult.split != null) {
            // The right-hand stats are computed against exact stats, so drop the estimate flag first.
            try {
                r.lock();
                try {
                    ReplicaState s = r.stateLocked();
                    s.setStats(s.stats().withContainsEstimates(false));
                    r.persistAppliedStateLocked();
                } finally {
                    r.unlock();
                }
                store.splitRange(r, rResult.split);
            } catch (ReplicaCorruptionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ReplicaCorruptionException(r + ": failed to apply split at " + rResult.split.right().span(), e);
            }
            rResult.split = null;
        }

        if (rResult.merge != null) {
            try {
                store.mergeRange(r, rResult.merge);
            } catch (RuntimeException e) {
                throw new ReplicaCorruptionException(r + ": failed to update store after merging range", e);
            }
            rResult.merge = null;
        }

        if (rResult.frozenStatus != FrozenStatus.UNSPECIFIED) {
            boolean frozen = rResult.frozenStatus == FrozenStatus.FROZEN;
            r.lock();
            try {
                r.stateLocked().setFrozen(frozen);
            } finally {
                r.unlock();
            }
            rResult.frozenStatus = FrozenStatus.UNSPECIFIED;
        }

        if (rResult.descriptor != null) {
            try {
                r.setDesc(rResult.descriptor);
            } catch (RuntimeException e) {
                throw new ReplicaCorruptionException(r + ": failed to install descriptor " + rResult.descriptor, e);
            }
            rResult.descriptor = null;
        }

        if (rResult.changeReplicas != null) {
            ChangeReplicasTrigger change = rResult.changeReplicas;
            if (change.changeType() == ChangeReplicasTrigger.ChangeType.REMOVE_REPLICA
                    && change.replica().storeId() == store.storeId()) {
                // The replica was removed; let replica GC collect it.
                try {
                    store.replicaGcQueue().add(r, store.config().replicaGcPriorityRemoved());
                } catch (QueueFullException e) {
                    store.metrics().replicaGcEnqueueFailed();
                    log.log(Level.WARNING, r + ": unable to add to replica GC queue", e);
                }
            }
            rResult.changeReplicas = null;
        }

        if (rResult.lease != null) {
            Lease newLease = rResult.lease;
            Lease prevLease;
            ReplicaDescriptor self;
            r.lock();
            try {
                ReplicaState s = r.stateLocked();
                prevLease = s.lease();
                s.setLease(newLease);
                self = r.replicaDescriptorLocked();
            } finally {
                r.unlock();
            }
            leaseHandler.onLeaseApplied(r, self, prevLease, newLease);
            rResult.lease = null;
        }

        if (rResult.truncatedState != null) {
            long truncatedIndex = rResult.truncatedState.index();
            r.lock();
            try {
                r.stateLocked().setTruncatedState(rResult.truncatedState);
            } finally {
                r.unlock();
            }
            store.raftEntryCache().clearTo(r.rangeId(), truncatedIndex);
            rResult.truncatedState = null;
        }

        if (!rResult.gcThreshold.isZero()) {
            r.lock();
            try {
                r.stateLocked().setGcThreshold(rResult.gcThreshold);
            } finally {
                r.unlock();
            }
            rResult.gcThreshold = Timestamp.ZERO;
        }

        if (!rResult.txnSpanGcThreshold.isZero()) {
            r.lock();
            try {
                r.stateLocked().setTxnSpanGcThreshold(rResult.txnSpanGcThreshold);
            } finally {
                r.unlock();
            }
            rResult.txnSpanGcThreshold = Timestamp.ZERO;
        }

        if (rResult.computeChecksum != null) {
            r.checksums().requestCompute(rResult.computeChecksum.checksumId(), rResult.computeChecksum.snapshot());
            rResult.computeChecksum = null;
        }

        if (!rResult.isEmpty()) {
            throw new UnhandledEffectsException(r + " ReplicatedEffects", rResult.setFields());
        }
        return shouldAssert;
    }
}
