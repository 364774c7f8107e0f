// file: server/src/main/java/io/rangelite/server/apply/LocalEffectsApplier.java
package io.rangelite.server.apply;

import io.rangelite.core.LocalEffects;
import io.rangelite.core.ReplicaDescriptor;
import io.rangelite.core.UnhandledEffectsException;
import io.rangelite.server.replica.Replica;
import io.rangelite.server.store.Store;

import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the side effects that only concern the node that proposed the
 * command, plus the few local triggers every replica acts on.
 * Consumes the record like {@link ReplicatedEffectsApplier}.
 */
public final class LocalEffectsApplier {
    private static final Logger log = Logger.getLogger(LocalEffectsApplier.class.getName());

    private final Store store;

    public LocalEffectsApplier(Store store) {
        this.store = store;
    }

    /**
     * @return true when a nontrivial effect was applied and the replica state should be checked
     */
    public boolean apply(Replica r, ReplicaDescriptor proposer, LocalEffects lResult) {
        // Identity and completion plumbing is handled by the caller, not here.
        lResult.commandId = null;
        lResult.proposedAtTicks = 0;
        lResult.resultChannel = null;
        lResult.completionHook = null;
        lResult.error = null;
        lResult.reply = null;

        boolean isProposer = proposer.storeId() == store.storeId();

        if (isProposer && lResult.unresolvedIntents != null) {
            // Even when the command failed.
            store.intentResolver().processIntentsAsync(r, lResult.unresolvedIntents);
        }
        lResult.unresolvedIntents = null;

        boolean shouldAssert = !lResult.isEmpty();

        if (lResult.raftLogSizeEstimate != null) {
            r.lock();
            try {
                r.stateLocked().setRaftLogSize(lResult.raftLogSizeEstimate);
            } finally {
                r.unlock();
            }
            lResult.raftLogSizeEstimate = null;
        }

        if (lResult.gossipFirstRange) {
            // Off the apply path: gossiping needs the lease, which may be mid-acquisition.
            try {
                store.stopper().runAsyncTask("gossip-first-range r" + r.rangeId(), r::maybeGossipFirstRange);
            } catch (RejectedExecutionException e) {
                log.log(Level.INFO, r + ": unable to gossip first range", e);
            }
            lResult.gossipFirstRange = false;
        }

        if (lResult.maybeAddToSplitQueue) {
            store.splitQueue().maybeAdd(r, store.clock().now());
            lResult.maybeAddToSplitQueue = false;
        }

        if (lResult.maybeGossipClusterConfig) {
            r.maybeGossipClusterConfig();
            lResult.maybeGossipClusterConfig = false;
        }

        if (isProposer) {
            if (lResult.leaseMetricsOutcome != null) {
                store.metrics().leaseRequestComplete(lResult.leaseMetricsOutcome);
            }
            if (lResult.maybeGossipNodeLiveness != null) {
                r.maybeGossipNodeLiveness(lResult.maybeGossipNodeLiveness);
            }
        }
        lResult.leaseMetricsOutcome = null;
        lResult.maybeGossipNodeLiveness = null;

        if (!lResult.isEmpty()) {
            throw new UnhandledEffectsException(r + " LocalEffects", lResult.setFields());
        }
        return shouldAssert;
    }
}
