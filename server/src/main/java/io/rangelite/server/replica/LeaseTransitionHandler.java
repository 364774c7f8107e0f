// file: server/src/main/java/io/rangelite/server/replica/LeaseTransitionHandler.java
package io.rangelite.server.replica;

import io.rangelite.core.Lease;
import io.rangelite.core.ReplicaCorruptionException;
import io.rangelite.core.ReplicaDescriptor;
import io.rangelite.core.Timestamp;

import java.util.logging.Logger;

/**
 * Consequences of a newly applied lease on the local replica.
 * <p>
 *  - A lease moving to this store raises the timestamp cache's low-water
 *    mark to the new lease's start. The old lease's expiration is not used:
 *    the stasis period makes overlapping leases safe.
 *  - A lease moving away from this store clears the timestamp cache.
 *  - If another replica holds an active lease and this one leads the raft
 *    group, leadership is offered to the lease holder.
 * <p>
 * Called without the replica lock held.
 */
public final class LeaseTransitionHandler {
    private static final Logger log = Logger.getLogger(LeaseTransitionHandler.class.getName());

    public void onLeaseApplied(Replica r, ReplicaDescriptor self, Lease prevLease, Lease newLease) {
        boolean iAmTheLeaseHolder = newLease.holder().replicaId() == self.replicaId()
                && newLease.holder().storeId() == self.storeId();
        boolean leaseChangingHands = prevLease.holder().storeId() != newLease.holder().storeId();
        Timestamp now = r.store().clock().now();

        if (leaseChangingHands) {
            if (iAmTheLeaseHolder) {
                log.info(() -> r + ": new range lease " + newLease + " following " + prevLease);
                r.tsCache().setLowWater(newLease.start());
                if (r.descriptor().isFirstRange() && newLease.covers(now)) {
                    r.maybeGossipFirstRange();
                }
            } else {
                r.tsCache().clear(now);
            }
        }

        if (!iAmTheLeaseHolder && newLease.covers(now)) {
            maybeTransferRaftLeadership(r, newLease.holder());
        }
    }

    private void maybeTransferRaftLeadership(Replica r, ReplicaDescriptor target) {
        try {
            r.withRaftGroup(group -> {
                if (group.isLeader()) {
                    log.info(() -> r + ": transferring raft leadership to replica " + target.replicaId());
                    group.transferLeader(target);
                }
                return null;
            });
        } catch (ReplicaDestroyedException e) {
            throw new ReplicaCorruptionException(r + ": leadership transfer on a destroyed replica", e);
        }
    }
}
