// file: storage/src/main/java/io/rangelite/storage/PersistedReplicaState.java
package io.rangelite.storage;

import io.rangelite.core.Lease;
import io.rangelite.core.MvccStats;
import io.rangelite.core.RangeDescriptor;
import io.rangelite.core.Timestamp;
import io.rangelite.core.TruncatedState;

import java.util.Objects;

/**
 * The part of a replica's state that is replicated and therefore persisted
 * with every applied command. Two replicas that applied the same commands
 * hold equal values.
 * <p>
 * No component is null: a range without a lease holds {@link Lease#none()},
 * unset watermarks are {@link Timestamp#ZERO}.
 */
public record PersistedReplicaState(
        long raftAppliedIndex,
        long leaseAppliedIndex,
        MvccStats stats,
        RangeDescriptor descriptor,
        Lease lease,
        TruncatedState truncatedState,
        Timestamp gcThreshold,
        Timestamp txnSpanGcThreshold,
        boolean frozen
) {

    public PersistedReplicaState {
        Objects.requireNonNull(stats, "stats");
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(lease, "lease");
        Objects.requireNonNull(truncatedState, "truncatedState");
        Objects.requireNonNull(gcThreshold, "gcThreshold");
        Objects.requireNonNull(txnSpanGcThreshold, "txnSpanGcThreshold");
    }
}
