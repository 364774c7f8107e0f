// file: core/src/main/java/io/rangelite/core/RangeDescriptor.java
package io.rangelite.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Boundaries and membership of a range.
 *
 * rangeId:       stable identifier of the range.
 * span:          token interval the range owns.
 * replicas:      current members of the consensus group.
 * nextReplicaId: id handed to the next added replica.
 */
public record RangeDescriptor(
        long rangeId,
        TokenRange span,
        List<ReplicaDescriptor> replicas,
        int nextReplicaId
) {

    public RangeDescriptor {
        if (rangeId <= 0) {
            throw new IllegalArgumentException("rangeId must be > 0");
        }
        Objects.requireNonNull(span, "span");
        replicas = List.copyOf(Objects.requireNonNull(replicas, "replicas"));
    }

    /** Replica hosted on the given store, or null if the store holds none. */
    public ReplicaDescriptor replicaOnStore(int storeId) {
        for (ReplicaDescriptor r : replicas) {
            if (r.storeId() == storeId) {
                return r;
            }
        }
        return null;
    }

    /** The first range is the one starting at token zero; it is gossiped to bootstrap routing. */
    @JsonIgnore
    public boolean isFirstRange() {
        return span.startInclusive() == 0L;
    }

    public RangeDescriptor withSpan(TokenRange newSpan) {
        return new RangeDescriptor(rangeId, newSpan, replicas, nextReplicaId);
    }

    public RangeDescriptor withReplicas(List<ReplicaDescriptor> newReplicas, int newNextReplicaId) {
        return new RangeDescriptor(rangeId, span, newReplicas, newNextReplicaId);
    }
}
