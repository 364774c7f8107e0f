// file: core/src/main/java/io/rangelite/core/ChangeReplicasTrigger.java
package io.rangelite.core;

import java.util.List;
import java.util.Objects;

/** Membership change of a range's consensus group. */
public record ChangeReplicasTrigger(
        ChangeType changeType,
        ReplicaDescriptor replica,
        List<ReplicaDescriptor> updatedReplicas
) {

    public enum ChangeType {
        ADD_REPLICA, REMOVE_REPLICA
    }

    public ChangeReplicasTrigger {
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(replica, "replica");
        updatedReplicas = List.copyOf(Objects.requireNonNull(updatedReplicas, "updatedReplicas"));
    }
}
