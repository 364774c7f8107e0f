// file: core/src/main/java/io/rangelite/core/ReplicaDescriptor.java
package io.rangelite.core;

import java.util.Objects;

/**
 * Identity of one replica of a range: the node and store hosting it, and its
 * replica id within the range's consensus group.
 */
public record ReplicaDescriptor(String nodeId, int storeId, int replicaId) {

    /** Placeholder holder of the empty lease a range starts with. */
    public static final ReplicaDescriptor NONE = new ReplicaDescriptor("", 0, 0);

    public ReplicaDescriptor {
        Objects.requireNonNull(nodeId, "nodeId");
        if (storeId < 0 || replicaId < 0) {
            throw new IllegalArgumentException("storeId and replicaId must be >= 0");
        }
    }
}
