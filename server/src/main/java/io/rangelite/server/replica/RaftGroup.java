// file: server/src/main/java/io/rangelite/server/replica/RaftGroup.java
package io.rangelite.server.replica;

import io.rangelite.core.ReplicaDescriptor;

/**
 * The consensus group of one range, as seen from the local replica.
 */
public interface RaftGroup {

    boolean isLeader();

    /**
     * Ask leadership to move to {@code target}. Best effort: the transfer may
     * silently not happen, e.g. when the target lags behind on the log.
     */
    void transferLeader(ReplicaDescriptor target);
}
