// file: server/src/main/java/io/rangelite/server/store/ReplicaQueue.java
package io.rangelite.server.store;

import io.rangelite.core.Timestamp;
import io.rangelite.server.replica.Replica;

/**
 * A queue of replicas some background process will look at later
 * (raft-log truncation, split, replica GC). The queue owns admission and dedup.
 */
public interface ReplicaQueue {

    /** Offer the replica; the queue decides whether it is worth processing. Never fails. */
    void maybeAdd(Replica replica, Timestamp now);

    /** Enqueue the replica at the given priority, bypassing the admission check. */
    void add(Replica replica, double priority) throws QueueFullException;
}
