// file: server/src/main/java/io/rangelite/server/replica/LocalRaftGroup.java
package io.rangelite.server.replica;

import io.rangelite.core.ReplicaDescriptor;

import java.util.logging.Logger;

/**
 * Raft group of a range whose log is ordered locally. Leadership is a flag;
 * a transfer hands it to the target and keeps no other state.
 */
public final class LocalRaftGroup implements RaftGroup {
    private static final Logger log = Logger.getLogger(LocalRaftGroup.class.getName());

    private volatile boolean leader;
    private volatile ReplicaDescriptor leaderHint = ReplicaDescriptor.NONE;

    public LocalRaftGroup(boolean leader) {
        this.leader = leader;
    }

    @Override
    public boolean isLeader() {
        return leader;
    }

    @Override
    public void transferLeader(ReplicaDescriptor target) {
        if (!leader) {
            return;
        }
        leader = false;
        leaderHint = target;
        log.fine(() -> "leadership handed to replica " + target.replicaId() + " on s" + target.storeId());
    }

    public void becomeLeader() {
        leader = true;
        leaderHint = ReplicaDescriptor.NONE;
    }

    /** Replica leadership was last handed to, or NONE. */
    public ReplicaDescriptor leaderHint() {
        return leaderHint;
    }
}
