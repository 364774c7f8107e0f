// file: server/src/main/java/io/rangelite/server/replica/ReplicaDestroyedException.java
package io.rangelite.server.replica;

/** The replica was removed from its store; its raft group is gone. */
public class ReplicaDestroyedException extends Exception {

    public ReplicaDestroyedException(long rangeId) {
        super("replica of range " + rangeId + " was destroyed");
    }
}
