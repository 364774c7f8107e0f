// file: core/src/main/java/io/rangelite/core/LocalEffects.java
package io.rangelite.core;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Side effects of a command that only matter on the node that proposed it.
 * Consumed destructively like {@link ReplicatedEffects}; {@link Field} is the
 * manifest of every field.
 * <p>
 * resultChannel and completionHook are how the proposer's waiting client is
 * released. Apply clears them along with the other structural fields, so the
 * caller takes {@link #copyCompletion()} before applying and finishes that copy.
 */
public final class LocalEffects {

    public enum Field {
        COMMAND_ID,
        PROPOSED_AT_TICKS,
        RESULT_CHANNEL,
        COMPLETION_HOOK,
        ERROR,
        REPLY,
        RAFT_LOG_SIZE_ESTIMATE,
        UNRESOLVED_INTENTS,
        LEASE_METRICS_OUTCOME,
        GOSSIP_FIRST_RANGE,
        MAYBE_GOSSIP_CLUSTER_CONFIG,
        MAYBE_ADD_TO_SPLIT_QUEUE,
        MAYBE_GOSSIP_NODE_LIVENESS
    }

    public String commandId;
    public int proposedAtTicks;
    public CompletableFuture<ProposalResult> resultChannel;
    public CompletionHook completionHook;
    public CommandError error;
    public CommandReply reply;

    public Long raftLogSizeEstimate;
    public List<Intent> unresolvedIntents;
    public Boolean leaseMetricsOutcome;
    public boolean gossipFirstRange;
    public boolean maybeGossipClusterConfig;
    public boolean maybeAddToSplitQueue;
    public TokenRange maybeGossipNodeLiveness;

    public boolean isSet(Field field) {
        return switch (field) {
            case COMMAND_ID -> commandId != null;
            case PROPOSED_AT_TICKS -> proposedAtTicks != 0;
            case RESULT_CHANNEL -> resultChannel != null;
            case COMPLETION_HOOK -> completionHook != null;
            case ERROR -> error != null;
            case REPLY -> reply != null;
            case RAFT_LOG_SIZE_ESTIMATE -> raftLogSizeEstimate != null;
            case UNRESOLVED_INTENTS -> unresolvedIntents != null;
            case LEASE_METRICS_OUTCOME -> leaseMetricsOutcome != null;
            case GOSSIP_FIRST_RANGE -> gossipFirstRange;
            case MAYBE_GOSSIP_CLUSTER_CONFIG -> maybeGossipClusterConfig;
            case MAYBE_ADD_TO_SPLIT_QUEUE -> maybeAddToSplitQueue;
            case MAYBE_GOSSIP_NODE_LIVENESS -> maybeGossipNodeLiveness != null;
        };
    }

    public Set<Field> setFields() {
        EnumSet<Field> out = EnumSet.noneOf(Field.class);
        for (Field f : Field.values()) {
            if (isSet(f)) {
                out.add(f);
            }
        }
        return out;
    }

    public boolean isEmpty() {
        return setFields().isEmpty();
    }

    /** A record carrying only this record's result channel and completion hook. */
    public LocalEffects copyCompletion() {
        LocalEffects copy = new LocalEffects();
        copy.resultChannel = resultChannel;
        copy.completionHook = completionHook;
        return copy;
    }

    /** The outcome this record would deliver: its reply and error as evaluated. */
    public ProposalResult outcome() {
        return new ProposalResult(reply, error, false);
    }

    @Override
    public String toString() {
        return "LocalEffects" + setFields();
    }
}
