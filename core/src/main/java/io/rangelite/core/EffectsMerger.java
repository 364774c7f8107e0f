// file: core/src/main/java/io/rangelite/core/EffectsMerger.java
package io.rangelite.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds the effects of one partial evaluation result into another, for
 * commands whose evaluation produced several results (a request plus the side
 * effect it triggered).
 * <p>
 * Rules per field:
 *  - exclusive triggers: taken from whichever side sets them; both set is a conflict.
 *  - the stats delta is summed.
 *  - GC thresholds move forward to the larger value.
 *  - the applied indexes are never accepted on the merged-in side.
 *  - boolean triggers are OR-ed.
 *  - unresolved intents are appended.
 * Every field taken from {@code src} is reset there, so a successful merge
 * leaves {@code src} empty.
 */
public final class EffectsMerger {

    private EffectsMerger() {
    }

    /**
     * Merge {@code src} into {@code dst}. {@code src} must not be used afterwards.
     *
     * @throws MergeConflictException     when both sides carry the same exclusive effect
     * @throws UnhandledEffectsException  when {@code src} has a field this merge does not know
     */
    public static void mergeAndDestroy(CommandEffects dst, CommandEffects src) throws MergeConflictException {
        mergeReplicated(dst.replicated, src.replicated);
        mergeLocal(dst.local, src.local);

        if (!src.replicated.isEmpty()) {
            throw new UnhandledEffectsException("merged ReplicatedEffects", src.replicated.setFields());
        }
        if (!src.local.isEmpty()) {
            throw new UnhandledEffectsException("merged LocalEffects", src.local.setFields());
        }
    }

    private static void mergeReplicated(ReplicatedEffects p, ReplicatedEffects q) throws MergeConflictException {
        if (q.raftAppliedIndex != 0) {
            throw MergeConflictException.mustNotSpecify("raftAppliedIndex");
        }
        if (q.leaseAppliedIndex != 0) {
            throw MergeConflictException.mustNotSpecify("leaseAppliedIndex");
        }

        p.leaseRequest = p.leaseRequest || q.leaseRequest;
        q.leaseRequest = false;
        p.consistencyRelated = p.consistencyRelated || q.consistencyRelated;
        q.consistencyRelated = false;
        p.freeze = p.freeze || q.freeze;
        q.freeze = false;
        p.timestamp = p.timestamp.forward(q.timestamp);
        q.timestamp = Timestamp.ZERO;

        if (p.descriptor == null) {
            p.descriptor = q.descriptor;
        } else if (q.descriptor != null) {
            throw MergeConflictException.conflicting("descriptor");
        }
        q.descriptor = null;

        if (p.lease == null) {
            p.lease = q.lease;
        } else if (q.lease != null) {
            throw MergeConflictException.conflicting("lease");
        }
        q.lease = null;

        if (p.truncatedState == null) {
            p.truncatedState = q.truncatedState;
        } else if (q.truncatedState != null) {
            throw MergeConflictException.conflicting("truncatedState");
        }
        q.truncatedState = null;

        p.gcThreshold = p.gcThreshold.forward(q.gcThreshold);
        q.gcThreshold = Timestamp.ZERO;
        p.txnSpanGcThreshold = p.txnSpanGcThreshold.forward(q.txnSpanGcThreshold);
        q.txnSpanGcThreshold = Timestamp.ZERO;

        p.delta = p.delta.plus(q.delta);
        q.delta = MvccStats.EMPTY;

        if (p.frozenStatus == FrozenStatus.UNSPECIFIED) {
            p.frozenStatus = q.frozenStatus;
        } else if (q.frozenStatus != FrozenStatus.UNSPECIFIED) {
            throw MergeConflictException.conflicting("frozenStatus");
        }
        q.frozenStatus = FrozenStatus.UNSPECIFIED;

        p.blockReads = p.blockReads || q.blockReads;
        q.blockReads = false;

        if (p.split == null) {
            p.split = q.split;
        } else if (q.split != null) {
            throw MergeConflictException.conflicting("split");
        }
        q.split = null;

        if (p.merge == null) {
            p.merge = q.merge;
        } else if (q.merge != null) {
            throw MergeConflictException.conflicting("merge");
        }
        q.merge = null;

        if (p.changeReplicas == null) {
            p.changeReplicas = q.changeReplicas;
        } else if (q.changeReplicas != null) {
            throw MergeConflictException.conflicting("changeReplicas");
        }
        q.changeReplicas = null;

        if (p.computeChecksum == null) {
            p.computeChecksum = q.computeChecksum;
        } else if (q.computeChecksum != null) {
            throw MergeConflictException.conflicting("computeChecksum");
        }
        q.computeChecksum = null;
    }

    private static void mergeLocal(LocalEffects p, LocalEffects q) throws MergeConflictException {
        // Identity, reply and completion plumbing belong to the outer result.
        if (p.commandId == null) {
            p.commandId = q.commandId;
        }
        q.commandId = null;
        if (p.proposedAtTicks == 0) {
            p.proposedAtTicks = q.proposedAtTicks;
        }
        q.proposedAtTicks = 0;

        if (p.resultChannel == null) {
            p.resultChannel = q.resultChannel;
        } else if (q.resultChannel != null) {
            throw MergeConflictException.conflicting("resultChannel");
        }
        q.resultChannel = null;

        if (p.completionHook == null) {
            p.completionHook = q.completionHook;
        } else if (q.completionHook != null) {
            throw MergeConflictException.conflicting("completionHook");
        }
        q.completionHook = null;

        if (p.error == null) {
            p.error = q.error;
        } else if (q.error != null) {
            throw MergeConflictException.conflicting("error");
        }
        q.error = null;

        if (p.reply == null) {
            p.reply = q.reply;
        } else if (q.reply != null) {
            throw MergeConflictException.conflicting("reply");
        }
        q.reply = null;

        if (p.raftLogSizeEstimate == null) {
            p.raftLogSizeEstimate = q.raftLogSizeEstimate;
        } else if (q.raftLogSizeEstimate != null) {
            throw MergeConflictException.conflicting("raftLogSizeEstimate");
        }
        q.raftLogSizeEstimate = null;

        if (q.unresolvedIntents != null) {
            if (p.unresolvedIntents == null) {
                p.unresolvedIntents = q.unresolvedIntents;
            } else {
                List<Intent> all = new ArrayList<>(p.unresolvedIntents.size() + q.unresolvedIntents.size());
                all.addAll(p.unresolvedIntents);
                all.addAll(q.unresolvedIntents);
                p.unresolvedIntents = all;
            }
        }
        q.unresolvedIntents = null;

        if (p.leaseMetricsOutcome == null) {
            p.leaseMetricsOutcome = q.leaseMetricsOutcome;
        } else if (q.leaseMetricsOutcome != null) {
            throw MergeConflictException.conflicting("leaseMetricsOutcome");
        }
        q.leaseMetricsOutcome = null;

        if (p.maybeGossipNodeLiveness == null) {
            p.maybeGossipNodeLiveness = q.maybeGossipNodeLiveness;
        } else if (q.maybeGossipNodeLiveness != null) {
            throw MergeConflictException.conflicting("maybeGossipNodeLiveness");
        }
        q.maybeGossipNodeLiveness = null;

        p.gossipFirstRange = p.gossipFirstRange || q.gossipFirstRange;
        q.gossipFirstRange = false;
        p.maybeGossipClusterConfig = p.maybeGossipClusterConfig || q.maybeGossipClusterConfig;
        q.maybeGossipClusterConfig = false;
        p.maybeAddToSplitQueue = p.maybeAddToSplitQueue || q.maybeAddToSplitQueue;
        q.maybeAddToSplitQueue = false;
    }
}
