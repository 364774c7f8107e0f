// file: core/src/main/java/io/rangelite/core/ReplicatedEffects.java
package io.rangelite.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Side effects of a command that every replica must apply identically.
 * <p>
 * The record is mutable and consumed destructively: the merge engine and the
 * replicated-effect applicator reset each field to its default as they handle
 * it. A record whose every field is back at its default is "empty"; anything
 * left over after a merge or apply is a field nobody handled.
 * <p>
 * Fields fall in two groups:
 *  - exclusive triggers (descriptor, lease, truncatedState, frozenStatus,
 *    split, merge, changeReplicas, computeChecksum): at most one per merged record.
 *  - accumulable values (delta, gcThreshold, txnSpanGcThreshold, blockReads):
 *    summed, forward-maxed or OR-ed.
 * The applied indexes are assigned once, after merging, by whoever orders the log.
 * <p>
 * {@link Field} is the manifest of every field; {@link #isSet(Field)} is an
 * exhaustive switch, so a new constant does not compile until it is handled.
 */
public final class ReplicatedEffects {

    public enum Field {
        LEASE_REQUEST,
        CONSISTENCY_RELATED,
        FREEZE,
        TIMESTAMP,
        BLOCK_READS,
        DELTA,
        RAFT_APPLIED_INDEX,
        LEASE_APPLIED_INDEX,
        DESCRIPTOR,
        LEASE,
        TRUNCATED_STATE,
        GC_THRESHOLD,
        TXN_SPAN_GC_THRESHOLD,
        FROZEN_STATUS,
        SPLIT,
        MERGE,
        CHANGE_REPLICAS,
        COMPUTE_CHECKSUM
    }

    // Markers describing the command; nothing acts on them after evaluation.
    public boolean leaseRequest;
    public boolean consistencyRelated;
    public boolean freeze;
    public Timestamp timestamp = Timestamp.ZERO;

    public boolean blockReads;
    public MvccStats delta = MvccStats.EMPTY;
    public long raftAppliedIndex;
    public long leaseAppliedIndex;

    public RangeDescriptor descriptor;
    public Lease lease;
    public TruncatedState truncatedState;
    public Timestamp gcThreshold = Timestamp.ZERO;
    public Timestamp txnSpanGcThreshold = Timestamp.ZERO;
    public FrozenStatus frozenStatus = FrozenStatus.UNSPECIFIED;

    public SplitTrigger split;
    public MergeTrigger merge;
    public ChangeReplicasTrigger changeReplicas;
    public ComputeChecksum computeChecksum;

    public boolean isSet(Field field) {
        return switch (field) {
            case LEASE_REQUEST -> leaseRequest;
            case CONSISTENCY_RELATED -> consistencyRelated;
            case FREEZE -> freeze;
            case TIMESTAMP -> !timestamp.isZero();
            case BLOCK_READS -> blockReads;
            case DELTA -> !delta.isEmpty();
            case RAFT_APPLIED_INDEX -> raftAppliedIndex != 0;
            case LEASE_APPLIED_INDEX -> leaseAppliedIndex != 0;
            case DESCRIPTOR -> descriptor != null;
            case LEASE -> lease != null;
            case TRUNCATED_STATE -> truncatedState != null;
            case GC_THRESHOLD -> !gcThreshold.isZero();
            case TXN_SPAN_GC_THRESHOLD -> !txnSpanGcThreshold.isZero();
            case FROZEN_STATUS -> frozenStatus != FrozenStatus.UNSPECIFIED;
            case SPLIT -> split != null;
            case MERGE -> merge != null;
            case CHANGE_REPLICAS -> changeReplicas != null;
            case COMPUTE_CHECKSUM -> computeChecksum != null;
        };
    }

    /** Fields still holding a non-default value. */
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

    @Override
    public String toString() {
        return "ReplicatedEffects" + setFields();
    }
}
