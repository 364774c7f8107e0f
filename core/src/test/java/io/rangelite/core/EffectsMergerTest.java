package io.rangelite.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EffectsMergerTest {

    private static final ReplicaDescriptor R1 = new ReplicaDescriptor("n1", 1, 1);

    private static RangeDescriptor desc(long rangeId) {
        return new RangeDescriptor(rangeId, TokenRange.FULL, List.of(R1), 2);
    }

    private static MvccStats stats(long keyBytes, long keyCount, boolean estimates) {
        return new MvccStats(0, keyBytes, 0, 0, 0, keyCount, 0, 0, 0, estimates);
    }

    @Test
    void disjoint_triggers_merge_and_accumulables_fold() throws Exception {
        CommandEffects dst = new CommandEffects();
        dst.replicated.delta = stats(10, 1, false);
        dst.replicated.gcThreshold = new Timestamp(100, 0);
        dst.replicated.descriptor = desc(1);
        dst.local.maybeAddToSplitQueue = true;
        dst.local.unresolvedIntents = List.of(new Intent("a", UUID.randomUUID()));

        CommandEffects src = new CommandEffects();
        src.replicated.delta = stats(5, 2, true);
        src.replicated.gcThreshold = new Timestamp(200, 3);
        src.replicated.txnSpanGcThreshold = new Timestamp(50, 0);
        src.replicated.blockReads = true;
        src.replicated.computeChecksum = new ComputeChecksum(UUID.randomUUID(), false);
        src.local.gossipFirstRange = true;
        src.local.raftLogSizeEstimate = 42L;
        src.local.unresolvedIntents = List.of(new Intent("b", UUID.randomUUID()));

        EffectsMerger.mergeAndDestroy(dst, src);

        assertEquals(stats(15, 3, true), dst.replicated.delta);
        assertEquals(new Timestamp(200, 3), dst.replicated.gcThreshold);
        assertEquals(new Timestamp(50, 0), dst.replicated.txnSpanGcThreshold);
        assertTrue(dst.replicated.blockReads);
        assertEquals(desc(1), dst.replicated.descriptor);
        assertNotNull(dst.replicated.computeChecksum);
        assertTrue(dst.local.gossipFirstRange);
        assertTrue(dst.local.maybeAddToSplitQueue);
        assertEquals(42L, dst.local.raftLogSizeEstimate);
        assertEquals(List.of("a", "b"), dst.local.unresolvedIntents.stream().map(Intent::key).toList());

        assertTrue(src.isEmpty(), "merged-away record must be zeroed: " + src);
    }

    @Test
    void gc_threshold_only_moves_forward() throws Exception {
        CommandEffects dst = new CommandEffects();
        dst.replicated.gcThreshold = new Timestamp(500, 0);
        CommandEffects src = new CommandEffects();
        src.replicated.gcThreshold = new Timestamp(100, 0);

        EffectsMerger.mergeAndDestroy(dst, src);

        assertEquals(new Timestamp(500, 0), dst.replicated.gcThreshold);
        assertTrue(src.isEmpty());
    }

    @Test
    void two_descriptors_conflict() {
        CommandEffects dst = new CommandEffects();
        dst.replicated.descriptor = desc(1);
        CommandEffects src = new CommandEffects();
        src.replicated.descriptor = desc(2);

        MergeConflictException e = assertThrows(MergeConflictException.class,
                () -> EffectsMerger.mergeAndDestroy(dst, src));
        assertEquals("descriptor", e.field());
        assertEquals("conflicting descriptor", e.getMessage());
        assertEquals(desc(1), dst.replicated.descriptor, "must not silently pick the other side");
    }

    @Test
    void every_exclusive_trigger_conflicts_with_itself() {
        Lease lease = new Lease(R1, new Timestamp(1, 0), new Timestamp(2, 0), new Timestamp(3, 0));
        RangeDescriptor l = desc(1);
        RangeDescriptor r = desc(2);
        List<java.util.function.Consumer<CommandEffects>> setters = List.of(
                e -> e.replicated.lease = lease,
                e -> e.replicated.truncatedState = new TruncatedState(5, 1),
                e -> e.replicated.frozenStatus = FrozenStatus.FROZEN,
                e -> e.replicated.split = new SplitTrigger(l, r, MvccStats.EMPTY),
                e -> e.replicated.merge = new MergeTrigger(l, r),
                e -> e.replicated.changeReplicas = new ChangeReplicasTrigger(
                        ChangeReplicasTrigger.ChangeType.ADD_REPLICA, R1, List.of(R1)),
                e -> e.replicated.computeChecksum = new ComputeChecksum(UUID.randomUUID(), true),
                e -> e.local.raftLogSizeEstimate = 7L,
                e -> e.local.leaseMetricsOutcome = true,
                e -> e.local.maybeGossipNodeLiveness = TokenRange.FULL
        );
        for (var set : setters) {
            CommandEffects dst = new CommandEffects();
            CommandEffects src = new CommandEffects();
            set.accept(dst);
            set.accept(src);
            MergeConflictException e = assertThrows(MergeConflictException.class,
                    () -> EffectsMerger.mergeAndDestroy(dst, src));
            assertTrue(e.getMessage().startsWith("conflicting "), e.getMessage());
        }
    }

    @Test
    void applied_indexes_on_merged_in_side_are_rejected() {
        CommandEffects dst = new CommandEffects();
        CommandEffects src = new CommandEffects();
        src.replicated.raftAppliedIndex = 7;
        MergeConflictException e = assertThrows(MergeConflictException.class,
                () -> EffectsMerger.mergeAndDestroy(dst, src));
        assertEquals("raftAppliedIndex", e.field());

        CommandEffects src2 = new CommandEffects();
        src2.replicated.leaseAppliedIndex = 3;
        e = assertThrows(MergeConflictException.class, () -> EffectsMerger.mergeAndDestroy(dst, src2));
        assertEquals("leaseAppliedIndex", e.field());
    }

    @Test
    void applied_indexes_on_destination_are_kept() throws Exception {
        CommandEffects dst = new CommandEffects();
        dst.replicated.raftAppliedIndex = 9;
        CommandEffects src = new CommandEffects();
        src.local.maybeGossipClusterConfig = true;

        EffectsMerger.mergeAndDestroy(dst, src);

        assertEquals(9, dst.replicated.raftAppliedIndex);
        assertTrue(dst.local.maybeGossipClusterConfig);
    }
}
