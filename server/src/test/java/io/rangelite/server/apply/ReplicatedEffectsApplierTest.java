// file: server/src/test/java/io/rangelite/server/apply/ReplicatedEffectsApplierTest.java
package io.rangelite.server.apply;

import io.rangelite.core.ChangeReplicasTrigger;
import io.rangelite.core.CommandEffects;
import io.rangelite.core.ComputeChecksum;
import io.rangelite.core.FrozenStatus;
import io.rangelite.core.Lease;
import io.rangelite.core.MergeTrigger;
import io.rangelite.core.ReplicaCorruptionException;
import io.rangelite.core.ReplicatedEffects;
import io.rangelite.core.SplitTrigger;
import io.rangelite.core.TokenRange;
import io.rangelite.core.TruncatedState;
import io.rangelite.server.TestStores;
import io.rangelite.server.config.StoreConfig;
import io.rangelite.server.replica.LeaseTransitionHandler;
import io.rangelite.server.replica.Replica;
import io.rangelite.storage.DurableEngine;
import io.rangelite.storage.InMemoryWal;
import io.rangelite.storage.PersistedReplicaState;
import io.rangelite.storage.ReplicaStateLoader;
import io.rangelite.storage.WriteBatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.rangelite.server.TestStores.activeLease;
import static io.rangelite.server.TestStores.desc;
import static io.rangelite.server.TestStores.replica;
import static io.rangelite.server.TestStores.stats;
import static io.rangelite.server.TestStores.ts;
import static org.junit.jupiter.api.Assertions.*;

public class ReplicatedEffectsApplierTest {

    private static final TokenRange LEFT = new TokenRange(0L, 1000L);
    private static final TokenRange RIGHT = new TokenRange(1000L, 0L);

    private TestStores t = new TestStores(1);
    private ReplicatedEffectsApplier applier = new ReplicatedEffectsApplier(t.store, new LeaseTransitionHandler());

    @AfterEach
    void tearDown() throws Exception {
        t.store.close();
    }

    private void reset(TestStores fresh) throws Exception {
        t.store.close();
        t = fresh;
        applier = new ReplicatedEffectsApplier(t.store, new LeaseTransitionHandler());
    }

    private Replica bootstrap(long rangeId, TokenRange span) {
        return t.store.bootstrapRange(desc(rangeId, span, 1, 2), activeLease(replica(1)));
    }

    private static AppliedCommand command(long rangeId, CommandEffects effects) {
        return new AppliedCommand(rangeId, replica(1), effects, List.of());
    }

    @Test
    void stats_and_indexes_apply_and_leave_the_record_empty() {
        Replica r = bootstrap(1, TokenRange.FULL);
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.raftAppliedIndex = 5;
        rr.leaseAppliedIndex = 3;
        rr.delta = stats(100, false);
        rr.timestamp = ts(TestStores.START);
        rr.leaseRequest = true;
        rr.consistencyRelated = true;

        boolean shouldAssert = applier.apply(r, rr);

        assertFalse(shouldAssert);
        assertTrue(rr.isEmpty());
        PersistedReplicaState s = r.persistedState();
        assertEquals(5, s.raftAppliedIndex());
        assertEquals(3, s.leaseAppliedIndex());
        assertEquals(stats(100, false), s.stats());
        assertEquals(100, t.store.metrics().snapshot().keyBytes() + t.store.metrics().snapshot().valBytes());
    }

    @Test
    void zero_lease_index_keeps_the_previous_one() {
        Replica r = bootstrap(1, TokenRange.FULL);
        ReplicatedEffects first = new ReplicatedEffects();
        first.raftAppliedIndex = 4;
        first.leaseAppliedIndex = 2;
        applier.apply(r, first);

        ReplicatedEffects second = new ReplicatedEffects();
        second.raftAppliedIndex = 5;
        applier.apply(r, second);

        assertEquals(5, r.persistedState().raftAppliedIndex());
        assertEquals(2, r.persistedState().leaseAppliedIndex());
    }

    @Test
    void raft_log_check_fires_once_per_frequency_window() {
        Replica r = bootstrap(1, TokenRange.FULL);
        long freq = t.store.config().raftLogCheckFrequency();

        ReplicatedEffects miss = new ReplicatedEffects();
        miss.raftAppliedIndex = freq;
        applier.apply(r, miss);
        assertTrue(t.raftLogQueue.maybeAdded.isEmpty());

        ReplicatedEffects hit = new ReplicatedEffects();
        hit.raftAppliedIndex = freq + 1;
        applier.apply(r, hit);
        assertEquals(List.of(1L), t.raftLogQueue.maybeAdded);
    }

    @Test
    void oversized_range_is_offered_to_the_split_queue() throws Exception {
        reset(new TestStores(new StoreConfig(1, "n1", 100, 50,
                Duration.ofHours(1), Duration.ofSeconds(5), 2.0, Duration.ofMillis(500), 2, 1 << 20, 0)));
        Replica r = bootstrap(1, TokenRange.FULL);
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.raftAppliedIndex = 2;
        rr.delta = stats(80, false);

        applier.apply(r, rr);

        assertEquals(List.of(1L), t.splitQueue.maybeAdded);
    }

    @Test
    void split_flushes_exact_stats_before_the_right_hand_side_exists() throws Exception {
        ReplicaStateLoader loader = new ReplicaStateLoader();
        List<boolean[]> commits = new CopyOnWriteArrayList<>();
        DurableEngine engine = new DurableEngine(new InMemoryWal()) {
            @Override
            public synchronized void commit(WriteBatch batch) {
                super.commit(batch);
                PersistedReplicaState lhs = loader.load(this, 1);
                boolean rhsExists = loader.load(this, 2) != null;
                commits.add(new boolean[]{lhs != null && lhs.stats().containsEstimates(), rhsExists});
            }
        };
        reset(new TestStores(StoreConfig.defaults(1, "n1"), b -> b.engine(engine)));
        Replica r = bootstrap(1, TokenRange.FULL);
        commits.clear();

        CommandEffects effects = new CommandEffects();
        effects.replicated.raftAppliedIndex = 7;
        effects.replicated.delta = stats(1000, true);
        effects.replicated.split = new SplitTrigger(desc(1, LEFT, 1, 2), desc(2, RIGHT, 1, 2), stats(400, false));
        new CommandApplier(t.store).applyCommand(r, command(1, effects));

        int firstWithRhs = -1;
        for (int i = 0; i < commits.size(); i++) {
            if (commits.get(i)[1]) {
                firstWithRhs = i;
                break;
            }
        }
        assertTrue(firstWithRhs > 0, "right-hand state was never written after the left-hand flush");
        assertFalse(commits.get(firstWithRhs - 1)[0], "estimates were still set when the split was written");

        Replica rhs = t.store.replica(2);
        assertNotNull(rhs);
        assertEquals(RIGHT, rhs.descriptor().span());
        assertEquals(LEFT, r.descriptor().span());
        assertEquals(stats(1000, false).minus(stats(400, false)), r.persistedState().stats());
        assertEquals(stats(400, false), rhs.persistedState().stats());
        assertEquals(r.lease(), rhs.lease());
        assertTrue(t.splitQueue.maybeAdded.contains(2L));
    }

    @Test
    void merge_absorbs_the_adjacent_right_hand_replica() {
        Replica lhs = bootstrap(1, LEFT);
        Replica rhs = bootstrap(2, RIGHT);
        rhs.lock();
        try {
            rhs.stateLocked().setStats(stats(300, false));
            rhs.persistAppliedStateLocked();
        } finally {
            rhs.unlock();
        }

        CommandEffects effects = new CommandEffects();
        effects.replicated.raftAppliedIndex = 3;
        effects.replicated.merge = new MergeTrigger(lhs.descriptor(), rhs.descriptor());
        new CommandApplier(t.store).applyCommand(lhs, command(1, effects));

        assertNull(t.store.replica(2));
        assertTrue(rhs.isDestroyed());
        assertEquals(TokenRange.FULL, lhs.descriptor().span());
        assertEquals(stats(300, false), lhs.persistedState().stats());
        assertNull(t.store.stateLoader().load(t.store.engine(), 2));
    }

    @Test
    void merge_without_the_right_hand_replica_is_fatal() {
        Replica lhs = bootstrap(1, LEFT);
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.merge = new MergeTrigger(lhs.descriptor(), desc(2, RIGHT, 1, 2));

        assertThrows(ReplicaCorruptionException.class, () -> applier.apply(lhs, rr));
    }

    @Test
    void descriptor_of_another_range_is_fatal() {
        Replica r = bootstrap(1, TokenRange.FULL);
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.descriptor = desc(7, TokenRange.FULL, 1);

        assertThrows(ReplicaCorruptionException.class, () -> applier.apply(r, rr));
    }

    @Test
    void removal_of_this_store_enqueues_replica_gc_once() {
        Replica r = bootstrap(1, TokenRange.FULL);
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.descriptor = desc(1, TokenRange.FULL, 2);
        rr.changeReplicas = new ChangeReplicasTrigger(
                ChangeReplicasTrigger.ChangeType.REMOVE_REPLICA, replica(1), List.of(replica(2)));

        assertTrue(applier.apply(r, rr));

        assertEquals(List.of(1L), t.replicaGcQueue.added);
        assertEquals(List.of(2.0), t.replicaGcQueue.priorities);
        assertTrue(rr.isEmpty());
    }

    @Test
    void removal_of_another_store_is_not_our_garbage() {
        Replica r = bootstrap(1, TokenRange.FULL);
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.changeReplicas = new ChangeReplicasTrigger(
                ChangeReplicasTrigger.ChangeType.REMOVE_REPLICA, replica(2), List.of(replica(1)));

        applier.apply(r, rr);

        assertTrue(t.replicaGcQueue.added.isEmpty());
    }

    @Test
    void full_replica_gc_queue_is_counted_not_fatal() {
        Replica r = bootstrap(1, TokenRange.FULL);
        t.replicaGcQueue.full = true;
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.changeReplicas = new ChangeReplicasTrigger(
                ChangeReplicasTrigger.ChangeType.REMOVE_REPLICA, replica(1), List.of(replica(2)));

        assertDoesNotThrow(() -> applier.apply(r, rr));
        assertEquals(1, t.store.metrics().snapshot().replicaGcEnqueueFailures());
    }

    @Test
    void truncation_clears_the_entry_cache_up_to_the_index() {
        Replica r = bootstrap(1, TokenRange.FULL);
        for (long i = 1; i <= 8; i++) {
            t.store.raftEntryCache().add(1, i, new byte[]{(byte) i});
        }
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.truncatedState = new TruncatedState(5, 2);

        applier.apply(r, rr);

        assertEquals(3, t.store.raftEntryCache().size(1));
        assertNull(t.store.raftEntryCache().get(1, 5));
        assertNotNull(t.store.raftEntryCache().get(1, 6));
        assertEquals(new TruncatedState(5, 2), r.persistedState().truncatedState());
    }

    @Test
    void gc_thresholds_and_frozen_status_land_in_state() {
        Replica r = bootstrap(1, TokenRange.FULL);
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.gcThreshold = ts(TestStores.START);
        rr.txnSpanGcThreshold = ts(TestStores.START).addWall(5);
        rr.frozenStatus = FrozenStatus.FROZEN;

        assertTrue(applier.apply(r, rr));

        PersistedReplicaState s = r.persistedState();
        assertEquals(ts(TestStores.START), s.gcThreshold());
        assertEquals(ts(TestStores.START).addWall(5), s.txnSpanGcThreshold());
        assertTrue(s.frozen());
    }

    @Test
    void checksum_request_starts_a_computation() throws Exception {
        Replica r = bootstrap(1, TokenRange.FULL);
        UUID id = UUID.randomUUID();
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.computeChecksum = new ComputeChecksum(id, false);

        applier.apply(r, rr);

        assertTrue(r.checksums().collect(id, Duration.ofSeconds(5)).ok());
    }

    @Test
    void block_reads_holds_read_only_commands_off_while_applying() {
        Replica r = bootstrap(1, TokenRange.FULL);
        ReplicatedEffects rr = new ReplicatedEffects();
        rr.blockReads = true;
        rr.lease = new Lease(replica(1), ts(TestStores.START), ts(TestStores.START).addWall(10), ts(TestStores.START).addWall(10));

        applier.apply(r, rr);

        assertFalse(r.readOnlyCmdLock().isWriteLocked());
        assertTrue(rr.isEmpty());
        assertEquals(replica(1), r.lease().holder());
    }
}
