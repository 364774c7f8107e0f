// file: server/src/test/java/io/rangelite/server/apply/CommandApplierTest.java
package io.rangelite.server.apply;

import io.rangelite.core.CommandEffects;
import io.rangelite.core.CommandReply;
import io.rangelite.core.Lease;
import io.rangelite.core.LocalEffects;
import io.rangelite.core.Mutation;
import io.rangelite.core.ProposalResult;
import io.rangelite.core.ReplicaCorruptionException;
import io.rangelite.core.TokenRange;
import io.rangelite.server.TestStores;
import io.rangelite.server.replica.Replica;
import io.rangelite.storage.KeyLayout;
import io.rangelite.storage.PersistedReplicaState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static io.rangelite.server.TestStores.activeLease;
import static io.rangelite.server.TestStores.desc;
import static io.rangelite.server.TestStores.replica;
import static io.rangelite.server.TestStores.stats;
import static io.rangelite.server.TestStores.ts;
import static org.junit.jupiter.api.Assertions.*;

public class CommandApplierTest {

    private TestStores t;
    private CommandApplier applier;
    private Replica r;

    @BeforeEach
    void setUp() {
        t = new TestStores(1);
        applier = new CommandApplier(t.store);
        r = t.store.bootstrapRange(desc(1, TokenRange.FULL, 1, 2), activeLease(replica(1)));
    }

    @AfterEach
    void tearDown() throws Exception {
        t.store.close();
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void first_lease_of_a_fresh_range_is_acquired() throws Exception {
        TestStores fresh = new TestStores(1);
        try {
            Replica leaseless = fresh.store.bootstrapRange(desc(1, TokenRange.FULL, 1, 2), Lease.none());
            CommandEffects effects = new CommandEffects();
            effects.replicated.raftAppliedIndex = 1;
            effects.replicated.lease = activeLease(replica(1));
            CompletableFuture<ProposalResult> channel = new CompletableFuture<>();
            effects.local.resultChannel = channel;

            new CommandApplier(fresh.store).applyCommand(leaseless, new AppliedCommand(1, replica(1), effects, List.of()));

            assertNull(channel.getNow(null).error());
            assertEquals(replica(1), leaseless.lease().holder());
            assertEquals(activeLease(replica(1)).start(), leaseless.tsCache().lowWater());
            assertEquals(replica(1), fresh.store.stateLoader().load(fresh.store.engine(), 1).lease().holder());
        } finally {
            fresh.store.close();
        }
    }

    @Test
    void writes_and_state_commit_together_and_the_client_is_released() throws Exception {
        List<String> events = new ArrayList<>();
        CompletableFuture<ProposalResult> channel = new CompletableFuture<>();
        channel.thenRun(() -> events.add("channel"));
        CommandEffects effects = new CommandEffects();
        effects.replicated.raftAppliedIndex = 11;
        effects.replicated.leaseAppliedIndex = 4;
        effects.replicated.delta = stats(10, false);
        effects.local.resultChannel = channel;
        effects.local.completionHook = (reply, error, retry) -> events.add("hook");
        effects.local.reply = new CommandReply(ts(TestStores.START), List.of("OK"));

        applier.applyCommand(r, new AppliedCommand(1, replica(1), effects,
                List.of(Mutation.put("a", utf8("1")), Mutation.delete("gone"))));

        assertArrayEquals(utf8("1"), t.store.engine().get(KeyLayout.userKey("a")));
        PersistedReplicaState onDisk = t.store.stateLoader().load(t.store.engine(), 1);
        assertEquals(11, onDisk.raftAppliedIndex());
        assertEquals(4, onDisk.leaseAppliedIndex());
        assertEquals(stats(10, false), onDisk.stats());
        assertEquals(onDisk, r.persistedState());

        ProposalResult res = channel.get();
        assertEquals(List.of("OK"), res.reply().responses());
        assertNull(res.error());
        assertEquals(List.of("hook", "channel"), events);
        assertTrue(effects.isEmpty());
    }

    @Test
    void nontrivial_effects_pass_the_state_check() {
        CommandEffects effects = new CommandEffects();
        effects.replicated.raftAppliedIndex = 2;
        effects.replicated.lease = activeLease(replica(2));
        effects.replicated.gcThreshold = ts(TestStores.START);
        effects.local.raftLogSizeEstimate = 100L;

        assertDoesNotThrow(() -> applier.applyCommand(r, new AppliedCommand(1, replica(2), effects, List.of())));
        assertEquals(replica(2), r.lease().holder());
        assertEquals(100L, r.raftLogSize());
    }

    @Test
    void state_check_detects_memory_drifting_from_disk() {
        r.lock();
        try {
            r.stateLocked().setStats(stats(999, false));
        } finally {
            r.unlock();
        }

        ReplicaCorruptionException e = assertThrows(ReplicaCorruptionException.class, () -> applier.assertState(r));
        assertTrue(e.getMessage().contains("on-disk"));
    }

    @Test
    void finish_local_runs_the_hook_once() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        LocalEffects completion = new LocalEffects();
        completion.completionHook = (reply, error, retry) -> calls.incrementAndGet();
        completion.resultChannel = new CompletableFuture<>();
        CompletableFuture<ProposalResult> channel = completion.resultChannel;

        CommandApplier.finishLocal(completion, ProposalResult.failed("first"));
        CommandApplier.finishLocal(completion, ProposalResult.failed("second"));

        assertEquals(1, calls.get());
        assertEquals("first", channel.get().error().message());
        assertNull(completion.completionHook);
        assertNull(completion.resultChannel);
    }

    @Test
    void command_without_a_waiting_client_still_applies() {
        CommandEffects effects = new CommandEffects();
        effects.replicated.raftAppliedIndex = 3;

        applier.applyCommand(r, new AppliedCommand(1, replica(2), effects, List.of(Mutation.put("b", utf8("2")))));

        assertEquals(3, r.persistedState().raftAppliedIndex());
        assertNotNull(t.store.engine().get(KeyLayout.userKey("b")));
    }
}
