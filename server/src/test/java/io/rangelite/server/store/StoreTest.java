// file: server/src/test/java/io/rangelite/server/store/StoreTest.java
package io.rangelite.server.store;

import io.rangelite.core.CommandEffects;
import io.rangelite.core.Mutation;
import io.rangelite.core.TokenRange;
import io.rangelite.server.TestStores;
import io.rangelite.server.apply.AppliedCommand;
import io.rangelite.server.apply.CommandApplier;
import io.rangelite.server.config.StoreConfig;
import io.rangelite.server.replica.Replica;
import io.rangelite.storage.PersistedReplicaState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static io.rangelite.server.TestStores.activeLease;
import static io.rangelite.server.TestStores.desc;
import static io.rangelite.server.TestStores.replica;
import static io.rangelite.server.TestStores.stats;
import static org.junit.jupiter.api.Assertions.*;

public class StoreTest {

    @TempDir
    Path walDir;

    private TestStores open() {
        return new TestStores(StoreConfig.defaults(1, "n1"), b -> b.walDir(walDir));
    }

    @Test
    void applied_state_survives_a_restart() throws Exception {
        PersistedReplicaState before;
        TestStores first = open();
        try {
            Replica r = first.store.bootstrapRange(desc(1, TokenRange.FULL, 1, 2), activeLease(replica(1)));
            CommandEffects effects = new CommandEffects();
            effects.replicated.raftAppliedIndex = 9;
            effects.replicated.leaseAppliedIndex = 2;
            effects.replicated.delta = stats(64, false);
            new CommandApplier(first.store).applyCommand(r, new AppliedCommand(1, replica(1), effects,
                    List.of(Mutation.put("k", "v".getBytes(StandardCharsets.UTF_8)))));
            before = r.persistedState();
        } finally {
            first.store.close();
        }

        TestStores second = open();
        try {
            assertEquals(1, second.store.loadReplicas());
            Replica r = second.store.replica(1);
            assertNotNull(r);
            assertEquals(before, r.persistedState());
            assertEquals(0, second.store.loadReplicas());
        } finally {
            second.store.close();
        }
    }

    @Test
    void bootstrapping_an_existing_range_fails() throws Exception {
        TestStores t = new TestStores(1);
        try {
            t.store.bootstrapRange(desc(1, TokenRange.FULL, 1), activeLease(replica(1)));
            assertThrows(IllegalStateException.class,
                    () -> t.store.bootstrapRange(desc(1, TokenRange.FULL, 1), activeLease(replica(1))));
        } finally {
            t.store.close();
        }
    }

    @Test
    void bootstrapping_without_a_lease_object_is_rejected() throws Exception {
        TestStores t = new TestStores(1);
        try {
            assertThrows(NullPointerException.class,
                    () -> t.store.bootstrapRange(desc(1, TokenRange.FULL, 1), null));
            assertNull(t.store.replica(1));
        } finally {
            t.store.close();
        }
    }

    @Test
    void removed_replica_is_destroyed_and_forgotten() throws Exception {
        TestStores t = new TestStores(1);
        try {
            Replica r = t.store.bootstrapRange(desc(3, TokenRange.FULL, 1), activeLease(replica(1)));
            t.store.raftEntryCache().add(3, 1, new byte[]{1});

            t.store.removeReplica(r);

            assertTrue(r.isDestroyed());
            assertNull(t.store.replica(3));
            assertEquals(0, t.store.raftEntryCache().size(3));
            assertTrue(t.store.stateLoader().loadRangeIds(t.store.engine()).isEmpty());
        } finally {
            t.store.close();
        }
    }

    @Test
    void default_split_queue_admits_only_oversized_ranges() throws Exception {
        StoreConfig cfg = new StoreConfig(1, "n1", 100, 100, Duration.ofHours(1),
                Duration.ofSeconds(5), 2.0, Duration.ofMillis(500), 1, 1 << 20, 0);
        try (Store store = Store.builder(cfg).build()) {
            Replica small = store.bootstrapRange(desc(1, new TokenRange(0L, 10L), 1), activeLease(replica(1)));
            Replica big = store.bootstrapRange(desc(2, new TokenRange(10L, 0L), 1), activeLease(replica(1)));
            big.lock();
            try {
                big.stateLocked().setStats(stats(500, false));
            } finally {
                big.unlock();
            }

            store.splitQueue().maybeAdd(small, store.clock().now());
            store.splitQueue().maybeAdd(big, store.clock().now());

            InMemoryReplicaQueue q = (InMemoryReplicaQueue) store.splitQueue();
            assertFalse(q.contains(1));
            assertTrue(q.contains(2));
        }
    }
}
