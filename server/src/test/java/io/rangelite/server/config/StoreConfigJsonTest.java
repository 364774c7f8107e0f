// file: server/src/test/java/io/rangelite/server/config/StoreConfigJsonTest.java
package io.rangelite.server.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class StoreConfigJsonTest {

    @TempDir
    Path dir;

    @Test
    void absent_fields_keep_their_defaults() throws Exception {
        Path file = dir.resolve("store.json");
        Files.writeString(file, "{\"storeId\":3,\"nodeId\":\"n3\",\"checksumGcIntervalMs\":1500,\"unknown\":true}");

        StoreConfig cfg = StoreConfig.fromJsonFile(file);
        StoreConfig d = StoreConfig.defaults(3, "n3");

        assertEquals(3, cfg.storeId());
        assertEquals("n3", cfg.nodeId());
        assertEquals(Duration.ofMillis(1500), cfg.checksumGcInterval());
        assertEquals(d.raftLogQueueStaleThreshold(), cfg.raftLogQueueStaleThreshold());
        assertEquals(d.replicaGcPriorityRemoved(), cfg.replicaGcPriorityRemoved());
        assertEquals(0, cfg.adminPort());
    }

    @Test
    void store_identity_is_required() throws Exception {
        Path file = dir.resolve("store.json");
        Files.writeString(file, "{\"nodeId\":\"n1\"}");

        assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromJsonFile(file));
    }

    @Test
    void invalid_values_are_rejected() throws Exception {
        Path file = dir.resolve("store.json");
        Files.writeString(file, "{\"storeId\":1,\"nodeId\":\"n1\",\"asyncTaskThreads\":0}");

        assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromJsonFile(file));
    }

    @Test
    void malformed_file_is_reported_with_its_path() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{not json");

        RuntimeException e = assertThrows(RuntimeException.class, () -> StoreConfig.fromJsonFile(file));
        assertTrue(e.getMessage().contains("broken.json"));
    }

    @Test
    void raft_log_check_frequency_follows_the_stale_threshold() {
        assertEquals(26, StoreConfig.defaults(1, "n1").raftLogCheckFrequency());
    }
}
