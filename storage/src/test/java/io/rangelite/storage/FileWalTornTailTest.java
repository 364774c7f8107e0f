package io.rangelite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;

    private static byte[] batch(String key, String value) {
        return RecordCodec.encode(List.of(new WriteBatch.Op("u/" + key, value.getBytes())));
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_batches() throws Exception {
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(batch("k1", "v1"));
        wal.append(batch("k2", "v2"));
        // Third record only partially written (simulated crash mid-append).
        byte[] r3 = batch("k3", "v3");
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5);
            out.flush();
        }
        wal.close();

        var engine = new DurableEngine(new FileWal(walDir, 1L << 60));

        assertArrayEquals("v1".getBytes(), engine.get("u/k1"));
        assertArrayEquals("v2".getBytes(), engine.get("u/k2"));
        assertNull(engine.get("u/k3"));
    }

    @Test
    void replay_stops_at_corrupted_payload() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(batch("k1", "v1"));
        byte[] bad = batch("k2", "v2");
        bad[bad.length - 1] ^= 0x7F; // payload no longer matches its CRC
        wal.append(bad);
        wal.append(batch("k3", "v3"));
        wal.close();

        var engine = new DurableEngine(new FileWal(walDir, 1L << 60));

        assertArrayEquals("v1".getBytes(), engine.get("u/k1"));
        assertNull(engine.get("u/k2"));
        assertNull(engine.get("u/k3"));
    }

    @Test
    void appends_after_a_torn_tail_survive_the_next_restart() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(batch("k1", "v1"));
        byte[] torn = batch("k2", "v2");
        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(torn, 0, 7);
        }
        wal.close();

        var engine = new DurableEngine(new FileWal(walDir, 1L << 60));
        engine.commit(engine.newBatch().put("u/k3", "v3".getBytes()));
        engine.close();

        var reopened = new DurableEngine(new FileWal(walDir, 1L << 60));
        assertArrayEquals("v1".getBytes(), reopened.get("u/k1"));
        assertNull(reopened.get("u/k2"));
        assertArrayEquals("v3".getBytes(), reopened.get("u/k3"));
    }
}
