// file: server/src/test/java/io/rangelite/server/replica/TimestampCacheTest.java
package io.rangelite.server.replica;

import io.rangelite.core.Timestamp;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TimestampCacheTest {

    @Test
    void unknown_keys_read_the_low_water_mark() {
        TimestampCache c = new TimestampCache();
        c.setLowWater(new Timestamp(50, 0));

        assertEquals(new Timestamp(50, 0), c.get("missing"));
    }

    @Test
    void low_water_only_moves_forward_and_evicts_older_reads() {
        TimestampCache c = new TimestampCache();
        c.add("old", new Timestamp(10, 0));
        c.add("new", new Timestamp(90, 0));

        c.setLowWater(new Timestamp(50, 0));
        c.setLowWater(new Timestamp(20, 0));

        assertEquals(new Timestamp(50, 0), c.lowWater());
        assertEquals(1, c.size());
        assertEquals(new Timestamp(90, 0), c.get("new"));
        assertEquals(new Timestamp(50, 0), c.get("old"));
    }

    @Test
    void clear_forgets_reads_and_restarts_at_now() {
        TimestampCache c = new TimestampCache();
        c.setLowWater(new Timestamp(100, 0));
        c.add("k", new Timestamp(120, 0));

        c.clear(new Timestamp(80, 3));

        assertEquals(0, c.size());
        assertEquals(new Timestamp(80, 3), c.get("k"));
    }
}
