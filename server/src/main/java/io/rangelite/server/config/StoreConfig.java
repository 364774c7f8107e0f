// file: server/src/main/java/io/rangelite/server/config/StoreConfig.java
package io.rangelite.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-store configuration.
 *
 *  - storeId / nodeId:           identity of the local store.
 *  - raftLogQueueStaleThreshold: log entries after which truncation is worth checking.
 *  - rangeMaxBytes:              a range above this size is a split candidate.
 *  - checksumGcInterval:         how long a computed checksum stays collectable.
 *  - checksumCollectTimeout:     how long a collector waits for a digest.
 *  - replicaGcPriorityRemoved:   replica-GC queue priority of a replica removed from its range.
 *  - maxClockOffset:             clock offset tolerated between nodes.
 *  - asyncTaskThreads:           threads running checksum and gossip tasks.
 *  - walRotateBytes:             WAL segment size.
 *  - adminPort:                  admin HTTP port, 0 to disable.
 */
public record StoreConfig(
        int storeId,
        String nodeId,
        long raftLogQueueStaleThreshold,
        long rangeMaxBytes,
        Duration checksumGcInterval,
        Duration checksumCollectTimeout,
        double replicaGcPriorityRemoved,
        Duration maxClockOffset,
        int asyncTaskThreads,
        long walRotateBytes,
        int adminPort
) {

    public StoreConfig {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(checksumGcInterval, "checksumGcInterval");
        Objects.requireNonNull(checksumCollectTimeout, "checksumCollectTimeout");
        Objects.requireNonNull(maxClockOffset, "maxClockOffset");
        if (storeId <= 0) throw new IllegalArgumentException("storeId must be > 0");
        if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
        if (raftLogQueueStaleThreshold <= 0) throw new IllegalArgumentException("raftLogQueueStaleThreshold must be > 0");
        if (rangeMaxBytes <= 0) throw new IllegalArgumentException("rangeMaxBytes must be > 0");
        if (checksumGcInterval.isNegative()) throw new IllegalArgumentException("checksumGcInterval must be >= 0");
        if (checksumCollectTimeout.isNegative() || checksumCollectTimeout.isZero()) {
            throw new IllegalArgumentException("checksumCollectTimeout must be > 0");
        }
        if (maxClockOffset.isNegative()) throw new IllegalArgumentException("maxClockOffset must be >= 0");
        if (asyncTaskThreads <= 0) throw new IllegalArgumentException("asyncTaskThreads must be > 0");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (adminPort < 0 || adminPort > 65535) throw new IllegalArgumentException("adminPort out of range");
    }

    public static StoreConfig defaults(int storeId, String nodeId) {
        return new StoreConfig(
                storeId,
                nodeId,
                100,
                64L << 20,
                Duration.ofHours(1),
                Duration.ofSeconds(5),
                2.0,
                Duration.ofMillis(500),
                4,
                64L << 20,
                0
        );
    }

    /** Applied-index interval between two raft-log truncation checks. */
    public long raftLogCheckFrequency() {
        return 1 + raftLogQueueStaleThreshold / 4;
    }

    public static StoreConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            StoreConfigJson cfg = mapper.readValue(path.toFile(), StoreConfigJson.class);
            if (cfg.storeId == null || cfg.nodeId == null) {
                throw new IllegalArgumentException("storeId and nodeId are required in " + path);
            }
            StoreConfig d = defaults(cfg.storeId, cfg.nodeId);
            return new StoreConfig(
                    cfg.storeId,
                    cfg.nodeId,
                    cfg.raftLogQueueStaleThreshold != null ? cfg.raftLogQueueStaleThreshold : d.raftLogQueueStaleThreshold,
                    cfg.rangeMaxBytes != null ? cfg.rangeMaxBytes : d.rangeMaxBytes,
                    cfg.checksumGcIntervalMs != null ? Duration.ofMillis(cfg.checksumGcIntervalMs) : d.checksumGcInterval,
                    cfg.checksumCollectTimeoutMs != null ? Duration.ofMillis(cfg.checksumCollectTimeoutMs) : d.checksumCollectTimeout,
                    cfg.replicaGcPriorityRemoved != null ? cfg.replicaGcPriorityRemoved : d.replicaGcPriorityRemoved,
                    cfg.maxClockOffsetMs != null ? Duration.ofMillis(cfg.maxClockOffsetMs) : d.maxClockOffset,
                    cfg.asyncTaskThreads != null ? cfg.asyncTaskThreads : d.asyncTaskThreads,
                    cfg.walRotateBytes != null ? cfg.walRotateBytes : d.walRotateBytes,
                    cfg.adminPort != null ? cfg.adminPort : d.adminPort
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load StoreConfig from " + path, e);
        }
    }
}
