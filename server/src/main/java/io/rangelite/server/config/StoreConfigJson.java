// file: server/src/main/java/io/rangelite/server/config/StoreConfigJson.java
package io.rangelite.server.config;

/**
 * JSON shape of a store configuration file. Absent fields keep their defaults.
 * Durations are in milliseconds.
 */
public class StoreConfigJson {
    public Integer storeId;
    public String nodeId;
    public Long raftLogQueueStaleThreshold;
    public Long rangeMaxBytes;
    public Long checksumGcIntervalMs;
    public Long checksumCollectTimeoutMs;
    public Double replicaGcPriorityRemoved;
    public Long maxClockOffsetMs;
    public Integer asyncTaskThreads;
    public Long walRotateBytes;
    public Integer adminPort;
}
