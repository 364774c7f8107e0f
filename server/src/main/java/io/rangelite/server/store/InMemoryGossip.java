// file: server/src/main/java/io/rangelite/server/store/InMemoryGossip.java
package io.rangelite.server.store;

import io.rangelite.core.RangeDescriptor;
import io.rangelite.core.TokenRange;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Gossip sink that keeps the latest published value of each kind, for a
 * single-node deployment or for inspection.
 */
public final class InMemoryGossip implements GossipSink {
    private final AtomicReference<RangeDescriptor> firstRange = new AtomicReference<>();
    private final AtomicReference<byte[]> clusterConfig = new AtomicReference<>();
    private final List<TokenRange> livenessSpans = new CopyOnWriteArrayList<>();

    @Override
    public void publishFirstRange(RangeDescriptor descriptor) {
        firstRange.set(descriptor);
    }

    @Override
    public void publishClusterConfig(byte[] config) {
        clusterConfig.set(config.clone());
    }

    @Override
    public void publishNodeLiveness(long rangeId, TokenRange span) {
        livenessSpans.add(span);
    }

    public RangeDescriptor firstRange() {
        return firstRange.get();
    }

    public byte[] clusterConfig() {
        byte[] c = clusterConfig.get();
        return c == null ? null : c.clone();
    }

    public List<TokenRange> livenessSpans() {
        return List.copyOf(livenessSpans);
    }
}
