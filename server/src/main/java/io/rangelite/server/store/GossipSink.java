// file: server/src/main/java/io/rangelite/server/store/GossipSink.java
package io.rangelite.server.store;

import io.rangelite.core.RangeDescriptor;
import io.rangelite.core.TokenRange;

/**
 * Cluster-metadata propagation. All calls are best effort and unacknowledged.
 */
public interface GossipSink {

    void publishFirstRange(RangeDescriptor descriptor);

    void publishClusterConfig(byte[] config);

    void publishNodeLiveness(long rangeId, TokenRange span);
}
