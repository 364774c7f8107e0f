// file: server/src/main/java/io/rangelite/server/admin/RangeStateResponse.java
package io.rangelite.server.admin;

import io.rangelite.core.Lease;
import io.rangelite.core.MvccStats;
import io.rangelite.core.RangeDescriptor;
import io.rangelite.core.Timestamp;
import io.rangelite.core.TruncatedState;

/** Body of GET /admin/ranges/{rangeId}. */
public class RangeStateResponse {
    public long rangeId;
    public RangeDescriptor descriptor;
    public Lease lease;
    public long raftAppliedIndex;
    public long leaseAppliedIndex;
    public MvccStats stats;
    public TruncatedState truncatedState;
    public Timestamp gcThreshold;
    public Timestamp txnSpanGcThreshold;
    public boolean frozen;
    public long raftLogSize;
    public boolean halted;
}
