// file: core/src/main/java/io/rangelite/core/Lease.java
package io.rangelite.core;

import java.util.Objects;

/**
 * Time-bounded grant to a single replica of the right to serve reads and
 * coordinate writes for a range.
 * <p>
 * A lease is usable in [start, startStasis). The stasis period
 * [startStasis, expiration) absorbs clock offset between nodes, which is
 * what allows a transferred lease to formally overlap its predecessor.
 */
public record Lease(
        ReplicaDescriptor holder,
        Timestamp start,
        Timestamp startStasis,
        Timestamp expiration
) {

    public Lease {
        Objects.requireNonNull(holder, "holder");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(startStasis, "startStasis");
        Objects.requireNonNull(expiration, "expiration");
        if (startStasis.less(start) || expiration.less(startStasis)) {
            throw new IllegalArgumentException(
                    "lease bounds out of order: " + start + " / " + startStasis + " / " + expiration);
        }
    }

    public static Lease none() {
        return new Lease(ReplicaDescriptor.NONE, Timestamp.ZERO, Timestamp.ZERO, Timestamp.ZERO);
    }

    public boolean covers(Timestamp now) {
        return !now.less(start) && now.less(startStasis);
    }

    public boolean ownedBy(int storeId) {
        return holder.storeId() == storeId;
    }

    @Override
    public String toString() {
        return "lease(replica=" + holder.replicaId() + "@s" + holder.storeId()
                + " " + start + ".." + expiration + ")";
    }
}
