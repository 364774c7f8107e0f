// file: server/src/main/java/io/rangelite/server/store/StoreMetrics.java
package io.rangelite.server.store;

import io.rangelite.core.MvccStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Store-wide counters.
 *  - live/key/val bytes and counts, intent count: running totals of applied stats deltas.
 *  - leaseRequestSuccess / leaseRequestError: outcomes of lease requests proposed here.
 *  - checksumsStarted / checksumsFailed: consistency checksum computations.
 *  - replicaGcEnqueueFailures: removed replicas the GC queue did not accept.
 */
public final class StoreMetrics {

    private final AtomicLong liveBytes = new AtomicLong();
    private final AtomicLong keyBytes = new AtomicLong();
    private final AtomicLong valBytes = new AtomicLong();
    private final AtomicLong liveCount = new AtomicLong();
    private final AtomicLong keyCount = new AtomicLong();
    private final AtomicLong valCount = new AtomicLong();
    private final AtomicLong intentCount = new AtomicLong();
    private final AtomicLong leaseRequestSuccess = new AtomicLong();
    private final AtomicLong leaseRequestError = new AtomicLong();
    private final AtomicLong checksumsStarted = new AtomicLong();
    private final AtomicLong checksumsFailed = new AtomicLong();
    private final AtomicLong replicaGcEnqueueFailures = new AtomicLong();

    public void addMvccStats(MvccStats delta) {
        liveBytes.addAndGet(delta.liveBytes());
        keyBytes.addAndGet(delta.keyBytes());
        valBytes.addAndGet(delta.valBytes());
        liveCount.addAndGet(delta.liveCount());
        keyCount.addAndGet(delta.keyCount());
        valCount.addAndGet(delta.valCount());
        intentCount.addAndGet(delta.intentCount());
    }

    public void leaseRequestComplete(boolean success) {
        if (success) {
            leaseRequestSuccess.incrementAndGet();
        } else {
            leaseRequestError.incrementAndGet();
        }
    }

    public void checksumStarted() {
        checksumsStarted.incrementAndGet();
    }

    public void checksumFailed() {
        checksumsFailed.incrementAndGet();
    }

    public void replicaGcEnqueueFailed() {
        replicaGcEnqueueFailures.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                liveBytes.get(), keyBytes.get(), valBytes.get(),
                liveCount.get(), keyCount.get(), valCount.get(), intentCount.get(),
                leaseRequestSuccess.get(), leaseRequestError.get(),
                checksumsStarted.get(), checksumsFailed.get(),
                replicaGcEnqueueFailures.get()
        );
    }

    public record Snapshot(
            long liveBytes,
            long keyBytes,
            long valBytes,
            long liveCount,
            long keyCount,
            long valCount,
            long intentCount,
            long leaseRequestSuccess,
            long leaseRequestError,
            long checksumsStarted,
            long checksumsFailed,
            long replicaGcEnqueueFailures
    ) {
    }
}
