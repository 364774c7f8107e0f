// file: server/src/main/java/io/rangelite/server/checksum/ChecksumCoordinator.java
package io.rangelite.server.checksum;

import io.rangelite.core.RangeDescriptor;
import io.rangelite.server.replica.Replica;
import io.rangelite.storage.EngineSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deduplicated, asynchronous consistency checksums of one replica.
 * <p>
 * Each checksum id moves through absent -> pending -> done:
 *  - requestCompute marks the entry started under the replica lock, so at
 *    most one computation per id ever runs.
 *  - the computation runs on the store's async pool against a snapshot
 *    taken when it is requested; on failure the entry still completes, with
 *    a null digest.
 *  - await hands out the entry's one-shot notify future; a collector that
 *    arrives before the request creates an unstarted entry whose future the
 *    later request reuses. An unstarted entry is dropped when its last
 *    collector gives up.
 *  - done and unstarted entries carry a GC deadline and are swept by the
 *    next requestCompute.
 * <p>
 * The entry table is guarded by the replica lock.
 */
public final class ChecksumCoordinator {
    private static final Logger log = Logger.getLogger(ChecksumCoordinator.class.getName());

    private static final class Entry {
        final CompletableFuture<ChecksumResult> notify = new CompletableFuture<>();
        boolean started;
        int collectors;
        ChecksumResult result;
        Instant gcDeadline;
    }

    private final Replica replica;
    private final Map<UUID, Entry> entries = new HashMap<>();

    public ChecksumCoordinator(Replica replica) {
        this.replica = replica;
    }

    /**
     * Start computing checksum {@code id} unless it already runs or ran.
     * Never blocks on the computation.
     */
    public void requestCompute(UUID id, boolean includeSnapshotData) {
        RangeDescriptor desc;
        Entry entry;
        replica.lock();
        try {
            gcOldChecksumEntriesLocked(replica.store().clock().physicalNow());
            entry = entries.get(id);
            if (entry != null && entry.started) {
                log.fine(() -> replica + ": checksum " + id + " already started");
                return;
            }
            if (entry == null) {
                entry = new Entry();
                entries.put(id, entry);
            }
            entry.started = true;
            entry.gcDeadline = null;
            desc = replica.stateLocked().descriptor();
        } finally {
            replica.unlock();
        }

        replica.store().metrics().checksumStarted();
        EngineSnapshot taken = null;
        try {
            // Taken here, on the apply path, so the digest reflects exactly this applied command.
            taken = replica.store().engine().newSnapshot();
            EngineSnapshot snap = taken;
            replica.store().stopper().runAsyncTask("checksum " + id, () -> {
                ChecksumResult result;
                try (snap) {
                    result = ReplicaDigests.compute(snap, desc, includeSnapshotData);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, replica + ": checksum " + id + " computation failed", e);
                    replica.store().metrics().checksumFailed();
                    result = ChecksumResult.FAILED;
                }
                computeChecksumDone(id, result);
            });
        } catch (RuntimeException e) {
            if (taken != null) {
                taken.close();
            }
            log.log(Level.WARNING, replica + ": could not start checksum " + id, e);
            replica.store().metrics().checksumFailed();
            computeChecksumDone(id, ChecksumResult.FAILED);
        }
    }

    /**
     * Notify future of checksum {@code id}; completes when the digest is known.
     * Already complete when the checksum is done.
     */
    public CompletableFuture<ChecksumResult> await(UUID id) {
        replica.lock();
        try {
            return entryLocked(id).notify;
        } finally {
            replica.unlock();
        }
    }

    private Entry entryLocked(UUID id) {
        return entries.computeIfAbsent(id, k -> {
            Entry e = new Entry();
            e.gcDeadline = replica.store().clock().physicalNow()
                    .plus(replica.store().config().checksumGcInterval());
            return e;
        });
    }

    /**
     * Wait up to {@code timeout} for checksum {@code id}.
     *
     * @throws ChecksumUnavailableException if the computation failed or did not finish in time
     */
    public ChecksumResult collect(UUID id, Duration timeout)
            throws ChecksumUnavailableException, InterruptedException {
        Entry entry;
        replica.lock();
        try {
            entry = entryLocked(id);
            entry.collectors++;
        } finally {
            replica.unlock();
        }
        ChecksumResult result;
        try {
            result = entry.notify.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ChecksumUnavailableException(
                    replica + ": checksum " + id + " not computed within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            throw new ChecksumUnavailableException(replica + ": checksum " + id + " failed: " + e.getCause());
        } finally {
            releaseCollector(id, entry);
        }
        if (!result.ok()) {
            throw new ChecksumUnavailableException(replica + ": no checksum found for " + id);
        }
        return result;
    }

    /** Number of entries in the table, done or not. */
    public int size() {
        replica.lock();
        try {
            return entries.size();
        } finally {
            replica.unlock();
        }
    }

    private void releaseCollector(UUID id, Entry entry) {
        replica.lock();
        try {
            entry.collectors--;
            if (!entry.started && entry.collectors == 0) {
                entries.remove(id, entry);
            }
        } finally {
            replica.unlock();
        }
    }

    private void computeChecksumDone(UUID id, ChecksumResult result) {
        Entry entry;
        replica.lock();
        try {
            entry = entries.get(id);
            if (entry == null) {
                log.severe(() -> replica + ": no map entry for checksum " + id);
                return;
            }
            entry.result = result;
            entry.gcDeadline = replica.store().clock().physicalNow()
                    .plus(replica.store().config().checksumGcInterval());
        } finally {
            replica.unlock();
        }
        entry.notify.complete(result);
    }

    private void gcOldChecksumEntriesLocked(Instant now) {
        Iterator<Map.Entry<UUID, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Entry e = it.next().getValue();
            if (e.gcDeadline != null && now.isAfter(e.gcDeadline) && e.collectors == 0) {
                it.remove();
            }
        }
    }
}
