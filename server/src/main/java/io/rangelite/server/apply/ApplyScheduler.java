// file: server/src/main/java/io/rangelite/server/apply/ApplyScheduler.java
package io.rangelite.server.apply;

import io.rangelite.core.LocalEffects;
import io.rangelite.core.ProposalResult;
import io.rangelite.core.ReplicaCorruptionException;
import io.rangelite.server.replica.Replica;
import io.rangelite.server.store.Store;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies ordered commands, one single-threaded worker per range: commands of
 * a range apply strictly in submission order, different ranges in parallel.
 * <p>
 * A {@link ReplicaCorruptionException}, or any other failure escaping the
 * applier, halts the range it came from: its worker rejects every later
 * command and the listener is told, while other ranges keep going. The
 * proposer is always released, with a failure when the command did not apply.
 * Workers of ranges no longer in the store are shut down.
 */
public final class ApplyScheduler implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ApplyScheduler.class.getName());

    private final Store store;
    private final CommandApplier applier;
    private final FatalErrorListener fatalErrors;
    private final Map<Long, ExecutorService> workers = new ConcurrentHashMap<>();
    private final Set<Long> halted = ConcurrentHashMap.newKeySet();

    public ApplyScheduler(Store store, CommandApplier applier, FatalErrorListener fatalErrors) {
        this.store = Objects.requireNonNull(store, "store");
        this.applier = Objects.requireNonNull(applier, "applier");
        this.fatalErrors = Objects.requireNonNull(fatalErrors, "fatalErrors");
    }

    /** Queue the command behind earlier commands of its range. Completes once it is applied or rejected. */
    public CompletableFuture<Void> submit(AppliedCommand cmd) {
        while (true) {
            ExecutorService worker = workers.computeIfAbsent(cmd.rangeId(), this::newWorker);
            try {
                return CompletableFuture.runAsync(() -> applyOne(cmd), worker);
            } catch (RejectedExecutionException e) {
                // Retired between lookup and submission; the next lookup makes a fresh one.
                workers.remove(cmd.rangeId(), worker);
            }
        }
    }

    /** Number of live per-range workers. */
    int workerCount() {
        return workers.size();
    }

    public boolean isHalted(long rangeId) {
        return halted.contains(rangeId);
    }

    private void applyOne(AppliedCommand cmd) {
        LocalEffects completion = cmd.effects().local.copyCompletion();
        long rangeId = cmd.rangeId();
        ProposalResult fallback = ProposalResult.failed("range " + rangeId + " is halted");
        try {
            if (halted.contains(rangeId)) {
                return;
            }
            Replica r = store.replica(rangeId);
            if (r == null) {
                fallback = ProposalResult.failed("range " + rangeId + " not found");
                return;
            }
            try {
                applier.applyCommand(r, cmd, completion);
            } catch (ReplicaCorruptionException e) {
                halt(r, e);
            } catch (RuntimeException e) {
                halt(r, new ReplicaCorruptionException(r + ": unexpected failure applying command", e));
            }
        } finally {
            // No-op when the command already finished normally.
            CommandApplier.finishLocal(completion, fallback);
            retireWorkersWithoutReplica();
        }
    }

    private void halt(Replica r, ReplicaCorruptionException e) {
        halted.add(r.rangeId());
        log.log(Level.SEVERE, r + ": halting range after fatal error", e);
        fatalErrors.onFatalError(r.rangeId(), e);
    }

    /** Shut down the workers of ranges merged away or removed from the store. */
    private void retireWorkersWithoutReplica() {
        for (Map.Entry<Long, ExecutorService> e : workers.entrySet()) {
            if (store.replica(e.getKey()) == null && workers.remove(e.getKey(), e.getValue())) {
                // Commands already queued still run and fail as "not found".
                e.getValue().shutdown();
                log.fine(() -> "retired apply worker of r" + e.getKey());
            }
        }
    }

    private ExecutorService newWorker(long rangeId) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "apply-r" + rangeId);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void close() throws InterruptedException {
        for (ExecutorService w : workers.values()) {
            w.shutdown();
        }
        for (ExecutorService w : workers.values()) {
            if (!w.awaitTermination(5, TimeUnit.SECONDS)) {
                w.shutdownNow();
            }
        }
    }
}
