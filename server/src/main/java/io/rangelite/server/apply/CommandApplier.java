// file: server/src/main/java/io/rangelite/server/apply/CommandApplier.java
package io.rangelite.server.apply;

import io.rangelite.core.CommandEffects;
import io.rangelite.core.CompletionHook;
import io.rangelite.core.FrozenStatus;
import io.rangelite.core.LocalEffects;
import io.rangelite.core.MvccStats;
import io.rangelite.core.Mutation;
import io.rangelite.core.ProposalResult;
import io.rangelite.core.ReplicaCorruptionException;
import io.rangelite.core.ReplicaDescriptor;
import io.rangelite.core.ReplicatedEffects;
import io.rangelite.server.replica.LeaseTransitionHandler;
import io.rangelite.server.replica.Replica;
import io.rangelite.server.replica.ReplicaState;
import io.rangelite.server.store.Store;
import io.rangelite.storage.KeyLayout;
import io.rangelite.storage.PersistedReplicaState;
import io.rangelite.storage.ReplicaStateLoader;
import io.rangelite.storage.WriteBatch;

import java.util.concurrent.CompletableFuture;

/**
 * Applies one ordered command to a replica:
 *  1) commit its writes and the resulting persisted state in one engine batch,
 *  2) apply its replicated and then its local side effects,
 *  3) when either reports a nontrivial effect, check memory against disk,
 *  4) release the proposer's waiting client.
 */
public final class CommandApplier {

    private final Store store;
    private final ReplicatedEffectsApplier replicated;
    private final LocalEffectsApplier local;

    public CommandApplier(Store store) {
        this(store, new LeaseTransitionHandler());
    }

    public CommandApplier(Store store, LeaseTransitionHandler leaseHandler) {
        this.store = store;
        this.replicated = new ReplicatedEffectsApplier(store, leaseHandler);
        this.local = new LocalEffectsApplier(store);
    }

    /** Apply the command and finish it with its evaluated outcome. */
    public void applyCommand(Replica r, AppliedCommand cmd) {
        applyCommand(r, cmd, cmd.effects().local.copyCompletion());
    }

    /**
     * As {@link #applyCommand(Replica, AppliedCommand)}, finishing {@code completion},
     * which the caller copied out of the record before the record is consumed.
     */
    void applyCommand(Replica r, AppliedCommand cmd, LocalEffects completion) {
        ProposalResult outcome = cmd.effects().local.outcome();
        applyRaftCommand(r, cmd);
        handleEvalResult(r, cmd.proposer(), cmd.effects());
        finishLocal(completion, outcome);
    }

    /**
     * Commit the command's writes together with the replica state it leads to.
     * The in-memory state is not touched; {@link #handleEvalResult} brings it in line.
     */
    public void applyRaftCommand(Replica r, AppliedCommand cmd) {
        ReplicatedEffects rr = cmd.effects().replicated;
        ReplicaStateLoader loader = store.stateLoader();
        WriteBatch batch = store.engine().newBatch();
        for (Mutation m : cmd.writes()) {
            if (m.deletion()) {
                batch.delete(KeyLayout.userKey(m.key()));
            } else {
                batch.put(KeyLayout.userKey(m.key()), m.value());
            }
        }

        long rangeId = r.rangeId();
        r.lock();
        try {
            ReplicaState s = r.stateLocked();
            long raftIndex = rr.raftAppliedIndex != 0 ? rr.raftAppliedIndex : s.raftAppliedIndex();
            long leaseIndex = rr.leaseAppliedIndex != 0 ? rr.leaseAppliedIndex : s.leaseAppliedIndex();
            MvccStats stats = s.stats().plus(rr.delta);
            loader.stageAppliedState(batch, rangeId, raftIndex, leaseIndex, stats);
            if (rr.descriptor != null && rr.descriptor.rangeId() == rangeId) {
                loader.stageDescriptor(batch, rr.descriptor);
            }
            if (rr.lease != null) {
                loader.stageLease(batch, rangeId, rr.lease);
            }
            if (rr.truncatedState != null) {
                loader.stageTruncatedState(batch, rangeId, rr.truncatedState);
            }
            if (!rr.gcThreshold.isZero()) {
                loader.stageGcThreshold(batch, rangeId, rr.gcThreshold);
            }
            if (!rr.txnSpanGcThreshold.isZero()) {
                loader.stageTxnSpanGcThreshold(batch, rangeId, rr.txnSpanGcThreshold);
            }
            if (rr.frozenStatus != FrozenStatus.UNSPECIFIED) {
                loader.stageFrozen(batch, rangeId, rr.frozenStatus == FrozenStatus.FROZEN);
            }
            try {
                store.engine().commit(batch);
            } catch (RuntimeException e) {
                // Memory would run ahead of disk from here on.
                throw new ReplicaCorruptionException(r + ": failed to commit applied command", e);
            }
        } finally {
            r.unlock();
        }
    }

    /**
     * Apply both halves of the side effects. Both always run; the state check
     * runs if either asks for it.
     */
    public void handleEvalResult(Replica r, ReplicaDescriptor proposer, CommandEffects effects) {
        boolean shouldAssert = replicated.apply(r, effects.replicated);
        if (local.apply(r, proposer, effects.local)) {
            shouldAssert = true;
        }
        if (shouldAssert) {
            assertState(r);
        }
    }

    /**
     * Compare the in-memory replicated state with what the engine holds.
     *
     * @throws ReplicaCorruptionException when they differ
     */
    public void assertState(Replica r) {
        r.lock();
        try {
            PersistedReplicaState onDisk = store.stateLoader().load(store.engine(), r.rangeId());
            PersistedReplicaState inMemory = r.stateLocked().toPersisted();
            if (!inMemory.equals(onDisk)) {
                throw new ReplicaCorruptionException(r + ": on-disk and in-memory state diverged:\n"
                        + "on-disk:   " + onDisk + "\nin-memory: " + inMemory);
            }
        } finally {
            r.unlock();
        }
    }

    /**
     * Run the completion hook at most once, then deliver {@code outcome} to the
     * waiting client. Safe to call concurrently with itself; later calls are no-ops.
     */
    public static void finishLocal(LocalEffects completion, ProposalResult outcome) {
        CompletionHook hook;
        CompletableFuture<ProposalResult> ch;
        synchronized (completion) {
            hook = completion.completionHook;
            completion.completionHook = null;
            ch = completion.resultChannel;
            completion.resultChannel = null;
        }
        if (hook != null) {
            hook.done(outcome.reply(), outcome.error(), outcome.shouldRetry());
        }
        if (ch != null) {
            ch.complete(outcome);
        }
    }
}
