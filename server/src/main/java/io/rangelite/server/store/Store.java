// file: server/src/main/java/io/rangelite/server/store/Store.java
package io.rangelite.server.store;

import io.rangelite.core.Lease;
import io.rangelite.core.MergeTrigger;
import io.rangelite.core.MvccStats;
import io.rangelite.core.RangeDescriptor;
import io.rangelite.core.ReplicaCorruptionException;
import io.rangelite.core.SplitTrigger;
import io.rangelite.core.Timestamp;
import io.rangelite.core.TruncatedState;
import io.rangelite.server.config.StoreConfig;
import io.rangelite.server.replica.LocalRaftGroup;
import io.rangelite.server.replica.RaftGroup;
import io.rangelite.server.replica.Replica;
import io.rangelite.server.replica.ReplicaState;
import io.rangelite.storage.DurableEngine;
import io.rangelite.storage.FileWal;
import io.rangelite.storage.PersistedReplicaState;
import io.rangelite.storage.ReplicaStateLoader;
import io.rangelite.storage.StorageEngine;
import io.rangelite.storage.WriteBatch;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;
import java.util.logging.Logger;

/**
 * A node's store: the replicas it hosts and the collaborators they share
 * (engine, clock, async task pool, queues, gossip, metrics).
 * <p>
 * Structural changes to the replica set (split, merge, removal) go through
 * here so that the store map and the engine stay in step.
 */
public final class Store implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Store.class.getName());

    private final StoreConfig config;
    private final StorageEngine engine;
    private final ReplicaStateLoader stateLoader;
    private final HybridClock clock;
    private final Stopper stopper;
    private final RaftEntryCache raftEntryCache;
    private final ReplicaQueue raftLogQueue;
    private final ReplicaQueue splitQueue;
    private final ReplicaQueue replicaGcQueue;
    private final GossipSink gossip;
    private final IntentResolver intentResolver;
    private final StoreMetrics metrics;
    private final LongFunction<RaftGroup> raftGroups;
    private final Map<Long, Replica> replicas = new ConcurrentHashMap<>();

    private Store(Builder b) {
        this.config = b.config;
        if (b.engine != null) {
            this.engine = b.engine;
        } else if (b.walDir != null) {
            this.engine = new DurableEngine(new FileWal(b.walDir, config.walRotateBytes()));
        } else {
            this.engine = DurableEngine.inMemory();
        }
        this.stateLoader = b.stateLoader != null ? b.stateLoader : new ReplicaStateLoader();
        this.clock = b.clock != null ? b.clock : new HybridClock(Clock.systemUTC(), config.maxClockOffset());
        this.stopper = b.stopper != null ? b.stopper : new Stopper(config.asyncTaskThreads());
        this.raftEntryCache = new RaftEntryCache();
        this.raftLogQueue = b.raftLogQueue != null ? b.raftLogQueue : new InMemoryReplicaQueue("raftlog", 1024);
        this.splitQueue = b.splitQueue != null ? b.splitQueue : new InMemoryReplicaQueue("split", 1024,
                (r, now) -> {
                    r.lock();
                    try {
                        return r.needsSplitBySizeLocked();
                    } finally {
                        r.unlock();
                    }
                });
        this.replicaGcQueue = b.replicaGcQueue != null ? b.replicaGcQueue : new InMemoryReplicaQueue("replicaGC", 1024);
        this.gossip = b.gossip != null ? b.gossip : new InMemoryGossip();
        this.intentResolver = b.intentResolver != null ? b.intentResolver
                : new AsyncIntentResolver(stopper, (rangeId, intents) ->
                        log.fine(() -> "r" + rangeId + ": " + intents.size() + " intents left for readers to resolve"));
        this.metrics = b.metrics != null ? b.metrics : new StoreMetrics();
        this.raftGroups = b.raftGroups != null ? b.raftGroups : id -> new LocalRaftGroup(true);
    }

    public static Builder builder(StoreConfig config) {
        return new Builder(config);
    }

    public int storeId() { return config.storeId(); }
    public StoreConfig config() { return config; }
    public StorageEngine engine() { return engine; }
    public ReplicaStateLoader stateLoader() { return stateLoader; }
    public HybridClock clock() { return clock; }
    public Stopper stopper() { return stopper; }
    public RaftEntryCache raftEntryCache() { return raftEntryCache; }
    public ReplicaQueue raftLogQueue() { return raftLogQueue; }
    public ReplicaQueue splitQueue() { return splitQueue; }
    public ReplicaQueue replicaGcQueue() { return replicaGcQueue; }
    public GossipSink gossip() { return gossip; }
    public IntentResolver intentResolver() { return intentResolver; }
    public StoreMetrics metrics() { return metrics; }

    /** The replica of the range, or null when the store hosts none. */
    public Replica replica(long rangeId) {
        return replicas.get(rangeId);
    }

    public Collection<Replica> replicas() {
        return List.copyOf(replicas.values());
    }

    /**
     * Create the first replica of a range on this store and persist its initial state.
     * A range whose lease is still to be acquired starts with {@link Lease#none()}.
     */
    public Replica bootstrapRange(RangeDescriptor desc, Lease lease) {
        Objects.requireNonNull(desc, "desc");
        Objects.requireNonNull(lease, "lease");
        if (replicas.containsKey(desc.rangeId())) {
            throw new IllegalStateException("range " + desc.rangeId() + " already exists on s" + storeId());
        }
        PersistedReplicaState initial = new PersistedReplicaState(
                0, 0, MvccStats.EMPTY, desc, lease, new TruncatedState(0, 0),
                Timestamp.ZERO, Timestamp.ZERO, false);
        WriteBatch batch = engine.newBatch();
        stateLoader.stageAll(batch, initial);
        engine.commit(batch);
        return register(initial);
    }

    /** Instantiate a replica for every range persisted in the engine. */
    public int loadReplicas() {
        int loaded = 0;
        for (long rangeId : stateLoader.loadRangeIds(engine)) {
            if (replicas.containsKey(rangeId)) {
                continue;
            }
            register(stateLoader.load(engine, rangeId));
            loaded++;
        }
        int n = loaded;
        log.info(() -> "s" + storeId() + ": loaded " + n + " replicas");
        return loaded;
    }

    /**
     * Apply a split to the local replicas: the left replica shrinks to
     * {@code split.left()} and gives up {@code split.rhsDelta()} of its stats to a
     * new right-hand replica, which inherits its lease and GC thresholds.
     */
    public Replica splitRange(Replica lhs, SplitTrigger split) {
        RangeDescriptor left = split.left();
        RangeDescriptor right = split.right();
        if (left.rangeId() != lhs.rangeId()) {
            throw new ReplicaCorruptionException(lhs + ": split trigger is for range " + left.rangeId());
        }
        if (replicas.containsKey(right.rangeId())) {
            throw new ReplicaCorruptionException(lhs + ": split target r" + right.rangeId() + " already exists");
        }

        PersistedReplicaState rhsState;
        lhs.lock();
        try {
            ReplicaState s = lhs.stateLocked();
            MvccStats lhsStats = s.stats().minus(split.rhsDelta());
            rhsState = new PersistedReplicaState(
                    0, 0, split.rhsDelta(), right, s.lease(), new TruncatedState(0, 0),
                    s.gcThreshold(), s.txnSpanGcThreshold(), false);

            WriteBatch batch = engine.newBatch();
            stateLoader.stageDescriptor(batch, left);
            stateLoader.stageAppliedState(batch, lhs.rangeId(), s.raftAppliedIndex(), s.leaseAppliedIndex(), lhsStats);
            stateLoader.stageAll(batch, rhsState);
            engine.commit(batch);

            s.setStats(lhsStats);
        } finally {
            lhs.unlock();
        }
        lhs.setDesc(left);

        Replica rhs = register(rhsState);
        log.info(() -> lhs + ": split at " + right.span() + " into " + rhs);
        splitQueue.maybeAdd(rhs, clock.now());
        return rhs;
    }

    /**
     * Absorb the right-hand replica named by the trigger into {@code lhs}. The
     * right-hand replica must be hosted here and adjacent to {@code lhs}.
     */
    public void mergeRange(Replica lhs, MergeTrigger merge) {
        Replica rhs = replicas.get(merge.right().rangeId());
        if (rhs == null) {
            throw new IllegalStateException(lhs + ": merge source r" + merge.right().rangeId() + " not found");
        }
        RangeDescriptor rhsDesc = rhs.descriptor();
        RangeDescriptor lhsDesc = lhs.descriptor();
        if (!lhsDesc.span().adjacentTo(rhsDesc.span())) {
            throw new IllegalStateException(lhs + ": " + rhs + " is not adjacent");
        }
        RangeDescriptor merged = merge.left().withSpan(lhsDesc.span().mergeWith(rhsDesc.span()));
        MvccStats rhsStats = rhs.persistedState().stats();

        lhs.lock();
        try {
            ReplicaState s = lhs.stateLocked();
            MvccStats mergedStats = s.stats().plus(rhsStats);
            WriteBatch batch = engine.newBatch();
            stateLoader.stageClear(batch, rhs.rangeId());
            stateLoader.stageAppliedState(batch, lhs.rangeId(), s.raftAppliedIndex(), s.leaseAppliedIndex(), mergedStats);
            engine.commit(batch);
            s.setStats(mergedStats);
        } finally {
            lhs.unlock();
        }
        rhs.destroy();
        replicas.remove(rhs.rangeId());
        raftEntryCache.dropRange(rhs.rangeId());
        lhs.setDesc(merged);
        log.info(() -> lhs + ": merged " + rhs + ", now " + merged.span());
    }

    /** Destroy the replica and delete its persisted state. */
    public void removeReplica(Replica r) {
        r.destroy();
        WriteBatch batch = engine.newBatch();
        stateLoader.stageClear(batch, r.rangeId());
        engine.commit(batch);
        replicas.remove(r.rangeId());
        raftEntryCache.dropRange(r.rangeId());
        log.info(() -> "s" + storeId() + ": removed " + r);
    }

    private Replica register(PersistedReplicaState state) {
        Replica r = new Replica(this, state, raftGroups.apply(state.descriptor().rangeId()));
        replicas.put(r.rangeId(), r);
        return r;
    }

    @Override
    public void close() throws Exception {
        stopper.stop();
        engine.close();
    }

    public static final class Builder {
        private final StoreConfig config;
        private StorageEngine engine;
        private Path walDir;
        private ReplicaStateLoader stateLoader;
        private HybridClock clock;
        private Stopper stopper;
        private ReplicaQueue raftLogQueue;
        private ReplicaQueue splitQueue;
        private ReplicaQueue replicaGcQueue;
        private GossipSink gossip;
        private IntentResolver intentResolver;
        private StoreMetrics metrics;
        private LongFunction<RaftGroup> raftGroups;

        private Builder(StoreConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder engine(StorageEngine engine) { this.engine = engine; return this; }
        /** Back the store with a file WAL in {@code dir}; ignored when an engine is given. */
        public Builder walDir(Path dir) { this.walDir = dir; return this; }
        public Builder stateLoader(ReplicaStateLoader loader) { this.stateLoader = loader; return this; }
        public Builder clock(HybridClock clock) { this.clock = clock; return this; }
        public Builder stopper(Stopper stopper) { this.stopper = stopper; return this; }
        public Builder raftLogQueue(ReplicaQueue q) { this.raftLogQueue = q; return this; }
        public Builder splitQueue(ReplicaQueue q) { this.splitQueue = q; return this; }
        public Builder replicaGcQueue(ReplicaQueue q) { this.replicaGcQueue = q; return this; }
        public Builder gossip(GossipSink gossip) { this.gossip = gossip; return this; }
        public Builder intentResolver(IntentResolver resolver) { this.intentResolver = resolver; return this; }
        public Builder metrics(StoreMetrics metrics) { this.metrics = metrics; return this; }
        public Builder raftGroups(LongFunction<RaftGroup> factory) { this.raftGroups = factory; return this; }

        public Store build() {
            return new Store(this);
        }
    }
}
