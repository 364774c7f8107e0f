// file: server/src/main/java/io/rangelite/server/store/InMemoryReplicaQueue.java
package io.rangelite.server.store;

import io.rangelite.core.Timestamp;
import io.rangelite.server.replica.Replica;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.BiPredicate;
import java.util.logging.Logger;

/**
 * Bounded max-priority queue of ranges.
 * <p>
 *  - One entry per range; re-adding a queued range only raises its priority.
 *  - {@link #maybeAdd} consults an admission predicate and enqueues at
 *    priority {@code 0} when it passes; a full queue drops the offer.
 *  - {@link #drain(int)} hands out the highest-priority ranges first,
 *    oldest first among equals.
 */
public final class InMemoryReplicaQueue implements ReplicaQueue {
    private static final Logger log = Logger.getLogger(InMemoryReplicaQueue.class.getName());

    /** One queued range. */
    public record Item(long rangeId, double priority, long seq) {
    }

    private final String name;
    private final int capacity;
    private final BiPredicate<Replica, Timestamp> shouldQueue;
    private final PriorityQueue<Item> queue = new PriorityQueue<>(
            Comparator.comparingDouble(Item::priority).reversed().thenComparingLong(Item::seq));
    private final Map<Long, Item> byRange = new HashMap<>();
    private long seq = 0;

    public InMemoryReplicaQueue(String name, int capacity) {
        this(name, capacity, (r, now) -> true);
    }

    public InMemoryReplicaQueue(String name, int capacity, BiPredicate<Replica, Timestamp> shouldQueue) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.shouldQueue = Objects.requireNonNull(shouldQueue, "shouldQueue");
    }

    @Override
    public void maybeAdd(Replica replica, Timestamp now) {
        if (!shouldQueue.test(replica, now)) {
            return;
        }
        try {
            add(replica, 0.0);
        } catch (QueueFullException e) {
            log.fine(() -> name + ": dropped r" + replica.rangeId() + ": " + e.getMessage());
        }
    }

    @Override
    public synchronized void add(Replica replica, double priority) throws QueueFullException {
        long rangeId = replica.rangeId();
        Item existing = byRange.get(rangeId);
        if (existing != null) {
            if (existing.priority() >= priority) {
                return;
            }
            queue.remove(existing);
        } else if (byRange.size() >= capacity) {
            throw new QueueFullException(name + " queue is full (" + capacity + ")");
        }
        Item item = new Item(rangeId, priority, existing != null ? existing.seq() : seq++);
        queue.add(item);
        byRange.put(rangeId, item);
        log.fine(() -> name + ": queued r" + rangeId + " at priority " + priority);
    }

    /** Remove and return up to {@code max} items, highest priority first. */
    public synchronized List<Item> drain(int max) {
        List<Item> out = new ArrayList<>(Math.min(max, queue.size()));
        while (out.size() < max && !queue.isEmpty()) {
            Item it = queue.poll();
            byRange.remove(it.rangeId());
            out.add(it);
        }
        return out;
    }

    public synchronized boolean contains(long rangeId) {
        return byRange.containsKey(rangeId);
    }

    public synchronized int size() {
        return byRange.size();
    }

    public String name() {
        return name;
    }
}
