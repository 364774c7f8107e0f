// file: server/src/main/java/io/rangelite/server/store/Stopper.java
package io.rangelite.server.store;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the store's fire-and-forget side tasks (checksum computation, gossip,
 * intent resolution) on a fixed pool of daemon threads.
 * <p>
 * Once {@link #stop()} is called, new tasks are rejected with
 * {@link RejectedExecutionException}; callers must handle that the same way
 * as a full pool.
 */
public final class Stopper implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Stopper.class.getName());

    private final ExecutorService exec;
    private volatile boolean stopping = false;

    public Stopper(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "store-async-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.exec = Executors.newFixedThreadPool(threads, tf);
    }

    /**
     * Schedule {@code task}.
     *
     * @throws RejectedExecutionException if the stopper is stopping or cannot take the task
     */
    public void runAsyncTask(String name, Runnable task) {
        if (stopping) {
            throw new RejectedExecutionException("stopper is stopping; rejected " + name);
        }
        exec.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "async task " + name + " failed", e);
            }
        });
    }

    public boolean isStopping() {
        return stopping;
    }

    public void stop() {
        stopping = true;
        exec.shutdown();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                exec.shutdownNow();
            }
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
