// file: server/src/main/java/io/rangelite/server/store/AsyncIntentResolver.java
package io.rangelite.server.store;

import io.rangelite.core.Intent;
import io.rangelite.server.replica.Replica;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs intent resolution on the store's {@link Stopper}. The resolution itself
 * (pushing the owning transaction and committing or aborting the intent) is
 * supplied by the caller.
 */
public final class AsyncIntentResolver implements IntentResolver {
    private static final Logger log = Logger.getLogger(AsyncIntentResolver.class.getName());

    private final Stopper stopper;
    private final BiConsumer<Long, List<Intent>> resolve;

    public AsyncIntentResolver(Stopper stopper, BiConsumer<Long, List<Intent>> resolve) {
        this.stopper = Objects.requireNonNull(stopper, "stopper");
        this.resolve = Objects.requireNonNull(resolve, "resolve");
    }

    @Override
    public void processIntentsAsync(Replica replica, List<Intent> intents) {
        if (intents.isEmpty()) {
            return;
        }
        List<Intent> batch = List.copyOf(intents);
        long rangeId = replica.rangeId();
        try {
            stopper.runAsyncTask("resolve-intents r" + rangeId, () -> resolve.accept(rangeId, batch));
        } catch (RejectedExecutionException e) {
            // Leftover intents are found again by later readers.
            log.log(Level.WARNING, "r" + rangeId + ": unable to resolve " + batch.size() + " intents", e);
        }
    }
}
