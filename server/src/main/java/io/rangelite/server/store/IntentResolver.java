// file: server/src/main/java/io/rangelite/server/store/IntentResolver.java
package io.rangelite.server.store;

import io.rangelite.core.Intent;
import io.rangelite.server.replica.Replica;

import java.util.List;

/** Cleans up provisional writes left behind by a command. */
public interface IntentResolver {

    /** Hand the intents off for resolution; returns without waiting for it. */
    void processIntentsAsync(Replica replica, List<Intent> intents);
}
