// file: server/src/main/java/io/rangelite/server/apply/FatalErrorListener.java
package io.rangelite.server.apply;

import io.rangelite.core.ReplicaCorruptionException;

/** Told when a range stops applying commands because its state can no longer be trusted. */
@FunctionalInterface
public interface FatalErrorListener {

    void onFatalError(long rangeId, ReplicaCorruptionException error);
}
