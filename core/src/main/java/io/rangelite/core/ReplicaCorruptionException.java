// file: core/src/main/java/io/rangelite/core/ReplicaCorruptionException.java
package io.rangelite.core;

/**
 * In-memory and durable replica state may have diverged, or an effect was
 * silently dropped. Processing of the affected range must stop.
 */
public class ReplicaCorruptionException extends RuntimeException {

    public ReplicaCorruptionException(String message) {
        super(message);
    }

    public ReplicaCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
