// file: server/src/main/java/io/rangelite/server/store/QueueFullException.java
package io.rangelite.server.store;

/** A replica queue refused a candidate because it is at capacity. */
public class QueueFullException extends Exception {

    public QueueFullException(String message) {
        super(message);
    }
}
