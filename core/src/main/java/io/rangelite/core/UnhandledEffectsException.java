// file: core/src/main/java/io/rangelite/core/UnhandledEffectsException.java
package io.rangelite.core;

import java.util.Set;

/** A merge or apply finished while fields of the record were still set. */
public class UnhandledEffectsException extends ReplicaCorruptionException {

    private final Set<? extends Enum<?>> fields;

    public UnhandledEffectsException(String where, Set<? extends Enum<?>> fields) {
        super("unhandled field(s) in " + where + ": " + fields);
        this.fields = Set.copyOf(fields);
    }

    public Set<? extends Enum<?>> fields() {
        return fields;
    }
}
