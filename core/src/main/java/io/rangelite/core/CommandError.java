// file: core/src/main/java/io/rangelite/core/CommandError.java
package io.rangelite.core;

import java.util.Objects;

/** Client-visible error of a command; carried through apply untouched. */
public record CommandError(String message) {

    public CommandError {
        Objects.requireNonNull(message, "message");
    }
}
