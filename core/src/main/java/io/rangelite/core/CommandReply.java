// file: core/src/main/java/io/rangelite/core/CommandReply.java
package io.rangelite.core;

import java.util.List;

/** Evaluated response of a command, delivered verbatim to the waiting client. */
public record CommandReply(Timestamp timestamp, List<String> responses) {

    public CommandReply {
        responses = responses == null ? List.of() : List.copyOf(responses);
    }
}
