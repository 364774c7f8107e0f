// file: core/src/main/java/io/rangelite/core/ProposalResult.java
package io.rangelite.core;

/**
 * Final outcome of a proposed command as seen by the client waiting on it.
 * Exactly one of {@code reply} / {@code error} is normally set.
 */
public record ProposalResult(CommandReply reply, CommandError error, boolean shouldRetry) {

    public static ProposalResult failed(String message) {
        return new ProposalResult(null, new CommandError(message), false);
    }
}
