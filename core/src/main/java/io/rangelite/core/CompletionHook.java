// file: core/src/main/java/io/rangelite/core/CompletionHook.java
package io.rangelite.core;

/**
 * Releases the concurrency-control admission a command held while it was in
 * flight (for example its slot in the command queue). Invoked once, before the
 * outcome is delivered.
 */
@FunctionalInterface
public interface CompletionHook {

    void done(CommandReply reply, CommandError error, boolean shouldRetry);
}
