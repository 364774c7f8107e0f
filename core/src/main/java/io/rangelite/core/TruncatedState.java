// file: core/src/main/java/io/rangelite/core/TruncatedState.java
package io.rangelite.core;

/** Raft log truncation marker: entries up to and including {@code index} are gone. */
public record TruncatedState(long index, long term) {
}
