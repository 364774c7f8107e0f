// file: core/src/main/java/io/rangelite/core/Mutation.java
package io.rangelite.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * One key-level write produced by evaluating a command; a null value deletes
 * the key. Values are copied in and out.
 */
public final class Mutation {
    private final String key;
    private final byte[] value;

    private Mutation(String key, byte[] value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value == null ? null : Arrays.copyOf(value, value.length);
    }

    public static Mutation put(String key, byte[] value) {
        return new Mutation(key, Objects.requireNonNull(value, "value"));
    }

    public static Mutation delete(String key) {
        return new Mutation(key, null);
    }

    public String key() { return key; }

    public byte[] value() { return value == null ? null : Arrays.copyOf(value, value.length); }

    public boolean deletion() { return value == null; }
}
