// file: core/src/main/java/io/rangelite/core/KeyTokens.java
package io.rangelite.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Maps user keys into the 64-bit token space that range descriptors partition.
 */
public final class KeyTokens {

    /** Key whose range gossips the cluster configuration. */
    public static final String CLUSTER_CONFIG_KEY = "\u0000system/cluster-config";

    private KeyTokens() {
    }

    /** First 8 bytes of SHA-256(key), big-endian, read as an unsigned token. */
    public static long tokenForKey(String key) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] h = md.digest(key.getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(h, 0, 8).order(ByteOrder.BIG_ENDIAN).getLong();
    }
}
