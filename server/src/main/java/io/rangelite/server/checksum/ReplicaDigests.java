// file: server/src/main/java/io/rangelite/server/checksum/ReplicaDigests.java
package io.rangelite.server.checksum;

import io.rangelite.core.RangeDescriptor;
import io.rangelite.storage.EngineSnapshot;
import io.rangelite.storage.KeyLayout;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SHA-512 digest of a range's replicated data in a snapshot.
 * <p>
 * Covered, in key order and length-prefixed:
 *  - user key/value pairs whose token falls in the range's span.
 *  - the range's persisted state, except applied indexes and stats
 *    (stats may legitimately differ while they contain estimates).
 */
public final class ReplicaDigests {

    private ReplicaDigests() {
    }

    public static ChecksumResult compute(EngineSnapshot snap, RangeDescriptor desc, boolean includeSnapshotData) {
        MessageDigest sha = sha512();
        List<RangeSnapshotData.KeyValue> entries = includeSnapshotData ? new ArrayList<>() : null;

        for (Map.Entry<String, byte[]> e : snap.scanPrefix(KeyLayout.USER_PREFIX).entrySet()) {
            String userKey = KeyLayout.stripUserPrefix(e.getKey());
            if (!desc.span().containsKey(userKey)) {
                continue;
            }
            update(sha, e.getKey(), e.getValue());
            if (entries != null) {
                entries.add(new RangeSnapshotData.KeyValue(userKey, e.getValue()));
            }
        }
        for (Map.Entry<String, byte[]> e : snap.scanPrefix(KeyLayout.rangeStatePrefix(desc.rangeId())).entrySet()) {
            if (KeyLayout.isAppliedStateKey(e.getKey())) {
                continue;
            }
            update(sha, e.getKey(), e.getValue());
        }

        RangeSnapshotData data = entries == null ? null : new RangeSnapshotData(desc.rangeId(), entries);
        return new ChecksumResult(sha.digest(), data);
    }

    private static void update(MessageDigest sha, String key, byte[] value) {
        byte[] k = key.getBytes(StandardCharsets.UTF_8);
        sha.update(ByteBuffer.allocate(4).putInt(k.length).array());
        sha.update(k);
        sha.update(ByteBuffer.allocate(4).putInt(value.length).array());
        sha.update(value);
    }

    private static MessageDigest sha512() {
        try {
            return MessageDigest.getInstance("SHA-512");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }
}
