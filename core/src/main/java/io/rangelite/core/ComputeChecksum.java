// file: core/src/main/java/io/rangelite/core/ComputeChecksum.java
package io.rangelite.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Request to compute a consistency checksum of the range on every replica.
 *
 * @param checksumId id under which replicas store and later report the digest
 * @param snapshot   also materialise the range data for diagnostics
 */
public record ComputeChecksum(UUID checksumId, boolean snapshot) {

    public ComputeChecksum {
        Objects.requireNonNull(checksumId, "checksumId");
    }
}
