// file: server/src/main/java/io/rangelite/server/checksum/ChecksumResult.java
package io.rangelite.server.checksum;

/**
 * Outcome of one checksum computation. {@code digest} is null when the
 * computation failed or could not be started; {@code snapshot} is null unless
 * snapshot data was requested.
 */
public record ChecksumResult(byte[] digest, RangeSnapshotData snapshot) {

    static final ChecksumResult FAILED = new ChecksumResult(null, null);

    public boolean ok() {
        return digest != null;
    }
}
