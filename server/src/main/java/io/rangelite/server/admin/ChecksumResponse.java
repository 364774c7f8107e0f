// file: server/src/main/java/io/rangelite/server/admin/ChecksumResponse.java
package io.rangelite.server.admin;

import io.rangelite.server.checksum.RangeSnapshotData;

/** Body of GET /admin/checksum/{rangeId}/{checksumId}. */
public class ChecksumResponse {
    public String checksumId;
    public String digestBase64;
    public RangeSnapshotData snapshot;
}
