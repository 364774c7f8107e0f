// file: core/src/main/java/io/rangelite/core/Intent.java
package io.rangelite.core;

import java.util.Objects;
import java.util.UUID;

/** Provisional write of transaction {@code txnId} on {@code key}, awaiting resolution. */
public record Intent(String key, UUID txnId) {

    public Intent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(txnId, "txnId");
    }
}
