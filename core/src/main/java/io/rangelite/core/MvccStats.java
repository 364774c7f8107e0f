// file: core/src/main/java/io/rangelite/core/MvccStats.java
package io.rangelite.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Byte and count statistics of a range's data.
 * <p>
 * Used both as cumulative statistics (replica state) and as a delta carried by
 * an applied command; deltas are folded in with {@link #plus(MvccStats)}.
 * {@code containsEstimates} is sticky under addition: once any contribution is
 * an estimate the sum is one too, until a split makes the numbers exact again.
 */
public record MvccStats(
        long liveBytes,
        long keyBytes,
        long valBytes,
        long intentBytes,
        long liveCount,
        long keyCount,
        long valCount,
        long intentCount,
        long sysBytes,
        boolean containsEstimates
) {

    public static final MvccStats EMPTY = new MvccStats(0, 0, 0, 0, 0, 0, 0, 0, 0, false);

    public MvccStats plus(MvccStats d) {
        return new MvccStats(
                liveBytes + d.liveBytes,
                keyBytes + d.keyBytes,
                valBytes + d.valBytes,
                intentBytes + d.intentBytes,
                liveCount + d.liveCount,
                keyCount + d.keyCount,
                valCount + d.valCount,
                intentCount + d.intentCount,
                sysBytes + d.sysBytes,
                containsEstimates || d.containsEstimates
        );
    }

    /** Subtracts {@code d}; the estimate flag is kept from this side. */
    public MvccStats minus(MvccStats d) {
        return new MvccStats(
                liveBytes - d.liveBytes,
                keyBytes - d.keyBytes,
                valBytes - d.valBytes,
                intentBytes - d.intentBytes,
                liveCount - d.liveCount,
                keyCount - d.keyCount,
                valCount - d.valCount,
                intentCount - d.intentCount,
                sysBytes - d.sysBytes,
                containsEstimates
        );
    }

    public MvccStats withContainsEstimates(boolean estimates) {
        return new MvccStats(liveBytes, keyBytes, valBytes, intentBytes, liveCount,
                keyCount, valCount, intentCount, sysBytes, estimates);
    }

    /** Size used for split-by-size decisions. */
    public long totalBytes() {
        return keyBytes + valBytes + sysBytes;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return EMPTY.equals(this);
    }
}
