// file: core/src/main/java/io/rangelite/core/TokenRange.java
package io.rangelite.core;

/**
 * Half-open interval [start, end) over the unsigned 64-bit token space.
 * The range may or may not wrap around:
 *  - Non-wrapping: start < end, covers [start, end).
 *  - Wrapping:     start > end, covers [start, 2^64) U [0, end).
 *  - Full ring:    start == end.
 * Uses unsigned comparison semantics (Long.compareUnsigned).
 * <p>
 * A range split at token t yields [start, t) and [t, end); two ranges merge
 * when the left one's end is the right one's start.
 */
public record TokenRange(long startInclusive, long endExclusive) {

    /** The whole token space, owned by a freshly bootstrapped store. */
    public static final TokenRange FULL = new TokenRange(0L, 0L);

    public boolean contains(long token) {
        int cmp = Long.compareUnsigned(startInclusive, endExclusive);
        if (cmp == 0) {
            return true;
        } else if (cmp < 0) {
            return Long.compareUnsigned(token, startInclusive) >= 0
                    && Long.compareUnsigned(token, endExclusive) < 0;
        } else {
            return Long.compareUnsigned(token, startInclusive) >= 0
                    || Long.compareUnsigned(token, endExclusive) < 0;
        }
    }

    public boolean containsKey(String key) {
        return contains(KeyTokens.tokenForKey(key));
    }

    /**
     * True when every token of {@code other} lies in this range. Offsets are
     * measured from this range's start so wrapping ranges compare correctly.
     */
    public boolean containsRange(TokenRange other) {
        if (startInclusive == endExclusive) {
            return true;
        }
        if (other.startInclusive == other.endExclusive) {
            return false;
        }
        long last = other.endExclusive - 1;
        return contains(other.startInclusive)
                && contains(last)
                && Long.compareUnsigned(other.startInclusive - startInclusive, last - startInclusive) <= 0;
    }

    /** True when {@code right} starts exactly where this range ends. */
    public boolean adjacentTo(TokenRange right) {
        return endExclusive == right.startInclusive;
    }

    public TokenRange mergeWith(TokenRange right) {
        if (!adjacentTo(right)) {
            throw new IllegalArgumentException(this + " is not adjacent to " + right);
        }
        return new TokenRange(startInclusive, right.endExclusive);
    }

    @Override
    public String toString() {
        return "TokenRange[" + toHex(startInclusive) + "," + toHex(endExclusive) + ")";
    }

    private static String toHex(long v) {
        return "0x" + Long.toUnsignedString(v, 16);
    }
}
