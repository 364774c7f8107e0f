// file: storage/src/main/java/io/rangelite/storage/KeyLayout.java
package io.rangelite.storage;

/**
 * Engine key layout.
 * <p>
 *   u/&lt;key&gt;                           user data
 *   r/&lt;rangeId, 20 digits&gt;/&lt;suffix&gt;   per-range replicated state
 */
public final class KeyLayout {

    public static final String USER_PREFIX = "u/";

    static final String APPLIED_STATE = "applied";
    static final String DESCRIPTOR = "desc";
    static final String LEASE = "lease";
    static final String TRUNCATED_STATE = "truncated";
    static final String GC_THRESHOLD = "gc";
    static final String TXN_SPAN_GC_THRESHOLD = "txn-gc";
    static final String FROZEN = "frozen";

    private KeyLayout() {
    }

    public static String userKey(String key) {
        return USER_PREFIX + key;
    }

    /** Inverse of {@link #userKey(String)}. */
    public static String stripUserPrefix(String engineKey) {
        if (!engineKey.startsWith(USER_PREFIX)) {
            throw new IllegalArgumentException("not a user key: " + engineKey);
        }
        return engineKey.substring(USER_PREFIX.length());
    }

    public static String rangeStatePrefix(long rangeId) {
        return String.format("r/%020d/", rangeId);
    }

    /** True for the key holding applied indexes and stats, which replicas do not compare. */
    public static boolean isAppliedStateKey(String engineKey) {
        return engineKey.startsWith("r/") && engineKey.endsWith("/" + APPLIED_STATE);
    }

    /** Range id of a range-state key, or -1 when the key is not one. */
    static long rangeIdOf(String engineKey, String suffix) {
        if (!engineKey.startsWith("r/") || !engineKey.endsWith("/" + suffix)) {
            return -1;
        }
        String digits = engineKey.substring(2, engineKey.length() - suffix.length() - 1);
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    static String rangeStateKey(long rangeId, String suffix) {
        return rangeStatePrefix(rangeId) + suffix;
    }
}
