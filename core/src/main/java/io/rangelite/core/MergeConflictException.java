// file: core/src/main/java/io/rangelite/core/MergeConflictException.java
package io.rangelite.core;

/**
 * Two partial results of one command carry incompatible effects.
 * <p>
 * The destination of the failed merge is left partially updated; the whole
 * command must fail rather than be retried with it.
 */
public class MergeConflictException extends Exception {

    private final String field;

    public MergeConflictException(String field, String message) {
        super(message);
        this.field = field;
    }

    static MergeConflictException conflicting(String field) {
        return new MergeConflictException(field, "conflicting " + field);
    }

    static MergeConflictException mustNotSpecify(String field) {
        return new MergeConflictException(field, "must not specify " + field);
    }

    /** Name of the offending field. */
    public String field() {
        return field;
    }
}
