// file: core/src/main/java/io/rangelite/core/SplitTrigger.java
package io.rangelite.core;

import java.util.Objects;

/**
 * Structural split of a range: the updated left-hand descriptor, the new
 * right-hand descriptor and the statistics the right-hand side starts with.
 */
public record SplitTrigger(RangeDescriptor left, RangeDescriptor right, MvccStats rhsDelta) {

    public SplitTrigger {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(rhsDelta, "rhsDelta");
    }
}
