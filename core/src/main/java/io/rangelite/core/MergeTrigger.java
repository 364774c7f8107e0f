// file: core/src/main/java/io/rangelite/core/MergeTrigger.java
package io.rangelite.core;

import java.util.Objects;

/** The left-hand range absorbs the adjacent right-hand range. */
public record MergeTrigger(RangeDescriptor left, RangeDescriptor right) {

    public MergeTrigger {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
