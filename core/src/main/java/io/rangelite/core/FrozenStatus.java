// file: core/src/main/java/io/rangelite/core/FrozenStatus.java
package io.rangelite.core;

/** Tri-state frozen flag; UNSPECIFIED means "leave unchanged". */
public enum FrozenStatus {
    UNSPECIFIED, FROZEN, UNFROZEN
}
