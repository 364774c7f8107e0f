// file: core/src/main/java/io/rangelite/core/CommandEffects.java
package io.rangelite.core;

/**
 * Everything evaluating one command may need to change or trigger: the part
 * every replica applies and the part only the proposer acts on.
 */
public final class CommandEffects {

    public final ReplicatedEffects replicated = new ReplicatedEffects();
    public final LocalEffects local = new LocalEffects();

    public boolean isEmpty() {
        return replicated.isEmpty() && local.isEmpty();
    }

    @Override
    public String toString() {
        return "CommandEffects{" + replicated + ", " + local + "}";
    }
}
