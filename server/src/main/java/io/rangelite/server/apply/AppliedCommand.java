// file: server/src/main/java/io/rangelite/server/apply/AppliedCommand.java
package io.rangelite.server.apply;

import io.rangelite.core.CommandEffects;
import io.rangelite.core.Mutation;
import io.rangelite.core.ReplicaDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * A command the consensus log has ordered, as delivered to the applying replica.
 *
 * rangeId:  range whose log ordered the command.
 * proposer: replica that evaluated and proposed it.
 * effects:  merged side effects of its evaluation.
 * writes:   key/value mutations its evaluation produced.
 */
public record AppliedCommand(
        long rangeId,
        ReplicaDescriptor proposer,
        CommandEffects effects,
        List<Mutation> writes
) {

    public AppliedCommand {
        Objects.requireNonNull(proposer, "proposer");
        Objects.requireNonNull(effects, "effects");
        writes = List.copyOf(writes);
    }
}
