package dev.grafcet.model;

import java.util.List;

/**
 * Flat element and connection graph produced by an external SFC compiler.
 * Nothing about its shape is guaranteed.
 */
public record CompiledProgram(
    List<CompiledStep> steps,
    List<CompiledTransition> transitions,
    List<CompiledConnection> connections
) {
    public CompiledProgram {
        steps = List.copyOf(steps);
        transitions = List.copyOf(transitions);
        connections = List.copyOf(connections);
    }
}
