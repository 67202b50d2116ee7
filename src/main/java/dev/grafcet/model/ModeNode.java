package dev.grafcet.model;

import java.util.List;

/**
 * One activated operating mode with its resolved edges.
 */
public record ModeNode(
    String id,
    String name,
    boolean activated,
    List<ModeEdge> outgoing,
    List<ModeEdge> incoming
) {
    public ModeNode {
        outgoing = List.copyOf(outgoing);
        incoming = List.copyOf(incoming);
    }
}
