package dev.grafcet.model;

/**
 * One guarded edge of the mode graph, seen from the mode that owns it.
 * For an outgoing edge {@code modeId} is the target, for an incoming edge it is the source.
 */
public record ModeEdge(String modeId, String guard) {}
