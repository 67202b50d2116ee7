package dev.grafcet.model;

/**
 * A directed edge between two compiled elements.
 */
public record CompiledConnection(String sourceId, String targetId) {

    public CompiledConnection {
        sourceId = sourceId == null ? "" : sourceId;
        targetId = targetId == null ? "" : targetId;
    }
}
