package dev.grafcet.model;

/**
 * A transition node of a compiled program graph.
 */
public record CompiledTransition(String id, String label, String condition) {

    public CompiledTransition {
        id = id == null ? "" : id;
        condition = condition == null ? "" : condition;
    }

    public String displayName() {
        return label == null || label.isEmpty() ? id : label;
    }
}
