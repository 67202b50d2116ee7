package dev.grafcet.model;

import java.util.List;

/**
 * A step node of a compiled program graph. {@code stepType} is kept as the compiler wrote it.
 */
public record CompiledStep(
    String id,
    String label,
    boolean initial,
    String stepType,
    List<CompiledAction> actions
) {
    public CompiledStep {
        id = id == null ? "" : id;
        stepType = stepType == null ? "" : stepType;
        actions = List.copyOf(actions);
    }

    /** Label for messages, falling back to the id. */
    public String displayName() {
        return label == null || label.isEmpty() ? id : label;
    }
}
