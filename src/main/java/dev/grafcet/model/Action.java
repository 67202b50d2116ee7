package dev.grafcet.model;

/**
 * An action attached to a step. Delayed and limited actions carry a duration such as {@code 5s}.
 */
public record Action(
    String name,
    ActionQualifier qualifier,
    String duration // nullable, required for D and L only
) {
    public Action {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action name must not be empty");
        }
        if (qualifier == null) {
            qualifier = ActionQualifier.N;
        }
        if (qualifier.requiresDuration() && (duration == null || duration.isBlank())) {
            throw new IllegalArgumentException(
                "Action '%s' with qualifier %s requires a duration".formatted(name, qualifier));
        }
        if (!qualifier.requiresDuration() && duration != null) {
            throw new IllegalArgumentException(
                "Action '%s' with qualifier %s does not take a duration".formatted(name, qualifier));
        }
    }

    public static Action of(String name, ActionQualifier qualifier) {
        return new Action(name, qualifier, null);
    }
}
