package dev.grafcet.model;

import java.util.Set;

/**
 * Known variable names (usable in guards) and action names (usable in steps).
 */
public record IoVocabulary(Set<String> variables, Set<String> actions) {

    public IoVocabulary {
        variables = Set.copyOf(variables);
        actions = Set.copyOf(actions);
    }

    public static IoVocabulary empty() {
        return new IoVocabulary(Set.of(), Set.of());
    }
}
