package dev.grafcet.model;

import java.util.List;
import java.util.Set;

/**
 * Vocabulary the verifier matches against.
 */
public record VerificationRules(
    List<String> emergencyKeywords, // lower case, substring match
    Set<String> terminalStepKinds
) {
    public static final List<String> DEFAULT_EMERGENCY_KEYWORDS =
        List.of("estop", "e_stop", "emergency", "stop", "arret", "urgence");
    public static final Set<String> DEFAULT_TERMINAL_STEP_KINDS = Set.of("final", "enclosing");

    public VerificationRules {
        emergencyKeywords = List.copyOf(emergencyKeywords);
        terminalStepKinds = Set.copyOf(terminalStepKinds);
    }

    public static VerificationRules defaults() {
        return new VerificationRules(DEFAULT_EMERGENCY_KEYWORDS, DEFAULT_TERMINAL_STEP_KINDS);
    }
}
