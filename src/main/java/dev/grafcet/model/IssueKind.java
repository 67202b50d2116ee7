package dev.grafcet.model;

/**
 * Closed set of problems the verifier can report.
 */
public enum IssueKind {
    MISSING_ESTOP("missing_estop"),
    UNREACHABLE_STEP("unreachable_step"),
    DEAD_END_TRANSITION("dead_end_transition"),
    INVALID_CONDITION("invalid_condition"),
    MISSING_RETURN_PATH("missing_return_path"),
    UNDEFINED_VARIABLE("undefined_variable"),
    UNDEFINED_ACTION("undefined_action"),
    INCORRECT_SEQUENCING("incorrect_sequencing"),
    SAFETY_VIOLATION("safety_violation");

    private final String code;

    IssueKind(String code) {
        this.code = code;
    }

    /** Stable lower-case identifier used in reports. */
    public String code() {
        return code;
    }
}
