package dev.grafcet.model;

/**
 * GEMMA family of a mode, derived from its id.
 */
public enum ModeCategory {
    /** A modes. */
    STOP_PROCEDURE,
    /** F modes. */
    OPERATING_PROCEDURE,
    /** D1. */
    EMERGENCY_STOP,
    /** D modes other than D1. */
    FAILURE_PROCEDURE,
    UNKNOWN;

    public static ModeCategory of(String modeId) {
        if (modeId == null || modeId.isEmpty()) {
            return UNKNOWN;
        }
        return switch (modeId.charAt(0)) {
            case 'A' -> STOP_PROCEDURE;
            case 'F' -> OPERATING_PROCEDURE;
            case 'D' -> "D1".equals(modeId) ? EMERGENCY_STOP : FAILURE_PROCEDURE;
            default -> UNKNOWN;
        };
    }

    public boolean requiresEmergencyStop() {
        return this == EMERGENCY_STOP;
    }
}
