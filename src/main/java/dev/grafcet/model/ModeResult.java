package dev.grafcet.model;

/**
 * Verification outcome of one mode's compiled program.
 */
public record ModeResult(String modeId, String modeName, VerificationReport report) {

    public boolean passed() {
        return report.passed();
    }
}
