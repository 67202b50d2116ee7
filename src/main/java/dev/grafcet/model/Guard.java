package dev.grafcet.model;

/**
 * Boolean guard text of a transition. Synthetic guards are manufactured by the
 * synthesizer and do not correspond to any input signal.
 */
public record Guard(String text, boolean synthetic) {

    /** Closes a mode without outgoing edges back to the initial step. */
    public static final Guard CYCLE_COMPLETE = new Guard("CYCLE_COMPLETE", true);

    /** Self-loop guard of the program synthesized for an empty mode graph. */
    public static final Guard ALWAYS = new Guard("TRUE", true);

    public static Guard of(String text) {
        return new Guard(text, false);
    }
}
