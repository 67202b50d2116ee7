package dev.grafcet.model;

/**
 * IEC 61131-3 style action qualifiers accepted by the conduct DSL.
 */
public enum ActionQualifier {
    /** Normal, active while the step is active. */
    N(false),
    /** Set, latched until reset. */
    S(false),
    /** Reset a previously set action. */
    R(false),
    /** Pulse, one scan cycle. */
    P(false),
    /** Delayed start. */
    D(true),
    /** Time limited. */
    L(true);

    private final boolean requiresDuration;

    ActionQualifier(boolean requiresDuration) {
        this.requiresDuration = requiresDuration;
    }

    public boolean requiresDuration() {
        return requiresDuration;
    }
}
