package dev.grafcet.model;

public enum Severity {
    /** Must be fixed, blocks deployment. */
    ERROR,
    /** Potential runtime problem. */
    WARNING,
    /** Best-practice suggestion. No check emits it yet. */
    INFO
}
