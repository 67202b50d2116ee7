package dev.grafcet.model;

/**
 * A flat transition entry between two modes.
 */
public record ModeTransitionRecord(
    String fromMode,
    String toMode,
    String guard, // nullable, treated as TRUE
    boolean activated
) {}
