package dev.grafcet.model;

/**
 * An action reference inside a compiled step.
 */
public record CompiledAction(String variable) {}
