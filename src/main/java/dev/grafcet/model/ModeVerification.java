package dev.grafcet.model;

/**
 * One unit of per-mode verification work.
 */
public record ModeVerification(
    String modeId,
    String modeName,
    ModeCategory category,
    CompiledProgram program // nullable, the mode's compiled program was not found
) {}
