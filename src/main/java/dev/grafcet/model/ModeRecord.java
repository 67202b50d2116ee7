package dev.grafcet.model;

/**
 * A flat mode entry as supplied by the GSRSM description.
 */
public record ModeRecord(String id, String name, boolean activated) {}
