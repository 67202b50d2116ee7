package dev.grafcet.model;

/**
 * OR selects exactly one branch, AND runs every branch in parallel.
 */
public enum DivergenceKind {
    OR,
    AND
}
