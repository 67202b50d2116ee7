package dev.grafcet.model;

public enum StepKind {
    NORMAL,
    MACRO,
    TASK
}
