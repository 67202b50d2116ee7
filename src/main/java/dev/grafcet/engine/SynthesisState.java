package dev.grafcet.engine;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable bookkeeping for a single synthesis call: step numbers, emitted modes,
 * and the transition counter. Never shared between calls.
 */
final class SynthesisState {
    private final Map<String, Integer> modeToStep;
    private final Set<String> emittedModes;
    private final String initialMode;
    private int transitionCount;

    SynthesisState(List<String> modesInPriorityOrder) {
        if (modesInPriorityOrder.isEmpty()) {
            throw new IllegalArgumentException("At least one mode is required to number steps");
        }
        this.modeToStep = new HashMap<>();
        this.emittedModes = new HashSet<>();
        this.initialMode = modesInPriorityOrder.get(0);
        this.transitionCount = 0;

        int step = 0;
        for (String mode : modesInPriorityOrder) {
            modeToStep.put(mode, step++);
        }
    }

    String initialMode() { return initialMode; }
    int initialStep() { return modeToStep.get(initialMode); }
    int transitionCount() { return transitionCount; }

    int stepOf(String mode) {
        Integer step = modeToStep.get(mode);
        if (step == null) {
            throw new IllegalArgumentException("No step assigned to mode " + mode);
        }
        return step;
    }

    /**
     * Record that the step of {@code mode} has been placed in the program.
     * Returns false when it already was.
     */
    boolean markEmitted(String mode) {
        return emittedModes.add(mode);
    }

    int nextTransitionId() {
        return transitionCount++;
    }
}
