package dev.grafcet.model;

import java.util.List;

/**
 * One element of a structured SFC program.
 * Exactly one of four forms: step, transition, divergence, or jump.
 */
public sealed interface ProgramElement {

    /** A step. The initial flag is independent of the kind. */
    record Step(
        int id,
        boolean initial,
        StepKind kind,
        String linkedFile, // nullable
        List<Action> actions
    ) implements ProgramElement {
        public Step {
            actions = List.copyOf(actions);
        }
    }

    /** A guarded transition. */
    record Transition(int id, Guard guard) implements ProgramElement {}

    /** A branch point. Each branch is its own element sequence. */
    record Divergence(DivergenceKind kind, List<List<ProgramElement>> branches) implements ProgramElement {
        public Divergence {
            branches = branches.stream().<List<ProgramElement>>map(List::copyOf).toList();
        }
    }

    /** Continue at an already emitted step. */
    record Jump(int targetStepId) implements ProgramElement {}
}
