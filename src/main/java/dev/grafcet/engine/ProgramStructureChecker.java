package dev.grafcet.engine;

import dev.grafcet.model.DivergenceKind;
import dev.grafcet.model.Program;
import dev.grafcet.model.ProgramElement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural contract of a {@link Program}. Returns an empty list if the
 * program is well formed, or a list of violation messages otherwise.
 *
 * <p>Rules:
 * <ul>
 *   <li>steps and transitions alternate along every path; a divergence does not count
 *       as an element, so its branches continue from the element before it</li>
 *   <li>a jump ends a path and must follow a transition</li>
 *   <li>the program starts with its only initial step; step ids are unique and every
 *       jump targets one of them</li>
 *   <li>OR: at least two branches, each starting and ending with a transition
 *       (a closing jump or a closed nested divergence may follow the last one)</li>
 *   <li>AND: preceded by a transition, at least two branches, each starting with a step</li>
 * </ul>
 */
public final class ProgramStructureChecker {

    /** Kind of the last element seen on a path. */
    private enum Last { NONE, STEP, TRANSITION, CLOSED }

    private ProgramStructureChecker() {}

    public static List<String> check(Program program) {
        var errors = new ArrayList<String>();
        List<ProgramElement> elements = program.elements();

        if (elements.isEmpty()) {
            errors.add("Program is empty");
            return errors;
        }
        if (!(elements.get(0) instanceof ProgramElement.Step first) || !first.initial()) {
            errors.add("Program must start with its initial step");
        }

        List<ProgramElement.Step> steps = program.steps();
        long initialCount = steps.stream().filter(ProgramElement.Step::initial).count();
        if (initialCount != 1) {
            errors.add("Program must have exactly one initial step, found " + initialCount);
        }

        Set<Integer> stepIds = new HashSet<>();
        for (ProgramElement.Step step : steps) {
            if (!stepIds.add(step.id())) {
                errors.add("Step %d is emitted more than once".formatted(step.id()));
            }
        }

        checkSequence(elements, Last.NONE, "main", stepIds, errors);
        return errors;
    }

    private static Last checkSequence(List<ProgramElement> sequence, Last before, String context,
                                      Set<Integer> stepIds, List<String> errors) {
        Last last = before;
        for (int i = 0; i < sequence.size(); i++) {
            ProgramElement element = sequence.get(i);
            String where = "%s[%d]".formatted(context, i);

            if (last == Last.CLOSED) {
                errors.add("%s: element after a closed path".formatted(where));
            }

            if (element instanceof ProgramElement.Step) {
                if (last == Last.STEP) {
                    errors.add("%s: two consecutive steps".formatted(where));
                }
                last = Last.STEP;
            } else if (element instanceof ProgramElement.Transition) {
                if (last == Last.TRANSITION) {
                    errors.add("%s: two consecutive transitions".formatted(where));
                } else if (last == Last.NONE) {
                    errors.add("%s: transition without a preceding step".formatted(where));
                }
                last = Last.TRANSITION;
            } else if (element instanceof ProgramElement.Jump jump) {
                if (last != Last.TRANSITION) {
                    errors.add("%s: jump must follow a transition".formatted(where));
                }
                if (!stepIds.contains(jump.targetStepId())) {
                    errors.add("%s: jump to unknown step %d".formatted(where, jump.targetStepId()));
                }
                last = Last.CLOSED;
            } else if (element instanceof ProgramElement.Divergence divergence) {
                last = checkDivergence(divergence, last, where, stepIds, errors);
            }
        }
        return last;
    }

    private static Last checkDivergence(ProgramElement.Divergence divergence, Last before, String where,
                                        Set<Integer> stepIds, List<String> errors) {
        List<List<ProgramElement>> branches = divergence.branches();
        String kind = divergence.kind().name();

        if (branches.size() < 2) {
            errors.add("%s: %s divergence must have at least 2 branches".formatted(where, kind));
        }
        if (divergence.kind() == DivergenceKind.AND && before != Last.TRANSITION) {
            errors.add("%s: AND divergence must be preceded by a transition".formatted(where));
        }

        var ends = new ArrayList<Last>();
        for (int b = 0; b < branches.size(); b++) {
            List<ProgramElement> branch = branches.get(b);
            String branchWhere = "%s.branch[%d]".formatted(where, b);
            if (branch.isEmpty()) {
                errors.add("%s: %s divergence branch is empty".formatted(branchWhere, kind));
                continue;
            }

            ProgramElement first = branch.get(0);
            if (divergence.kind() == DivergenceKind.OR && !(first instanceof ProgramElement.Transition)) {
                errors.add("%s: OR divergence branch must start with a transition".formatted(branchWhere));
            }
            if (divergence.kind() == DivergenceKind.AND && !(first instanceof ProgramElement.Step)) {
                errors.add("%s: AND divergence branch must start with a step".formatted(branchWhere));
            }

            Last end = checkSequence(branch, before, branchWhere, stepIds, errors);
            if (divergence.kind() == DivergenceKind.OR && end != Last.TRANSITION && end != Last.CLOSED) {
                errors.add("%s: OR divergence branch must end with a transition".formatted(branchWhere));
            }
            ends.add(end);
        }

        if (ends.isEmpty()) {
            return before;
        }
        if (ends.stream().allMatch(e -> e == Last.CLOSED)) {
            return Last.CLOSED;
        }
        List<Last> open = ends.stream().filter(e -> e != Last.CLOSED).distinct().toList();
        if (open.size() > 1) {
            errors.add("%s: %s divergence branches converge on different element kinds".formatted(where, kind));
        }
        return open.get(0);
    }
}
