package dev.grafcet.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A structured SFC program: a titled element sequence.
 */
public record Program(String title, List<ProgramElement> elements) {

    public Program {
        elements = List.copyOf(elements);
    }

    /**
     * All steps of the program, depth first, in emission order.
     */
    public List<ProgramElement.Step> steps() {
        var steps = new ArrayList<ProgramElement.Step>();
        collectSteps(elements, steps);
        return steps;
    }

    /**
     * All transitions of the program, depth first, in emission order.
     */
    public List<ProgramElement.Transition> transitions() {
        var transitions = new ArrayList<ProgramElement.Transition>();
        collectTransitions(elements, transitions);
        return transitions;
    }

    private static void collectSteps(List<ProgramElement> sequence, List<ProgramElement.Step> out) {
        for (ProgramElement element : sequence) {
            if (element instanceof ProgramElement.Step step) {
                out.add(step);
            } else if (element instanceof ProgramElement.Divergence divergence) {
                divergence.branches().forEach(branch -> collectSteps(branch, out));
            }
        }
    }

    private static void collectTransitions(List<ProgramElement> sequence, List<ProgramElement.Transition> out) {
        for (ProgramElement element : sequence) {
            if (element instanceof ProgramElement.Transition transition) {
                out.add(transition);
            } else if (element instanceof ProgramElement.Divergence divergence) {
                divergence.branches().forEach(branch -> collectTransitions(branch, out));
            }
        }
    }
}
