package dev.grafcet.engine;

import dev.grafcet.model.Action;
import dev.grafcet.model.Program;
import dev.grafcet.model.ProgramElement;
import dev.grafcet.model.StepKind;

import java.util.List;

/**
 * Renders a {@link Program} in the line-oriented conduct DSL read by the SFC compiler.
 */
public final class ProgramWriter {

    private static final String INDENT = "    ";

    private ProgramWriter() {}

    public static String write(Program program) {
        var sb = new StringBuilder();
        sb.append("SFC \"").append(program.title()).append("\"\n");
        writeSequence(program.elements(), 0, sb);
        return sb.toString();
    }

    private static void writeSequence(List<ProgramElement> sequence, int depth, StringBuilder sb) {
        String indent = INDENT.repeat(depth);
        for (ProgramElement element : sequence) {
            if (element instanceof ProgramElement.Step step) {
                sb.append(indent).append("Step ").append(step.id()).append(stepSuffix(step)).append('\n');
                for (Action action : step.actions()) {
                    sb.append(indent).append(INDENT).append(actionLine(action)).append('\n');
                }
                if (step.linkedFile() != null) {
                    sb.append(indent).append(INDENT)
                        .append("LinkedFile \"").append(step.linkedFile()).append("\"\n");
                }
            } else if (element instanceof ProgramElement.Transition transition) {
                // guards are never quoted
                sb.append(indent).append("Transition ").append(transition.guard().text()).append('\n');
            } else if (element instanceof ProgramElement.Jump jump) {
                sb.append(indent).append("Jump ").append(jump.targetStepId()).append('\n');
            } else if (element instanceof ProgramElement.Divergence divergence) {
                sb.append(indent).append("Divergence ").append(divergence.kind().name()).append('\n');
                for (List<ProgramElement> branch : divergence.branches()) {
                    sb.append(indent).append(INDENT).append("Branch\n");
                    writeSequence(branch, depth + 2, sb);
                    sb.append(indent).append(INDENT).append("EndBranch\n");
                }
                sb.append(indent).append("EndDivergence\n");
            }
        }
    }

    private static String stepSuffix(ProgramElement.Step step) {
        if (step.initial()) {
            return " (Initial)";
        }
        if (step.kind() == StepKind.MACRO) {
            return " (Macro)";
        }
        if (step.kind() == StepKind.TASK) {
            return " (Task)";
        }
        return "";
    }

    static String actionLine(Action action) {
        var sb = new StringBuilder("Action ").append(action.name())
            .append(" (").append(action.qualifier().name());
        if (action.duration() != null) {
            sb.append(", \"").append(action.duration()).append('"');
        }
        return sb.append(')').toString();
    }
}
