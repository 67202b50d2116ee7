package dev.grafcet.engine;

import dev.grafcet.model.ConductOptions;
import dev.grafcet.model.DivergenceKind;
import dev.grafcet.model.Guard;
import dev.grafcet.model.ModeEdge;
import dev.grafcet.model.ModeGraph;
import dev.grafcet.model.Program;
import dev.grafcet.model.ProgramElement;
import dev.grafcet.model.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lowers a mode graph into a structured conduct program.
 *
 * <p>Each activated mode gets a step numbered by {@link ModeGraph#activatedModesInPriorityOrder()}.
 * The first mode is the initial step; every other mode reached from it becomes a macro step
 * linked to the mode's own sub-program. Emission walks the outgoing edges from the initial mode:
 * <ul>
 *   <li>no edge: a {@link Guard#CYCLE_COMPLETE} transition and a jump to the initial step</li>
 *   <li>one edge: its transition, then the target mode's step and continuation</li>
 *   <li>several edges: an OR divergence with one branch per edge, in edge order</li>
 * </ul>
 * A mode whose step was already emitted is not emitted again; the path ends with a jump to it.
 * Emission does not recurse: long mode chains and nested divergences never grow the call stack.
 * Modes unreachable from the initial mode keep their step number but are not emitted.
 */
public final class ConductSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ConductSynthesizer.class);

    private final ModeGraph graph;
    private final ConductOptions options;
    private final SynthesisState state;

    private ConductSynthesizer(ModeGraph graph, ConductOptions options, SynthesisState state) {
        this.graph = graph;
        this.options = options;
        this.state = state;
    }

    public static Program synthesize(ModeGraph graph) {
        return synthesize(graph, ConductOptions.defaults());
    }

    public static Program synthesize(ModeGraph graph, ConductOptions options) {
        List<String> modes = graph.activatedModesInPriorityOrder();
        if (modes.isEmpty()) {
            log.debug("No activated modes, emitting the minimal self-closing program");
            return emptyProgram(options);
        }
        var synthesizer = new ConductSynthesizer(graph, options, new SynthesisState(modes));
        Program program = synthesizer.emit();
        log.debug("Synthesized conduct program: {} steps, {} transitions from {} modes",
            program.steps().size(), program.transitions().size(), modes.size());
        return program;
    }

    private static Program emptyProgram(ConductOptions options) {
        return new Program(options.title(), List.of(
            new ProgramElement.Step(0, true, StepKind.NORMAL, null, List.of()),
            new ProgramElement.Transition(0, Guard.ALWAYS),
            new ProgramElement.Jump(0)
        ));
    }

    private Program emit() {
        var sequence = new ArrayList<ProgramElement>();
        String initial = state.initialMode();
        state.markEmitted(initial);
        sequence.add(new ProgramElement.Step(
            state.initialStep(), true, StepKind.NORMAL, options.linkedFileOf(initial), List.of()));

        // open OR divergences, innermost on top; branches are filled depth first in edge order
        Deque<PendingDivergence> open = new ArrayDeque<>();
        String fork = walk(initial, sequence);
        if (fork != null) {
            open.push(new PendingDivergence(graph.mode(fork).outgoing(), sequence));
        }
        while (!open.isEmpty()) {
            PendingDivergence divergence = open.peek();
            if (divergence.isComplete()) {
                open.pop();
                divergence.close();
                continue;
            }
            List<ProgramElement> branch = divergence.nextBranch();
            String target = emitEdge(divergence.currentEdge(), branch);
            String nested = target == null ? null : walk(target, branch);
            if (nested != null) {
                open.push(new PendingDivergence(graph.mode(nested).outgoing(), branch));
            }
        }
        return new Program(options.title(), sequence);
    }

    /**
     * Emit the continuation of {@code mode} while it has a single outgoing edge.
     * Returns the mode where an OR divergence must open, or null when the path is closed.
     */
    private String walk(String mode, List<ProgramElement> sequence) {
        String current = mode;
        while (true) {
            List<ModeEdge> outgoing = graph.mode(current).outgoing();
            if (outgoing.isEmpty()) {
                sequence.add(new ProgramElement.Transition(state.nextTransitionId(), Guard.CYCLE_COMPLETE));
                sequence.add(new ProgramElement.Jump(state.initialStep()));
                return null;
            }
            if (outgoing.size() > 1) {
                return current;
            }
            current = emitEdge(outgoing.get(0), sequence);
            if (current == null) {
                return null;
            }
        }
    }

    /**
     * Emit the transition of {@code edge} and, on first arrival, the target's step.
     * Returns the target mode to continue from, or null when the path ended with a jump.
     */
    private String emitEdge(ModeEdge edge, List<ProgramElement> sequence) {
        sequence.add(new ProgramElement.Transition(state.nextTransitionId(), Guard.of(edge.guard())));

        String target = edge.modeId();
        if (!state.markEmitted(target)) {
            log.debug("Mode {} already emitted, closing path with Jump {}", target, state.stepOf(target));
            sequence.add(new ProgramElement.Jump(state.stepOf(target)));
            return null;
        }
        sequence.add(new ProgramElement.Step(
            state.stepOf(target), false, StepKind.MACRO, options.linkedFileOf(target), List.of()));
        return target;
    }

    /**
     * An OR divergence whose branches are still being emitted. It is appended to its
     * enclosing sequence once every branch is complete, always as that sequence's last element.
     */
    private static final class PendingDivergence {
        private final List<ModeEdge> edges;
        private final List<ProgramElement> enclosing;
        private final List<List<ProgramElement>> branches = new ArrayList<>();

        PendingDivergence(List<ModeEdge> edges, List<ProgramElement> enclosing) {
            this.edges = edges;
            this.enclosing = enclosing;
        }

        boolean isComplete() {
            return branches.size() == edges.size();
        }

        List<ProgramElement> nextBranch() {
            var branch = new ArrayList<ProgramElement>();
            branches.add(branch);
            return branch;
        }

        ModeEdge currentEdge() {
            return edges.get(branches.size() - 1);
        }

        void close() {
            enclosing.add(new ProgramElement.Divergence(DivergenceKind.OR, branches));
        }
    }
}
