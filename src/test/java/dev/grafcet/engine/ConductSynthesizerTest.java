package dev.grafcet.engine;

import dev.grafcet.model.ConductOptions;
import dev.grafcet.model.DivergenceKind;
import dev.grafcet.model.Guard;
import dev.grafcet.model.ModeGraph;
import dev.grafcet.model.ModeRecord;
import dev.grafcet.model.ModeTransitionRecord;
import dev.grafcet.model.Program;
import dev.grafcet.model.ProgramElement;
import dev.grafcet.model.StepKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ConductSynthesizerTest {

    private static ModeGraph graph(List<String> modes, List<ModeTransitionRecord> transitions) {
        var records = modes.stream().map(id -> new ModeRecord(id, "Mode " + id, true)).toList();
        return ModeGraphBuilder.build(records, transitions);
    }

    private static ModeTransitionRecord edge(String from, String to, String guard) {
        return new ModeTransitionRecord(from, to, guard, true);
    }

    private static Program synthesizeWellFormed(ModeGraph graph) {
        Program program = ConductSynthesizer.synthesize(graph);
        assertThat(ProgramStructureChecker.check(program)).isEmpty();
        assertThat(program.steps()).filteredOn(ProgramElement.Step::initial).hasSize(1);
        return program;
    }

    @Test
    void emptyGraphYieldsSelfClosingProgram() {
        Program program = synthesizeWellFormed(ModeGraph.empty());

        assertThat(program.title()).isEqualTo(ConductOptions.DEFAULT_TITLE);
        assertThat(program.elements()).containsExactly(
            new ProgramElement.Step(0, true, StepKind.NORMAL, null, List.of()),
            new ProgramElement.Transition(0, Guard.ALWAYS),
            new ProgramElement.Jump(0)
        );
    }

    @Test
    void singleModeWithoutEdgesClosesWithCycleCompleteSentinel() {
        Program program = synthesizeWellFormed(graph(List.of("A1"), List.of()));

        assertThat(program.elements()).hasSize(3);
        var initial = (ProgramElement.Step) program.elements().get(0);
        assertThat(initial.id()).isZero();
        assertThat(initial.initial()).isTrue();
        assertThat(initial.linkedFile()).isEqualTo("A1/default");

        var transition = (ProgramElement.Transition) program.elements().get(1);
        assertThat(transition.guard()).isEqualTo(Guard.CYCLE_COMPLETE);
        assertThat(transition.guard().synthetic()).isTrue();
        assertThat(program.elements().get(2)).isEqualTo(new ProgramElement.Jump(0));
    }

    @Test
    void twoModeCycleJumpsBackToInitialStep() {
        Program program = synthesizeWellFormed(graph(
            List.of("F1", "A1"),
            List.of(edge("A1", "F1", "PB_START"), edge("F1", "A1", "PB_STOP"))));

        assertThat(program.elements()).containsExactly(
            new ProgramElement.Step(0, true, StepKind.NORMAL, "A1/default", List.of()),
            new ProgramElement.Transition(0, Guard.of("PB_START")),
            new ProgramElement.Step(1, false, StepKind.MACRO, "F1/default", List.of()),
            new ProgramElement.Transition(1, Guard.of("PB_STOP")),
            new ProgramElement.Jump(0)
        );
    }

    @Test
    void multipleOutgoingEdgesBecomeOrDivergenceInEdgeOrder() {
        Program program = synthesizeWellFormed(graph(
            List.of("A1", "F1", "D1", "A6"),
            List.of(edge("A1", "F1", "gx"), edge("A1", "D1", "gy"), edge("A1", "A6", "gz"))));

        assertThat(program.elements()).hasSize(2);
        var divergence = (ProgramElement.Divergence) program.elements().get(1);
        assertThat(divergence.kind()).isEqualTo(DivergenceKind.OR);
        assertThat(divergence.branches()).hasSize(3);

        List<String> firstGuards = divergence.branches().stream()
            .map(branch -> ((ProgramElement.Transition) branch.get(0)).guard().text())
            .toList();
        assertThat(firstGuards).containsExactly("gx", "gy", "gz");

        // A1=0, A6=1, F1=2, D1=3
        assertThat(((ProgramElement.Step) divergence.branches().get(0).get(1)).id()).isEqualTo(2);
        assertThat(((ProgramElement.Step) divergence.branches().get(1).get(1)).id()).isEqualTo(3);
        assertThat(((ProgramElement.Step) divergence.branches().get(2).get(1)).id()).isEqualTo(1);
    }

    @Test
    void modeReachedTwiceIsEmittedOnceAndJumpedToAfterwards() {
        Program program = synthesizeWellFormed(graph(
            List.of("A1", "F1", "F2", "D1"),
            List.of(
                edge("A1", "F1", "a"), edge("A1", "F2", "b"),
                edge("F1", "D1", "c"), edge("F2", "D1", "d"),
                edge("D1", "A1", "e"))));

        assertThat(program.steps()).extracting(ProgramElement.Step::id).containsExactly(0, 1, 3, 2);

        var divergence = (ProgramElement.Divergence) program.elements().get(1);
        List<ProgramElement> second = divergence.branches().get(1);
        assertThat(second).containsExactly(
            new ProgramElement.Transition(3, Guard.of("b")),
            new ProgramElement.Step(2, false, StepKind.MACRO, "F2/default", List.of()),
            new ProgramElement.Transition(4, Guard.of("d")),
            new ProgramElement.Jump(3)
        );
    }

    @Test
    void cycleAwayFromInitialModeTerminates() {
        Program program = synthesizeWellFormed(graph(
            List.of("A1", "F1", "D1"),
            List.of(edge("A1", "F1", "go"), edge("F1", "D1", "fault"), edge("D1", "F1", "recovered"))));

        assertThat(program.elements()).last().isEqualTo(new ProgramElement.Jump(1));
        assertThat(program.steps()).hasSize(3);
    }

    @Test
    void selfLoopJumpsToOwnStep() {
        Program program = synthesizeWellFormed(graph(List.of("A1"), List.of(edge("A1", "A1", "again"))));

        assertThat(program.elements()).containsExactly(
            new ProgramElement.Step(0, true, StepKind.NORMAL, "A1/default", List.of()),
            new ProgramElement.Transition(0, Guard.of("again")),
            new ProgramElement.Jump(0)
        );
    }

    @Test
    void modesUnreachableFromInitialModeKeepTheirNumberButAreNotEmitted() {
        Program program = synthesizeWellFormed(graph(
            List.of("A1", "F1", "D1"),
            List.of(edge("F1", "D1", "x"))));

        assertThat(program.steps()).extracting(ProgramElement.Step::id).containsExactly(0);
    }

    @Test
    void optionsControlTitleAndLinkedFiles() {
        var graph = graph(List.of("A1", "F1"), List.of(edge("A1", "F1", "go")));

        Program program = ConductSynthesizer.synthesize(graph, new ConductOptions("Line 3", "main"));

        assertThat(program.title()).isEqualTo("Line 3");
        assertThat(program.steps()).extracting(ProgramElement.Step::linkedFile)
            .containsExactly("A1/main", "F1/main");
    }

    @Test
    void transitionIdsAreSequentialAndUnique() {
        Program program = synthesizeWellFormed(graph(
            List.of("A1", "F1", "D1"),
            List.of(edge("A1", "F1", "a"), edge("A1", "D1", "b"), edge("F1", "A1", "c"))));

        assertThat(program.transitions()).extracting(ProgramElement.Transition::id)
            .containsExactly(0, 1, 2, 3);
    }

    @Test
    void synthesisIsDeterministic() {
        var graph = graph(
            List.of("D1", "F1", "A1", "A6"),
            List.of(edge("A1", "F1", "a"), edge("A1", "A6", "b"), edge("F1", "D1", "c"), edge("A6", "A1", "d")));

        assertThat(ConductSynthesizer.synthesize(graph)).isEqualTo(ConductSynthesizer.synthesize(graph));
    }

    @Test
    void randomGraphsAlwaysYieldWellFormedPrograms() {
        var ids = List.of("A1", "A2", "A5", "A6", "F1", "F2", "F4", "D1", "D2", "D3");
        var random = new Random(42);

        for (int round = 0; round < 200; round++) {
            var modes = new ArrayList<String>();
            for (String id : ids) {
                if (random.nextInt(3) > 0) {
                    modes.add(id);
                }
            }
            var transitions = new ArrayList<ModeTransitionRecord>();
            int edges = modes.isEmpty() ? 0 : random.nextInt(modes.size() * 2 + 1);
            for (int e = 0; e < edges; e++) {
                String from = modes.get(random.nextInt(modes.size()));
                String to = modes.get(random.nextInt(modes.size()));
                transitions.add(edge(from, to, "G" + e));
            }

            Program program = synthesizeWellFormed(graph(modes, transitions));

            var stepIds = program.steps().stream().map(ProgramElement.Step::id).collect(Collectors.toList());
            assertThat(new HashSet<>(stepIds)).hasSameSizeAs(stepIds);
        }
    }

    @Test
    void longSingleEdgeChainIsSynthesizedWithoutDeepRecursion() {
        int length = 10_000;
        var modes = new ArrayList<String>();
        var transitions = new ArrayList<ModeTransitionRecord>();
        for (int i = 1; i <= length; i++) {
            modes.add("F" + i);
            if (i < length) {
                transitions.add(edge("F" + i, "F" + (i + 1), "NEXT_" + i));
            }
        }

        Program program = synthesizeWellFormed(graph(modes, transitions));

        assertThat(program.elements()).hasSize(2 * length + 1);
        assertThat(program.steps()).hasSize(length);
        assertThat(program.transitions()).hasSize(length);
        assertThat(program.elements().get(2 * length - 1))
            .isEqualTo(new ProgramElement.Transition(length - 1, Guard.CYCLE_COMPLETE));
        assertThat(program.elements().get(2 * length)).isEqualTo(new ProgramElement.Jump(0));
    }

    @Test
    void nestedDivergencesCloseInnermostFirst() {
        int depth = 300;
        var modes = new ArrayList<String>();
        var transitions = new ArrayList<ModeTransitionRecord>();
        for (int i = 1; i <= depth + 1; i++) {
            modes.add("F" + i);
            if (i <= depth) {
                transitions.add(edge("F" + i, "F" + (i + 1), "NEXT"));
                transitions.add(edge("F" + i, "F1", "BACK"));
            }
        }

        Program program = synthesizeWellFormed(graph(modes, transitions));

        assertThat(program.steps()).hasSize(depth + 1);
        assertThat(program.transitions()).hasSize(2 * depth + 1);
        var outer = (ProgramElement.Divergence) program.elements().get(1);
        assertThat(outer.branches().get(0).get(0)).isEqualTo(new ProgramElement.Transition(0, Guard.of("NEXT")));
        assertThat(outer.branches().get(1))
            .containsExactly(new ProgramElement.Transition(2 * depth, Guard.of("BACK")), new ProgramElement.Jump(0));
    }
}
