package dev.grafcet.engine;

import dev.grafcet.model.ModeEdge;
import dev.grafcet.model.ModeRecord;
import dev.grafcet.model.ModeTransitionRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModeGraphBuilderTest {

    private static ModeRecord active(String id) {
        return new ModeRecord(id, "Mode " + id, true);
    }

    @Test
    void keepsOnlyActivatedModes() {
        var graph = ModeGraphBuilder.build(
            List.of(active("A1"), new ModeRecord("A5", "Preparation", false), active("F1")),
            List.of());

        assertThat(graph.modes()).containsOnlyKeys("A1", "F1");
        assertThat(graph.contains("A5")).isFalse();
        assertThat(graph.mode("A1").name()).isEqualTo("Mode A1");
    }

    @Test
    void blankNameFallsBackToId() {
        var graph = ModeGraphBuilder.build(List.of(new ModeRecord("F2", " ", true)), List.of());

        assertThat(graph.mode("F2").name()).isEqualTo("F2");
    }

    @Test
    void resolvesEdgesInInputOrder() {
        var graph = ModeGraphBuilder.build(
            List.of(active("A1"), active("F1"), active("D1")),
            List.of(
                new ModeTransitionRecord("A1", "F1", "start", true),
                new ModeTransitionRecord("A1", "D1", "estop", true),
                new ModeTransitionRecord("F1", "A1", "stop", true)));

        assertThat(graph.mode("A1").outgoing())
            .containsExactly(new ModeEdge("F1", "start"), new ModeEdge("D1", "estop"));
        assertThat(graph.mode("A1").incoming()).containsExactly(new ModeEdge("F1", "stop"));
        assertThat(graph.mode("D1").outgoing()).isEmpty();
    }

    @Test
    void dropsInactiveAndDanglingTransitions() {
        var graph = ModeGraphBuilder.build(
            List.of(active("A1"), active("F1"), new ModeRecord("D1", "Emergency", false)),
            List.of(
                new ModeTransitionRecord("A1", "F1", "start", false),
                new ModeTransitionRecord("A1", "D1", "estop", true),
                new ModeTransitionRecord("A1", "X9", "ghost", true),
                new ModeTransitionRecord("F1", "A1", "stop", true)));

        assertThat(graph.mode("A1").outgoing()).isEmpty();
        assertThat(graph.mode("F1").outgoing()).containsExactly(new ModeEdge("A1", "stop"));
    }

    @Test
    void missingGuardDefaultsToTrue() {
        var graph = ModeGraphBuilder.build(
            List.of(active("A1"), active("F1")),
            List.of(new ModeTransitionRecord("A1", "F1", null, true),
                new ModeTransitionRecord("F1", "A1", "", true)));

        assertThat(graph.mode("A1").outgoing()).containsExactly(new ModeEdge("F1", "TRUE"));
        assertThat(graph.mode("F1").outgoing()).containsExactly(new ModeEdge("A1", "TRUE"));
    }

    @Test
    void priorityOrderIsTierThenNumericSuffix() {
        var graph = ModeGraphBuilder.build(
            List.of(active("Z1"), active("D1"), active("A10"), active("F1"), active("Ax"), active("A2"),
                active("A1")),
            List.of());

        assertThat(graph.activatedModesInPriorityOrder())
            .containsExactly("A1", "A2", "A10", "Ax", "F1", "D1", "Z1");
    }

    @Test
    void emptyInputGivesEmptyGraph() {
        assertThat(ModeGraphBuilder.build(List.of(), List.of()).isEmpty()).isTrue();
    }
}
