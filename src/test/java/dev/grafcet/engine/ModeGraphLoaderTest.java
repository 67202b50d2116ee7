package dev.grafcet.engine;

import dev.grafcet.model.ModeEdge;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModeGraphLoaderTest {

    private static final String GSRSM = """
        {
          "modes": [
            { "id": "A1", "name": "Initial stop", "activated": true },
            { "code": "F1", "name": "Normal production", "activated": true },
            { "id": "D1", "name": "Emergency stop", "activated": true },
            { "id": "A5", "name": "Restart preparation" }
          ],
          "transitions": [
            { "fromMode": "A1", "toMode": "F1", "condition": "PB_START", "activated": true },
            { "fromMode": "F1", "toMode": "D1", "condition": "E_STOP", "activated": true },
            { "fromMode": "D1", "toMode": "A1", "activated": true },
            { "fromMode": "A1", "toMode": "A5", "condition": "PREP", "activated": true },
            { "fromMode": "F1", "toMode": "A1", "condition": "PB_STOP" }
          ]
        }
        """;

    @Test
    void loadsModesAndActivatedTransitions() throws IOException {
        var graph = ModeGraphLoader.loadFromString(GSRSM);

        assertThat(graph.activatedModesInPriorityOrder()).containsExactly("A1", "F1", "D1");
        assertThat(graph.mode("F1").name()).isEqualTo("Normal production");
        assertThat(graph.mode("A1").outgoing()).containsExactly(new ModeEdge("F1", "PB_START"));
        assertThat(graph.mode("F1").outgoing()).containsExactly(new ModeEdge("D1", "E_STOP"));
        assertThat(graph.mode("D1").outgoing()).containsExactly(new ModeEdge("A1", "TRUE"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("gsrsm.json");
        Files.writeString(file, GSRSM);

        assertThat(ModeGraphLoader.loadFromFile(file).modes()).hasSize(3);
    }

    @Test
    void missingSectionsGiveEmptyGraph() throws IOException {
        assertThat(ModeGraphLoader.loadFromString("{}").isEmpty()).isTrue();
    }

    @Test
    void rejectsModeWithoutIdentifier() {
        assertThatThrownBy(() -> ModeGraphLoader.loadFromString("""
            { "modes": [ { "name": "Nameless", "activated": true } ] }
            """))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("without id");
    }

    @Test
    void rejectsNonObjectRoot() {
        assertThatThrownBy(() -> ModeGraphLoader.loadFromString("[]"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void malformedJsonIsAnIoError() {
        assertThatThrownBy(() -> ModeGraphLoader.loadFromString("{ \"modes\": ["))
            .isInstanceOf(IOException.class);
    }
}
