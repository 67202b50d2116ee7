package dev.grafcet.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.grafcet.model.CompiledAction;
import dev.grafcet.model.CompiledConnection;
import dev.grafcet.model.CompiledProgram;
import dev.grafcet.model.CompiledStep;
import dev.grafcet.model.CompiledTransition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a compiled SFC ({@code .sfc} JSON) into a {@link CompiledProgram}.
 *
 * <p>Accepts {@code {"elements": [...]}} or a bare element array. Elements are read by their
 * {@code type} ({@code step}, {@code transition}, {@code connection}); other types, extra fields
 * and element order are ignored. Missing fields default to empty values so the verifier can
 * report on them instead of the loader failing.
 */
public final class CompiledProgramLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CompiledProgramLoader() {}

    public static CompiledProgram loadFromFile(Path path) throws IOException {
        return parseProgram(MAPPER.readTree(path.toFile()));
    }

    public static CompiledProgram loadFromString(String json) throws IOException {
        return parseProgram(MAPPER.readTree(json));
    }

    private static CompiledProgram parseProgram(JsonNode root) {
        JsonNode elements = root == null ? null : root.isArray() ? root : root.get("elements");

        var steps = new ArrayList<CompiledStep>();
        var transitions = new ArrayList<CompiledTransition>();
        var connections = new ArrayList<CompiledConnection>();
        if (elements == null) {
            return new CompiledProgram(steps, transitions, connections);
        }

        for (JsonNode element : elements) {
            switch (element.path("type").asText("")) {
                case "step" -> steps.add(parseStep(element));
                case "transition" -> transitions.add(new CompiledTransition(
                    element.path("id").asText(""),
                    element.path("label").asText(""),
                    element.path("condition").asText("")));
                case "connection" -> connections.add(new CompiledConnection(
                    element.path("sourceId").asText(""),
                    element.path("targetId").asText("")));
                default -> {
                    // gates, action blocks and layout-only elements carry no control flow
                }
            }
        }
        return new CompiledProgram(steps, transitions, connections);
    }

    private static CompiledStep parseStep(JsonNode node) {
        List<CompiledAction> actions = new ArrayList<>();
        for (JsonNode action : node.path("actions")) {
            actions.add(new CompiledAction(action.path("variable").asText("")));
        }
        return new CompiledStep(
            node.path("id").asText(""),
            node.path("label").asText(""),
            node.path("isInitial").asBoolean(false),
            node.path("stepType").asText(""),
            actions
        );
    }
}
