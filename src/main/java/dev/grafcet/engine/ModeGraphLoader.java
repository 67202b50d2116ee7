package dev.grafcet.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.grafcet.model.ModeGraph;
import dev.grafcet.model.ModeRecord;
import dev.grafcet.model.ModeTransitionRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a GSRSM mode description from JSON and builds its mode graph.
 *
 * <pre>
 * { "modes": [ { "id": "A1", "name": "Initial stop", "activated": true } ],
 *   "transitions": [ { "fromMode": "A1", "toMode": "F1", "condition": "PB_START", "activated": true } ] }
 * </pre>
 * A mode may use {@code code} instead of {@code id}. A missing {@code activated} flag means inactive.
 */
public final class ModeGraphLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ModeGraphLoader() {}

    public static ModeGraph loadFromFile(Path path) throws IOException {
        return parseGraph(MAPPER.readTree(path.toFile()));
    }

    public static ModeGraph loadFromString(String json) throws IOException {
        return parseGraph(MAPPER.readTree(json));
    }

    private static ModeGraph parseGraph(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("GSRSM description must be a JSON object");
        }
        return ModeGraphBuilder.build(parseModes(root.get("modes")), parseTransitions(root.get("transitions")));
    }

    private static List<ModeRecord> parseModes(JsonNode modesNode) {
        var modes = new ArrayList<ModeRecord>();
        if (modesNode == null) {
            return modes;
        }
        for (JsonNode node : modesNode) {
            String id = text(node, "id");
            if (id == null) {
                id = text(node, "code");
            }
            if (id == null) {
                throw new IllegalArgumentException("Mode without id or code: " + node);
            }
            String name = text(node, "name");
            modes.add(new ModeRecord(id, name == null ? id : name, node.path("activated").asBoolean(false)));
        }
        return modes;
    }

    private static List<ModeTransitionRecord> parseTransitions(JsonNode transitionsNode) {
        var transitions = new ArrayList<ModeTransitionRecord>();
        if (transitionsNode == null) {
            return transitions;
        }
        for (JsonNode node : transitionsNode) {
            transitions.add(new ModeTransitionRecord(
                text(node, "fromMode"),
                text(node, "toMode"),
                text(node, "condition"),
                node.path("activated").asBoolean(false)
            ));
        }
        return transitions;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
