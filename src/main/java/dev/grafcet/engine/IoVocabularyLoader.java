package dev.grafcet.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.grafcet.model.IoVocabulary;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Loads the project IO vocabulary: {@code {"variables": [{"name": ...}], "actions": [{"name": ...}]}}.
 * Everything except the names is ignored.
 */
public final class IoVocabularyLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IoVocabularyLoader() {}

    public static IoVocabulary loadFromFile(Path path) throws IOException {
        return parseVocabulary(MAPPER.readTree(path.toFile()));
    }

    public static IoVocabulary loadFromString(String json) throws IOException {
        return parseVocabulary(MAPPER.readTree(json));
    }

    private static IoVocabulary parseVocabulary(JsonNode root) {
        if (root == null) {
            return IoVocabulary.empty();
        }
        return new IoVocabulary(names(root.path("variables")), names(root.path("actions")));
    }

    private static Set<String> names(JsonNode entries) {
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode entry : entries) {
            String name = entry.path("name").asText("");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
