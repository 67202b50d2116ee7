package dev.grafcet.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Activated modes keyed by id. Only edges between activated modes are present.
 */
public final class ModeGraph {

    private final Map<String, ModeNode> modes;

    public ModeGraph(Map<String, ModeNode> modes) {
        this.modes = Collections.unmodifiableMap(new LinkedHashMap<>(modes));
    }

    public static ModeGraph empty() {
        return new ModeGraph(Map.of());
    }

    public Map<String, ModeNode> modes() { return modes; }

    public ModeNode mode(String id) { return modes.get(id); }

    public boolean contains(String id) { return modes.containsKey(id); }

    public boolean isEmpty() { return modes.isEmpty(); }

    /**
     * Mode ids ordered for step numbering. See {@link ModePriority}.
     */
    public List<String> activatedModesInPriorityOrder() {
        var ids = new ArrayList<>(modes.keySet());
        ids.sort(ModePriority.COMPARATOR);
        return ids;
    }
}
