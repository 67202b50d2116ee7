package dev.grafcet.engine;

import dev.grafcet.model.ModeEdge;
import dev.grafcet.model.ModeGraph;
import dev.grafcet.model.ModeNode;
import dev.grafcet.model.ModeRecord;
import dev.grafcet.model.ModeTransitionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link ModeGraph} from flat mode and transition records.
 *
 * <p>Inactive modes are left out. Inactive transitions, and transitions whose source or
 * target is not an activated mode, are dropped without error.
 */
public final class ModeGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ModeGraphBuilder.class);

    static final String DEFAULT_GUARD = "TRUE";

    private ModeGraphBuilder() {}

    public static ModeGraph build(List<ModeRecord> modes, List<ModeTransitionRecord> transitions) {
        var names = new LinkedHashMap<String, String>();
        var outgoing = new LinkedHashMap<String, List<ModeEdge>>();
        var incoming = new LinkedHashMap<String, List<ModeEdge>>();

        for (ModeRecord mode : modes) {
            if (!mode.activated() || mode.id() == null || mode.id().isEmpty()) {
                continue;
            }
            names.put(mode.id(), mode.name() == null || mode.name().isBlank() ? mode.id() : mode.name());
            outgoing.put(mode.id(), new ArrayList<>());
            incoming.put(mode.id(), new ArrayList<>());
        }

        int dropped = 0;
        for (ModeTransitionRecord transition : transitions) {
            if (!transition.activated()) {
                continue;
            }
            String from = transition.fromMode();
            String to = transition.toMode();
            if (!names.containsKey(from) || !names.containsKey(to)) {
                log.debug("Dropping transition {} -> {}: endpoint is not an activated mode", from, to);
                dropped++;
                continue;
            }
            String guard = transition.guard() == null || transition.guard().isBlank()
                ? DEFAULT_GUARD : transition.guard();
            outgoing.get(from).add(new ModeEdge(to, guard));
            incoming.get(to).add(new ModeEdge(from, guard));
        }

        Map<String, ModeNode> nodes = new LinkedHashMap<>();
        for (var entry : names.entrySet()) {
            String id = entry.getKey();
            nodes.put(id, new ModeNode(id, entry.getValue(), true, outgoing.get(id), incoming.get(id)));
        }
        log.debug("Built mode graph with {} activated modes ({} dangling transitions dropped)",
            nodes.size(), dropped);
        return new ModeGraph(nodes);
    }
}
