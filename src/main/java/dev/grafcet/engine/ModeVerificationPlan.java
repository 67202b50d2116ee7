package dev.grafcet.engine;

import dev.grafcet.model.CompiledProgram;
import dev.grafcet.model.ModeCategory;
import dev.grafcet.model.ModeGraph;
import dev.grafcet.model.ModeNode;
import dev.grafcet.model.ModeVerification;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The per-mode verification jobs of a project, one per activated mode in priority order.
 * Built once by {@link #register} and handed to {@link ModeVerificationRunner}.
 */
public record ModeVerificationPlan(List<ModeVerification> jobs) {

    public ModeVerificationPlan {
        jobs = List.copyOf(jobs);
    }

    /**
     * @param graph    activated modes of the project
     * @param programs compiled program per mode id; modes absent from the map are planned without one
     */
    public static ModeVerificationPlan register(ModeGraph graph, Map<String, CompiledProgram> programs) {
        var jobs = new ArrayList<ModeVerification>();
        for (String modeId : graph.activatedModesInPriorityOrder()) {
            ModeNode node = graph.mode(modeId);
            jobs.add(new ModeVerification(modeId, node.name(), ModeCategory.of(modeId), programs.get(modeId)));
        }
        return new ModeVerificationPlan(jobs);
    }

    public int size() {
        return jobs.size();
    }
}
