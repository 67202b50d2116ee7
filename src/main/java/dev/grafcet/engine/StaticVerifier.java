package dev.grafcet.engine;

import dev.grafcet.model.CompiledAction;
import dev.grafcet.model.CompiledConnection;
import dev.grafcet.model.CompiledProgram;
import dev.grafcet.model.CompiledStep;
import dev.grafcet.model.CompiledTransition;
import dev.grafcet.model.IoVocabulary;
import dev.grafcet.model.Issue;
import dev.grafcet.model.IssueKind;
import dev.grafcet.model.ModeCategory;
import dev.grafcet.model.Severity;
import dev.grafcet.model.VerificationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static analysis of a compiled program graph.
 *
 * <p>Steps and transitions are both plain graph nodes; nothing about alternation or
 * ordering of the input is assumed. Every finding is returned as an {@link Issue},
 * the verifier itself never throws for a non-null program.
 */
public final class StaticVerifier {

    private static final Logger log = LoggerFactory.getLogger(StaticVerifier.class);

    private StaticVerifier() {}

    public static List<Issue> verify(CompiledProgram program, IoVocabulary vocabulary, ModeCategory category) {
        return verify(program, vocabulary, category, VerificationRules.defaults());
    }

    public static List<Issue> verify(CompiledProgram program, IoVocabulary vocabulary, ModeCategory category,
                                     VerificationRules rules) {
        var issues = new ArrayList<Issue>();
        var graph = new ConnectionIndex(program.connections());

        List<CompiledStep> initialSteps = program.steps().stream().filter(CompiledStep::initial).toList();

        // 1: initial step
        if (initialSteps.isEmpty()) {
            issues.add(Issue.of(IssueKind.INCORRECT_SEQUENCING, Severity.ERROR,
                "No initial step found. SFC must have at least one initial step.",
                "Mark the first step as initial: Step 0 (Initial)"));
        }

        // 2: reachability
        Set<String> reached = graph.reachableFrom(initialSteps.stream().map(CompiledStep::id).toList());
        for (CompiledStep step : program.steps()) {
            if (!step.initial() && !reached.contains(step.id())) {
                String name = step.displayName();
                issues.add(new Issue(IssueKind.UNREACHABLE_STEP, Severity.ERROR,
                    "Step '%s' is unreachable from initial state.".formatted(name),
                    step.id(), name,
                    "Add a transition path from an active step to '%s'".formatted(name)));
            }
        }

        issues.addAll(checkDeadEnds(program, graph, rules));

        if (category.requiresEmergencyStop()) {
            issues.addAll(checkEmergencyStop(program.transitions(), rules));
        }

        issues.addAll(checkUndefinedVariables(program.transitions(), vocabulary));
        issues.addAll(checkUndefinedActions(program.steps(), vocabulary));

        // 7: closed loop back to the initial step
        if (!initialSteps.isEmpty()) {
            CompiledStep initial = initialSteps.get(0);
            if (graph.incoming(initial.id()).isEmpty()) {
                issues.add(new Issue(IssueKind.MISSING_RETURN_PATH, Severity.WARNING,
                    "No return path to initial step. GEMMA modes should form a closed loop.",
                    initial.id(), initial.displayName(),
                    "Add a transition from the final step back to the initial step"));
            }
        }

        issues.addAll(checkDuplicateIds(program));
        issues.addAll(checkDanglingConnections(program));

        log.debug("Verified {} steps, {} transitions, {} connections ({}): {} issues",
            program.steps().size(), program.transitions().size(), program.connections().size(),
            category, issues.size());
        return issues;
    }

    private static List<Issue> checkDeadEnds(CompiledProgram program, ConnectionIndex graph,
                                             VerificationRules rules) {
        var issues = new ArrayList<Issue>();
        Set<String> transitionIds = new HashSet<>();
        program.transitions().forEach(t -> transitionIds.add(t.id()));

        for (CompiledStep step : program.steps()) {
            boolean leadsToTransition = graph.outgoing(step.id()).stream().anyMatch(transitionIds::contains);
            if (leadsToTransition) {
                continue;
            }
            String kind = step.stepType().toLowerCase(Locale.ROOT);
            if (!rules.terminalStepKinds().contains(kind)) {
                String name = step.displayName();
                issues.add(new Issue(IssueKind.DEAD_END_TRANSITION, Severity.WARNING,
                    "Step '%s' has no outgoing transitions (dead end).".formatted(name),
                    step.id(), name,
                    "Add a transition after step '%s' to continue the sequence".formatted(name)));
            }
        }
        return issues;
    }

    private static List<Issue> checkEmergencyStop(List<CompiledTransition> transitions, VerificationRules rules) {
        for (CompiledTransition transition : transitions) {
            String condition = transition.condition().toLowerCase(Locale.ROOT);
            if (rules.emergencyKeywords().stream().anyMatch(condition::contains)) {
                return List.of();
            }
        }
        return List.of(Issue.of(IssueKind.MISSING_ESTOP, Severity.ERROR,
            "Emergency stop mode must have E-Stop condition handling.",
            "Add an E-Stop check to a transition guard: Transition E_STOP OR EMERGENCY"));
    }

    private static List<Issue> checkUndefinedVariables(List<CompiledTransition> transitions,
                                                       IoVocabulary vocabulary) {
        var issues = new ArrayList<Issue>();
        for (CompiledTransition transition : transitions) {
            for (String token : GuardScanner.variableReferences(transition.condition())) {
                if (!vocabulary.variables().contains(token)) {
                    issues.add(new Issue(IssueKind.UNDEFINED_VARIABLE, Severity.WARNING,
                        "Variable '%s' in condition is not defined.".formatted(token),
                        transition.id(), transition.displayName(),
                        "Define variable '%s' in project IO".formatted(token)));
                }
            }
        }
        return issues;
    }

    private static List<Issue> checkUndefinedActions(List<CompiledStep> steps, IoVocabulary vocabulary) {
        var issues = new ArrayList<Issue>();
        for (CompiledStep step : steps) {
            for (CompiledAction action : step.actions()) {
                String variable = action.variable();
                if (variable != null && !variable.isEmpty() && !vocabulary.actions().contains(variable)) {
                    String name = step.displayName();
                    issues.add(new Issue(IssueKind.UNDEFINED_ACTION, Severity.WARNING,
                        "Action '%s' in step '%s' is not defined.".formatted(variable, name),
                        step.id(), name,
                        "Define action '%s' in project IO".formatted(variable)));
                }
            }
        }
        return issues;
    }

    private static List<Issue> checkDuplicateIds(CompiledProgram program) {
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        var ids = new ArrayList<String>();
        program.steps().forEach(s -> ids.add(s.id()));
        program.transitions().forEach(t -> ids.add(t.id()));

        var issues = new ArrayList<Issue>();
        for (String id : ids) {
            if (!id.isEmpty() && !seen.add(id) && reported.add(id)) {
                issues.add(new Issue(IssueKind.INCORRECT_SEQUENCING, Severity.ERROR,
                    "Element id '%s' is used by more than one step or transition.".formatted(id),
                    id, null,
                    "Give every step and transition its own id"));
            }
        }
        return issues;
    }

    private static List<Issue> checkDanglingConnections(CompiledProgram program) {
        Set<String> known = new HashSet<>();
        program.steps().forEach(s -> known.add(s.id()));
        program.transitions().forEach(t -> known.add(t.id()));

        var issues = new ArrayList<Issue>();
        for (CompiledConnection connection : program.connections()) {
            String source = connection.sourceId();
            String target = connection.targetId();
            if (source.isEmpty()) {
                issues.add(Issue.of(IssueKind.INCORRECT_SEQUENCING, Severity.ERROR,
                    "Connection -> %s has no source element.".formatted(target),
                    "Connect the element to its predecessor or remove the connection"));
            } else if (!known.contains(source)) {
                issues.add(unknownEndpoint(connection, source));
            }
            if (target.isEmpty()) {
                issues.add(Issue.of(IssueKind.INCORRECT_SEQUENCING, Severity.ERROR,
                    "Connection %s -> has no target element.".formatted(source),
                    "Connect the element to its successor or remove the connection"));
            } else if (!known.contains(target)) {
                issues.add(unknownEndpoint(connection, target));
            }
        }
        return issues;
    }

    private static Issue unknownEndpoint(CompiledConnection connection, String endpoint) {
        return new Issue(IssueKind.INCORRECT_SEQUENCING, Severity.ERROR,
            "Connection %s -> %s references unknown element '%s'."
                .formatted(connection.sourceId(), connection.targetId(), endpoint),
            endpoint, null,
            "Remove the connection or add the missing element");
    }

    /**
     * Forward and backward adjacency over element ids.
     */
    private static final class ConnectionIndex {
        private final Map<String, List<String>> from = new LinkedHashMap<>();
        private final Map<String, List<String>> to = new LinkedHashMap<>();

        ConnectionIndex(List<CompiledConnection> connections) {
            for (CompiledConnection connection : connections) {
                String source = connection.sourceId();
                String target = connection.targetId();
                if (!source.isEmpty()) {
                    from.computeIfAbsent(source, k -> new ArrayList<>()).add(target);
                }
                if (!target.isEmpty()) {
                    to.computeIfAbsent(target, k -> new ArrayList<>()).add(source);
                }
            }
        }

        List<String> outgoing(String id) {
            return from.getOrDefault(id, List.of());
        }

        List<String> incoming(String id) {
            return to.getOrDefault(id, List.of());
        }

        /** Breadth-first over every node kind. */
        Set<String> reachableFrom(List<String> starts) {
            Set<String> visited = new HashSet<>();
            var queue = new ArrayDeque<String>(starts);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                if (!visited.add(current)) {
                    continue;
                }
                for (String next : outgoing(current)) {
                    if (!visited.contains(next)) {
                        queue.add(next);
                    }
                }
            }
            return visited;
        }
    }
}
