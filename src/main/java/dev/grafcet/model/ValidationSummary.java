package dev.grafcet.model;

import java.util.List;

/**
 * Per-mode results of a project verification, in plan order.
 */
public record ValidationSummary(List<ModeResult> results) {

    public ValidationSummary {
        results = List.copyOf(results);
    }

    public int totalModes() { return results.size(); }

    public int passed() {
        return (int) results.stream().filter(ModeResult::passed).count();
    }

    public int failed() { return totalModes() - passed(); }

    public boolean allPassed() { return passed() == totalModes(); }
}
