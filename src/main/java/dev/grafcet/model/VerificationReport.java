package dev.grafcet.model;

import java.util.List;

/**
 * Issues found for one compiled program, with the status derived from them.
 */
public record VerificationReport(List<Issue> issues) {

    public VerificationReport {
        issues = List.copyOf(issues);
    }

    public VerificationStatus status() {
        return VerificationStatus.of(issues);
    }

    public boolean passed() {
        return status() == VerificationStatus.PASS;
    }

    public long errorCount() {
        return count(Severity.ERROR);
    }

    public long warningCount() {
        return count(Severity.WARNING);
    }

    private long count(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).count();
    }
}
