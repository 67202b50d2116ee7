package dev.grafcet.engine;

import dev.grafcet.model.Issue;
import dev.grafcet.model.ModeResult;
import dev.grafcet.model.ValidationSummary;
import dev.grafcet.model.VerificationReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns verification results into text a person (or a generating agent) can act on.
 */
public final class FeedbackFormatter {

    private static final String RULE = "=".repeat(60);

    private FeedbackFormatter() {}

    /**
     * Feedback for one mode: a single line when it passed, one block per issue otherwise.
     */
    public static String feedback(ModeResult result) {
        if (result.passed()) {
            return "PASS Mode %s (%s) passed validation.".formatted(result.modeId(), result.modeName());
        }
        VerificationReport report = result.report();
        var sb = new StringBuilder();
        sb.append("FAIL Mode %s (%s) failed validation:\n".formatted(result.modeId(), result.modeName()));
        sb.append("  Errors: %d, Warnings: %d\n".formatted(report.errorCount(), report.warningCount()));
        for (Issue issue : report.issues()) {
            sb.append('\n');
            sb.append(issueLines(issue));
        }
        return sb.toString();
    }

    /**
     * One block per issue, used by single-program verification.
     */
    public static String issueLines(Issue issue) {
        var sb = new StringBuilder();
        sb.append("  ").append(issue.severity()).append(" [").append(issue.kind().code()).append("] ")
            .append(issue.message()).append('\n');
        if (issue.elementName() != null) {
            sb.append("     Element: ").append(issue.elementName()).append('\n');
        }
        if (issue.suggestedFix() != null) {
            sb.append("     Fix: ").append(issue.suggestedFix()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Suggested fixes of error issues, each preceded by a comment naming the problem.
     */
    public static List<String> corrections(VerificationReport report) {
        var corrections = new ArrayList<String>();
        for (Issue issue : report.issues()) {
            if (issue.isError() && issue.suggestedFix() != null) {
                corrections.add("// Fix for: " + issue.message());
                corrections.add(issue.suggestedFix());
                corrections.add("");
            }
        }
        return corrections;
    }

    public static String summary(ValidationSummary summary) {
        var sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("VERIFICATION SUMMARY\n");
        sb.append(RULE).append('\n');
        sb.append("Total Modes Tested: ").append(summary.totalModes()).append('\n');
        sb.append("Passed: ").append(summary.passed()).append('\n');
        sb.append("Failed: ").append(summary.failed()).append("\n\n");
        for (ModeResult result : summary.results()) {
            VerificationReport report = result.report();
            sb.append("  %s: %s (%dE/%dW)\n".formatted(
                result.modeId(), report.status(), report.errorCount(), report.warningCount()));
        }
        sb.append('\n').append(RULE);
        return sb.toString();
    }
}
