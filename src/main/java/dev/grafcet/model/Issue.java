package dev.grafcet.model;

/**
 * A single verification finding. The suggested fix is advisory text only.
 */
public record Issue(
    IssueKind kind,
    Severity severity,
    String message,
    String elementId, // nullable
    String elementName, // nullable
    String suggestedFix // nullable
) {
    public static Issue of(IssueKind kind, Severity severity, String message, String suggestedFix) {
        return new Issue(kind, severity, message, null, null, suggestedFix);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
