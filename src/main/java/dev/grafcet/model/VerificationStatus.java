package dev.grafcet.model;

import java.util.List;

public enum VerificationStatus {
    PASS,
    FAIL;

    /** FAIL as soon as one issue has error severity. */
    public static VerificationStatus of(List<Issue> issues) {
        return issues.stream().anyMatch(Issue::isError) ? FAIL : PASS;
    }
}
