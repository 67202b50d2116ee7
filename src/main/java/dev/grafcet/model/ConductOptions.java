package dev.grafcet.model;

/**
 * Naming used when synthesizing a conduct program.
 */
public record ConductOptions(
    String title,
    String subProgramName
) {
    public static final String DEFAULT_TITLE = "System Conduct - GSRSM Orchestrator";
    public static final String DEFAULT_SUB_PROGRAM = "default";

    public static ConductOptions defaults() {
        return new ConductOptions(DEFAULT_TITLE, DEFAULT_SUB_PROGRAM);
    }

    /** Linked file of a mode's own sub-program, e.g. {@code A1/default}. */
    public String linkedFileOf(String modeId) {
        return modeId + "/" + subProgramName;
    }
}
