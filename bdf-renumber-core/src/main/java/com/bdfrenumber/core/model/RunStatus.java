package com.bdfrenumber.core.model;

/**
 * Overall outcome of a renumbering run.
 */
public enum RunStatus {
    SUCCESS,
    SUCCESS_WITH_WARNINGS,
    FAILURE;

    /**
     * Derives the status from a report.
     *
     * @param report validation report
     * @return FAILURE on any error, SUCCESS_WITH_WARNINGS on any warning, else SUCCESS
     */
    public static RunStatus of(ValidationReport report) {
        if (report.hasErrors()) {
            return FAILURE;
        }
        return report.hasWarnings() ? SUCCESS_WITH_WARNINGS : SUCCESS;
    }

    /**
     * Process exit code used by the command line.
     *
     * @return 0, 2 or 1
     */
    public int exitCode() {
        return switch (this) {
            case SUCCESS -> 0;
            case SUCCESS_WITH_WARNINGS -> 2;
            case FAILURE -> 1;
        };
    }
}
