package com.bdfrenumber.core.model;

/**
 * Severity level of a validation finding.
 *
 * @since 1.0.0
 */
public enum FindingSeverity {
    /**
     * Informational - no action required, just for awareness.
     */
    INFO,

    /**
     * Warning - the run continues and output stays complete, but the caller should review it.
     */
    WARNING,

    /**
     * Error - the run is aborted or its output must not be trusted.
     */
    ERROR
}
