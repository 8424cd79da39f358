package com.bdfrenumber.core.model;

import java.util.Objects;

/**
 * A single validation finding.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Finding finding = Finding.error(
 *     FindingCategory.CAPACITY,
 *     "wing.bdf/Node ID: range [1-10] has capacity 10 but 12 entities need renumbering"
 * ).at("wing.bdf", Namespace.NODE, null);
 * }</pre>
 *
 * @param severity severity level
 * @param category finding category
 * @param message human-readable description
 * @param file offending file (relative name), or null
 * @param namespace offending namespace, or null
 * @param id offending ID, or null
 */
public record Finding(
    FindingSeverity severity,
    FindingCategory category,
    String message,
    String file,
    Namespace namespace,
    Integer id
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Create an error finding.
     *
     * @param category the category
     * @param message the message
     * @return a new Finding with ERROR severity
     */
    public static Finding error(FindingCategory category, String message) {
        return new Finding(FindingSeverity.ERROR, category, message, null, null, null);
    }

    /**
     * Create a warning finding.
     *
     * @param category the category
     * @param message the message
     * @return a new Finding with WARNING severity
     */
    public static Finding warning(FindingCategory category, String message) {
        return new Finding(FindingSeverity.WARNING, category, message, null, null, null);
    }

    /**
     * Create an informational finding.
     *
     * @param category the category
     * @param message the message
     * @return a new Finding with INFO severity
     */
    public static Finding info(FindingCategory category, String message) {
        return new Finding(FindingSeverity.INFO, category, message, null, null, null);
    }

    /**
     * Returns a copy of this finding located at the given file, namespace and ID.
     *
     * @param file file name, or null
     * @param namespace namespace, or null
     * @param id ID, or null
     * @return located finding
     */
    public Finding at(String file, Namespace namespace, Integer id) {
        return new Finding(severity, category, message, file, namespace, id);
    }

    /**
     * Returns true if this finding is an error.
     *
     * @return true for ERROR severity
     */
    public boolean isError() {
        return severity == FindingSeverity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " [" + category + "] " + message;
    }
}
