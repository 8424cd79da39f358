package com.bdfrenumber.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of findings produced by one or more pipeline stages.
 *
 * <p>Reports are complete: every stage records all of its findings rather than
 * stopping at the first error, so a caller can fix every issue in one pass.
 *
 * @param findings findings in the order they were produced
 */
public record ValidationReport(List<Finding> findings) {

    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(findings, "findings must not be null");
        findings = List.copyOf(findings);
    }

    /**
     * Creates an empty report.
     *
     * @return report without findings
     */
    public static ValidationReport empty() {
        return new ValidationReport(List.of());
    }

    /**
     * Concatenates reports, keeping their order.
     *
     * @param reports reports to merge
     * @return merged report
     */
    public static ValidationReport merge(ValidationReport... reports) {
        List<Finding> all = new ArrayList<>();
        Arrays.stream(reports).filter(Objects::nonNull).forEach(r -> all.addAll(r.findings()));
        return new ValidationReport(all);
    }

    /**
     * Returns a new report with the other report's findings appended.
     *
     * @param other report to append
     * @return combined report
     */
    public ValidationReport and(ValidationReport other) {
        return merge(this, other);
    }

    /**
     * Check if there are any errors.
     *
     * @return true if at least one ERROR finding exists
     */
    public boolean hasErrors() {
        return findings.stream().anyMatch(Finding::isError);
    }

    /**
     * Check if there are any warnings.
     *
     * @return true if at least one WARNING finding exists
     */
    public boolean hasWarnings() {
        return findings.stream().anyMatch(f -> f.severity() == FindingSeverity.WARNING);
    }

    /**
     * Get findings by severity level.
     *
     * @param severity the severity level
     * @return findings with the specified severity
     */
    public List<Finding> getFindingsBySeverity(FindingSeverity severity) {
        return findings.stream()
            .filter(finding -> finding.severity() == severity)
            .toList();
    }

    /**
     * Get findings by category.
     *
     * @param category the category
     * @return findings with the specified category
     */
    public List<Finding> getFindingsByCategory(FindingCategory category) {
        return findings.stream()
            .filter(finding -> finding.category() == category)
            .toList();
    }

    /**
     * Shorthand for the error findings.
     *
     * @return ERROR findings
     */
    public List<Finding> errors() {
        return getFindingsBySeverity(FindingSeverity.ERROR);
    }

    /**
     * Shorthand for the warning findings.
     *
     * @return WARNING findings
     */
    public List<Finding> warnings() {
        return getFindingsBySeverity(FindingSeverity.WARNING);
    }
}
