package com.bdfrenumber.core.engine;

import com.bdfrenumber.core.model.RunStatus;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.RangePlan;
import com.bdfrenumber.core.scanner.ScanResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a full renumbering run.
 *
 * @param status overall status derived from the report
 * @param report every finding of the run, in pipeline order
 * @param scan include scan of the source deck
 * @param plan range plan
 * @param writtenFiles files written, root first; empty when the run stopped before writing
 */
public record RunResult(
    RunStatus status,
    ValidationReport report,
    ScanResult scan,
    RangePlan plan,
    List<Path> writtenFiles
) {
    /**
     * Compact constructor with validation.
     */
    public RunResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(report, "report must not be null");
        writtenFiles = writtenFiles == null ? List.of() : List.copyOf(writtenFiles);
    }

    /**
     * Creates a result whose status follows the report.
     *
     * @param report findings of the run
     * @param scan include scan
     * @param plan range plan
     * @param writtenFiles files written
     * @return result
     */
    public static RunResult of(ValidationReport report, ScanResult scan, RangePlan plan, List<Path> writtenFiles) {
        return new RunResult(RunStatus.of(report), report, scan, plan, writtenFiles);
    }

    public boolean isWritten() {
        return !writtenFiles.isEmpty();
    }
}
