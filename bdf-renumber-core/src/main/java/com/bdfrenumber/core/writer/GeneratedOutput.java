package com.bdfrenumber.core.writer;

import com.bdfrenumber.core.model.ValidationReport;

import java.util.List;
import java.util.Objects;

/**
 * Collection of deck files to be written, root first.
 *
 * @param files generated files in include tree order
 * @param report fallback warnings raised while rendering
 */
public record GeneratedOutput(
    List<GeneratedFile> files,
    ValidationReport report
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
        if (report == null) {
            report = ValidationReport.empty();
        }
    }

    /**
     * The root deck file.
     *
     * @return first generated file
     */
    public GeneratedFile root() {
        if (files.isEmpty()) {
            throw new IllegalStateException("no files were generated");
        }
        return files.get(0);
    }
}
