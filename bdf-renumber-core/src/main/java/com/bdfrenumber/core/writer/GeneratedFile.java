package com.bdfrenumber.core.writer;

import java.util.List;
import java.util.Objects;

/**
 * Represents a deck file to be written.
 *
 * @param relativePath path relative to the output directory (e.g., "includes/wing.bdf")
 * @param lines file lines without terminators
 * @param sourceIndex index of the source file in the include tree
 */
public record GeneratedFile(
    String relativePath,
    List<String> lines,
    int sourceIndex
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(lines, "lines must not be null");
        lines = List.copyOf(lines);
    }
}
