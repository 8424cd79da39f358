package com.bdfrenumber.core.bulk;

import java.util.List;
import java.util.Objects;

/**
 * Executive and case control sections of the root deck file.
 *
 * @param executiveLines executive control lines, including {@code CEND}
 * @param caseControlLines case control lines, excluding {@code BEGIN BULK}
 * @param bulkOnly true if the root file had no control sections
 */
public record ControlDeck(List<String> executiveLines, List<String> caseControlLines, boolean bulkOnly) {

    /**
     * Compact constructor with validation.
     */
    public ControlDeck {
        executiveLines = executiveLines == null ? List.of() : List.copyOf(executiveLines);
        caseControlLines = caseControlLines == null ? List.of() : List.copyOf(caseControlLines);
    }

    /**
     * Control deck of a bulk-data-only root file.
     *
     * @return empty control deck
     */
    public static ControlDeck bulkDataOnly() {
        return new ControlDeck(List.of(), List.of(), true);
    }

    /**
     * Returns a copy with the case control replaced.
     *
     * @param lines new case control lines
     * @return updated control deck
     */
    public ControlDeck withCaseControl(List<String> lines) {
        Objects.requireNonNull(lines, "lines must not be null");
        return new ControlDeck(executiveLines, lines, bulkOnly);
    }
}
