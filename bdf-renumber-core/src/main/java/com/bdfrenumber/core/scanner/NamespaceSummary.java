package com.bdfrenumber.core.scanner;

import java.util.SortedSet;

/**
 * Count and span of the IDs one file defines in one namespace.
 *
 * @param count number of IDs
 * @param min smallest ID
 * @param max largest ID
 */
public record NamespaceSummary(int count, int min, int max) {

    /**
     * Summarizes a non-empty ID set.
     *
     * @param ids sorted IDs
     * @return summary
     */
    public static NamespaceSummary of(SortedSet<Integer> ids) {
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("cannot summarize an empty ID set");
        }
        return new NamespaceSummary(ids.size(), ids.first(), ids.last());
    }
}
