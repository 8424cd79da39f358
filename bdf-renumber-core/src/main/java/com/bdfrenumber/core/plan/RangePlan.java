package com.bdfrenumber.core.plan;

import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Allocation result: the effective range of every (file, namespace) pair and the ID maps built from them.
 *
 * @param mode allocation mode the ranges were given in
 * @param renumberSetIds false when set namespaces keep their IDs
 * @param table ranges as requested
 * @param ranges effective ranges per file index and namespace
 * @param maps ID maps, one per (file, namespace) that could be allocated
 * @param unknownFiles requested file names that are not in the include tree
 */
public record RangePlan(
    AllocationMode mode,
    boolean renumberSetIds,
    RangeTable table,
    Map<Integer, Map<Namespace, IdRange>> ranges,
    IdMapSet maps,
    List<String> unknownFiles
) {
    /**
     * Compact constructor with validation.
     */
    public RangePlan {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(maps, "maps must not be null");
        Map<Integer, Map<Namespace, IdRange>> copy = new LinkedHashMap<>();
        if (ranges != null) {
            ranges.forEach((file, perNamespace) -> {
                Map<Namespace, IdRange> inner = new EnumMap<>(Namespace.class);
                inner.putAll(perNamespace);
                copy.put(file, Collections.unmodifiableMap(inner));
            });
        }
        ranges = Collections.unmodifiableMap(copy);
        unknownFiles = unknownFiles == null ? List.of() : List.copyOf(unknownFiles);
    }

    /**
     * Effective range of one file and namespace.
     *
     * @param fileIndex file index
     * @param namespace namespace
     * @return the range, or null when none was given
     */
    public IdRange range(int fileIndex, Namespace namespace) {
        return ranges.getOrDefault(fileIndex, Map.of()).get(namespace);
    }

    /**
     * Returns true if IDs of the namespace are kept as they are.
     *
     * @param namespace namespace
     * @return true for set namespaces when set renumbering is off
     */
    public boolean isFrozen(Namespace namespace) {
        return !renumberSetIds && namespace.isSetNamespace();
    }
}
