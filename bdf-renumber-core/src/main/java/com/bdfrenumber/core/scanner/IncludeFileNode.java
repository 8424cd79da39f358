package com.bdfrenumber.core.scanner;

import com.bdfrenumber.core.bulk.RawCard;
import com.bdfrenumber.core.model.Namespace;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One file of the include tree.
 *
 * @param index position in the tree arena, 0 for the root
 * @param path normalized absolute path
 * @param parentIndex index of the including file, -1 for the root
 * @param childIndices indices of directly included files, in statement order
 * @param ids IDs whose defining card is written in this file, per namespace
 * @param passthrough cards of this file the catalog cannot key, in file order
 */
public record IncludeFileNode(
    int index,
    Path path,
    int parentIndex,
    List<Integer> childIndices,
    Map<Namespace, SortedSet<Integer>> ids,
    List<RawCard> passthrough
) {
    /**
     * Compact constructor with validation.
     */
    public IncludeFileNode {
        Objects.requireNonNull(path, "path must not be null");
        childIndices = childIndices == null ? List.of() : List.copyOf(childIndices);
        passthrough = passthrough == null ? List.of() : List.copyOf(passthrough);
        Map<Namespace, SortedSet<Integer>> copy = new EnumMap<>(Namespace.class);
        if (ids != null) {
            ids.forEach((namespace, set) -> {
                if (!set.isEmpty()) {
                    copy.put(namespace, Collections.unmodifiableSortedSet(new TreeSet<>(set)));
                }
            });
        }
        ids = Collections.unmodifiableMap(copy);
    }

    public boolean isRoot() {
        return parentIndex < 0;
    }

    /**
     * IDs of one namespace.
     *
     * @param namespace namespace
     * @return sorted IDs, empty when the file defines none
     */
    public SortedSet<Integer> ids(Namespace namespace) {
        return ids.getOrDefault(namespace, Collections.emptySortedSet());
    }

    /**
     * Namespaces this file defines IDs in, in canonical order.
     *
     * @return non-empty namespaces
     */
    public List<Namespace> namespaces() {
        return List.copyOf(ids.keySet());
    }

    public int totalIds() {
        return ids.values().stream().mapToInt(SortedSet::size).sum();
    }

    /**
     * Count, min and max per namespace.
     *
     * @return summaries in canonical namespace order
     */
    public Map<Namespace, NamespaceSummary> summary() {
        Map<Namespace, NamespaceSummary> summary = new LinkedHashMap<>();
        ids.forEach((namespace, set) -> summary.put(namespace, NamespaceSummary.of(set)));
        return summary;
    }
}
