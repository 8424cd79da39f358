package com.bdfrenumber.core.scanner;

import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.model.ValidationReport;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of an include scan: the file tree, card provenance and structural findings.
 *
 * @param tree include file tree
 * @param origins source file of every keyed card
 * @param disabledCards card names treated as passthrough during the scan
 * @param report structural findings (missing includes, IDs defined in two files)
 */
public record ScanResult(
    IncludeTree tree,
    CardOrigins origins,
    Set<String> disabledCards,
    ValidationReport report
) {
    /**
     * Compact constructor with validation.
     */
    public ScanResult {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(origins, "origins must not be null");
        disabledCards = disabledCards == null ? Set.of() : Set.copyOf(disabledCards);
        if (report == null) {
            report = ValidationReport.empty();
        }
    }

    public boolean hasErrors() {
        return report.hasErrors();
    }

    /**
     * Catalog summary of every file, keyed by relative name.
     *
     * @return per-file namespace summaries in discovery order
     */
    public Map<String, Map<Namespace, NamespaceSummary>> summary() {
        Map<String, Map<Namespace, NamespaceSummary>> summary = new LinkedHashMap<>();
        for (IncludeFileNode node : tree.nodes()) {
            summary.put(tree.relativeName(node.index()), node.summary());
        }
        return summary;
    }

    /**
     * File that owns an ID.
     *
     * @param namespace namespace
     * @param id ID
     * @return file index, or -1 when no file catalogued the ID
     */
    public int ownerOf(Namespace namespace, int id) {
        for (IncludeFileNode node : tree.nodes()) {
            if (node.ids(namespace).contains(id)) {
                return node.index();
            }
        }
        return -1;
    }
}
