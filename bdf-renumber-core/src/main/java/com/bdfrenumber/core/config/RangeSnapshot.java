package com.bdfrenumber.core.config;

import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangeTable;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saved range table.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "mode" : "SIMPLE",
 *   "renumberSetIds" : true,
 *   "fileRanges" : { "main.bdf" : [ 1, 999 ], "includes/wing.bdf" : [ 1000, 1999 ] },
 *   "ranges" : { }
 * }
 * }</pre>
 *
 * @param mode allocation mode
 * @param renumberSetIds whether set namespaces are renumbered
 * @param fileRanges file name to {@code [start, end]}, Simple mode
 * @param ranges file name to namespace key to {@code [start, end]}, Advanced mode
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RangeSnapshot(
    @JsonProperty("mode") AllocationMode mode,
    @JsonProperty("renumberSetIds") boolean renumberSetIds,
    @JsonProperty("fileRanges") Map<String, List<Integer>> fileRanges,
    @JsonProperty("ranges") Map<String, Map<String, List<Integer>>> ranges
) {
    /**
     * Compact constructor with defaults.
     */
    public RangeSnapshot {
        if (mode == null) {
            mode = AllocationMode.SIMPLE;
        }
        fileRanges = fileRanges == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fileRanges));
        ranges = ranges == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
    }

    /**
     * Captures a range table.
     *
     * @param mode allocation mode
     * @param renumberSetIds whether set namespaces are renumbered
     * @param table ranges to save
     * @return snapshot
     */
    public static RangeSnapshot of(AllocationMode mode, boolean renumberSetIds, RangeTable table) {
        Map<String, List<Integer>> files = new LinkedHashMap<>();
        table.fileRanges().forEach((file, range) -> files.put(file, pair(range)));

        Map<String, Map<String, List<Integer>>> perNamespace = new LinkedHashMap<>();
        table.namespaceRanges().forEach((file, byNamespace) -> {
            Map<String, List<Integer>> entries = new LinkedHashMap<>();
            byNamespace.forEach((namespace, range) -> entries.put(namespace.key(), pair(range)));
            perNamespace.put(file, entries);
        });
        return new RangeSnapshot(mode, renumberSetIds, files, perNamespace);
    }

    /**
     * Rebuilds the range table.
     *
     * @return range table
     * @throws IllegalArgumentException if a range is not a pair or a namespace key is unknown
     */
    public RangeTable toRangeTable() {
        Map<String, IdRange> files = new LinkedHashMap<>();
        fileRanges.forEach((file, pair) -> files.put(file, range(file, pair)));

        Map<String, Map<Namespace, IdRange>> perNamespace = new LinkedHashMap<>();
        ranges.forEach((file, byKey) -> {
            Map<Namespace, IdRange> entries = new EnumMap<>(Namespace.class);
            byKey.forEach((key, pair) -> entries.put(Namespace.fromKey(key), range(file + ":" + key, pair)));
            perNamespace.put(file, entries);
        });
        return new RangeTable(files, perNamespace);
    }

    private static List<Integer> pair(IdRange range) {
        return List.of(range.start(), range.end());
    }

    private static IdRange range(String owner, List<Integer> pair) {
        if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
            throw new IllegalArgumentException("Range of " + owner + " must be [start, end]: " + pair);
        }
        return new IdRange(pair.get(0), pair.get(1));
    }
}
