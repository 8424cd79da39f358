package com.bdfrenumber.core.plan;

import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ranges requested by the user, keyed by file name relative to the root's directory.
 *
 * <p>Simple mode reads {@code fileRanges}; Advanced mode reads
 * {@code namespaceRanges}. The other map is ignored.
 *
 * @param fileRanges one range per file
 * @param namespaceRanges one range per file and namespace
 */
public record RangeTable(Map<String, IdRange> fileRanges, Map<String, Map<Namespace, IdRange>> namespaceRanges) {

    /**
     * Compact constructor with validation.
     */
    public RangeTable {
        fileRanges = fileRanges == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fileRanges));
        Map<String, Map<Namespace, IdRange>> copy = new LinkedHashMap<>();
        if (namespaceRanges != null) {
            namespaceRanges.forEach((file, ranges) -> {
                Map<Namespace, IdRange> perNamespace = new EnumMap<>(Namespace.class);
                perNamespace.putAll(ranges);
                copy.put(file, Collections.unmodifiableMap(perNamespace));
            });
        }
        namespaceRanges = Collections.unmodifiableMap(copy);
    }

    public static RangeTable simple(Map<String, IdRange> fileRanges) {
        return new RangeTable(fileRanges, Map.of());
    }

    public static RangeTable advanced(Map<String, Map<Namespace, IdRange>> namespaceRanges) {
        return new RangeTable(Map.of(), namespaceRanges);
    }
}
