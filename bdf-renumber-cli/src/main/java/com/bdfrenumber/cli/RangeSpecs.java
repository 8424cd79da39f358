package com.bdfrenumber.cli;

import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangeTable;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code --range} arguments.
 *
 * <p>Simple mode: {@code file=start:end}. Advanced mode:
 * {@code file:namespace=start:end}, the namespace given by key ({@code nid})
 * or name ({@code NODE}).
 */
public final class RangeSpecs {

    private RangeSpecs() {
        // Utility class
    }

    /**
     * Builds a range table from range arguments.
     *
     * @param specs range arguments
     * @param mode allocation mode
     * @return range table
     * @throws IllegalArgumentException if an argument is malformed or repeated
     */
    public static RangeTable parse(List<String> specs, AllocationMode mode) {
        Map<String, IdRange> fileRanges = new LinkedHashMap<>();
        Map<String, Map<Namespace, IdRange>> namespaceRanges = new LinkedHashMap<>();
        for (String spec : specs) {
            int equals = spec.lastIndexOf('=');
            if (equals <= 0) {
                throw new IllegalArgumentException("Range must look like file=start:end: " + spec);
            }
            String target = spec.substring(0, equals).strip();
            IdRange range = parseRange(spec, spec.substring(equals + 1).strip());

            if (mode == AllocationMode.SIMPLE) {
                if (fileRanges.put(normalize(target), range) != null) {
                    throw new IllegalArgumentException("Range given twice for " + target);
                }
                continue;
            }
            int colon = target.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Advanced range must look like file:namespace=start:end: " + spec);
            }
            String file = normalize(target.substring(0, colon));
            Namespace namespace = Namespace.fromKey(target.substring(colon + 1).strip());
            if (namespaceRanges.computeIfAbsent(file, f -> new EnumMap<>(Namespace.class))
                .put(namespace, range) != null) {
                throw new IllegalArgumentException("Range given twice for " + file + ":" + namespace.key());
            }
        }
        return new RangeTable(fileRanges, namespaceRanges);
    }

    private static IdRange parseRange(String spec, String value) {
        String[] bounds = value.split(":");
        if (bounds.length != 2) {
            throw new IllegalArgumentException("Range bounds must look like start:end: " + spec);
        }
        try {
            return new IdRange(Integer.parseInt(bounds[0].strip()), Integer.parseInt(bounds[1].strip()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Range bounds must be integers: " + spec, e);
        }
    }

    private static String normalize(String file) {
        String name = file.strip().replace('\\', '/');
        return name.startsWith("./") ? name.substring(2) : name;
    }
}
