package com.bdfrenumber.core.plan;

import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.scanner.IncludeFileNode;
import com.bdfrenumber.core.scanner.IncludeTree;
import com.bdfrenumber.core.scanner.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Turns requested ranges into effective per-namespace ranges and ID maps.
 *
 * <p>Allocation never truncates: a (file, namespace) pair whose range is
 * missing, inverted or too small gets no map, and the range validator reports
 * why. Within a block, sorted old IDs receive {@code start, start + 1, ...},
 * so relative order is preserved.
 */
public class RangeAllocator {

    private static final Logger log = LoggerFactory.getLogger(RangeAllocator.class);

    /**
     * Builds a plan from a scan and a range table.
     *
     * @param scan include scan
     * @param mode how the table is to be read
     * @param table requested ranges
     * @param renumberSetIds false to keep set namespace IDs unchanged
     * @return plan with effective ranges and ID maps
     */
    public RangePlan plan(ScanResult scan, AllocationMode mode, RangeTable table, boolean renumberSetIds) {
        IncludeTree tree = scan.tree();
        List<String> unknownFiles = new ArrayList<>();
        Map<Integer, Map<Namespace, IdRange>> ranges = new LinkedHashMap<>();

        if (mode == AllocationMode.SIMPLE) {
            table.fileRanges().forEach((file, range) -> {
                int index = tree.indexOfRelative(file);
                if (index < 0) {
                    unknownFiles.add(file);
                } else {
                    ranges.put(index, allocateSimple(tree.node(index), range, renumberSetIds));
                }
            });
        } else {
            table.namespaceRanges().forEach((file, perNamespace) -> {
                int index = tree.indexOfRelative(file);
                if (index < 0) {
                    unknownFiles.add(file);
                } else {
                    ranges.put(index, perNamespace);
                }
            });
        }

        List<IdMap> maps = new ArrayList<>();
        for (Namespace namespace : Namespace.canonicalOrder()) {
            boolean frozen = !renumberSetIds && namespace.isSetNamespace();
            for (IncludeFileNode node : tree.nodes()) {
                SortedSet<Integer> ids = node.ids(namespace);
                if (ids.isEmpty()) {
                    continue;
                }
                if (frozen) {
                    maps.add(identityMap(node.index(), namespace, ids));
                    continue;
                }
                IdRange range = ranges.getOrDefault(node.index(), Map.of()).get(namespace);
                if (range == null || range.capacity() < ids.size() || range.start() < 1) {
                    log.debug("No map for {}/{}: range {} cannot hold {} ID(s)",
                        tree.relativeName(node.index()), namespace.label(), range, ids.size());
                    continue;
                }
                maps.add(sequentialMap(node.index(), namespace, ids, range));
            }
        }

        IdMapSet mapSet = new IdMapSet(maps);
        log.info("Planned {} map(s) in {} mode; {} ID(s) change", maps.size(), mode, mapSet.changedCount());
        return new RangePlan(mode, renumberSetIds, table, ranges, mapSet, unknownFiles);
    }

    /**
     * Splits a file range into equal blocks, one per namespace the file defines IDs in.
     *
     * <p>Namespaces are taken in canonical order; every block has
     * {@code floor(size / n)} IDs and the last block also absorbs the remainder.
     *
     * @param node file
     * @param fileRange range of the whole file
     * @param renumberSetIds false to leave set namespaces out of the split
     * @return block per namespace, in canonical order
     */
    public Map<Namespace, IdRange> allocateSimple(IncludeFileNode node, IdRange fileRange, boolean renumberSetIds) {
        List<Namespace> present = node.namespaces().stream()
            .filter(namespace -> renumberSetIds || !namespace.isSetNamespace())
            .toList();
        Map<Namespace, IdRange> blocks = new EnumMap<>(Namespace.class);
        if (present.isEmpty()) {
            return blocks;
        }

        long total = (long) fileRange.end() - fileRange.start() + 1;
        long blockSize = Math.max(0, total / present.size());
        for (int i = 0; i < present.size(); i++) {
            long blockStart = fileRange.start() + i * blockSize;
            long blockEnd = i == present.size() - 1 ? fileRange.end() : blockStart + blockSize - 1;
            blocks.put(present.get(i), new IdRange(clamp(blockStart), clamp(blockEnd)));
        }
        return blocks;
    }

    /**
     * Proposes one Simple-mode range per file, in discovery order, starting at {@code start}.
     *
     * <p>Each range is large enough for an equal split to hold the file's
     * largest namespace, and ends on a rounded-up magnitude: an end of 4,321
     * becomes 5,000 while 7 stays 7. The next file starts right after. A file
     * with no IDs gets a one-ID range.
     *
     * @param scan include scan
     * @param start first ID of the first file
     * @param renumberSetIds false to ignore set namespaces when sizing
     * @return range per relative file name, in discovery order
     */
    public Map<String, IdRange> suggest(ScanResult scan, int start, boolean renumberSetIds) {
        IncludeTree tree = scan.tree();
        Map<String, IdRange> suggestion = new LinkedHashMap<>();
        long cursor = start;
        for (IncludeFileNode node : tree.nodes()) {
            List<Namespace> present = node.namespaces().stream()
                .filter(namespace -> renumberSetIds || !namespace.isSetNamespace())
                .toList();
            long largest = present.stream().mapToLong(namespace -> node.ids(namespace).size()).max().orElse(0);
            long needed = largest * present.size();
            if (needed == 0) {
                suggestion.put(tree.relativeName(node.index()), new IdRange(clamp(cursor), clamp(cursor)));
                cursor++;
                continue;
            }
            long end = roundUpToMagnitude(cursor + needed - 1);
            suggestion.put(tree.relativeName(node.index()), new IdRange(clamp(cursor), clamp(end)));
            cursor = end + 1;
        }
        return suggestion;
    }

    /**
     * Rounds a positive value up to its leading digit's magnitude.
     *
     * @param value value to round
     * @return e.g. 4321 becomes 5000, 7 stays 7
     */
    static long roundUpToMagnitude(long value) {
        if (value <= 0) {
            return value;
        }
        long magnitude = 1;
        while (magnitude <= value / 10) {
            magnitude *= 10;
        }
        return ((value + magnitude - 1) / magnitude) * magnitude;
    }

    private static IdMap sequentialMap(int fileIndex, Namespace namespace, SortedSet<Integer> ids, IdRange range) {
        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        int next = range.start();
        for (int oldId : ids) {
            mapping.put(oldId, next++);
        }
        return new IdMap(fileIndex, namespace, range, mapping);
    }

    private static IdMap identityMap(int fileIndex, Namespace namespace, SortedSet<Integer> ids) {
        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        ids.forEach(id -> mapping.put(id, id));
        return new IdMap(fileIndex, namespace, null, mapping);
    }

    private static int clamp(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
