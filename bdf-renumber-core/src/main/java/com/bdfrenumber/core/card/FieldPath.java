package com.bdfrenumber.core.card;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Location of one or more reference fields within a card's flattened field list.
 *
 * <p>Field 0 is the card name and field 1 the primary ID. Continuation lines
 * are flattened eight fields per line, so the first field of the second line
 * is field 9. The {@code last} bound is inclusive; {@link Integer#MAX_VALUE}
 * means "to the end of the card".
 *
 * @param shape how the fields are laid out
 * @param first first field index
 * @param last last field index (inclusive)
 * @param stride distance between consecutive fields for {@link Shape#STRIDED}
 */
public record FieldPath(Shape shape, int first, int last, int stride) {

    private static final Set<String> GROUP_TERMINATORS = Set.of("UM", "ALPHA", "TREF", "SCALE");

    /**
     * Layout of a field path.
     */
    public enum Shape {
        /** Fields {@code first..last}, each one an ID. */
        FIELDS,
        /** Open-ended ID list from {@code first}, with {@code THRU} expansion. */
        LIST,
        /** Every {@code stride}-th field from {@code first}. */
        STRIDED,
        /** Groups of (weight, components, ID, ID, ...) starting at {@code first}. */
        WEIGHTED_GROUPS
    }

    /**
     * Compact constructor with validation.
     */
    public FieldPath {
        if (shape == null) {
            throw new IllegalArgumentException("shape must not be null");
        }
        if (first < 1) {
            throw new IllegalArgumentException("first field must be >= 1, got " + first);
        }
        if (last < first) {
            throw new IllegalArgumentException("last field " + last + " precedes first field " + first);
        }
        if (shape == Shape.STRIDED && stride < 1) {
            throw new IllegalArgumentException("stride must be >= 1, got " + stride);
        }
    }

    public static FieldPath field(int index) {
        return new FieldPath(Shape.FIELDS, index, index, 1);
    }

    public static FieldPath fields(int first, int last) {
        return new FieldPath(Shape.FIELDS, first, last, 1);
    }

    public static FieldPath list(int first) {
        return new FieldPath(Shape.LIST, first, Integer.MAX_VALUE, 1);
    }

    public static FieldPath strided(int first, int stride) {
        return new FieldPath(Shape.STRIDED, first, Integer.MAX_VALUE, stride);
    }

    public static FieldPath weightedGroups(int first) {
        return new FieldPath(Shape.WEIGHTED_GROUPS, first, Integer.MAX_VALUE, 1);
    }

    /**
     * Resolves the field indices this path covers on a concrete card.
     *
     * <p>For {@link Shape#LIST} paths the result holds every index from
     * {@code first}; {@code THRU} ranges are handled by {@link Fields#spans}.
     * For {@link Shape#WEIGHTED_GROUPS} only the ID slots are returned: the
     * weight and component fields that open each group are skipped, as are the
     * component fields of {@code UM} pairs.
     *
     * @param fields flattened card fields
     * @return candidate field indices in ascending order
     */
    public List<Integer> indices(List<String> fields) {
        List<Integer> indices = new ArrayList<>();
        int end = Math.min(last, fields.size() - 1);
        switch (shape) {
            case FIELDS, LIST -> {
                for (int i = first; i <= end; i++) {
                    indices.add(i);
                }
            }
            case STRIDED -> {
                for (int i = first; i <= end; i += stride) {
                    indices.add(i);
                }
            }
            case WEIGHTED_GROUPS -> collectGroupIds(fields, end, indices);
        }
        return indices;
    }

    private void collectGroupIds(List<String> fields, int end, List<Integer> indices) {
        boolean expectComponent = false;
        boolean inUm = false;
        boolean umNodeNext = true;
        for (int i = first; i <= end; i++) {
            String value = fields.get(i).trim().toUpperCase(Locale.ROOT);
            if (value.isEmpty()) {
                continue;
            }
            if (GROUP_TERMINATORS.contains(value)) {
                inUm = "UM".equals(value);
                umNodeNext = true;
                expectComponent = false;
                if (!inUm) {
                    return;
                }
                continue;
            }
            if (inUm) {
                if (umNodeNext) {
                    indices.add(i);
                }
                umNodeNext = !umNodeNext;
            } else if (Fields.isReal(value)) {
                expectComponent = true;
            } else if (expectComponent) {
                expectComponent = false;
            } else {
                indices.add(i);
            }
        }
    }
}
