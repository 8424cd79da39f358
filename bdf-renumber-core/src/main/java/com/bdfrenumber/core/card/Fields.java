package com.bdfrenumber.core.card;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.NavigableSet;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Field value classification and ID list parsing.
 *
 * <p>Only positive integers are IDs. Blanks, zero, negative values, reals and
 * keywords are data and never rewritten.
 */
public final class Fields {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final String THRU = "THRU";
    private static final String BY = "BY";

    private Fields() {
        // Utility class
    }

    /**
     * Parses a field as an ID.
     *
     * @param field raw field text
     * @return the positive integer value, or -1 when the field is not an ID
     */
    public static int parseId(String field) {
        if (field == null) {
            return -1;
        }
        String value = field.trim();
        if (!INTEGER.matcher(value).matches()) {
            return -1;
        }
        try {
            int id = Integer.parseInt(value.startsWith("+") ? value.substring(1) : value);
            return id > 0 ? id : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public static boolean isId(String field) {
        return parseId(field) > 0;
    }

    /**
     * Returns true for real numbers written with a decimal point or exponent.
     *
     * @param field raw field text
     * @return true if the field holds a real value
     */
    public static boolean isReal(String field) {
        String value = field == null ? "" : field.trim();
        if (value.isEmpty() || INTEGER.matcher(value).matches()) {
            return false;
        }
        char first = value.charAt(0);
        return Character.isDigit(first) || first == '.' || first == '-' || first == '+';
    }

    public static boolean isKeyword(String field, String keyword) {
        return field != null && field.trim().toUpperCase(Locale.ROOT).equals(keyword);
    }

    /**
     * Splits an open-ended ID list into spans.
     *
     * <p>Single IDs become one-field spans; {@code a THRU b [BY s]} becomes one
     * span covering all of its fields. Fields that are neither (blanks, reals,
     * other keywords) belong to no span.
     *
     * @param fields flattened card fields
     * @param from first field index of the list
     * @return spans in field order
     */
    public static List<IdSpan> spans(List<String> fields, int from) {
        List<IdSpan> spans = new ArrayList<>();
        int i = from;
        while (i < fields.size()) {
            int id = parseId(fields.get(i));
            if (id < 0) {
                i++;
                continue;
            }
            int next = nextNonBlank(fields, i + 1);
            if (next > 0 && isKeyword(fields.get(next), THRU)) {
                int highIndex = nextNonBlank(fields, next + 1);
                int high = highIndex > 0 ? parseId(fields.get(highIndex)) : -1;
                if (high >= id) {
                    int end = highIndex;
                    int step = 1;
                    int byIndex = nextNonBlank(fields, highIndex + 1);
                    if (byIndex > 0 && isKeyword(fields.get(byIndex), BY)) {
                        int stepIndex = nextNonBlank(fields, byIndex + 1);
                        int parsed = stepIndex > 0 ? parseId(fields.get(stepIndex)) : -1;
                        if (parsed > 0) {
                            step = parsed;
                            end = stepIndex;
                        }
                    }
                    spans.add(new IdSpan(i, end, id, high, step));
                    i = end + 1;
                    continue;
                }
            }
            spans.add(new IdSpan(i, i, id, id, 1));
            i++;
        }
        return spans;
    }

    private static int nextNonBlank(List<String> fields, int from) {
        for (int i = from; i < fields.size(); i++) {
            if (!fields.get(i).isBlank()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * A single ID or an inclusive {@code THRU} range within a field list.
     *
     * @param startIndex first field index of the span
     * @param endIndex last field index of the span (inclusive)
     * @param low first ID
     * @param high last ID
     * @param step increment between IDs
     */
    public record IdSpan(int startIndex, int endIndex, int low, int high, int step) {

        public boolean isRange() {
            return endIndex > startIndex;
        }

        /**
         * Returns true if the ID is one of the span's members.
         *
         * @param id candidate ID
         * @return true when {@code id} lies on the span's {@code BY} grid
         */
        public boolean covers(int id) {
            return id >= low && id <= high && ((long) id - low) % step == 0;
        }

        /**
         * Members of this span found in a sorted ID set.
         *
         * <p>Cost follows the size of the set, not the width of the span.
         *
         * @param ids sorted IDs
         * @return matching IDs in ascending order
         */
        public Stream<Integer> membersIn(NavigableSet<Integer> ids) {
            if (ids.isEmpty() || low > high) {
                return Stream.empty();
            }
            return ids.subSet(low, true, high, true).stream().filter(this::covers);
        }

        /**
         * Enumerates the IDs of this span. Only spans that define entities
         * ({@code SPOINT}) are expanded this way.
         *
         * @return IDs in ascending order
         */
        public List<Integer> ids() {
            List<Integer> ids = new ArrayList<>();
            for (long id = low; id <= high; id += step) {
                ids.add((int) id);
            }
            return ids;
        }
    }
}
