package com.bdfrenumber.core.bulk;

import com.bdfrenumber.core.card.CardType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Splits raw bulk data lines into card names and flattened field lists.
 *
 * <p>Three formats are understood, and may be mixed line by line:
 * <ul>
 *   <li>small field: 8-character name, eight 8-character fields per line</li>
 *   <li>large field: name ending in {@code *}, four 16-character fields per
 *       line, continuation lines starting with {@code *}</li>
 *   <li>free field: comma separated values</li>
 * </ul>
 *
 * <p>Fields are flattened eight per logical line, so two large-field lines
 * fill the same slots as one small-field line. Field 0 is the card name.
 */
public final class CardReader {

    static final int SMALL_WIDTH = 8;
    static final int LARGE_WIDTH = 16;
    static final int FIELDS_PER_LINE = 8;

    private CardReader() {
        // Utility class
    }

    /**
     * Builds a card from its raw lines.
     *
     * @param raw raw card
     * @param disabledCards card names to keep as passthrough even when known
     * @return parsed card; its type is null when unknown or disabled
     */
    public static BulkCard read(RawCard raw, Set<String> disabledCards) {
        String name = raw.name();
        CardType type = disabledCards.contains(name)
            ? null
            : CardType.fromName(name).orElse(null);
        return new BulkCard(name, type, splitFields(raw.lines()), raw.lines());
    }

    /**
     * Resolves the card type of a raw card, honouring disabled names.
     *
     * @param raw raw card
     * @param disabledCards disabled card names
     * @return the card type, or empty for unknown and disabled cards
     */
    public static Optional<CardType> typeOf(RawCard raw, Set<String> disabledCards) {
        String name = raw.name();
        return disabledCards.contains(name) ? Optional.empty() : CardType.fromName(name);
    }

    /**
     * Extracts the card name of a first card line.
     *
     * @param line first line of a card
     * @return upper-case name without the large-field marker
     */
    public static String cardName(String line) {
        String expanded = expandTabs(line);
        String name;
        if (expanded.contains(",")) {
            name = expanded.substring(0, expanded.indexOf(',')).strip();
        } else {
            name = column(expanded, 0, SMALL_WIDTH).strip();
        }
        name = name.toUpperCase(Locale.ROOT);
        return name.endsWith("*") ? name.substring(0, name.length() - 1) : name;
    }

    /**
     * Returns true for blank lines and {@code $} comments.
     *
     * @param line raw line
     * @return true if the line carries no data
     */
    public static boolean isBlankOrComment(String line) {
        String stripped = line.strip();
        return stripped.isEmpty() || stripped.startsWith("$");
    }

    /**
     * Returns true if the line continues the preceding card.
     *
     * <p>Continuations start with {@code +}, {@code *} or {@code ,}, or leave
     * the name field blank.
     *
     * @param line raw, non-blank line
     * @return true for continuation lines
     */
    public static boolean isContinuation(String line) {
        String expanded = expandTabs(line);
        if (expanded.isEmpty()) {
            return false;
        }
        char first = expanded.charAt(0);
        if (first == '+' || first == '*' || first == ',') {
            return true;
        }
        if (expanded.contains(",")) {
            return expanded.substring(0, expanded.indexOf(',')).isBlank();
        }
        return column(expanded, 0, SMALL_WIDTH).isBlank();
    }

    /**
     * Flattens card lines into a field list.
     *
     * @param lines first line followed by continuations
     * @return field 0 is the card name; trailing blank fields are removed
     */
    public static List<String> splitFields(List<String> lines) {
        List<String> fields = new ArrayList<>();
        boolean first = true;
        for (String rawLine : lines) {
            String line = expandTabs(rawLine);
            if (first) {
                fields.add(cardName(line));
            }
            boolean large = isLargeField(line, first);
            List<String> lineFields = line.contains(",")
                ? freeFields(line, large)
                : fixedFields(line, large);
            fields.addAll(lineFields);
            first = false;
        }
        int end = fields.size();
        while (end > 1 && fields.get(end - 1).isEmpty()) {
            end--;
        }
        return new ArrayList<>(fields.subList(0, end));
    }

    private static boolean isLargeField(String line, boolean first) {
        if (first) {
            String head = line.contains(",") ? line.substring(0, line.indexOf(',')) : column(line, 0, SMALL_WIDTH);
            return head.strip().endsWith("*");
        }
        return line.startsWith("*");
    }

    private static List<String> fixedFields(String line, boolean large) {
        int width = large ? LARGE_WIDTH : SMALL_WIDTH;
        int count = large ? FIELDS_PER_LINE / 2 : FIELDS_PER_LINE;
        List<String> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int start = SMALL_WIDTH + i * width;
            result.add(column(line, start, start + width).strip());
        }
        return result;
    }

    private static List<String> freeFields(String line, boolean large) {
        int perLine = large ? FIELDS_PER_LINE / 2 : FIELDS_PER_LINE;
        List<String> tokens = Arrays.stream(line.split(",", -1)).map(String::strip).toList();
        List<String> data = tokens.subList(1, tokens.size());
        if (data.size() > perLine + 1) {
            // No continuation marker: the line simply runs on.
            List<String> result = new ArrayList<>(data);
            while (result.size() % perLine != 0) {
                result.add("");
            }
            return result;
        }
        List<String> result = new ArrayList<>(data.subList(0, Math.min(perLine, data.size())));
        while (result.size() < perLine) {
            result.add("");
        }
        return result;
    }

    private static String column(String line, int start, int end) {
        if (start >= line.length()) {
            return "";
        }
        return line.substring(start, Math.min(end, line.length()));
    }

    /**
     * Expands tab characters to 8-column stops.
     *
     * @param line raw line
     * @return line without tabs
     */
    static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder expanded = new StringBuilder();
        for (char c : line.toCharArray()) {
            if (c == '\t') {
                do {
                    expanded.append(' ');
                } while (expanded.length() % SMALL_WIDTH != 0);
            } else {
                expanded.append(c);
            }
        }
        return expanded.toString();
    }
}
