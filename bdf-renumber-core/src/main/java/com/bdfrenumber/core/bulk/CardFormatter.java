package com.bdfrenumber.core.bulk;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes cards back as deck lines.
 *
 * <p>Unmodified cards keep their original lines. Modified cards are written in
 * small-field format when every field fits in 8 characters, large-field
 * format when every field fits in 16, and free-field format otherwise.
 */
public final class CardFormatter {

    private static final String SMALL_CONTINUATION = "+";
    private static final String LARGE_CONTINUATION = "*";

    private CardFormatter() {
        // Utility class
    }

    /**
     * Formats a card.
     *
     * @param card card to write
     * @return deck lines without terminators
     */
    public static List<String> format(BulkCard card) {
        if (!card.isModified()) {
            return card.rawLines();
        }
        return formatFields(card.fields());
    }

    /**
     * Formats a flattened field list.
     *
     * @param fields field 0 is the card name
     * @return deck lines without terminators
     */
    public static List<String> formatFields(List<String> fields) {
        List<String> data = fields.subList(1, fields.size());
        int widest = data.stream().mapToInt(String::length).max().orElse(0);
        if (widest <= CardReader.SMALL_WIDTH && fields.get(0).length() <= CardReader.SMALL_WIDTH) {
            return fixed(fields.get(0), SMALL_CONTINUATION, data, CardReader.SMALL_WIDTH, CardReader.FIELDS_PER_LINE);
        }
        if (widest <= CardReader.LARGE_WIDTH && fields.get(0).length() < CardReader.SMALL_WIDTH) {
            return fixed(fields.get(0) + "*", LARGE_CONTINUATION, data,
                CardReader.LARGE_WIDTH, CardReader.FIELDS_PER_LINE / 2);
        }
        return free(fields.get(0), data);
    }

    private static List<String> fixed(String name, String continuation, List<String> data, int width, int perLine) {
        List<String> lines = new ArrayList<>();
        int lineCount = Math.max(1, (data.size() + perLine - 1) / perLine);
        for (int line = 0; line < lineCount; line++) {
            StringBuilder text = new StringBuilder(pad(line == 0 ? name : continuation, CardReader.SMALL_WIDTH));
            for (int i = line * perLine; i < Math.min(data.size(), (line + 1) * perLine); i++) {
                text.append(pad(data.get(i), width));
            }
            lines.add(text.toString().stripTrailing());
        }
        return lines;
    }

    private static List<String> free(String name, List<String> data) {
        List<String> lines = new ArrayList<>();
        int perLine = CardReader.FIELDS_PER_LINE;
        int lineCount = Math.max(1, (data.size() + perLine - 1) / perLine);
        for (int line = 0; line < lineCount; line++) {
            List<String> chunk = data.subList(line * perLine, Math.min(data.size(), (line + 1) * perLine));
            lines.add((line == 0 ? name : "") + "," + String.join(",", chunk));
        }
        return lines;
    }

    private static String pad(String value, int width) {
        return value.length() >= width ? value : value + " ".repeat(width - value.length());
    }
}
