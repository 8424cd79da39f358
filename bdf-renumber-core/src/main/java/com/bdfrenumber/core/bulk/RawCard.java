package com.bdfrenumber.core.bulk;

import java.util.List;
import java.util.Objects;

/**
 * Lines of one bulk data card as found in the source file: the first line plus its continuations.
 *
 * @param lines original lines without terminators, comments excluded
 * @param lineNumber 1-based line number of the first line
 */
public record RawCard(List<String> lines, int lineNumber) {

    /**
     * Compact constructor with validation.
     */
    public RawCard {
        Objects.requireNonNull(lines, "lines must not be null");
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("a card needs at least one line");
        }
        lines = List.copyOf(lines);
    }

    /**
     * Card name of the first line, upper case, without the large-field marker.
     *
     * @return card name
     */
    public String name() {
        return CardReader.cardName(lines.get(0));
    }
}
