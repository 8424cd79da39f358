package com.bdfrenumber.core.bulk;

import com.bdfrenumber.core.card.CardType;
import com.bdfrenumber.core.card.Fields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One bulk data record: card name, flattened fields and the original lines.
 *
 * <p>Fields are mutable so the renumberer can rewrite references in place.
 * A card whose fields never changed is written back from its original lines.
 */
public final class BulkCard {

    private final String name;
    private final CardType type;
    private final List<String> fields;
    private final List<String> rawLines;
    private final int originalId;
    private int occurrence;
    private boolean modified;

    /**
     * Creates a card.
     *
     * @param name upper-case card name
     * @param type card type, or null when unknown or disabled
     * @param fields flattened fields, field 0 being the name
     * @param rawLines original source lines
     */
    public BulkCard(String name, CardType type, List<String> fields, List<String> rawLines) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = type;
        this.fields = new ArrayList<>(Objects.requireNonNull(fields, "fields must not be null"));
        this.rawLines = List.copyOf(Objects.requireNonNull(rawLines, "rawLines must not be null"));
        this.originalId = Fields.parseId(field(1));
    }

    public String name() {
        return name;
    }

    /**
     * Resolved card type.
     *
     * @return type, or null for passthrough cards
     */
    public CardType type() {
        return type;
    }

    public boolean isKnown() {
        return type != null;
    }

    public List<String> fields() {
        return Collections.unmodifiableList(fields);
    }

    public List<String> rawLines() {
        return rawLines;
    }

    /**
     * Returns a field value.
     *
     * @param index field index
     * @return trimmed field text, or an empty string past the end of the card
     */
    public String field(int index) {
        return index < fields.size() ? fields.get(index) : "";
    }

    public int fieldCount() {
        return fields.size();
    }

    /**
     * Current primary ID.
     *
     * @return primary ID, or -1 when field 1 is not a positive integer
     */
    public int primaryId() {
        return Fields.parseId(field(1));
    }

    /**
     * Primary ID as read from the source file, unaffected by renumbering.
     *
     * @return original primary ID, or -1
     */
    public int originalId() {
        return originalId;
    }

    /**
     * Position of this card among the cards sharing its name and original
     * primary ID, in read order.
     *
     * @return 0-based occurrence index
     */
    public int occurrence() {
        return occurrence;
    }

    void setOccurrence(int occurrence) {
        this.occurrence = occurrence;
    }

    /**
     * Sets a field value, extending the card with blanks if needed.
     *
     * @param index field index, at least 1
     * @param value new value
     */
    public void setField(int index, String value) {
        if (index < 1) {
            throw new IllegalArgumentException("field " + index + " is the card name");
        }
        while (fields.size() <= index) {
            fields.add("");
        }
        if (!fields.get(index).equals(value)) {
            fields.set(index, value);
            modified = true;
        }
    }

    /**
     * Replaces every field from {@code from} to the end of the card.
     *
     * @param from first field index to replace
     * @param values replacement values
     */
    public void replaceTail(int from, List<String> values) {
        List<String> current = from < fields.size() ? fields.subList(from, fields.size()) : List.of();
        if (current.equals(values)) {
            return;
        }
        while (fields.size() > from) {
            fields.remove(fields.size() - 1);
        }
        while (fields.size() < from) {
            fields.add("");
        }
        fields.addAll(values);
        modified = true;
    }

    /**
     * Returns true if any field changed since the card was read.
     *
     * @return true when the card must be reformatted
     */
    public boolean isModified() {
        return modified;
    }

    @Override
    public String toString() {
        return name + " " + field(1);
    }
}
