package com.bdfrenumber.core.bulk;

import com.bdfrenumber.core.card.CardReferences;
import com.bdfrenumber.core.card.CardType;
import com.bdfrenumber.core.model.Namespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Flattened deck: one ID-keyed dictionary per card type plus a passthrough bucket.
 *
 * <p>Cards of unknown or disabled types, inert parameter cards and known
 * cards without a usable primary ID go to the passthrough bucket and are never
 * renumbered. Every other card is keyed by its primary ID; several cards may
 * share a key in set namespaces. Keyless cards ({@code SUPORT}) are keyed by
 * their first field.
 */
public final class BulkModel {

    private ControlDeck controlDeck = ControlDeck.bulkDataOnly();
    private final Map<CardType, Map<Integer, List<BulkCard>>> cards = new EnumMap<>(CardType.class);
    private final List<BulkCard> passthrough = new ArrayList<>();
    private final Map<String, Integer> occurrences = new HashMap<>();
    private boolean renumbered;

    public ControlDeck controlDeck() {
        return controlDeck;
    }

    public void setControlDeck(ControlDeck controlDeck) {
        this.controlDeck = Objects.requireNonNull(controlDeck, "controlDeck must not be null");
    }

    /**
     * Whether a plan has been applied to this model.
     *
     * @return true once renumbered
     */
    public boolean isRenumbered() {
        return renumbered;
    }

    /**
     * Marks the model as renumbered. A model is renumbered at most once.
     */
    public void markRenumbered() {
        renumbered = true;
    }

    /**
     * Adds a card read from the deck.
     *
     * @param card card to add
     */
    public void add(BulkCard card) {
        String key = card.name() + "#" + card.originalId();
        card.setOccurrence(occurrences.merge(key, 1, Integer::sum) - 1);

        if (isPassthrough(card)) {
            passthrough.add(card);
            return;
        }
        cards.computeIfAbsent(card.type(), t -> new LinkedHashMap<>())
            .computeIfAbsent(card.primaryId(), id -> new ArrayList<>())
            .add(card);
    }

    private static boolean isPassthrough(BulkCard card) {
        return !card.isKnown() || card.type().isInert() || card.primaryId() < 0;
    }

    /**
     * Card types with at least one keyed card, in declaration order.
     *
     * @return present card types
     */
    public Set<CardType> cardTypes() {
        return Collections.unmodifiableSet(cards.keySet());
    }

    /**
     * Cards of one type keyed by primary ID.
     *
     * @param type card type
     * @return unmodifiable view, empty when the type is absent
     */
    public Map<Integer, List<BulkCard>> cards(CardType type) {
        Map<Integer, List<BulkCard>> byId = cards.get(type);
        return byId == null ? Map.of() : Collections.unmodifiableMap(byId);
    }

    /**
     * Every keyed card, by type declaration order then dictionary order.
     *
     * @return keyed cards
     */
    public List<BulkCard> allCards() {
        List<BulkCard> all = new ArrayList<>();
        cards.values().forEach(byId -> byId.values().forEach(all::addAll));
        return all;
    }

    public List<BulkCard> passthrough() {
        return Collections.unmodifiableList(passthrough);
    }

    /**
     * Replaces the dictionary of one card type, used after renumbering.
     *
     * @param type card type
     * @param byId new dictionary keyed by the new primary IDs
     */
    public void replaceCards(CardType type, Map<Integer, List<BulkCard>> byId) {
        if (byId.isEmpty()) {
            cards.remove(type);
        } else {
            cards.put(type, new LinkedHashMap<>(byId));
        }
    }

    /**
     * Number of cards per card name, passthrough cards included.
     *
     * @return counts sorted by card name
     */
    public SortedMap<String, Integer> cardCounts() {
        SortedMap<String, Integer> counts = new TreeMap<>();
        allCards().forEach(card -> counts.merge(card.name(), 1, Integer::sum));
        passthrough.forEach(card -> counts.merge(card.name(), 1, Integer::sum));
        return counts;
    }

    /**
     * Number of keyed cards per primary namespace. Keyless cards are not counted.
     *
     * @return counts in canonical namespace order
     */
    public Map<Namespace, Integer> recordCounts() {
        Map<Namespace, Integer> counts = new EnumMap<>(Namespace.class);
        cards.forEach((type, byId) -> {
            if (!type.isKeyless()) {
                counts.merge(type.primaryNamespace(), byId.values().stream().mapToInt(List::size).sum(), Integer::sum);
            }
        });
        return counts;
    }

    /**
     * IDs defined by the keyed cards, per namespace.
     *
     * <p>Besides primary IDs this covers every point of a {@code SPOINT} list
     * and the second system of a {@code CORD1R}.
     *
     * @return sorted defined IDs, with an entry for every namespace
     */
    public Map<Namespace, NavigableSet<Integer>> definedIds() {
        Map<Namespace, NavigableSet<Integer>> ids = new EnumMap<>(Namespace.class);
        for (Namespace namespace : Namespace.canonicalOrder()) {
            ids.put(namespace, new TreeSet<>());
        }
        for (BulkCard card : allCards()) {
            CardReferences.definitions(card.type(), card.fields()).forEach(definition ->
                definition.spans().forEach(span -> ids.get(definition.target()).addAll(span.ids())));
        }
        return ids;
    }

    /**
     * IDs defined in one namespace by the keyed cards.
     *
     * @param namespace namespace
     * @return sorted defined IDs
     */
    public NavigableSet<Integer> definedIds(Namespace namespace) {
        return definedIds().get(namespace);
    }

    /**
     * Total number of cards, passthrough included.
     *
     * @return card count
     */
    public int size() {
        return allCards().size() + passthrough.size();
    }
}
