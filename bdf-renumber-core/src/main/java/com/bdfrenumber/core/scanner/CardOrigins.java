package com.bdfrenumber.core.scanner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Source file of every keyed card, recovered from the raw text.
 *
 * <p>Cards are identified by card name, original primary ID and occurrence:
 * the third {@code FORCE 10} read from the deck is the third one the scanner
 * saw, because both walk the files in the same depth-first order.
 */
public final class CardOrigins {

    private final Map<String, List<Integer>> filesByCard = new HashMap<>();

    void record(String cardName, int primaryId, int fileIndex) {
        filesByCard.computeIfAbsent(key(cardName, primaryId), k -> new ArrayList<>()).add(fileIndex);
    }

    /**
     * File that holds the given card.
     *
     * @param cardName card name
     * @param originalId primary ID as read
     * @param occurrence 0-based occurrence among cards with the same name and ID
     * @return file index, or -1 when the scanner never saw the card
     */
    public int fileOf(String cardName, int originalId, int occurrence) {
        List<Integer> files = filesByCard.get(key(cardName, originalId));
        if (files == null || occurrence < 0 || occurrence >= files.size()) {
            return -1;
        }
        return files.get(occurrence);
    }

    private static String key(String cardName, int primaryId) {
        return cardName + "#" + primaryId;
    }
}
