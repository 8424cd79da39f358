package com.bdfrenumber.core.config;

import com.bdfrenumber.core.card.CardType;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Named groups of card types that can be disabled together.
 *
 * <pre>{@code
 * cards:
 *   disabledGroups:
 *     - contact
 * }</pre>
 */
public final class CardGroups {

    private CardGroups() {
        // Utility class
    }

    /**
     * Map of group names to card names.
     */
    public static final Map<String, List<String>> GROUPS = Map.ofEntries(
        // Contact definitions and their parameters
        Map.entry("contact", names(
            CardType.BSURF, CardType.BSURFS, CardType.BCTSET, CardType.BCTADD, CardType.BCTPARA,
            CardType.BCONP, CardType.BLSEG, CardType.BCBODY, CardType.BFRIC
        )),

        // Static loads and load combinations
        Map.entry("loads", names(
            CardType.FORCE, CardType.MOMENT, CardType.FORCE1, CardType.MOMENT1, CardType.PLOAD,
            CardType.PLOAD2, CardType.PLOAD4, CardType.GRAV, CardType.RFORCE, CardType.TEMP,
            CardType.TEMPD, CardType.LOAD
        )),

        // Dynamic loads, eigenvalue methods and tables
        Map.entry("dynamic", names(
            CardType.DLOAD, CardType.DAREA, CardType.RLOAD1, CardType.RLOAD2, CardType.TLOAD1,
            CardType.TLOAD2, CardType.EIGRL, CardType.EIGR, CardType.EIGC, CardType.TABLED1,
            CardType.TABLED2, CardType.TABLEM1, CardType.TABDMP1
        ))
    );

    /**
     * Get all card names for the specified groups.
     *
     * @param groupNames names of groups to expand; unknown names are ignored
     * @return set of card names from all specified groups
     */
    public static Set<String> getCardsForGroups(List<String> groupNames) {
        return groupNames.stream()
            .filter(GROUPS::containsKey)
            .flatMap(group -> GROUPS.get(group).stream())
            .collect(Collectors.toSet());
    }

    /**
     * Check if a card belongs to any of the specified groups.
     *
     * @param cardName card name to check
     * @param groupNames group names to check
     * @return true if the card is in any of the groups
     */
    public static boolean isInGroups(String cardName, List<String> groupNames) {
        return getCardsForGroups(groupNames).contains(cardName);
    }

    /**
     * Get all available group names.
     *
     * @return set of group names
     */
    public static Set<String> getAvailableGroups() {
        return GROUPS.keySet();
    }

    private static List<String> names(CardType... types) {
        return Arrays.stream(types).map(CardType::name).toList();
    }
}
