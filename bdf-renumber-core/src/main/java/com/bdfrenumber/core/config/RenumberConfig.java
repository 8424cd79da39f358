package com.bdfrenumber.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Renumbering configuration.
 *
 * <p>Loaded from {@code bdf-renumber.yaml} next to the deck or given on the
 * command line.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * cards:
 *   disabled:
 *     - BCPROPS
 *     - BOUTPUT
 *   disabledGroups:
 *     - dynamic
 *
 * renumberSetIds: true
 *
 * output:
 *   directory: "./renumbered"
 * }</pre>
 *
 * @param cards card selection
 * @param renumberSetIds whether set namespaces are renumbered, defaults to true
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenumberConfig(
    @JsonProperty("cards") CardConfig cards,
    @JsonProperty("renumberSetIds") Boolean renumberSetIds,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Card names kept as passthrough unless the configuration says otherwise.
     */
    public static final List<String> DEFAULT_DISABLED_CARDS = List.of("BCPROPS", "BCTPARM", "BCPARA", "BOUTPUT");

    /**
     * Compact constructor filling absent sections.
     */
    public RenumberConfig {
        if (cards == null) {
            cards = new CardConfig(DEFAULT_DISABLED_CARDS, List.of());
        }
        if (renumberSetIds == null) {
            renumberSetIds = Boolean.TRUE;
        }
        if (output == null) {
            output = new OutputConfig("./renumbered");
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return defaults
     */
    public static RenumberConfig defaults() {
        return new RenumberConfig(null, null, null);
    }

    /**
     * Card names that must not be renumbered: the disabled list plus every card of a disabled group.
     *
     * @return upper-case card names
     */
    public Set<String> effectiveDisabledCards() {
        Set<String> disabled = new TreeSet<>();
        cards.disabled().forEach(name -> disabled.add(name.strip().toUpperCase(Locale.ROOT)));
        disabled.addAll(CardGroups.getCardsForGroups(cards.disabledGroups()));
        return disabled;
    }

    /**
     * Card selection.
     *
     * @param disabled card names treated as passthrough; null means the defaults
     * @param disabledGroups card groups treated as passthrough
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CardConfig(
        @JsonProperty("disabled") List<String> disabled,
        @JsonProperty("disabledGroups") List<String> disabledGroups
    ) {
        /**
         * Compact constructor with defaults.
         */
        public CardConfig {
            disabled = disabled == null ? DEFAULT_DISABLED_CARDS : List.copyOf(disabled);
            disabledGroups = disabledGroups == null ? List.of() : List.copyOf(disabledGroups);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory default output directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {}
}
