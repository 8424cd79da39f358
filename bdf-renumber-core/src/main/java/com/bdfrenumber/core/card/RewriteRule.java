package com.bdfrenumber.core.card;

import com.bdfrenumber.core.model.Namespace;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Declares that the fields at {@link #path()} reference IDs in {@link #targets()}.
 *
 * <p>Most rules have exactly one target. A rule with several targets is
 * ambiguous ({@code SET1} members may be nodes or elements) and is resolved
 * against the ID catalog by the renumberer.
 *
 * <p>The guard decides per card whether the rule applies; it receives the
 * card's flattened field list. A definition rule marks fields that define
 * further entities of the card, such as the second system of a {@code CORD1R}.
 *
 * @param path referenced field locations
 * @param targets target namespaces, first one preferred on a tie
 * @param guard applicability test over the card fields
 * @param definition true when the fields define IDs rather than reference them
 */
public record RewriteRule(FieldPath path, List<Namespace> targets, Predicate<List<String>> guard,
                          boolean definition) {

    private static final Predicate<List<String>> ALWAYS = fields -> true;

    /**
     * Compact constructor with validation.
     */
    public RewriteRule {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(targets, "targets must not be null");
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("a rewrite rule needs at least one target namespace");
        }
        targets = List.copyOf(targets);
        guard = guard != null ? guard : ALWAYS;
    }

    public static RewriteRule of(FieldPath path, Namespace target) {
        return new RewriteRule(path, List.of(target), ALWAYS, false);
    }

    public static RewriteRule field(int index, Namespace target) {
        return of(FieldPath.field(index), target);
    }

    public static RewriteRule fields(int first, int last, Namespace target) {
        return of(FieldPath.fields(first, last), target);
    }

    public static RewriteRule list(int first, Namespace target) {
        return of(FieldPath.list(first), target);
    }

    public static RewriteRule strided(int first, int stride, Namespace target) {
        return of(FieldPath.strided(first, stride), target);
    }

    public static RewriteRule weightedGroups(int first, Namespace target) {
        return of(FieldPath.weightedGroups(first), target);
    }

    /**
     * Declares a field that defines an additional entity of the card.
     *
     * @param index field index
     * @param target namespace of the defined ID
     * @return definition rule
     */
    public static RewriteRule defines(int index, Namespace target) {
        return new RewriteRule(FieldPath.field(index), List.of(target), ALWAYS, true);
    }

    /**
     * Creates an ambiguous rule resolved by catalog overlap.
     *
     * @param path field locations
     * @param targets candidate namespaces in tie-break order
     * @return ambiguous rule
     */
    public static RewriteRule oneOf(FieldPath path, Namespace... targets) {
        return new RewriteRule(path, Arrays.asList(targets), ALWAYS, false);
    }

    /**
     * Restricts this rule to cards whose field at {@code index} is one of the keywords.
     *
     * @param index field index to test
     * @param keywords accepted keywords (case-insensitive)
     * @return guarded rule
     */
    public RewriteRule when(int index, String... keywords) {
        List<String> accepted = Arrays.stream(keywords).map(k -> k.toUpperCase(Locale.ROOT)).toList();
        return new RewriteRule(path, targets, guard.and(fields -> accepted.contains(keyword(fields, index))), definition);
    }

    /**
     * Restricts this rule to cards whose field at {@code index} is not the keyword.
     *
     * @param index field index to test
     * @param keyword rejected keyword (case-insensitive)
     * @return guarded rule
     */
    public RewriteRule unless(int index, String keyword) {
        String rejected = keyword.toUpperCase(Locale.ROOT);
        return new RewriteRule(path, targets, guard.and(fields -> !rejected.equals(keyword(fields, index))), definition);
    }

    /**
     * Returns true if this rule applies to the given card fields.
     *
     * @param fields flattened card fields
     * @return true when the guard accepts the card
     */
    public boolean appliesTo(List<String> fields) {
        return guard.test(fields);
    }

    /**
     * Returns true if the target namespace must be chosen per card.
     *
     * @return true for rules with several candidate targets
     */
    public boolean isAmbiguous() {
        return targets.size() > 1;
    }

    /**
     * Returns the single (or preferred) target namespace.
     *
     * @return first target
     */
    public Namespace target() {
        return targets.get(0);
    }

    private static String keyword(List<String> fields, int index) {
        if (index >= fields.size()) {
            return "";
        }
        return fields.get(index).trim().toUpperCase(Locale.ROOT);
    }
}
