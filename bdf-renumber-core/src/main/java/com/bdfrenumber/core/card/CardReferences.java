package com.bdfrenumber.core.card;

import com.bdfrenumber.core.model.Namespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import java.util.function.Function;

/**
 * Applies a card type's rewrite rules to a concrete field list.
 *
 * <p>The primary ID comes first, as a definition, unless a rule already
 * covers field 1. Keyless types have no primary ID. Rules whose guard
 * rejects the card are skipped. Ambiguous rules pick the candidate namespace
 * in which most of the referenced IDs are known, the first candidate winning
 * a tie.
 */
public final class CardReferences {

    private static final Function<Namespace, NavigableSet<Integer>> NOTHING_KNOWN =
        namespace -> Collections.emptyNavigableSet();

    private CardReferences() {
        // Utility class
    }

    /**
     * Resolves only the fields that define IDs: the primary ID, {@code SPOINT}
     * lists and the declared extra definitions.
     *
     * @param type card type
     * @param fields flattened card fields
     * @return definition references
     */
    public static List<Reference> definitions(CardType type, List<String> fields) {
        return resolve(type, fields, NOTHING_KNOWN).stream().filter(Reference::definition).toList();
    }

    /**
     * Resolves every ID reference of a card.
     *
     * @param type card type
     * @param fields flattened card fields
     * @param known known IDs per namespace, used for ambiguous rules
     * @return references in rule order, primary ID first
     */
    public static List<Reference> resolve(CardType type, List<String> fields,
                                          Function<Namespace, NavigableSet<Integer>> known) {
        List<Reference> references = new ArrayList<>();
        if (type.isInert()) {
            return references;
        }
        boolean ruleCoversPrimary = type.rules().stream().anyMatch(rule -> rule.path().first() == 1);
        if (!type.isKeyless() && !ruleCoversPrimary) {
            RewriteRule primary = RewriteRule.field(1, type.primaryNamespace());
            references.add(new Reference(primary, type.primaryNamespace(), idSpans(primary.path(), fields), true));
        }
        for (RewriteRule rule : type.rules()) {
            if (!rule.appliesTo(fields)) {
                continue;
            }
            List<Fields.IdSpan> spans = idSpans(rule.path(), fields);
            if (spans.isEmpty()) {
                continue;
            }
            Namespace target = rule.isAmbiguous() ? pick(rule.targets(), spans, known) : rule.target();
            boolean definition = rule.definition()
                || (rule.path().first() == 1 && target == type.primaryNamespace());
            references.add(new Reference(rule, target, spans, definition));
        }
        return references;
    }

    private static List<Fields.IdSpan> idSpans(FieldPath path, List<String> fields) {
        if (path.shape() == FieldPath.Shape.LIST) {
            return Fields.spans(fields, path.first());
        }
        List<Fields.IdSpan> spans = new ArrayList<>();
        for (int index : path.indices(fields)) {
            int id = Fields.parseId(fields.get(index));
            if (id > 0) {
                spans.add(new Fields.IdSpan(index, index, id, id, 1));
            }
        }
        return spans;
    }

    private static Namespace pick(List<Namespace> candidates, List<Fields.IdSpan> spans,
                                  Function<Namespace, NavigableSet<Integer>> known) {
        Namespace best = candidates.get(0);
        long bestScore = -1;
        for (Namespace candidate : candidates) {
            NavigableSet<Integer> ids = known.apply(candidate);
            long score = spans.stream()
                .mapToLong(span -> span.membersIn(ids).count())
                .sum();
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * ID-bearing fields of one rule on one card.
     *
     * @param rule rule that produced the reference
     * @param target resolved target namespace
     * @param spans ID spans, in field order
     * @param definition true when the fields define IDs rather than reference them
     */
    public record Reference(RewriteRule rule, Namespace target, List<Fields.IdSpan> spans, boolean definition) {

        /**
         * Compact constructor with validation.
         */
        public Reference {
            spans = List.copyOf(spans);
        }

        public boolean isList() {
            return rule.path().shape() == FieldPath.Shape.LIST;
        }
    }
}
