package com.bdfrenumber.core.validation;

import com.bdfrenumber.core.bulk.BulkCard;
import com.bdfrenumber.core.bulk.BulkModel;
import com.bdfrenumber.core.card.CardReferences;
import com.bdfrenumber.core.card.CardReferences.Reference;
import com.bdfrenumber.core.card.CardType;
import com.bdfrenumber.core.card.Fields;
import com.bdfrenumber.core.model.Finding;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.IdMapSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Structural checks on a flattened model.
 *
 * <p>Before renumbering: duplicate definitions. After renumbering: unchanged
 * record counts and resolvable references. After writing: the written deck
 * holds the same cards as the source.
 *
 * <p>Reference checks distinguish what renumbering broke from what was
 * already unresolved: a field rewritten to an ID nothing defines is an error,
 * while a field that still holds an unmapped source ID is only a warning.
 * Such IDs usually belong to cards this tool does not parse.
 */
public class ModelValidator {

    private static final Logger log = LoggerFactory.getLogger(ModelValidator.class);

    /**
     * Reports IDs defined more than once where the namespace forbids it.
     *
     * @param model source model
     * @return {@code STRUCTURAL} errors
     */
    public ValidationReport checkDuplicates(BulkModel model) {
        List<Finding> findings = new ArrayList<>();
        Map<Namespace, Map<Integer, CardType>> firstDefiner = new EnumMap<>(Namespace.class);

        for (CardType type : model.cardTypes()) {
            if (type.isKeyless()) {
                continue;
            }
            Namespace namespace = type.primaryNamespace();
            if (namespace.uniqueness() == Namespace.Uniqueness.NONE) {
                continue;
            }
            model.cards(type).forEach((id, cards) -> {
                if (cards.size() > 1) {
                    findings.add(Finding.error(FindingCategory.STRUCTURAL,
                        type + " " + id + " is defined " + cards.size() + " times").at(null, namespace, id));
                }
                if (namespace.uniqueness() == Namespace.Uniqueness.NAMESPACE) {
                    CardType other = firstDefiner.computeIfAbsent(namespace, n -> new HashMap<>()).putIfAbsent(id, type);
                    if (other != null && other != type) {
                        findings.add(Finding.error(FindingCategory.STRUCTURAL,
                            namespace.label() + " " + id + " is defined by both " + other + " and " + type)
                            .at(null, namespace, id));
                    }
                }
            });
        }
        findings.addAll(checkExtraDefinitions(model));
        return new ValidationReport(findings);
    }

    private static List<Finding> checkExtraDefinitions(BulkModel model) {
        Map<Namespace, Set<Integer>> seen = new EnumMap<>(Namespace.class);
        for (CardType type : model.cardTypes()) {
            if (!type.isKeyless()) {
                seen.computeIfAbsent(type.primaryNamespace(), n -> new HashSet<>()).addAll(model.cards(type).keySet());
            }
        }
        List<Finding> findings = new ArrayList<>();
        for (BulkCard card : model.allCards()) {
            for (Reference definition : CardReferences.definitions(card.type(), card.fields())) {
                Namespace namespace = definition.target();
                if (!definition.rule().definition() || namespace.uniqueness() == Namespace.Uniqueness.NONE) {
                    continue;
                }
                for (Fields.IdSpan span : definition.spans()) {
                    if (!seen.computeIfAbsent(namespace, n -> new HashSet<>()).add(span.low())) {
                        findings.add(Finding.error(FindingCategory.STRUCTURAL,
                            namespace.label() + " " + span.low() + " defined by " + card.name() + " " + card.field(1)
                                + " field " + span.startIndex() + " is already defined")
                            .at(null, namespace, span.low()));
                    }
                }
            }
        }
        return findings;
    }

    /**
     * Reports reference fields that point at IDs nothing defines.
     *
     * <p>Definitions include those of passthrough cards whose name is a known
     * card type, so references into disabled card types are not flagged. An
     * unresolved field holding one of the plan's new IDs is an error; any
     * other unresolved field kept its source value and is a warning.
     *
     * @param model renumbered model
     * @param maps ID maps that were applied
     * @return {@code DANGLING_REFERENCE} findings
     */
    public ValidationReport checkReferences(BulkModel model, IdMapSet maps) {
        Map<Namespace, NavigableSet<Integer>> defined = definitions(model);
        List<Finding> findings = new ArrayList<>();
        for (BulkCard card : model.allCards()) {
            List<Reference> references = CardReferences.resolve(card.type(), card.fields(), defined::get);
            for (Reference reference : references) {
                if (reference.definition()) {
                    continue;
                }
                Namespace target = reference.target();
                for (Fields.IdSpan span : reference.spans()) {
                    if (resolves(span, defined.get(target))) {
                        continue;
                    }
                    String what = span.isRange()
                        ? "IDs " + span.low() + " THRU " + span.high()
                        : String.valueOf(span.low());
                    String message = card.name() + " " + card.field(1) + " field " + span.startIndex()
                        + " references " + target.label() + " " + what + ", which is not defined";
                    Finding finding = resolves(span, maps.newIds(target))
                        ? Finding.error(FindingCategory.DANGLING_REFERENCE, message)
                        : Finding.warning(FindingCategory.DANGLING_REFERENCE, message + "; left unchanged");
                    findings.add(finding.at(null, target, span.low()));
                }
            }
        }
        log.debug("Reference check: {} unresolved reference(s)", findings.size());
        return new ValidationReport(findings);
    }

    private static boolean resolves(Fields.IdSpan span, NavigableSet<Integer> ids) {
        return span.isRange() ? span.membersIn(ids).findAny().isPresent() : ids.contains(span.low());
    }

    /**
     * Compares record counts per namespace and per card type.
     *
     * @param namespaceBefore counts per namespace before renumbering
     * @param cardsBefore counts per card name before renumbering
     * @param model model after renumbering
     * @return {@code COUNT_MISMATCH} errors
     */
    public ValidationReport checkCounts(Map<Namespace, Integer> namespaceBefore,
                                        SortedMap<String, Integer> cardsBefore,
                                        BulkModel model) {
        List<Finding> findings = new ArrayList<>();
        Map<Namespace, Integer> namespaceAfter = model.recordCounts();
        for (Namespace namespace : Namespace.canonicalOrder()) {
            int before = namespaceBefore.getOrDefault(namespace, 0);
            int after = namespaceAfter.getOrDefault(namespace, 0);
            if (before != after) {
                findings.add(Finding.error(FindingCategory.COUNT_MISMATCH,
                    namespace.label() + " record count changed: before=" + before + ", after=" + after)
                    .at(null, namespace, null));
            }
        }
        findings.addAll(compareCardCounts(cardsBefore, model.cardCounts(), "after renumbering"));
        return new ValidationReport(findings);
    }

    /**
     * Compares the cards of the source deck with those read back from the written deck.
     *
     * @param source counts per card name of the source
     * @param written counts per card name of the written output
     * @return {@code COUNT_MISMATCH} errors
     */
    public ValidationReport checkOutput(SortedMap<String, Integer> source, SortedMap<String, Integer> written) {
        return new ValidationReport(compareCardCounts(source, written, "in the written deck"));
    }

    private static List<Finding> compareCardCounts(SortedMap<String, Integer> before,
                                                   SortedMap<String, Integer> after,
                                                   String where) {
        List<Finding> findings = new ArrayList<>();
        Set<String> names = new TreeSet<>(before.keySet());
        names.addAll(after.keySet());
        for (String name : names) {
            int expected = before.getOrDefault(name, 0);
            int actual = after.getOrDefault(name, 0);
            if (expected != actual) {
                findings.add(Finding.error(FindingCategory.COUNT_MISMATCH,
                    name + " card count " + where + " is " + actual + ", expected " + expected));
            }
        }
        return findings;
    }

    private static Map<Namespace, NavigableSet<Integer>> definitions(BulkModel model) {
        Map<Namespace, NavigableSet<Integer>> defined = model.definedIds();
        for (BulkCard card : model.passthrough()) {
            CardType.fromName(card.name()).ifPresent(type ->
                CardReferences.definitions(type, card.fields()).forEach(definition ->
                    definition.spans().forEach(span -> defined.get(definition.target()).addAll(span.ids()))));
        }
        return defined;
    }
}
