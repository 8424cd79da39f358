package com.bdfrenumber.core.renumber;

import com.bdfrenumber.core.bulk.BulkCard;
import com.bdfrenumber.core.bulk.BulkModel;
import com.bdfrenumber.core.card.CardReferences;
import com.bdfrenumber.core.card.CardReferences.Reference;
import com.bdfrenumber.core.card.CardType;
import com.bdfrenumber.core.card.Fields;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.plan.IdMapSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Rewrites the ID fields of every keyed card through the namespace-wide maps.
 *
 * <p>Each card type's rule table decides which fields are IDs; nothing is
 * found by inspection. A reference whose ID has no mapping keeps its value.
 * Dictionaries are rebuilt under the new primary IDs afterwards.
 *
 * <p>Passthrough cards are left alone; the deck writer reports them when it
 * copies them out.
 */
public class RecordRenumberer {

    private static final Logger log = LoggerFactory.getLogger(RecordRenumberer.class);

    private static final String THRU = "THRU";
    private static final int MIN_RUN = 3;

    /**
     * Renumbers the model in place.
     *
     * @param model flattened model
     * @param maps ID maps of the plan
     * @return number of cards whose fields changed
     */
    public int renumber(BulkModel model, IdMapSet maps) {
        int rewritten = 0;
        for (CardType type : List.copyOf(model.cardTypes())) {
            Map<Integer, List<BulkCard>> rekeyed = new TreeMap<>();
            for (List<BulkCard> cards : model.cards(type).values()) {
                for (BulkCard card : cards) {
                    rewrite(card, maps);
                    if (card.isModified()) {
                        rewritten++;
                    }
                    rekeyed.computeIfAbsent(card.primaryId(), id -> new ArrayList<>()).add(card);
                }
            }
            model.replaceCards(type, new LinkedHashMap<>(rekeyed));
        }
        log.info("Renumbered {} card(s) across {} card type(s)", rewritten, model.cardTypes().size());
        return rewritten;
    }

    /**
     * Rewrites the ID fields of one card.
     *
     * @param card card to rewrite
     * @param maps ID maps
     */
    public void rewrite(BulkCard card, IdMapSet maps) {
        if (!card.isKnown()) {
            return;
        }
        List<Reference> references = CardReferences.resolve(card.type(), card.fields(), maps::mappedIds);
        Reference list = null;
        for (Reference reference : references) {
            if (reference.isList()) {
                list = reference;
                continue;
            }
            for (Fields.IdSpan span : reference.spans()) {
                int newId = maps.lookup(reference.target(), span.low());
                if (newId > 0) {
                    card.setField(span.startIndex(), String.valueOf(newId));
                }
            }
        }
        if (list != null) {
            rewriteList(card, list, maps);
        }
    }

    private void rewriteList(BulkCard card, Reference reference, IdMapSet maps) {
        Namespace target = reference.target();
        int from = reference.rule().path().first();
        Map<Integer, Fields.IdSpan> byStart = new HashMap<>();
        reference.spans().forEach(span -> byStart.put(span.startIndex(), span));

        List<String> tail = new ArrayList<>();
        int i = from;
        while (i < card.fieldCount()) {
            Fields.IdSpan span = byStart.get(i);
            if (span == null) {
                tail.add(card.field(i));
                i++;
            } else if (!span.isRange()) {
                int newId = maps.lookup(target, span.low());
                tail.add(newId > 0 ? String.valueOf(newId) : card.field(i));
                i++;
            } else {
                List<Integer> members = span.membersIn(maps.mappedIds(target))
                    .map(oldId -> maps.lookup(target, oldId))
                    .collect(Collectors.toList());
                if (members.isEmpty()) {
                    for (int j = span.startIndex(); j <= span.endIndex(); j++) {
                        tail.add(card.field(j));
                    }
                } else {
                    tail.addAll(compress(members));
                }
                i = span.endIndex() + 1;
            }
        }
        card.replaceTail(from, tail);
    }

    /**
     * Writes runs of consecutive IDs as {@code a THRU b}.
     *
     * @param ids new IDs in list order
     * @return list fields
     */
    static List<String> compress(List<Integer> ids) {
        List<String> fields = new ArrayList<>();
        int runStart = 0;
        for (int i = 1; i <= ids.size(); i++) {
            boolean continues = i < ids.size() && ids.get(i) == ids.get(i - 1) + 1;
            if (continues) {
                continue;
            }
            int runLength = i - runStart;
            if (runLength >= MIN_RUN) {
                fields.add(String.valueOf(ids.get(runStart)));
                fields.add(THRU);
                fields.add(String.valueOf(ids.get(i - 1)));
            } else {
                for (int j = runStart; j < i; j++) {
                    fields.add(String.valueOf(ids.get(j)));
                }
            }
            runStart = i;
        }
        return fields;
    }
}
