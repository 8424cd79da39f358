package com.bdfrenumber.core.engine;

import com.bdfrenumber.core.bulk.BulkModel;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.plan.RangePlan;
import com.bdfrenumber.core.scanner.ScanResult;

import java.util.Map;
import java.util.SortedMap;

/**
 * State of the current renumbering run.
 *
 * <p>Holds the latest plan, the scan it was built from, the model it passed
 * validation against and the record counts taken before that model was
 * mutated. Building a new plan starts a new run and drops the previous state,
 * so an engine reused for many decks keeps one run in memory. Plans and models
 * are compared by identity: an equal plan built again has not been validated.
 */
public final class RunContext {

    private RangePlan plan;
    private ScanResult scan;
    private BulkModel validated;
    private BulkModel applied;
    private Counts counts;

    /**
     * Record counts of a model before renumbering.
     *
     * @param namespaces keyed records per namespace
     * @param cards cards per card name, passthrough included
     */
    public record Counts(Map<Namespace, Integer> namespaces, SortedMap<String, Integer> cards) {
    }

    void planned(RangePlan plan, ScanResult scan) {
        this.plan = plan;
        this.scan = scan;
        this.validated = null;
        this.applied = null;
        this.counts = null;
    }

    ScanResult scanOf(RangePlan plan) {
        if (plan != this.plan) {
            throw new IllegalArgumentException("The plan is not the current plan of this engine");
        }
        return scan;
    }

    void validated(RangePlan plan, BulkModel model) {
        scanOf(plan);
        if (validated != model) {
            validated = model;
            counts = new Counts(model.recordCounts(), model.cardCounts());
        }
    }

    boolean isValidated(RangePlan plan, BulkModel model) {
        return plan == this.plan && validated == model;
    }

    void applied(RangePlan plan, BulkModel model) {
        applied = model;
        model.markRenumbered();
    }

    boolean isApplied(RangePlan plan, BulkModel model) {
        return plan == this.plan && applied == model;
    }

    Counts countsBefore(BulkModel model) {
        return model == validated ? counts : null;
    }
}
