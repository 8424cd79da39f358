package com.bdfrenumber.core.validation;

import com.bdfrenumber.core.model.Finding;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangePlan;
import com.bdfrenumber.core.scanner.IncludeFileNode;
import com.bdfrenumber.core.scanner.IncludeTree;
import com.bdfrenumber.core.scanner.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks a range plan before anything is modified.
 *
 * <p>Every problem is reported, not just the first: missing ranges,
 * non-positive or inverted ranges, capacity shortfalls and overlaps between
 * files within a namespace. Frozen set namespaces keep their IDs and are not
 * checked.
 */
public class RangeValidator {

    private static final Logger log = LoggerFactory.getLogger(RangeValidator.class);

    /**
     * Validates a plan against the scanned catalog.
     *
     * @param scan include scan
     * @param plan range plan
     * @return findings, all of them errors
     */
    public ValidationReport validate(ScanResult scan, RangePlan plan) {
        IncludeTree tree = scan.tree();
        List<Finding> findings = new ArrayList<>();

        for (String file : plan.unknownFiles()) {
            findings.add(Finding.error(FindingCategory.STRUCTURAL,
                "Range given for " + file + ", which is not part of the include tree").at(file, null, null));
        }

        for (Namespace namespace : Namespace.canonicalOrder()) {
            if (plan.isFrozen(namespace)) {
                continue;
            }
            List<Placed> placed = new ArrayList<>();
            for (IncludeFileNode node : tree.nodes()) {
                int count = node.ids(namespace).size();
                if (count == 0) {
                    continue;
                }
                String file = tree.relativeName(node.index());
                String prefix = file + "/" + namespace.label() + ": ";
                IdRange range = plan.range(node.index(), namespace);

                if (range == null) {
                    String hint = plan.mode() == AllocationMode.SIMPLE ? " (no range given for the file)" : "";
                    findings.add(Finding.error(FindingCategory.CAPACITY,
                        prefix + "no range specified for " + count + " entities" + hint).at(file, namespace, null));
                    continue;
                }
                if (range.start() < 1) {
                    String reason = namespace == Namespace.COORDINATE_SYSTEM
                        ? " (0 is reserved for the basic coordinate system)"
                        : "";
                    findings.add(Finding.error(FindingCategory.POSITIVITY,
                        prefix + "start ID must be >= 1 (got " + range.start() + ")" + reason)
                        .at(file, namespace, null));
                }
                if (range.end() < range.start()) {
                    findings.add(Finding.error(FindingCategory.POSITIVITY,
                        prefix + "end ID (" + range.end() + ") < start ID (" + range.start() + ")")
                        .at(file, namespace, null));
                    continue;
                }
                if (range.capacity() < count) {
                    findings.add(Finding.error(FindingCategory.CAPACITY,
                        prefix + "range " + range + " has capacity " + range.capacity()
                            + " but " + count + " entities need renumbering").at(file, namespace, null));
                }
                placed.add(new Placed(file, range));
            }
            findings.addAll(overlaps(namespace, placed));
        }

        log.info("Range validation: {} error(s)", findings.size());
        return new ValidationReport(findings);
    }

    private static List<Finding> overlaps(Namespace namespace, List<Placed> placed) {
        List<Placed> sorted = new ArrayList<>(placed);
        sorted.sort(Comparator.comparingInt((Placed p) -> p.range().start()).thenComparingInt(p -> p.range().end()));
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Placed first = sorted.get(i);
            for (int j = i + 1; j < sorted.size(); j++) {
                Placed second = sorted.get(j);
                if (second.range().start() > first.range().end()) {
                    break;
                }
                findings.add(Finding.error(FindingCategory.OVERLAP,
                    namespace.label() + ": ranges overlap between " + first.file() + " " + first.range()
                        + " and " + second.file() + " " + second.range()).at(second.file(), namespace, null));
            }
        }
        return findings;
    }

    private record Placed(String file, IdRange range) {
    }
}
