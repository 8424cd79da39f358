package com.bdfrenumber.core.validation;

import com.bdfrenumber.core.DeckTestBase;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangeAllocator;
import com.bdfrenumber.core.plan.RangePlan;
import com.bdfrenumber.core.plan.RangeTable;
import com.bdfrenumber.core.scanner.IncludeScanner;
import com.bdfrenumber.core.scanner.ScanResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RangeValidator}.
 */
class RangeValidatorTest extends DeckTestBase {

    private final RangeAllocator allocator = new RangeAllocator();
    private final RangeValidator validator = new RangeValidator();
    private ScanResult scan;

    @BeforeEach
    void scanDeck() throws IOException {
        scan = new IncludeScanner().scan(createTwoFileDeck());
    }

    private ValidationReport validate(AllocationMode mode, RangeTable table) {
        RangePlan plan = allocator.plan(scan, mode, table, true);
        return validator.validate(scan, plan);
    }

    private static Map<Namespace, IdRange> ranges(IdRange nodes, IdRange elements) {
        return Map.of(Namespace.NODE, nodes, Namespace.ELEMENT, elements);
    }

    @Test
    void validate_disjointSufficientRanges_passes() {
        ValidationReport report = validate(AllocationMode.SIMPLE, RangeTable.simple(Map.of(
            "main.bdf", new IdRange(1, 999),
            "includes/part.bdf", new IdRange(1000, 1999))));

        assertThat(report.findings()).isEmpty();
    }

    @Test
    void validate_overlappingRanges_reportsOverlap() {
        ValidationReport report = validate(AllocationMode.ADVANCED, RangeTable.advanced(Map.of(
            "main.bdf", ranges(new IdRange(1, 10), new IdRange(100, 110)),
            "includes/part.bdf", ranges(new IdRange(5, 20), new IdRange(200, 210)))));

        assertThat(report.getFindingsByCategory(FindingCategory.OVERLAP)).singleElement()
            .satisfies(finding -> {
                assertThat(finding.namespace()).isEqualTo(Namespace.NODE);
                assertThat(finding.message()).contains("main.bdf [1-10]").contains("includes/part.bdf [5-20]");
            });
    }

    @Test
    void validate_smallRange_reportsCapacity() {
        ValidationReport report = validate(AllocationMode.ADVANCED, RangeTable.advanced(Map.of(
            "main.bdf", ranges(new IdRange(1, 3), new IdRange(100, 110)),
            "includes/part.bdf", ranges(new IdRange(20, 30), new IdRange(200, 210)))));

        assertThat(report.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.category()).isEqualTo(FindingCategory.CAPACITY);
            assertThat(finding.message()).isEqualTo(
                "main.bdf/Node ID: range [1-3] has capacity 3 but 4 entities need renumbering");
        });
    }

    @Test
    void validate_everyProblemIsReported() {
        ValidationReport report = validate(AllocationMode.ADVANCED, RangeTable.advanced(Map.of(
            "main.bdf", ranges(new IdRange(0, 10), new IdRange(50, 40)),
            "includes/part.bdf", ranges(new IdRange(5, 6), new IdRange(200, 210)))));

        assertThat(report.getFindingsByCategory(FindingCategory.POSITIVITY)).hasSize(2);
        assertThat(report.getFindingsByCategory(FindingCategory.OVERLAP)).hasSize(1);
        assertThat(report.getFindingsByCategory(FindingCategory.POSITIVITY))
            .anySatisfy(finding -> assertThat(finding.message()).contains("end ID (40) < start ID (50)"));
    }

    @Test
    void validate_missingFileRange_reportsEveryUncoveredNamespace() {
        ValidationReport report = validate(AllocationMode.SIMPLE,
            RangeTable.simple(Map.of("main.bdf", new IdRange(1, 999))));

        assertThat(report.errors()).hasSize(2)
            .allSatisfy(finding -> {
                assertThat(finding.category()).isEqualTo(FindingCategory.CAPACITY);
                assertThat(finding.file()).isEqualTo("includes/part.bdf");
                assertThat(finding.message()).contains("no range specified");
            });
    }

    @Test
    void validate_unknownFile_isStructuralError() {
        ValidationReport report = validate(AllocationMode.SIMPLE, RangeTable.simple(Map.of(
            "main.bdf", new IdRange(1, 999),
            "includes/part.bdf", new IdRange(1000, 1999),
            "typo.bdf", new IdRange(5000, 5999))));

        assertThat(report.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.category()).isEqualTo(FindingCategory.STRUCTURAL);
            assertThat(finding.message()).contains("typo.bdf");
        });
    }

    @Test
    void validate_coordinateRangeAtZero_explainsReservedId() throws IOException {
        ScanResult coords = new IncludeScanner().scan(createDeck("coords.bdf", "CORD2R,5\n"));
        RangePlan plan = allocator.plan(coords, AllocationMode.ADVANCED,
            RangeTable.advanced(Map.of("coords.bdf", Map.of(Namespace.COORDINATE_SYSTEM, new IdRange(0, 9)))), true);

        ValidationReport report = validator.validate(coords, plan);

        assertThat(report.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.category()).isEqualTo(FindingCategory.POSITIVITY);
            assertThat(finding.message()).contains("0 is reserved for the basic coordinate system");
        });
    }

    @Test
    void validate_frozenSetNamespaces_areNotChecked() throws IOException {
        ScanResult loads = new IncludeScanner().scan(createDeck("loads.bdf", """
            GRID,7,,0.,0.,0.
            FORCE,40,7,,1.,1.,0.,0.
            """));
        RangePlan plan = allocator.plan(loads, AllocationMode.ADVANCED,
            RangeTable.advanced(Map.of("loads.bdf", Map.of(Namespace.NODE, new IdRange(1, 9)))), false);

        assertThat(validator.validate(loads, plan).findings()).isEmpty();
    }
}
