package com.bdfrenumber.core.validation;

import com.bdfrenumber.core.DeckTestBase;
import com.bdfrenumber.core.bulk.BulkDataRepository;
import com.bdfrenumber.core.bulk.BulkModel;
import com.bdfrenumber.core.model.Finding;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.IdMap;
import com.bdfrenumber.core.plan.IdMapSet;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ModelValidator}.
 */
class ModelValidatorTest extends DeckTestBase {

    private final ModelValidator validator = new ModelValidator();

    private BulkModel read(String content) throws IOException {
        return new BulkDataRepository().read(createDeck("model.bdf", content), Set.of());
    }

    /** Node maps whose new IDs include the given ones. */
    private static IdMapSet nodeMapsTo(int... newIds) {
        Map<Integer, Integer> mapping = new TreeMap<>();
        for (int i = 0; i < newIds.length; i++) {
            mapping.put(1000 + i, newIds[i]);
        }
        return new IdMapSet(List.of(new IdMap(0, Namespace.NODE, null, mapping)));
    }

    @Test
    void checkDuplicates_repeatedId_isReported() throws IOException {
        // Given
        BulkModel model = read("""
            GRID,1,,0.,0.,0.
            GRID,1,,1.,0.,0.
            GRID,2,,0.,0.,0.
            """);

        // When
        ValidationReport report = validator.checkDuplicates(model);

        // Then
        assertThat(report.errors()).extracting(Finding::message).containsExactly("GRID 1 is defined 2 times");
    }

    @Test
    void checkDuplicates_sameIdAcrossCardTypesOfOneNamespace_isReported() throws IOException {
        BulkModel model = read("""
            GRID,5,,0.,0.,0.
            SPOINT,5
            """);

        ValidationReport report = validator.checkDuplicates(model);

        assertThat(report.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.category()).isEqualTo(FindingCategory.STRUCTURAL);
            assertThat(finding.message()).contains("Node ID 5").contains("GRID").contains("SPOINT");
        });
    }

    @Test
    void checkDuplicates_setIdsMayRepeat() throws IOException {
        BulkModel model = read("""
            GRID,1,,0.,0.,0.
            FORCE,10,1,,1.,1.,0.,0.
            FORCE,10,1,,1.,0.,1.,0.
            """);

        assertThat(validator.checkDuplicates(model).findings()).isEmpty();
    }

    @Test
    void checkDuplicates_secondCoordinateSystemOfCord1_isCheckedToo() throws IOException {
        BulkModel model = read("""
            GRID,1,,0.,0.,0.
            GRID,2,,1.,0.,0.
            GRID,3,,0.,1.,0.
            CORD2R,6
            CORD1R,5,1,2,3,6,1,3,2
            """);

        ValidationReport report = validator.checkDuplicates(model);

        assertThat(report.errors()).extracting(Finding::message)
            .containsExactly("Coord ID 6 defined by CORD1R 5 field 5 is already defined");
    }

    @Test
    void checkReferences_renumberedToAnUndefinedNode_isAnError() throws IOException {
        BulkModel model = read("""
            GRID,1,,0.,0.,0.
            CONROD,10,1,2,,0.5
            """);

        ValidationReport report = validator.checkReferences(model, nodeMapsTo(1, 2));

        assertThat(report.errors()).singleElement().satisfies(finding -> {
            assertThat(finding.category()).isEqualTo(FindingCategory.DANGLING_REFERENCE);
            assertThat(finding.namespace()).isEqualTo(Namespace.NODE);
            assertThat(finding.id()).isEqualTo(2);
            assertThat(finding.message()).isEqualTo("CONROD 10 field 3 references Node ID 2, which is not defined");
        });
    }

    @Test
    void checkReferences_thruRange_needsOnlyOneDefinedMember() throws IOException {
        BulkModel model = read("""
            GRID,1,,0.,0.,0.
            SPC1,3,123,1,THRU,5
            SPC1,4,123,7,THRU,9
            """);

        ValidationReport report = validator.checkReferences(model, nodeMapsTo(1, 8));

        assertThat(report.errors()).singleElement()
            .satisfies(finding -> assertThat(finding.message()).contains("IDs 7 THRU 9"));
    }

    @Test
    void checkReferences_unmappedSourceId_isOnlyAWarning() throws IOException {
        // Given: node 99 was never defined in the source and no map produces it
        BulkModel model = read("""
            GRID,1,,0.,0.,0.
            CONROD,10,1,99,,0.5
            """);

        // When
        ValidationReport report = validator.checkReferences(model, nodeMapsTo(1));

        // Then
        assertThat(report.hasErrors()).isFalse();
        assertThat(report.warnings()).singleElement().satisfies(finding -> {
            assertThat(finding.category()).isEqualTo(FindingCategory.DANGLING_REFERENCE);
            assertThat(finding.message())
                .isEqualTo("CONROD 10 field 3 references Node ID 99, which is not defined; left unchanged");
        });
    }

    @Test
    void checkReferences_materialOfAnUnlistedMaterialCard_isDefined() throws IOException {
        BulkModel model = read("""
            PSOLID,30,40
            MAT11,40,1.E7
            """);

        assertThat(validator.checkReferences(model, nodeMapsTo()).findings()).isEmpty();
    }

    @Test
    void checkCounts_unchangedModel_passes() throws IOException {
        BulkModel model = read("""
            GRID,1,,0.,0.,0.
            CONROD,10,1,1,,0.5
            PARAM,POST,-1
            """);

        ValidationReport report = validator.checkCounts(model.recordCounts(), model.cardCounts(), model);

        assertThat(report.findings()).isEmpty();
    }

    @Test
    void checkCounts_lostRecords_areReported() throws IOException {
        BulkModel model = read("GRID,1,,0.,0.,0.\n");
        Map<Namespace, Integer> namespaces = new EnumMap<>(Namespace.class);
        namespaces.put(Namespace.NODE, 2);
        TreeMap<String, Integer> cards = new TreeMap<>(Map.of("GRID", 2));

        ValidationReport report = validator.checkCounts(namespaces, cards, model);

        assertThat(report.getFindingsByCategory(FindingCategory.COUNT_MISMATCH)).extracting(Finding::message)
            .containsExactly(
                "Node ID record count changed: before=2, after=1",
                "GRID card count after renumbering is 1, expected 2");
    }

    @Test
    void checkOutput_comparesEveryCardName() {
        ValidationReport report = validator.checkOutput(
            new TreeMap<>(Map.of("GRID", 4, "PARAM", 1)),
            new TreeMap<>(Map.of("GRID", 4, "MYCARD", 1)));

        assertThat(report.errors()).extracting(Finding::message).containsExactly(
            "MYCARD card count in the written deck is 1, expected 0",
            "PARAM card count in the written deck is 0, expected 1");
    }
}
