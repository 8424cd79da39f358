package com.bdfrenumber.core.engine;

import com.bdfrenumber.core.DeckTestBase;
import com.bdfrenumber.core.bulk.BulkCard;
import com.bdfrenumber.core.bulk.BulkDataRepository;
import com.bdfrenumber.core.bulk.BulkModel;
import com.bdfrenumber.core.bulk.ModelRepository;
import com.bdfrenumber.core.card.CardType;
import com.bdfrenumber.core.config.RenumberConfig;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.RunStatus;
import com.bdfrenumber.core.model.ValidationReport;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangePlan;
import com.bdfrenumber.core.plan.RangeTable;
import com.bdfrenumber.core.scanner.ScanResult;
import com.bdfrenumber.core.writer.DeckWriter;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RenumberEngine}.
 */
class RenumberEngineTest extends DeckTestBase {

    private static final RangeTable TWO_FILE_RANGES = RangeTable.simple(Map.of(
        "main.bdf", new IdRange(1, 999),
        "includes/part.bdf", new IdRange(1000, 1999)));

    private final RenumberEngine engine = new RenumberEngine();

    private BulkModel reread(Path file) {
        return new BulkDataRepository().read(file, Set.of());
    }

    @Nested
    class Run {

        @Test
        void run_twoFileDeck_writesRenumberedTree() throws IOException {
            // Given
            Path root = createTwoFileDeck();
            Path out = tempDir.resolve("out");

            // When
            RunResult result = engine.run(root, AllocationMode.SIMPLE, TWO_FILE_RANGES, out);

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(result.writtenFiles()).containsExactly(out.resolve("main.bdf"), out.resolve("includes/part.bdf"));

            BulkModel written = reread(out.resolve("main.bdf"));
            assertThat(written.cards(CardType.GRID)).containsOnlyKeys(1, 2, 3, 4, 1000, 1001);
            assertThat(written.cards(CardType.CONROD)).containsOnlyKeys(500, 501, 1500);
            BulkCard rod = written.cards(CardType.CONROD).get(1500).get(0);
            assertThat(rod.field(2)).isEqualTo("1000");
            assertThat(rod.field(3)).isEqualTo("1001");
            assertThat(written.controlDeck().caseControlLines()).containsExactly("TITLE = TWO FILES");

            assertThat(readDeck(out.resolve("main.bdf")))
                .startsWith("SOL 101", "CEND", "TITLE = TWO FILES", "BEGIN BULK", "INCLUDE 'includes/part.bdf'")
                .endsWith("ENDDATA");
            assertThat(readDeck(out.resolve("includes/part.bdf"))).first()
                .isEqualTo("$ Renumbered from: includes/part.bdf");
        }

        @Test
        void run_sourceFilesAreNotTouched() throws IOException {
            Path root = createTwoFileDeck();
            String before = Files.readString(root);

            engine.run(root, AllocationMode.SIMPLE, TWO_FILE_RANGES, tempDir.resolve("out"));

            assertThat(Files.readString(root)).isEqualTo(before);
        }

        @Test
        void run_unknownCard_isCopiedVerbatimWithWarning() throws IOException {
            Path root = createDeck("deck.bdf", """
                GRID,7,,0.,0.,0.
                MYCARD  7       12.5
                """);
            Path out = tempDir.resolve("out");

            RunResult result = engine.run(root, AllocationMode.SIMPLE,
                RangeTable.simple(Map.of("deck.bdf", new IdRange(100, 199))), out);

            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS_WITH_WARNINGS);
            assertThat(result.status().exitCode()).isEqualTo(2);
            assertThat(result.report().getFindingsByCategory(FindingCategory.UNMAPPED_TYPE))
                .anySatisfy(finding -> assertThat(finding.message()).contains("MYCARD"));
            assertThat(readDeck(out.resolve("deck.bdf"))).contains("MYCARD  7       12.5");
            assertThat(reread(out.resolve("deck.bdf")).cards(CardType.GRID)).containsOnlyKeys(100);
        }

        @Test
        void run_caseControlReferences_followTheirSets() throws IOException {
            Path root = createDeck("deck.bdf", """
                SOL 101
                CEND
                SUBCASE 1
                  LOAD = 10
                BEGIN BULK
                GRID,1,,0.,0.,0.
                FORCE,10,1,,1.,1.,0.,0.
                ENDDATA
                """);
            Path out = tempDir.resolve("out");

            RunResult result = engine.run(root, AllocationMode.SIMPLE,
                RangeTable.simple(Map.of("deck.bdf", new IdRange(1, 999))), out);

            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(readDeck(out.resolve("deck.bdf"))).contains("SUBCASE 1", "  LOAD = 500");
            assertThat(reread(out.resolve("deck.bdf")).cards(CardType.FORCE)).containsOnlyKeys(500);
        }

        @Test
        void run_keptSetIds_leaveLoadSetsAlone() throws IOException {
            Path root = createDeck("deck.bdf", """
                GRID,1,,0.,0.,0.
                FORCE,10,1,,1.,1.,0.,0.
                """);
            Path out = tempDir.resolve("out");
            RenumberEngine keepSets = new RenumberEngine(
                new RenumberConfig(null, false, null));

            RunResult result = keepSets.run(root, AllocationMode.SIMPLE,
                RangeTable.simple(Map.of("deck.bdf", new IdRange(50, 99))), out);

            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
            BulkCard force = reread(out.resolve("deck.bdf")).cards(CardType.FORCE).get(10).get(0);
            assertThat(force.field(2)).isEqualTo("50");
        }

        @Test
        void run_failedValidation_writesNothing() throws IOException {
            Path root = createTwoFileDeck();
            Path out = tempDir.resolve("out");

            RunResult result = engine.run(root, AllocationMode.SIMPLE,
                RangeTable.simple(Map.of("main.bdf", new IdRange(1, 3))), out);

            assertThat(result.status()).isEqualTo(RunStatus.FAILURE);
            assertThat(result.status().exitCode()).isEqualTo(1);
            assertThat(result.isWritten()).isFalse();
            assertThat(result.report().getFindingsByCategory(FindingCategory.CAPACITY)).isNotEmpty();
            assertThat(out).doesNotExist();
        }

        @Test
        void run_postValidationErrors_writeNothing() throws IOException {
            // Given: the model loses node 2 after the scan planned it
            Path root = createTwoFileDeck();
            Path out = tempDir.resolve("out");
            ModelRepository dropsNode = (file, disabled) -> {
                BulkModel model = new BulkDataRepository().read(file, disabled);
                Map<Integer, List<BulkCard>> grids = new LinkedHashMap<>(model.cards(CardType.GRID));
                grids.remove(2);
                model.replaceCards(CardType.GRID, grids);
                return model;
            };
            RenumberEngine lossy = new RenumberEngine(RenumberConfig.defaults(), dropsNode, new DeckWriter());

            // When
            RunResult result = lossy.run(root, AllocationMode.SIMPLE, TWO_FILE_RANGES, out);

            // Then
            assertThat(result.status()).isEqualTo(RunStatus.FAILURE);
            assertThat(result.isWritten()).isFalse();
            assertThat(result.report().errors()).singleElement().satisfies(finding -> {
                assertThat(finding.category()).isEqualTo(FindingCategory.DANGLING_REFERENCE);
                assertThat(finding.message()).startsWith("CONROD 500 field 3 references Node ID 2,");
            });
            assertThat(out).doesNotExist();
        }

        @Test
        void run_missingInclude_failsWithAReport() throws IOException {
            Path root = createDeck("main.bdf", """
                INCLUDE 'missing.bdf'
                GRID,1,,0.,0.,0.
                """);
            Path out = tempDir.resolve("out");

            RunResult result = engine.run(root, AllocationMode.SIMPLE,
                RangeTable.simple(Map.of("main.bdf", new IdRange(1, 99))), out);

            assertThat(result.status()).isEqualTo(RunStatus.FAILURE);
            assertThat(result.report().getFindingsByCategory(FindingCategory.STRUCTURAL))
                .anySatisfy(finding -> assertThat(finding.message()).startsWith("Include file not found: missing.bdf"));
            assertThat(out).doesNotExist();
        }

        @Test
        void run_materialCardsOutsideTheCommonSet_areRenumberedAndLinked() throws IOException {
            Path root = createDeck("solid.bdf", """
                GRID,1,,0.,0.,0.
                GRID,2,,1.,0.,0.
                GRID,3,,0.,1.,0.
                GRID,4,,0.,0.,1.
                CTETRA,20,30,1,2,3,4
                PSOLID,30,40
                MAT11,40,1.E7
                """);
            Path out = tempDir.resolve("out");

            RunResult result = engine.run(root, AllocationMode.SIMPLE,
                RangeTable.simple(Map.of("solid.bdf", new IdRange(1000, 4999))), out);

            assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
            BulkModel written = reread(out.resolve("solid.bdf"));
            BulkCard property = written.cards(CardType.PSOLID).values().iterator().next().get(0);
            BulkCard element = written.cards(CardType.CTETRA).values().iterator().next().get(0);
            assertThat(written.cards(CardType.MAT11)).doesNotContainKey(40)
                .containsOnlyKeys(Integer.parseInt(property.field(2)));
            assertThat(element.field(2)).isEqualTo(property.field(1));
        }

        @Test
        void run_sameEngineTwice_startsAFreshRunEachTime() throws IOException {
            Path root = createTwoFileDeck();

            RunResult first = engine.run(root, AllocationMode.SIMPLE, TWO_FILE_RANGES, tempDir.resolve("first"));
            RunResult second = engine.run(root, AllocationMode.SIMPLE, TWO_FILE_RANGES, tempDir.resolve("second"));

            assertThat(first.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(second.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(readDeck(tempDir.resolve("second/main.bdf"))).isEqualTo(readDeck(tempDir.resolve("first/main.bdf")));
        }
    }

    @Nested
    class Steps {

        @Test
        void apply_withoutValidation_isRejected() throws IOException {
            Path root = createTwoFileDeck();
            ScanResult scan = engine.scan(root);
            RangePlan plan = engine.plan(scan, AllocationMode.SIMPLE, TWO_FILE_RANGES);
            BulkModel model = engine.read(root);

            assertThatThrownBy(() -> engine.apply(model, plan))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must pass validation");
        }

        @Test
        void apply_afterFailedValidation_isRejected() throws IOException {
            Path root = createTwoFileDeck();
            ScanResult scan = engine.scan(root);
            RangePlan plan = engine.plan(scan, AllocationMode.SIMPLE,
                RangeTable.simple(Map.of("main.bdf", new IdRange(1, 999))));
            BulkModel model = engine.read(root);

            assertThat(engine.validate(model, plan).hasErrors()).isTrue();
            assertThatThrownBy(() -> engine.apply(model, plan)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void apply_sameModelTwice_isRejected() throws IOException {
            Path root = createTwoFileDeck();
            ScanResult scan = engine.scan(root);
            RangePlan plan = engine.plan(scan, AllocationMode.SIMPLE, TWO_FILE_RANGES);
            BulkModel model = engine.read(root);

            assertThat(engine.validate(model, plan).hasErrors()).isFalse();
            ValidationReport applied = engine.apply(model, plan);

            assertThat(applied.hasErrors()).isFalse();
            assertThatThrownBy(() -> engine.apply(model, plan)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> engine.validate(model, plan)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void validate_planFromAnotherEngine_isRejected() throws IOException {
            Path root = createTwoFileDeck();
            RenumberEngine other = new RenumberEngine();
            RangePlan foreign = other.plan(other.scan(root), AllocationMode.SIMPLE, TWO_FILE_RANGES);

            assertThatThrownBy(() -> engine.validate(engine.read(root), foreign))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void validate_supersededPlan_isRejected() throws IOException {
            Path root = createTwoFileDeck();
            ScanResult scan = engine.scan(root);
            RangePlan stale = engine.plan(scan, AllocationMode.SIMPLE, TWO_FILE_RANGES);
            RangePlan current = engine.plan(scan, AllocationMode.SIMPLE, TWO_FILE_RANGES);
            BulkModel model = engine.read(root);

            assertThatThrownBy(() -> engine.validate(model, stale))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not the current plan");
            assertThat(engine.validate(model, current).hasErrors()).isFalse();
        }

        @Test
        void write_beforeApply_isRejected() throws IOException {
            Path root = createTwoFileDeck();
            ScanResult scan = engine.scan(root);
            RangePlan plan = engine.plan(scan, AllocationMode.SIMPLE, TWO_FILE_RANGES);
            BulkModel model = engine.read(root);
            engine.validate(model, plan);

            assertThatThrownBy(() -> engine.write(model, scan, plan, tempDir.resolve("out")))
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void suggest_feedsAValidPlan() throws IOException {
            Path root = createTwoFileDeck();
            ScanResult scan = engine.scan(root);

            Map<String, IdRange> suggestion = engine.suggest(scan, 1);
            RangePlan plan = engine.plan(scan, AllocationMode.SIMPLE, RangeTable.simple(suggestion));

            assertThat(engine.validate(engine.read(root), plan).hasErrors()).isFalse();
        }
    }
}
