package com.bdfrenumber.core.scanner;

import com.bdfrenumber.core.DeckTestBase;
import com.bdfrenumber.core.model.Finding;
import com.bdfrenumber.core.model.FindingCategory;
import com.bdfrenumber.core.model.FindingSeverity;
import com.bdfrenumber.core.model.Namespace;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IncludeScanner}.
 */
class IncludeScannerTest extends DeckTestBase {

    private final IncludeScanner scanner = new IncludeScanner();

    @Nested
    class TreeDiscovery {

        @Test
        void scan_twoFileDeck_catalogsIdsPerFile() throws IOException {
            // Given
            Path root = createTwoFileDeck();

            // When
            ScanResult result = scanner.scan(root);

            // Then
            IncludeTree tree = result.tree();
            assertThat(tree.size()).isEqualTo(2);
            assertThat(tree.relativeName(0)).isEqualTo("main.bdf");
            assertThat(tree.relativeName(1)).isEqualTo("includes/part.bdf");
            assertThat(tree.root().ids(Namespace.NODE)).containsExactly(1, 2, 3, 4);
            assertThat(tree.root().ids(Namespace.ELEMENT)).containsExactly(10, 11);
            assertThat(tree.node(1).ids(Namespace.NODE)).containsExactly(100, 101);
            assertThat(tree.node(1).ids(Namespace.ELEMENT)).containsExactly(200);
            assertThat(tree.node(1).parentIndex()).isZero();
            assertThat(tree.root().childIndices()).containsExactly(1);
            assertThat(result.report().findings()).isEmpty();
        }

        @Test
        void scan_includeStatementForms_areAllFollowed() throws IOException {
            createDeck("a.bdf", "GRID,1,,0.,0.,0.\n");
            createDeck("b.bdf", "GRID,2,,0.,0.,0.\n");
            createDeck("sub/c.bdf", "GRID,3,,0.,0.,0.\n");
            Path root = createDeck("main.bdf", """
                INCLUDE 'a.bdf'
                INCLUDE "b.bdf"
                include sub/c.bdf
                """);

            ScanResult result = scanner.scan(root);

            assertThat(result.summary().keySet()).containsExactly("main.bdf", "a.bdf", "b.bdf", "sub/c.bdf");
        }

        @Test
        void scan_nestedIncludes_walkDepthFirst() throws IOException {
            createDeck("leaf.bdf", "GRID,3,,0.,0.,0.\n");
            createDeck("mid.bdf", """
                INCLUDE 'leaf.bdf'
                GRID,2,,0.,0.,0.
                """);
            createDeck("side.bdf", "GRID,4,,0.,0.,0.\n");
            Path root = createDeck("main.bdf", """
                INCLUDE 'mid.bdf'
                INCLUDE 'side.bdf'
                GRID,1,,0.,0.,0.
                """);

            IncludeTree tree = scanner.scan(root).tree();

            assertThat(tree.nodes()).extracting(node -> tree.relativeName(node.index()))
                .containsExactly("main.bdf", "mid.bdf", "leaf.bdf", "side.bdf");
            assertThat(tree.node(2).parentIndex()).isEqualTo(1);
            assertThat(tree.children(0)).extracting(IncludeFileNode::index).containsExactly(1, 3);
        }

        @Test
        void scan_duplicateInclude_isWalkedOnce() throws IOException {
            createDeck("shared.bdf", "GRID,5,,0.,0.,0.\n");
            Path root = createDeck("main.bdf", """
                INCLUDE 'shared.bdf'
                INCLUDE 'shared.bdf'
                """);

            ScanResult result = scanner.scan(root);

            assertThat(result.tree().size()).isEqualTo(2);
            assertThat(result.report().findings()).isEmpty();
        }

        @Test
        void scan_recursiveInclude_breaksTheCycle() throws IOException {
            createDeck("b.bdf", """
                INCLUDE 'main.bdf'
                GRID,2,,0.,0.,0.
                """);
            Path root = createDeck("main.bdf", """
                INCLUDE 'b.bdf'
                GRID,1,,0.,0.,0.
                """);

            ScanResult result = scanner.scan(root);

            assertThat(result.tree().size()).isEqualTo(2);
            assertThat(result.tree().root().ids(Namespace.NODE)).containsExactly(1);
            assertThat(result.tree().node(1).ids(Namespace.NODE)).containsExactly(2);
        }

        @Test
        void scan_missingInclude_reportsErrorAndContinues() throws IOException {
            createDeck("ok.bdf", "GRID,2,,0.,0.,0.\n");
            Path root = createDeck("main.bdf", """
                INCLUDE 'gone.bdf'
                INCLUDE 'ok.bdf'
                GRID,1,,0.,0.,0.
                """);

            ScanResult result = scanner.scan(root);

            assertThat(result.tree().size()).isEqualTo(2);
            assertThat(result.hasErrors()).isTrue();
            Finding finding = result.report().errors().get(0);
            assertThat(finding.category()).isEqualTo(FindingCategory.STRUCTURAL);
            assertThat(finding.message()).contains("gone.bdf");
            assertThat(finding.file()).isEqualTo("main.bdf");
        }
    }

    @Nested
    class Catalog {

        @Test
        void scan_entityIdInTwoFiles_isAnError() throws IOException {
            createDeck("inc.bdf", "GRID,1,,5.,0.,0.\n");
            Path root = createDeck("main.bdf", """
                INCLUDE 'inc.bdf'
                GRID,1,,0.,0.,0.
                """);

            ScanResult result = scanner.scan(root);

            assertThat(result.report().errors()).hasSize(1);
            assertThat(result.report().errors().get(0).namespace()).isEqualTo(Namespace.NODE);
            assertThat(result.report().errors().get(0).id()).isEqualTo(1);
        }

        @Test
        void scan_setIdInTwoFiles_warnsAndFirstFileOwnsIt() throws IOException {
            createDeck("inc.bdf", """
                GRID,2,,0.,0.,0.
                FORCE,5,2,,1.,1.,0.,0.
                """);
            Path root = createDeck("main.bdf", """
                GRID,1,,0.,0.,0.
                FORCE,5,1,,1.,1.,0.,0.
                INCLUDE 'inc.bdf'
                """);

            ScanResult result = scanner.scan(root);

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.report().getFindingsBySeverity(FindingSeverity.WARNING)).hasSize(1);
            assertThat(result.ownerOf(Namespace.LOAD_SET, 5)).isZero();
            assertThat(result.tree().node(1).ids(Namespace.LOAD_SET)).isEmpty();
        }

        @Test
        void scan_contactIdsAreUniquePerCardType() throws IOException {
            createDeck("inc.bdf", """
                BCTSET,1,1,2
                BSURF,1,20
                """);
            Path root = createDeck("main.bdf", """
                BSURF,1,10,11
                INCLUDE 'inc.bdf'
                """);

            ScanResult result = scanner.scan(root);

            assertThat(result.report().errors()).hasSize(1);
            assertThat(result.report().errors().get(0).message()).contains("BSURF");
        }

        @Test
        void scan_passthroughCards_areKeptPerFile() throws IOException {
            createDeck("inc.bdf", """
                MYCARD,1,2,3
                BCTSET,7,1,2
                """);
            Path root = createDeck("main.bdf", """
                PARAM,POST,-1
                INCLUDE 'inc.bdf'
                """);

            ScanResult result = new IncludeScanner(Set.of("BCTSET")).scan(root);

            assertThat(result.tree().root().passthrough()).extracting(raw -> raw.name()).containsExactly("PARAM");
            assertThat(result.tree().node(1).passthrough()).extracting(raw -> raw.name())
                .containsExactly("MYCARD", "BCTSET");
            assertThat(result.tree().node(1).ids(Namespace.CONTACT)).isEmpty();
        }

        @Test
        void scan_spointList_catalogsEveryMember() throws IOException {
            Path root = createDeck("main.bdf", "SPOINT,10,THRU,13\n");

            ScanResult result = scanner.scan(root);

            assertThat(result.tree().root().ids(Namespace.NODE)).containsExactly(10, 11, 12, 13);
        }

        @Test
        void scan_origins_recordEachCardOccurrence() throws IOException {
            createDeck("inc.bdf", "FORCE,5,2,,1.,1.,0.,0.\n");
            Path root = createDeck("main.bdf", """
                FORCE,5,1,,1.,1.,0.,0.
                INCLUDE 'inc.bdf'
                """);

            ScanResult result = scanner.scan(root);

            assertThat(result.origins().fileOf("FORCE", 5, 0)).isZero();
            assertThat(result.origins().fileOf("FORCE", 5, 1)).isEqualTo(1);
            assertThat(result.origins().fileOf("FORCE", 5, 2)).isEqualTo(-1);
            assertThat(result.origins().fileOf("GRID", 5, 0)).isEqualTo(-1);
        }

        @Test
        void summary_reportsCountMinAndMax() throws IOException {
            Path root = createTwoFileDeck();

            NamespaceSummary nodes = scanner.scan(root).summary().get("includes/part.bdf").get(Namespace.NODE);

            assertThat(nodes).isEqualTo(new NamespaceSummary(2, 100, 101));
        }
    }
}
