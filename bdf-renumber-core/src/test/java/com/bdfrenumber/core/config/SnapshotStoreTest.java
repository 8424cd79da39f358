package com.bdfrenumber.core.config;

import com.bdfrenumber.core.RenumberException;
import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;
import com.bdfrenumber.core.plan.AllocationMode;
import com.bdfrenumber.core.plan.RangeTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SnapshotStore} and {@link RangeSnapshot}.
 */
class SnapshotStoreTest {

    @TempDir
    Path tempDir;

    private final SnapshotStore store = new SnapshotStore();

    @Test
    void save_thenLoad_restoresAdvancedRanges() {
        // Given
        RangeTable table = RangeTable.advanced(Map.of(
            "main.bdf", Map.of(Namespace.NODE, new IdRange(1, 100), Namespace.CONTACT, new IdRange(5, 9))));
        Path file = tempDir.resolve("snapshots/ranges.json");

        // When
        store.save(RangeSnapshot.of(AllocationMode.ADVANCED, false, table), file);
        RangeSnapshot loaded = store.load(file);

        // Then
        assertThat(loaded.mode()).isEqualTo(AllocationMode.ADVANCED);
        assertThat(loaded.renumberSetIds()).isFalse();
        assertThat(loaded.ranges().get("main.bdf")).containsOnlyKeys("nid", "contact_id");
        assertThat(loaded.toRangeTable()).isEqualTo(table);
    }

    @Test
    void load_handWrittenSimpleSnapshot_buildsFileRanges() throws IOException {
        Path file = Files.writeString(tempDir.resolve("ranges.json"), """
            {
              "fileRanges" : { "main.bdf" : [ 1, 999 ], "includes/wing.bdf" : [ 1000, 1999 ] },
              "comment" : "ignored"
            }
            """);

        RangeSnapshot snapshot = store.load(file);

        assertThat(snapshot.mode()).isEqualTo(AllocationMode.SIMPLE);
        assertThat(snapshot.toRangeTable().fileRanges()).containsExactly(
            Map.entry("main.bdf", new IdRange(1, 999)),
            Map.entry("includes/wing.bdf", new IdRange(1000, 1999)));
    }

    @Test
    void toRangeTable_rangeThatIsNotAPair_throws() {
        RangeSnapshot snapshot = new RangeSnapshot(AllocationMode.SIMPLE, true,
            Map.of("main.bdf", List.of(1, 2, 3)), null);

        assertThatThrownBy(snapshot::toRangeTable)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("main.bdf");
    }

    @Test
    void toRangeTable_unknownNamespaceKey_throws() {
        RangeSnapshot snapshot = new RangeSnapshot(AllocationMode.ADVANCED, true, null,
            Map.of("main.bdf", Map.of("widget_id", List.of(1, 2))));

        assertThatThrownBy(snapshot::toRangeTable).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void load_malformedJson_throwsRenumberException() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.json"), "{ \"fileRanges\" : ");

        assertThatThrownBy(() -> store.load(file))
            .isInstanceOf(RenumberException.class)
            .hasMessageContaining("Failed to read range snapshot");
    }

    @Test
    void load_missingFile_throwsRenumberException() {
        assertThatThrownBy(() -> store.load(tempDir.resolve("absent.json")))
            .isInstanceOf(RenumberException.class);
    }
}
