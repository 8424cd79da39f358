package com.bdfrenumber.core.writer;

import com.bdfrenumber.core.RenumberException;
import com.bdfrenumber.core.model.ValidationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemWriter}.
 */
class FileSystemWriterTest {

    @TempDir
    Path tempDir;

    private final FileSystemWriter writer = new FileSystemWriter();

    @Test
    void write_createsNestedDirectoriesAndReturnsRootFirst() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("main.bdf", List.of("INCLUDE 'includes/part.bdf'", "ENDDATA"), 0),
            new GeneratedFile("includes/part.bdf", List.of("GRID,1,,0.,0.,0."), 1)), ValidationReport.empty());
        Path out = tempDir.resolve("out");

        // When
        List<Path> written = writer.write(output, out);

        // Then
        assertThat(written).containsExactly(out.resolve("main.bdf"), out.resolve("includes/part.bdf"));
        assertThat(Files.readString(out.resolve("main.bdf"), StandardCharsets.ISO_8859_1))
            .isEqualTo("INCLUDE 'includes/part.bdf'\nENDDATA\n");
        assertThat(Files.readString(out.resolve("includes/part.bdf"), StandardCharsets.ISO_8859_1))
            .isEqualTo("GRID,1,,0.,0.,0.\n");
    }

    @Test
    void write_existingFile_isOverwritten() throws IOException {
        Path out = tempDir.resolve("out");
        Files.createDirectories(out);
        Files.writeString(out.resolve("main.bdf"), "old content that is longer\n");

        writer.write(new GeneratedOutput(List.of(new GeneratedFile("main.bdf", List.of("ENDDATA"), 0)), null), out);

        assertThat(Files.readString(out.resolve("main.bdf"), StandardCharsets.ISO_8859_1)).isEqualTo("ENDDATA\n");
    }

    @Test
    void write_unwritableTarget_throwsRenumberException() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("main.bdf", List.of("ENDDATA"), 0)), null);

        assertThatThrownBy(() -> writer.write(output, blocker))
            .isInstanceOf(RenumberException.class)
            .hasMessageContaining("Failed to write file")
            .hasCauseInstanceOf(IOException.class);
    }
}
