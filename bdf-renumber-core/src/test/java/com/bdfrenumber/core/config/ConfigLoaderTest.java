package com.bdfrenumber.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("bdf-renumber.yaml");
        Files.writeString(configFile, """
            cards:
              disabled:
                - bctset
                - MYCARD
              disabledGroups:
                - dynamic

            renumberSetIds: false

            output:
              directory: "./out"
            """);

        RenumberConfig config = ConfigLoader.load(configFile);

        assertThat(config.cards().disabled()).containsExactly("bctset", "MYCARD");
        assertThat(config.cards().disabledGroups()).containsExactly("dynamic");
        assertThat(config.renumberSetIds()).isFalse();
        assertThat(config.output().directory()).isEqualTo("./out");
        assertThat(config.effectiveDisabledCards())
            .contains("BCTSET", "MYCARD", "EIGRL", "TABLED1", "DLOAD")
            .doesNotContain("BCPROPS", "GRID");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("bdf-renumber.yaml");
        Files.writeString(configFile, """
            output:
              directory: "./elsewhere"
            """);

        RenumberConfig config = ConfigLoader.load(configFile);

        assertThat(config.cards().disabled()).isEqualTo(RenumberConfig.DEFAULT_DISABLED_CARDS);
        assertThat(config.renumberSetIds()).isTrue();
        assertThat(config.output().directory()).isEqualTo("./elsewhere");
    }

    @Test
    void load_emptyDisabledList_enablesEveryCard() throws IOException {
        Path configFile = tempDir.resolve("bdf-renumber.yaml");
        Files.writeString(configFile, """
            cards:
              disabled: []
            """);

        RenumberConfig config = ConfigLoader.load(configFile);

        assertThat(config.effectiveDisabledCards()).isEmpty();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("bdf-renumber.yaml");
        Files.writeString(configFile, """
            solver: nastran
            renumberSetIds: true
            """);

        RenumberConfig config = ConfigLoader.load(configFile);

        assertThat(config.renumberSetIds()).isTrue();
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        Path configFile = tempDir.resolve("nonexistent.yaml");

        RenumberConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(RenumberConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("bdf-renumber.yaml");
        Files.writeString(configFile, """
            cards:
              disabled: [unclosed
            """);

        RenumberConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(RenumberConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() throws IOException {
        Path directory = Files.createDirectories(tempDir.resolve("config-dir"));

        assertThat(ConfigLoader.load(directory)).isEqualTo(RenumberConfig.defaults());
    }

    @Test
    void loadFor_readsTheFileNextToTheDeck() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), "renumberSetIds: false\n");
        Path deck = Files.writeString(tempDir.resolve("main.bdf"), "ENDDATA\n");

        RenumberConfig config = ConfigLoader.loadFor(deck);

        assertThat(config.renumberSetIds()).isFalse();
    }
}
