package com.bdfrenumber.core;

import com.bdfrenumber.core.util.FileUtils;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Base class for tests that work on deck files.
 *
 * <p>Provides a temporary directory and helpers for writing and reading
 * deck files in the deck character set.
 */
public abstract class DeckTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a deck file in the temp directory.
     *
     * @param relativePath path relative to tempDir (e.g., "main.bdf" or "includes/wing.bdf")
     * @param content file content
     * @return the created file path
     * @throws IOException if the file cannot be created
     */
    protected Path createDeck(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content, FileUtils.DECK_CHARSET);
        return filePath;
    }

    protected List<String> readDeck(Path path) throws IOException {
        return FileUtils.readLines(path);
    }

    /**
     * Two-file deck: a root with nodes 1-4 and elements 10-11, and an
     * include with nodes 100-101 and element 200 that references node 100.
     *
     * @return root file
     * @throws IOException if the files cannot be created
     */
    protected Path createTwoFileDeck() throws IOException {
        createDeck("includes/part.bdf", """
            $ part
            GRID,100,,10.,0.,0.
            GRID,101,,11.,0.,0.
            CONROD,200,100,101,,0.5
            """);
        return createDeck("main.bdf", """
            SOL 101
            CEND
            TITLE = TWO FILES
            BEGIN BULK
            INCLUDE 'includes/part.bdf'
            GRID,1,,0.,0.,0.
            GRID,2,,1.,0.,0.
            GRID,3,,1.,1.,0.
            GRID,4,,0.,1.,0.
            CONROD,10,1,2,,0.5
            CONROD,11,3,4,,0.5
            ENDDATA
            """);
    }
}
