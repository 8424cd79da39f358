package com.bdfrenumber.core.bulk;

import java.nio.file.Path;

/**
 * Callbacks of a {@link DeckWalker} pass over a deck and its includes.
 *
 * <p>Files are visited depth first: an included file is walked completely at
 * the point where its {@code INCLUDE} statement appears, before the rest of
 * the including file.
 */
public interface DeckVisitor {

    /**
     * Called before the first line of a file is read.
     *
     * @param file normalized absolute file path
     * @param parent including file, or null for the root
     */
    default void enterFile(Path file, Path parent) {
    }

    /**
     * Called after the last card of a file.
     *
     * @param file normalized absolute file path
     */
    default void exitFile(Path file) {
    }

    /**
     * Called for an include statement naming a file that was already walked.
     *
     * @param file normalized absolute file path
     * @param parent including file
     */
    default void duplicateInclude(Path file, Path parent) {
    }

    /**
     * Called for an include statement naming a file that does not exist.
     *
     * @param file resolved path of the missing file
     * @param parent including file
     */
    default void missingInclude(Path file, Path parent) {
    }

    /**
     * Called for every executive and case control line of the root file.
     *
     * @param section {@link DeckSection#EXECUTIVE} or {@link DeckSection#CASE_CONTROL}
     * @param line raw line
     */
    default void controlLine(DeckSection section, String line) {
    }

    /**
     * Called when the root file's {@code BEGIN BULK} line is reached.
     */
    default void beginBulk() {
    }

    /**
     * Called for every bulk data card.
     *
     * @param file file the card is written in
     * @param card raw card lines
     */
    default void card(Path file, RawCard card) {
    }
}
