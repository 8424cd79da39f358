package com.bdfrenumber.core.bulk;

/**
 * Sections of a deck file, in the order they appear in the root file.
 */
public enum DeckSection {
    /** Executive control, up to and including {@code CEND}. */
    EXECUTIVE,
    /** Case control, between {@code CEND} and {@code BEGIN BULK}. */
    CASE_CONTROL,
    /** Bulk data, after {@code BEGIN BULK} and everywhere in include files. */
    BULK
}
