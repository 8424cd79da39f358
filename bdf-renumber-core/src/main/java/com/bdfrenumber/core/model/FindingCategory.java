package com.bdfrenumber.core.model;

/**
 * Taxonomy of validation findings.
 */
public enum FindingCategory {
    /** Missing include file or an ambiguous source model (duplicate IDs). */
    STRUCTURAL,
    /** An assigned range is too small for the IDs it must hold. */
    CAPACITY,
    /** Two files were given intersecting ranges in the same namespace. */
    OVERLAP,
    /** A range starts below 1, ends before it starts, or touches a reserved value. */
    POSITIVITY,
    /** A reference points at an ID that no record defines. */
    DANGLING_REFERENCE,
    /** A record count changed between source and result. */
    COUNT_MISMATCH,
    /** A card type outside the rewrite rule table was carried through untouched. */
    UNMAPPED_TYPE,
    /** A case control entry that may hold an ID was left untouched. */
    UNRECOGNIZED_ENTRY
}
