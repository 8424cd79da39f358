package com.bdfrenumber.core.plan;

/**
 * How ranges are given for a run.
 */
public enum AllocationMode {
    /** One range per file, split into equal blocks per namespace. */
    SIMPLE,
    /** One range per file and namespace. */
    ADVANCED
}
