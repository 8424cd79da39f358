package com.bdfrenumber.core.model;

/**
 * Inclusive numeric range of new IDs.
 *
 * <p>No ordering constraint is enforced here; the range validator reports
 * inverted or non-positive ranges as findings instead of failing on construction.
 *
 * @param start first ID (inclusive)
 * @param end last ID (inclusive)
 */
public record IdRange(int start, int end) {

    /**
     * Number of IDs the range can hold, or 0 when inverted.
     *
     * @return capacity
     */
    public long capacity() {
        return end < start ? 0 : (long) end - start + 1;
    }

    /**
     * Returns true if the value lies inside the range.
     *
     * @param value value to test
     * @return true if {@code start <= value <= end}
     */
    public boolean contains(int value) {
        return value >= start && value <= end;
    }

    /**
     * Returns true if the two ranges share at least one value.
     *
     * @param other other range
     * @return true if the ranges intersect
     */
    public boolean overlaps(IdRange other) {
        return start <= other.end && other.start <= end;
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + "]";
    }
}
