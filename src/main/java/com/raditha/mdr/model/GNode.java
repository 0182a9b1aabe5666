package com.raditha.mdr.model;

/**
 * Generalized node: a contiguous, half-open range of sibling indexes under a
 * parent node.
 *
 * @param parent Parent whose children are spanned
 * @param start  First child index (inclusive)
 * @param end    Last child index (exclusive)
 */
public record GNode(NodeId parent, int start, int end) {

    public GNode {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0");
        }
        if (end <= start) {
            throw new IllegalArgumentException("end must be > start (got start=" + start + ", end=" + end + ")");
        }
    }

    /**
     * Number of sibling nodes spanned.
     */
    public int size() {
        return end - start;
    }

    /**
     * Format including the parent, e.g. "GN(table-00000,  3,  5)".
     */
    public String toLongString() {
        return String.format("GN(%s, %2d, %2d)", parent, start, end);
    }

    @Override
    public String toString() {
        return String.format("GN(%2d, %2d)", start, end);
    }
}
