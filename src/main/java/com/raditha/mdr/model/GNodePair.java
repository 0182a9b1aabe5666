package com.raditha.mdr.model;

import java.util.Objects;

/**
 * Two adjacent generalized nodes of equal size under the same parent.
 * Used as the key of a stored similarity score.
 *
 * @param left  Window on the left
 * @param right Window immediately following {@code left}
 */
public record GNodePair(GNode left, GNode right) {

    public GNodePair {
        if (left == null || right == null) {
            throw new IllegalArgumentException("gnodes cannot be null");
        }
        if (left.size() != right.size()) {
            throw new IllegalArgumentException("gnodes must have the same size: " + left + " - " + right);
        }
        if (left.end() != right.start()) {
            throw new IllegalArgumentException("gnodes must be adjacent: " + left + " - " + right);
        }
        if (!Objects.equals(left.parent(), right.parent())) {
            throw new IllegalArgumentException("gnodes must share a parent: " + left.toLongString()
                    + " - " + right.toLongString());
        }
    }

    /**
     * Build the pair whose right window starts at {@code rightStart}.
     */
    public static GNodePair endingAt(NodeId parent, int rightStart, int gnodeSize) {
        return new GNodePair(
                new GNode(parent, rightStart - gnodeSize, rightStart),
                new GNode(parent, rightStart, rightStart + gnodeSize));
    }

    public int gnodeSize() {
        return left.size();
    }

    @Override
    public String toString() {
        return left + " - " + right;
    }
}
