package com.raditha.mdr.model;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A run of at least two adjacent, similar generalized nodes of equal size under
 * one parent.
 * <p>
 * Iterating a region yields its gnodes from left to right; together they cover
 * exactly {@code [firstGNodeStartIndex, lastCoveredIndex()]}.
 *
 * @param parent               Parent whose children form the region
 * @param gnodeSize            Number of siblings in each generalized node
 * @param firstGNodeStartIndex Child index where the first gnode starts
 * @param nNodesCovered        Total number of siblings covered
 */
public record DataRegion(
        NodeId parent,
        int gnodeSize,
        int firstGNodeStartIndex,
        int nNodesCovered) implements Iterable<GNode> {

    public DataRegion {
        if (gnodeSize < 1) {
            throw new IllegalArgumentException("gnodeSize must be >= 1");
        }
        if (firstGNodeStartIndex < 0) {
            throw new IllegalArgumentException("firstGNodeStartIndex must be >= 0");
        }
        if (nNodesCovered % gnodeSize != 0 || nNodesCovered / gnodeSize < 2) {
            throw new IllegalArgumentException(
                    "nNodesCovered must be a multiple of gnodeSize covering at least 2 gnodes (got "
                            + nNodesCovered + " for size " + gnodeSize + ")");
        }
    }

    /**
     * The region made of {@code gnode} and the window of equal size right before it.
     */
    public static DataRegion binaryFromLastGNode(GNode gnode) {
        int size = gnode.size();
        return new DataRegion(gnode.parent(), size, gnode.start() - size, 2 * size);
    }

    /**
     * Copy of this region grown by one gnode on the right.
     */
    public DataRegion extendOneGNode() {
        return new DataRegion(parent, gnodeSize, firstGNodeStartIndex, nNodesCovered + gnodeSize);
    }

    public int nGNodes() {
        return nNodesCovered / gnodeSize;
    }

    public int lastCoveredIndex() {
        return firstGNodeStartIndex + nNodesCovered - 1;
    }

    /**
     * Check whether a child index (relative to {@link #parent()}) falls inside
     * this region.
     */
    public boolean contains(int childIndex) {
        return firstGNodeStartIndex <= childIndex && childIndex <= lastCoveredIndex();
    }

    /**
     * Check whether the sibling ranges of two regions intersect.
     */
    public boolean overlaps(DataRegion other) {
        return parent.equals(other.parent)
                && firstGNodeStartIndex <= other.lastCoveredIndex()
                && other.firstGNodeStartIndex <= lastCoveredIndex();
    }

    @Override
    public Iterator<GNode> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < nGNodes();
            }

            @Override
            public GNode next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int start = firstGNodeStartIndex + next * gnodeSize;
                next++;
                return new GNode(parent, start, start + gnodeSize);
            }
        };
    }

    /**
     * Format including the parent, e.g. "DR(tr-00009, 2, 0, 6)".
     */
    public String toLongString() {
        return String.format("DR(%s, %d, %d, %d)", parent, gnodeSize, firstGNodeStartIndex, nNodesCovered);
    }

    @Override
    public String toString() {
        return String.format("DR(%d, %d, %d)", gnodeSize, firstGNodeStartIndex, nNodesCovered);
    }
}
