package com.raditha.mdr.tree;

import java.util.List;

/**
 * Read-only view of a parsed markup document as consumed by the miner.
 *
 * @param <N> Node type of the underlying parser
 */
public interface DocumentTree<N> {

    /**
     * Root of the document. It sits at depth 0.
     */
    N root();

    /**
     * Tag (label) of a node.
     */
    String tagOf(N node);

    /**
     * Ordered children of a node. Never null.
     */
    List<N> childrenOf(N node);

    /**
     * Canonical text of a contiguous span of sibling subtrees: each sibling's
     * markup, trimmed, joined with a single space.
     *
     * @param siblings Consecutive children of one parent
     * @return Serialized span used as similarity input
     */
    String serialize(List<N> siblings);
}
