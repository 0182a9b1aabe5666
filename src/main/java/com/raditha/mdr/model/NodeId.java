package com.raditha.mdr.model;

/**
 * Stable identity of a document node within one mining run.
 * Sequences are assigned per tag in first-visit order.
 *
 * @param tag      Tag of the identified node
 * @param sequence Zero-based counter among nodes sharing the same tag
 */
public record NodeId(String tag, int sequence) {

    public NodeId {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }

    /**
     * Format as "tag-00042" for reporting.
     */
    @Override
    public String toString() {
        return String.format("%s-%05d", tag, sequence);
    }
}
