package com.raditha.mdr.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One mined record instance. Usually a single generalized node; a record built
 * from corresponding children of several siblings spans disjoint subtrees.
 * Equality is order-sensitive.
 *
 * @param gnodes Generalized nodes making up the record
 */
public record DataRecord(List<GNode> gnodes) {

    public DataRecord {
        if (gnodes == null || gnodes.isEmpty()) {
            throw new IllegalArgumentException("a data record needs at least one gnode");
        }
        gnodes = List.copyOf(gnodes);
    }

    public static DataRecord of(GNode... gnodes) {
        return new DataRecord(List.of(gnodes));
    }

    public int size() {
        return gnodes.size();
    }

    /**
     * Check if the record spans more than one parent.
     */
    public boolean isNonContiguous() {
        return gnodes.stream().map(GNode::parent).distinct().count() > 1;
    }

    @Override
    public String toString() {
        return gnodes.stream()
                .map(GNode::toString)
                .collect(Collectors.joining(", ", "DataRecord(", ")"));
    }
}
