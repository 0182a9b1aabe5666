package com.raditha.mdr.analyzer;

import com.raditha.mdr.config.MiningConfig;
import com.raditha.mdr.model.DataRecord;
import com.raditha.mdr.model.DataRegion;
import com.raditha.mdr.model.GNode;
import com.raditha.mdr.tree.NodeIndex;

import java.util.List;

/**
 * Output of one mining run: the records in extraction order, the regions they
 * came from, and the index needed to resolve them to document nodes.
 *
 * @param records The mined data records
 * @param regions Every data region found in the tree, in extraction order
 * @param index   Node index of the run
 * @param config  Configuration used
 * @param <N>     Node type of the underlying parser
 */
public record MiningResult<N>(
        List<DataRecord> records,
        List<DataRegion> regions,
        NodeIndex<N> index,
        MiningConfig config) {

    public MiningResult {
        records = List.copyOf(records);
        regions = List.copyOf(regions);
    }

    public int getRecordCount() {
        return records.size();
    }

    public boolean hasRecords() {
        return !records.isEmpty();
    }

    /**
     * Resolve one gnode to the sibling nodes it spans.
     */
    public List<N> nodesOf(GNode gnode) {
        return index.nodesOf(gnode);
    }

    /**
     * Resolve every record to its nodes: one inner list per gnode of the record.
     */
    public List<List<List<N>>> toNodeLists() {
        return records.stream()
                .map(record -> record.gnodes().stream()
                        .map(index::nodesOf)
                        .toList())
                .toList();
    }

    /**
     * Get summary string.
     */
    public String getSummary() {
        return String.format("%d data record(s) in %d data region(s)", records.size(), regions.size());
    }
}
