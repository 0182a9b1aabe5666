package com.raditha.mdr.extraction;

import com.raditha.mdr.config.MiningConfig;
import com.raditha.mdr.distance.DistanceTables;
import com.raditha.mdr.model.DataRecord;
import com.raditha.mdr.model.DataRegion;
import com.raditha.mdr.model.GNode;
import com.raditha.mdr.model.GNodePair;
import com.raditha.mdr.model.NodeId;
import com.raditha.mdr.observer.MiningObserver;
import com.raditha.mdr.tree.DocumentTree;
import com.raditha.mdr.tree.NodeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the generalized nodes of data regions into data records.
 * <p>
 * A gnode is either a record itself or is split into finer records, one per
 * child (single-node gnodes) or one per child position across its nodes
 * (multi-node gnodes).
 *
 * @param <N> Node type of the underlying parser
 */
public class RecordExtractor<N> {

    private static final Logger logger = LoggerFactory.getLogger(RecordExtractor.class);

    /**
     * Rows of a data table are records themselves, never split into cells.
     */
    public static final String TABLE_ROW_TAG = "tr";

    private final NodeIndex<N> index;
    private final DistanceTables distances;
    private final MiningObserver observer;
    private final double threshold1;
    private final double thresholdN;

    public RecordExtractor(
            NodeIndex<N> index,
            DistanceTables distances,
            MiningConfig config,
            MiningObserver observer) {
        this.index = index;
        this.distances = distances;
        this.observer = observer;
        this.threshold1 = config.recordThreshold1();
        this.thresholdN = config.recordThresholdN();
    }

    /**
     * Extract the records of every gnode of every region, in region order.
     */
    public List<DataRecord> findDataRecords(Collection<DataRegion> regions) {
        List<DataRecord> records = new ArrayList<>();
        for (DataRegion region : regions) {
            logger.debug("data region {}", region.toLongString());
            for (GNode gnode : region) {
                List<DataRecord> found = region.gnodeSize() == 1 ? findRecords1(gnode) : findRecordsN(gnode);
                observer.recordsExtracted(gnode, found);
                records.addAll(found);
            }
        }
        return records;
    }

    /**
     * Records of a single-node gnode. If all children of the node are similar
     * and it is not a table row, each child is a record; otherwise the gnode
     * is. Only the chained adjacent scores are checked, not every pair of
     * children.
     *
     * @return The records, empty if the node has no size-1 scores
     */
    public List<DataRecord> findRecords1(GNode gnode) {
        N node = index.nodesOf(gnode).get(0);
        NodeId nodeId = index.identify(node);

        Optional<Map<GNodePair, Double>> childScores = childScores(nodeId);
        if (childScores.isEmpty()) {
            logger.debug("{}: no children distances", nodeId);
            return List.of();
        }

        boolean allChildrenSimilar = childScores.get().values().stream().allMatch(d -> d <= threshold1);
        boolean isTableRow = TABLE_ROW_TAG.equalsIgnoreCase(nodeId.tag());

        if (allChildrenSimilar && !isTableRow) {
            int nChildren = index.getTree().childrenOf(node).size();
            List<DataRecord> records = new ArrayList<>(nChildren);
            for (int i = 0; i < nChildren; i++) {
                records.add(DataRecord.of(new GNode(nodeId, i, i + 1)));
            }
            return records;
        }
        return List.of(DataRecord.of(gnode));
    }

    /**
     * Records of a multi-node gnode. If every node has the same number of
     * children and all their children are similar, the i-th children of all
     * nodes form the i-th record; otherwise the gnode is a single record.
     */
    public List<DataRecord> findRecordsN(GNode gnode) {
        DocumentTree<N> tree = index.getTree();
        List<N> nodes = index.nodesOf(gnode);

        List<NodeId> nodeIds = new ArrayList<>(nodes.size());
        int childCount = -1;
        boolean sameChildCount = true;
        boolean childrenSimilar = true;

        for (N node : nodes) {
            NodeId nodeId = index.identify(node);
            nodeIds.add(nodeId);

            int count = tree.childrenOf(node).size();
            if (childCount >= 0 && count != childCount) {
                sameChildCount = false;
            }
            childCount = count;

            Optional<Map<GNodePair, Double>> scores = childScores(nodeId);
            if (scores.isEmpty() || !scores.get().values().stream().allMatch(d -> d <= thresholdN)) {
                childrenSimilar = false;
            }
        }

        if (!(sameChildCount && childrenSimilar)) {
            return List.of(DataRecord.of(gnode));
        }

        List<DataRecord> records = new ArrayList<>(childCount);
        for (int i = 0; i < childCount; i++) {
            List<GNode> parts = new ArrayList<>(nodeIds.size());
            for (NodeId nodeId : nodeIds) {
                parts.add(new GNode(nodeId, i, i + 1));
            }
            records.add(new DataRecord(parts));
        }
        return records;
    }

    private Optional<Map<GNodePair, Double>> childScores(NodeId nodeId) {
        return distances.find(nodeId)
                .filter(table -> table.hasSize(1))
                .map(table -> table.scoresOfSize(1));
    }
}
