package com.raditha.mdr.distance;

import com.raditha.mdr.config.MiningConfig;
import com.raditha.mdr.model.GNode;
import com.raditha.mdr.model.GNodePair;
import com.raditha.mdr.model.NodeId;
import com.raditha.mdr.observer.MiningObserver;
import com.raditha.mdr.similarity.StringSimilarity;
import com.raditha.mdr.tree.DocumentTree;
import com.raditha.mdr.tree.NodeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Computes the similarity of adjacent generalized nodes among the children of
 * every node deep enough to be analyzed.
 * <p>
 * For each gnode size {@code j} and each starting phase {@code i <= j}, windows
 * are compared in a chain: every right window becomes the left window of the
 * next comparison.
 *
 * @param <N> Node type of the underlying parser
 */
public class DistanceCalculator<N> {

    private static final Logger logger = LoggerFactory.getLogger(DistanceCalculator.class);

    private final DocumentTree<N> tree;
    private final NodeIndex<N> index;
    private final StringSimilarity similarity;
    private final MiningObserver observer;
    private final int maxWindow;
    private final int minimumDepth;

    public DistanceCalculator(
            NodeIndex<N> index,
            MiningConfig config,
            StringSimilarity similarity,
            MiningObserver observer) {
        this.tree = index.getTree();
        this.index = index;
        this.similarity = similarity;
        this.observer = observer;
        this.maxWindow = config.maxWindow();
        this.minimumDepth = config.minimumDepth();
    }

    /**
     * Visit the whole tree in pre-order and compute a table for every node at
     * or below the minimum depth.
     */
    public DistanceTables computeDistances() {
        DistanceTables tables = new DistanceTables();
        Deque<Visit<N>> stack = new ArrayDeque<>();
        stack.push(new Visit<>(tree.root(), 0));

        while (!stack.isEmpty()) {
            Visit<N> visit = stack.pop();
            NodeId nodeId = index.identify(visit.node());
            List<N> children = tree.childrenOf(visit.node());

            if (visit.depth() >= minimumDepth) {
                DistanceTable table = compareCombinations(nodeId, children);
                tables.recordTable(nodeId, table);
                observer.distancesComputed(nodeId, visit.depth(), table);
                logger.debug("{} (depth={}): {} pairs compared", nodeId, visit.depth(), table.totalPairCount());
            } else {
                tables.recordShallow(nodeId);
                observer.nodeSkipped(nodeId, visit.depth());
                logger.debug("{} (depth={}): skipped, less than minimum depth {}",
                        nodeId, visit.depth(), minimumDepth);
            }

            // Reverse push keeps the pre-order, so ids follow document order
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Visit<>(children.get(i), visit.depth() + 1));
            }
        }
        return tables;
    }

    /**
     * Compare every chained pair of equal-size adjacent windows over
     * {@code children}, for all sizes up to the maximum window.
     *
     * @param parent   Id of the node owning {@code children}
     * @param children Ordered children to compare
     * @return Scores grouped by gnode size; empty for an empty list
     */
    public DistanceTable compareCombinations(NodeId parent, List<N> children) {
        DistanceTable table = new DistanceTable();
        int nNodes = children.size();
        if (nNodes == 0) {
            return table;
        }

        for (int startingTag = 1; startingTag <= maxWindow; startingTag++) {
            for (int gnodeSize = startingTag; gnodeSize <= maxWindow; gnodeSize++) {
                // Skip unless a first pair of windows fits
                if (startingTag + 2 * gnodeSize - 1 > nNodes) {
                    continue;
                }

                int leftStart = startingTag - 1;
                for (int rightStart = startingTag + gnodeSize - 1; rightStart < nNodes; rightStart += gnodeSize) {
                    if (rightStart + gnodeSize > nNodes) {
                        continue;
                    }
                    GNode left = new GNode(parent, leftStart, rightStart);
                    GNode right = new GNode(parent, rightStart, rightStart + gnodeSize);

                    String leftText = tree.serialize(children.subList(left.start(), left.end()));
                    String rightText = tree.serialize(children.subList(right.start(), right.end()));

                    table.put(new GNodePair(left, right), similarity.ratio(leftText, rightText));
                    leftStart = rightStart;
                }
            }
        }
        return table;
    }

    /**
     * Depth of a node counting the root as 0.
     */
    static <N> int depth(DocumentTree<N> tree, N node) {
        Deque<Visit<N>> stack = new ArrayDeque<>();
        stack.push(new Visit<>(tree.root(), 0));
        while (!stack.isEmpty()) {
            Visit<N> visit = stack.pop();
            if (visit.node() == node) {
                return visit.depth();
            }
            for (N child : tree.childrenOf(visit.node())) {
                stack.push(new Visit<>(child, visit.depth() + 1));
            }
        }
        return -1;
    }

    private record Visit<N>(N node, int depth) {
    }
}
