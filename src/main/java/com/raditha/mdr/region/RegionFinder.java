package com.raditha.mdr.region;

import com.raditha.mdr.config.MiningConfig;
import com.raditha.mdr.distance.DistanceTable;
import com.raditha.mdr.distance.DistanceTables;
import com.raditha.mdr.model.DataRegion;
import com.raditha.mdr.model.GNode;
import com.raditha.mdr.model.GNodePair;
import com.raditha.mdr.model.NodeId;
import com.raditha.mdr.observer.MiningObserver;
import com.raditha.mdr.tree.DocumentTree;
import com.raditha.mdr.tree.NodeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Finds data regions: maximal runs of adjacent, similar generalized nodes.
 * <p>
 * Every node at or below the minimum depth gets its own regions, then the
 * regions of each child whose index is not already covered by one of them.
 * Traversal order matters: sizes ascend, phases ascend and each phase is
 * scanned left to right, because ties go to the earlier candidate.
 *
 * @param <N> Node type of the underlying parser
 */
public class RegionFinder<N> {

    private static final Logger logger = LoggerFactory.getLogger(RegionFinder.class);

    private final NodeIndex<N> index;
    private final DistanceTables distances;
    private final MiningObserver observer;
    private final int maxWindow;
    private final double threshold;
    private final int minimumDepth;

    public RegionFinder(
            NodeIndex<N> index,
            DistanceTables distances,
            MiningConfig config,
            MiningObserver observer) {
        this.index = index;
        this.distances = distances;
        this.observer = observer;
        this.maxWindow = config.maxWindow();
        this.threshold = config.regionThreshold();
        this.minimumDepth = config.minimumDepth();
    }

    /**
     * Find the regions of every node of the tree.
     *
     * @return Region set per analyzed node, in pre-order. Shallow nodes have no
     *         entry.
     */
    public Map<NodeId, Set<DataRegion>> findDataRegions() {
        DocumentTree<N> tree = index.getTree();
        Map<NodeId, Set<DataRegion>> regions = new LinkedHashMap<>();
        Deque<Frame<N>> stack = new ArrayDeque<>();
        stack.push(enter(tree, tree.root(), 0, regions));

        while (!stack.isEmpty()) {
            Frame<N> frame = stack.peek();
            if (frame.nextChild < frame.children.size()) {
                N child = frame.children.get(frame.nextChild++);
                stack.push(enter(tree, child, frame.depth + 1, regions));
                continue;
            }

            stack.pop();
            if (!frame.analyzed()) {
                continue;
            }

            Set<DataRegion> nodeRegions = new LinkedHashSet<>(frame.ownRegions);
            nodeRegions.addAll(frame.childRegions);
            Set<DataRegion> finalRegions = Collections.unmodifiableSet(nodeRegions);
            regions.put(frame.nodeId, finalRegions);
            observer.regionsIdentified(frame.nodeId, finalRegions);

            Frame<N> parent = stack.peek();
            if (parent != null && parent.analyzed()) {
                int childIndex = parent.nextChild - 1;
                parent.childRegions.addAll(uncoveredDataRegions(parent.ownRegions, childIndex, finalRegions));
            }
        }
        return regions;
    }

    private Frame<N> enter(DocumentTree<N> tree, N node, int depth, Map<NodeId, Set<DataRegion>> regions) {
        NodeId nodeId = index.identify(node);
        List<N> children = tree.childrenOf(node);
        Frame<N> frame = new Frame<>(nodeId, depth, children);

        if (frame.depth >= minimumDepth) {
            frame.ownRegions = identifyDataRegions(0, nodeId, children.size(), distances.find(nodeId));
            // Reserve the pre-order slot; the final set replaces it on exit
            regions.put(nodeId, frame.ownRegions);
            logger.debug("{}: own data regions {}", nodeId, frame.ownRegions);
        }
        return frame;
    }

    /**
     * Regions a child contributes to its parent: none if the child is inside
     * one of the parent's own regions, otherwise all of the child's regions.
     *
     * @param parentRegions Regions found among the parent's children
     * @param childIndex    Index of the child among its siblings
     * @param childRegions  Final regions of the child
     */
    public static Set<DataRegion> uncoveredDataRegions(
            Set<DataRegion> parentRegions,
            int childIndex,
            Set<DataRegion> childRegions) {
        for (DataRegion region : parentRegions) {
            if (region.contains(childIndex)) {
                return Set.of();
            }
        }
        return childRegions;
    }

    /**
     * Identify the maximal data regions among the children of {@code parent},
     * starting at {@code startIndex}.
     *
     * @param startIndex Child index where the search starts
     * @param parent     Node owning the children
     * @param nChildren  Number of children of {@code parent}
     * @param table      Distance table of {@code parent}, empty if it has none
     * @return Non-overlapping regions, left to right
     */
    public Set<DataRegion> identifyDataRegions(
            int startIndex,
            NodeId parent,
            int nChildren,
            Optional<DistanceTable> table) {
        if (table.isEmpty() || table.get().isEmpty()) {
            return Set.of();
        }

        Set<DataRegion> found = new LinkedHashSet<>();
        int start = startIndex;
        while (true) {
            DataRegion maxRegion = findMaxRegion(start, parent, nChildren, table.get());
            if (maxRegion == null) {
                break;
            }
            found.add(maxRegion);
            if (maxRegion.lastCoveredIndex() >= nChildren - 1) {
                break;
            }
            start = maxRegion.lastCoveredIndex() + 1;
        }
        return Collections.unmodifiableSet(found);
    }

    /**
     * Best region starting at or after {@code start}, or null if there is none.
     */
    private DataRegion findMaxRegion(int start, NodeId parent, int nChildren, DistanceTable table) {
        DataRegion maxRegion = null;

        for (int gnodeSize = 1; gnodeSize <= maxWindow; gnodeSize++) {
            for (int firstStart = start; firstStart < start + gnodeSize; firstStart++) {
                DataRegion current = scanPhase(firstStart, gnodeSize, parent, nChildren, table);
                if (current != null && isBetter(current, maxRegion)) {
                    logger.trace("{}: {} replaces {}", parent, current, maxRegion);
                    maxRegion = current;
                }
            }
        }
        return maxRegion;
    }

    /**
     * Scan one phase left to right. A region opens on the first similar pair and
     * ends at the first dissimilar pair after that.
     */
    private DataRegion scanPhase(int firstStart, int gnodeSize, NodeId parent, int nChildren, DistanceTable table) {
        DataRegion current = null;

        for (int lastStart = firstStart + gnodeSize; lastStart + gnodeSize <= nChildren; lastStart += gnodeSize) {
            GNodePair pair = GNodePair.endingAt(parent, lastStart, gnodeSize);
            OptionalDouble score = table.score(pair);

            if (score.isPresent() && score.getAsDouble() <= threshold) {
                if (current == null) {
                    current = DataRegion.binaryFromLastGNode(new GNode(parent, lastStart, lastStart + gnodeSize));
                } else {
                    current = current.extendOneGNode();
                }
            } else if (current != null) {
                break;
            }
        }
        return current;
    }

    /**
     * A candidate wins only if it covers strictly more nodes and does not start
     * after the current best. A later, larger candidate loses on purpose.
     */
    static boolean isBetter(DataRegion candidate, DataRegion best) {
        if (best == null) {
            return true;
        }
        return candidate.nNodesCovered() > best.nNodesCovered()
                && candidate.firstGNodeStartIndex() <= best.firstGNodeStartIndex();
    }

    private static final class Frame<N> {
        private final NodeId nodeId;
        private final int depth;
        private final List<N> children;
        private int nextChild;
        private Set<DataRegion> ownRegions;
        private final Set<DataRegion> childRegions = new LinkedHashSet<>();

        private Frame(NodeId nodeId, int depth, List<N> children) {
            this.nodeId = nodeId;
            this.depth = depth;
            this.children = children;
        }

        private boolean analyzed() {
            return ownRegions != null;
        }
    }
}
