package com.raditha.mdr.distance;

import com.raditha.mdr.model.NodeId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Distance tables of every visited node, in visit order.
 * <p>
 * A node shallower than the minimum depth is visited but has no table. That
 * is different from an analyzed node with an empty table (fewer than two
 * children).
 */
public class DistanceTables {

    private final Map<NodeId, DistanceTable> tables = new LinkedHashMap<>();
    private final Set<NodeId> visited = new LinkedHashSet<>();

    void recordTable(NodeId nodeId, DistanceTable table) {
        visited.add(nodeId);
        tables.put(nodeId, table);
    }

    void recordShallow(NodeId nodeId) {
        visited.add(nodeId);
    }

    /**
     * Get the table of a node. Empty for shallow or unknown nodes.
     */
    public Optional<DistanceTable> find(NodeId nodeId) {
        return Optional.ofNullable(tables.get(nodeId));
    }

    /**
     * Check whether a node was analyzed (it has a table, possibly empty).
     */
    public boolean isAnalyzed(NodeId nodeId) {
        return tables.containsKey(nodeId);
    }

    public boolean isVisited(NodeId nodeId) {
        return visited.contains(nodeId);
    }

    /**
     * All visited nodes, in pre-order.
     */
    public Set<NodeId> visitedNodes() {
        return Collections.unmodifiableSet(visited);
    }

    public int size() {
        return visited.size();
    }
}
