package com.raditha.mdr.tree;

import com.raditha.mdr.model.GNode;
import com.raditha.mdr.model.NodeId;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns stable ids to document nodes without touching them.
 * <p>
 * Nodes are keyed by identity, so two structurally equal nodes always get
 * different ids. Each tag has its own counter; ids follow first-visit order.
 *
 * @param <N> Node type of the underlying parser
 */
public class NodeIndex<N> {

    private final DocumentTree<N> tree;
    private final Map<N, NodeId> ids = new IdentityHashMap<>();
    private final Map<NodeId, N> nodes = new HashMap<>();
    private final Map<String, Integer> tagCounts = new HashMap<>();

    public NodeIndex(DocumentTree<N> tree) {
        this.tree = tree;
    }

    /**
     * Get the id of a node, assigning the next one for its tag on first call.
     */
    public NodeId identify(N node) {
        NodeId existing = ids.get(node);
        if (existing != null) {
            return existing;
        }
        String tag = tree.tagOf(node);
        int sequence = tagCounts.merge(tag, 1, Integer::sum) - 1;
        NodeId id = new NodeId(tag, sequence);
        ids.put(node, id);
        nodes.put(id, node);
        return id;
    }

    /**
     * Get the node behind an id.
     *
     * @throws NodeLookupException if the id was never assigned by this index
     */
    public N resolve(NodeId id) {
        N node = nodes.get(id);
        if (node == null) {
            throw new NodeLookupException(id);
        }
        return node;
    }

    /**
     * Get the sibling nodes a generalized node spans.
     */
    public List<N> nodesOf(GNode gnode) {
        return tree.childrenOf(resolve(gnode.parent())).subList(gnode.start(), gnode.end());
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return ids.size();
    }

    public DocumentTree<N> getTree() {
        return tree;
    }
}
