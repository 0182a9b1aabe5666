package com.raditha.mdr.tree;

import com.raditha.mdr.model.NodeId;

/**
 * Thrown when a {@link NodeId} cannot be resolved. This means an id from
 * another run (or a hand-built one) reached the index.
 */
public class NodeLookupException extends RuntimeException {

    private final transient NodeId nodeId;

    public NodeLookupException(NodeId nodeId) {
        super("Unknown node id: " + nodeId);
        this.nodeId = nodeId;
    }

    public NodeId getNodeId() {
        return nodeId;
    }
}
