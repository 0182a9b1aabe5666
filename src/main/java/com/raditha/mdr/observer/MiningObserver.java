package com.raditha.mdr.observer;

import com.raditha.mdr.distance.DistanceTable;
import com.raditha.mdr.model.DataRecord;
import com.raditha.mdr.model.DataRegion;
import com.raditha.mdr.model.GNode;
import com.raditha.mdr.model.NodeId;

import java.util.List;
import java.util.Set;

/**
 * Receives progress callbacks from a mining run. All methods default to no-ops
 * so implementations only override what they need.
 */
public interface MiningObserver {

    /**
     * Observer that ignores everything.
     */
    MiningObserver SILENT = new MiningObserver() {
    };

    default void phaseStarted(MiningPhase phase) {
    }

    default void phaseFinished(MiningPhase phase) {
    }

    /**
     * A node deep enough to be analyzed got its distance table.
     */
    default void distancesComputed(NodeId nodeId, int depth, DistanceTable table) {
    }

    /**
     * A node above the minimum depth was visited without analysis.
     */
    default void nodeSkipped(NodeId nodeId, int depth) {
    }

    /**
     * Final region set of a node, its own regions plus uncovered child regions.
     */
    default void regionsIdentified(NodeId nodeId, Set<DataRegion> regions) {
    }

    /**
     * Records produced from one generalized node of a data region.
     */
    default void recordsExtracted(GNode gnode, List<DataRecord> records) {
    }
}
