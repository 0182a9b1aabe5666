package com.raditha.mdr.observer;

import com.raditha.mdr.distance.DistanceTable;
import com.raditha.mdr.model.DataRecord;
import com.raditha.mdr.model.DataRegion;
import com.raditha.mdr.model.GNode;
import com.raditha.mdr.model.GNodePair;
import com.raditha.mdr.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Logs the details of selected phases at INFO level. Phase boundaries are
 * always logged at DEBUG.
 */
public class LoggingMiningObserver implements MiningObserver {

    private static final Logger logger = LoggerFactory.getLogger(LoggingMiningObserver.class);

    private final Set<MiningPhase> verbosePhases;

    public LoggingMiningObserver(Set<MiningPhase> verbosePhases) {
        this.verbosePhases = verbosePhases.isEmpty()
                ? EnumSet.noneOf(MiningPhase.class)
                : EnumSet.copyOf(verbosePhases);
    }

    /**
     * Log phase boundaries only.
     */
    public static LoggingMiningObserver silent() {
        return new LoggingMiningObserver(EnumSet.noneOf(MiningPhase.class));
    }

    /**
     * Log the details of every phase.
     */
    public static LoggingMiningObserver verbose() {
        return new LoggingMiningObserver(EnumSet.allOf(MiningPhase.class));
    }

    public static LoggingMiningObserver only(MiningPhase phase) {
        return new LoggingMiningObserver(EnumSet.of(phase));
    }

    public boolean isVerbose(MiningPhase phase) {
        return verbosePhases.contains(phase);
    }

    @Override
    public void phaseStarted(MiningPhase phase) {
        logger.debug(">>>>> START PHASE {} ({}) <<<<<", phase, phase.ordinal());
    }

    @Override
    public void phaseFinished(MiningPhase phase) {
        logger.debug(">>>>> END PHASE {} ({}) <<<<<", phase, phase.ordinal());
    }

    @Override
    public void distancesComputed(NodeId nodeId, int depth, DistanceTable table) {
        if (!isVerbose(MiningPhase.COMPUTE_DISTANCES)) {
            return;
        }
        logger.info("{} (depth={}): {} gnode sizes", nodeId, depth, table.gnodeSizes().size());
        for (int size : table.gnodeSizes()) {
            for (Map.Entry<GNodePair, Double> entry : table.scoresOfSize(size).entrySet()) {
                logger.info("\t{} = {}", entry.getKey(), String.format("%.2f", entry.getValue()));
            }
        }
    }

    @Override
    public void nodeSkipped(NodeId nodeId, int depth) {
        if (isVerbose(MiningPhase.COMPUTE_DISTANCES)) {
            logger.info("{} (depth={}): skipped", nodeId, depth);
        }
    }

    @Override
    public void regionsIdentified(NodeId nodeId, Set<DataRegion> regions) {
        if (isVerbose(MiningPhase.FIND_DATA_REGIONS)) {
            logger.info("{}: data regions {}", nodeId, regions);
        }
    }

    @Override
    public void recordsExtracted(GNode gnode, List<DataRecord> records) {
        if (isVerbose(MiningPhase.IDENTIFY_DATA_RECORDS)) {
            logger.info("{}: {} record(s) {}", gnode.toLongString(), records.size(), records);
        }
    }
}
