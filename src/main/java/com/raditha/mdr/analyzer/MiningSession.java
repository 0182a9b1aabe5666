package com.raditha.mdr.analyzer;

import com.raditha.mdr.config.MiningConfig;
import com.raditha.mdr.distance.DistanceCalculator;
import com.raditha.mdr.distance.DistanceTables;
import com.raditha.mdr.extraction.RecordExtractor;
import com.raditha.mdr.model.DataRecord;
import com.raditha.mdr.model.DataRegion;
import com.raditha.mdr.model.NodeId;
import com.raditha.mdr.observer.MiningObserver;
import com.raditha.mdr.observer.MiningPhase;
import com.raditha.mdr.region.RegionFinder;
import com.raditha.mdr.similarity.StringSimilarity;
import com.raditha.mdr.tree.DocumentTree;
import com.raditha.mdr.tree.NodeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single mining run over one tree. Can be run once; intermediate results
 * stay available afterwards for inspection.
 *
 * @param <N> Node type of the underlying parser
 */
public class MiningSession<N> {

    private static final Logger logger = LoggerFactory.getLogger(MiningSession.class);

    private final MiningConfig config;
    private final StringSimilarity similarity;
    private final MiningObserver observer;
    private final NodeIndex<N> index;

    private boolean used;
    private DistanceTables distances;
    private Map<NodeId, Set<DataRegion>> dataRegions;

    public MiningSession(
            DocumentTree<N> tree,
            MiningConfig config,
            StringSimilarity similarity,
            MiningObserver observer) {
        this.config = config;
        this.similarity = similarity;
        this.observer = observer;
        this.index = new NodeIndex<>(tree);
    }

    /**
     * Run the three phases: distances, data regions, data records.
     *
     * @throws MinerAlreadyUsedException if the session already ran
     */
    public MiningResult<N> run() {
        if (used) {
            throw new MinerAlreadyUsedException();
        }
        used = true;

        observer.phaseStarted(MiningPhase.COMPUTE_DISTANCES);
        distances = new DistanceCalculator<>(index, config, similarity, observer).computeDistances();
        observer.phaseFinished(MiningPhase.COMPUTE_DISTANCES);

        observer.phaseStarted(MiningPhase.FIND_DATA_REGIONS);
        dataRegions = new RegionFinder<>(index, distances, config, observer).findDataRegions();
        observer.phaseFinished(MiningPhase.FIND_DATA_REGIONS);

        List<DataRegion> allRegions = collectRegions(dataRegions);

        observer.phaseStarted(MiningPhase.IDENTIFY_DATA_RECORDS);
        List<DataRecord> records = new RecordExtractor<>(index, distances, config, observer)
                .findDataRecords(allRegions);
        observer.phaseFinished(MiningPhase.IDENTIFY_DATA_RECORDS);

        MiningResult<N> result = new MiningResult<>(records, allRegions, index, config);
        logger.info("Mined {} from {} nodes", result.getSummary(), index.size());
        return result;
    }

    /**
     * Union of the region sets of all nodes, in pre-order, without duplicates.
     */
    private static List<DataRegion> collectRegions(Map<NodeId, Set<DataRegion>> dataRegions) {
        Set<DataRegion> union = new LinkedHashSet<>();
        dataRegions.values().forEach(union::addAll);
        return new ArrayList<>(union);
    }

    public boolean isUsed() {
        return used;
    }

    /**
     * Distance tables of the run, null before {@link #run()}.
     */
    public DistanceTables getDistances() {
        return distances;
    }

    /**
     * Region sets per analyzed node, empty before {@link #run()}.
     */
    public Map<NodeId, Set<DataRegion>> getDataRegions() {
        return dataRegions == null ? Map.of() : Collections.unmodifiableMap(dataRegions);
    }

    public NodeIndex<N> getIndex() {
        return index;
    }
}
