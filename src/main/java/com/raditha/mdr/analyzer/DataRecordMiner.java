package com.raditha.mdr.analyzer;

import com.raditha.mdr.config.MiningConfig;
import com.raditha.mdr.observer.MiningObserver;
import com.raditha.mdr.similarity.LevenshteinRatio;
import com.raditha.mdr.similarity.StringSimilarity;
import com.raditha.mdr.tree.DocumentTree;

/**
 * Main entry point for data record mining.
 * Each call to {@link #mine(DocumentTree)} is an independent run, so a miner
 * can be shared across documents.
 */
public class DataRecordMiner {

    private final MiningConfig config;
    private final StringSimilarity similarity;
    private final MiningObserver observer;

    /**
     * Create miner with default configuration.
     */
    public DataRecordMiner() {
        this(MiningConfig.defaults());
    }

    /**
     * Create miner with custom configuration and the Levenshtein ratio.
     */
    public DataRecordMiner(MiningConfig config) {
        this(config, new LevenshteinRatio(), MiningObserver.SILENT);
    }

    public DataRecordMiner(MiningConfig config, StringSimilarity similarity, MiningObserver observer) {
        if (config == null || similarity == null || observer == null) {
            throw new IllegalArgumentException("config, similarity and observer cannot be null");
        }
        this.config = config;
        this.similarity = similarity;
        this.observer = observer;
    }

    /**
     * Mine the data records of a document.
     *
     * @param tree Parsed document
     * @return Records with the regions they came from; empty if the document has
     *         no repeating structure
     */
    public <N> MiningResult<N> mine(DocumentTree<N> tree) {
        return newSession(tree).run();
    }

    /**
     * Start a session to run and then inspect intermediate results.
     */
    public <N> MiningSession<N> newSession(DocumentTree<N> tree) {
        return new MiningSession<>(tree, config, similarity, observer);
    }

    public MiningConfig getConfig() {
        return config;
    }
}
