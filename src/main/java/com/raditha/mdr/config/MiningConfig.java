package com.raditha.mdr.config;

/**
 * Configuration for data record mining.
 * A pair of adjacent windows counts as similar when its score is at or below
 * the relevant threshold.
 *
 * @param maxWindow        Largest generalized node width considered
 * @param regionThreshold  Maximum score for adjacent gnodes inside a data region
 * @param recordThreshold1 Threshold used when splitting single-node gnodes
 * @param recordThresholdN Threshold used when splitting multi-node gnodes
 * @param minimumDepth     Shallowest depth whose children are analyzed (root = 0)
 */
public record MiningConfig(
        int maxWindow,
        double regionThreshold,
        double recordThreshold1,
        double recordThresholdN,
        int minimumDepth) {

    public static final int DEFAULT_MAX_WINDOW = 10;
    public static final double DEFAULT_THRESHOLD = 0.3;
    public static final int DEFAULT_MINIMUM_DEPTH = 3;

    /**
     * Validate configuration.
     */
    public MiningConfig {
        if (maxWindow < 1) {
            throw new IllegalArgumentException("maxWindow must be >= 1");
        }
        checkThreshold("regionThreshold", regionThreshold);
        checkThreshold("recordThreshold1", recordThreshold1);
        checkThreshold("recordThresholdN", recordThresholdN);
        if (minimumDepth < 0) {
            throw new IllegalArgumentException("minimumDepth must be >= 0");
        }
    }

    private static void checkThreshold(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }

    /**
     * Default preset: windows up to 10 nodes, 0.3 for every threshold, depth 3.
     */
    public static MiningConfig defaults() {
        return allThresholds(DEFAULT_THRESHOLD);
    }

    /**
     * Default preset with the same value for all three thresholds.
     */
    public static MiningConfig allThresholds(double threshold) {
        return new MiningConfig(
                DEFAULT_MAX_WINDOW,
                threshold,
                threshold,
                threshold,
                DEFAULT_MINIMUM_DEPTH);
    }

    public MiningConfig withMaxWindow(int maxWindow) {
        return new MiningConfig(maxWindow, regionThreshold, recordThreshold1, recordThresholdN, minimumDepth);
    }

    public MiningConfig withMinimumDepth(int minimumDepth) {
        return new MiningConfig(maxWindow, regionThreshold, recordThreshold1, recordThresholdN, minimumDepth);
    }
}
