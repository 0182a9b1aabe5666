package com.raditha.mdr.distance;

import com.raditha.mdr.model.GNodePair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;

/**
 * Similarity scores between adjacent generalized nodes under one parent,
 * grouped by gnode size. Sizes with no comparable pair are not present.
 */
public class DistanceTable {

    private final TreeMap<Integer, Map<GNodePair, Double>> scoresBySize = new TreeMap<>();

    /**
     * Store the score of a pair, keyed by the pair's gnode size.
     */
    public void put(GNodePair pair, double score) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0 (got " + score + ")");
        }
        scoresBySize.computeIfAbsent(pair.gnodeSize(), k -> new LinkedHashMap<>()).put(pair, score);
    }

    /**
     * Get the score stored for a pair, if it was compared.
     */
    public OptionalDouble score(GNodePair pair) {
        Map<GNodePair, Double> scores = scoresBySize.get(pair.gnodeSize());
        if (scores == null) {
            return OptionalDouble.empty();
        }
        Double score = scores.get(pair);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    /**
     * Scores of all pairs of a given gnode size, in computation order.
     * Empty when the size is absent.
     */
    public Map<GNodePair, Double> scoresOfSize(int gnodeSize) {
        Map<GNodePair, Double> scores = scoresBySize.get(gnodeSize);
        return scores == null ? Map.of() : Collections.unmodifiableMap(scores);
    }

    public boolean hasSize(int gnodeSize) {
        return scoresBySize.containsKey(gnodeSize);
    }

    /**
     * Gnode sizes with at least one pair, ascending.
     */
    public Set<Integer> gnodeSizes() {
        return Collections.unmodifiableSet(scoresBySize.keySet());
    }

    public int pairCount(int gnodeSize) {
        return scoresOfSize(gnodeSize).size();
    }

    public int totalPairCount() {
        return scoresBySize.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return scoresBySize.isEmpty();
    }

    @Override
    public String toString() {
        return scoresBySize.toString();
    }
}
