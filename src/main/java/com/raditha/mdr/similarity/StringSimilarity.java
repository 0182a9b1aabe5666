package com.raditha.mdr.similarity;

/**
 * Normalized similarity between two serialized spans.
 * Implementations must be symmetric and return values in [0.0, 1.0],
 * with 1.0 for identical inputs.
 */
@FunctionalInterface
public interface StringSimilarity {

    /**
     * @param a First string
     * @param b Second string
     * @return Similarity ratio (0.0 to 1.0)
     */
    double ratio(String a, String b);
}
