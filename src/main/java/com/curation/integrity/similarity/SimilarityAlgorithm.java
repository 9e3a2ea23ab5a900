package com.curation.integrity.similarity;

/**
 * A string similarity measure returning 0.0 (nothing in common) to 1.0 (identical).
 * Implementations must be symmetric.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
