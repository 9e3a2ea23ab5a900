package com.curation.integrity.similarity;

/**
 * Weights of the string measures inside {@link CompositeSimilarityScorer}.
 */
public record SimilarityWeights(
        double levenshteinWeight,
        double jaroWinklerWeight,
        double jaccardWeight
) {
    public SimilarityWeights {
        if (levenshteinWeight < 0 || jaroWinklerWeight < 0 || jaccardWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = levenshteinWeight + jaroWinklerWeight + jaccardWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.4, 0.3, 0.3);
    }

    /**
     * Token overlap first; suited to long titles where word order varies.
     */
    public static SimilarityWeights tokenFocused() {
        return new SimilarityWeights(0.2, 0.2, 0.6);
    }
}
