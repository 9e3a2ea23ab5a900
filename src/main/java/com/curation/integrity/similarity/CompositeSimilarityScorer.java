package com.curation.integrity.similarity;

/**
 * Weighted blend of edit distance, Jaro-Winkler and token overlap for one pair of strings.
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final JaccardSimilarity jaccard = new JaccardSimilarity();
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        double score = weights.levenshteinWeight() * levenshtein.compute(s1, s2)
                + weights.jaroWinklerWeight() * jaroWinkler.compute(s1, s2)
                + weights.jaccardWeight() * jaccard.compute(s1, s2);
        return Math.max(0.0, Math.min(1.0, score));
    }

    @Override
    public String getName() {
        return "Composite";
    }

    public SimilarityWeights getWeights() {
        return weights;
    }
}
