package com.curation.integrity.similarity;

/**
 * Weights of the compared record fields. Fields absent from both records are
 * skipped and the remaining weights renormalized.
 */
public record FieldWeights(
        double titleWeight,
        double authorWeight,
        double yearWeight,
        double containerWeight
) {
    public FieldWeights {
        if (titleWeight < 0 || authorWeight < 0 || yearWeight < 0 || containerWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = titleWeight + authorWeight + yearWeight + containerWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static FieldWeights defaultWeights() {
        return new FieldWeights(0.45, 0.30, 0.10, 0.15);
    }
}
