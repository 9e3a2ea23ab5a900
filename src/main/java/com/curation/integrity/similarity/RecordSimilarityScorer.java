package com.curation.integrity.similarity;

import com.curation.integrity.core.model.Record;
import com.curation.integrity.metrics.MetricsService;
import com.curation.integrity.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Similarity of two records in [0, 1], as a weighted blend of title, author, year and
 * container similarity.
 *
 * <p>Identical compared fields score 1.0, disjoint ones score near 0.0, and the
 * function is symmetric. The decision threshold belongs to the caller.</p>
 */
public class RecordSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(RecordSimilarityScorer.class);

    public static final String TITLE = "title";
    public static final String AUTHOR = "author";
    public static final String YEAR = "year";
    public static final String CONTAINER = "container";

    private final FieldWeights weights;
    private final SimilarityAlgorithm titleMeasure;
    private final SimilarityAlgorithm nameMeasure;
    private final MetricsService metrics;

    public RecordSimilarityScorer() {
        this(FieldWeights.defaultWeights());
    }

    public RecordSimilarityScorer(FieldWeights weights) {
        this(weights, NoOpMetricsService.INSTANCE);
    }

    public RecordSimilarityScorer(FieldWeights weights, MetricsService metrics) {
        this.weights = Objects.requireNonNull(weights, "weights are required");
        this.titleMeasure = new CompositeSimilarityScorer(SimilarityWeights.tokenFocused());
        this.nameMeasure = new CompositeSimilarityScorer();
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public FieldWeights getWeights() {
        return weights;
    }

    public double similarity(Record a, Record b) {
        return breakdown(a, b).score();
    }

    /**
     * Per-field scores and the blended result. Fields absent from both records are
     * left out of the breakdown.
     */
    public SimilarityBreakdown breakdown(Record a, Record b) {
        Objects.requireNonNull(a, "record a is required");
        Objects.requireNonNull(b, "record b is required");

        Map<String, Double> fieldScores = new LinkedHashMap<>();
        double weighted = 0.0;
        double totalWeight = 0.0;

        Double title = compare(a, b, RecordNormalizer::title, titleMeasure);
        if (title != null) {
            fieldScores.put(TITLE, title);
            weighted += weights.titleWeight() * title;
            totalWeight += weights.titleWeight();
        }
        Double author = compare(a, b, RecordNormalizer::authors, nameMeasure);
        if (author != null) {
            fieldScores.put(AUTHOR, author);
            weighted += weights.authorWeight() * author;
            totalWeight += weights.authorWeight();
        }
        Double year = compare(a, b, RecordNormalizer::year, null);
        if (year != null) {
            fieldScores.put(YEAR, year);
            weighted += weights.yearWeight() * year;
            totalWeight += weights.yearWeight();
        }
        Double container = compare(a, b, RecordNormalizer::container, nameMeasure);
        if (container != null) {
            fieldScores.put(CONTAINER, container);
            weighted += weights.containerWeight() * container;
            totalWeight += weights.containerWeight();
        }

        double score;
        if (totalWeight == 0.0) {
            // Nothing salient to compare
            score = bibliographic(a).equals(bibliographic(b)) ? 1.0 : 0.0;
        } else {
            score = Math.max(0.0, Math.min(1.0, weighted / totalWeight));
        }
        metrics.recordSimilarityScore(score);
        log.debug("Similarity {} vs {}: {} -> {}", a.getId(), b.getId(), fieldScores, score);
        return new SimilarityBreakdown(fieldScores, score);
    }

    private static Map<String, String> bibliographic(Record record) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String field : record.bibliographicFields()) {
            values.put(field, record.getField(field));
        }
        return values;
    }

    /**
     * Returns null when neither record has the field, 0.0 when only one has it.
     * A null measure means exact comparison.
     */
    private static Double compare(Record a, Record b, Function<Record, String> extractor,
                                  SimilarityAlgorithm measure) {
        String left = extractor.apply(a);
        String right = extractor.apply(b);
        if (left == null && right == null) {
            return null;
        }
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        if (measure == null) {
            return 0.0;
        }
        // Canonical argument order keeps the score symmetric
        return left.compareTo(right) < 0 ? measure.compute(left, right) : measure.compute(right, left);
    }

    /**
     * Per-field similarity scores and the blended score.
     */
    public record SimilarityBreakdown(Map<String, Double> fieldScores, double score) {
        public SimilarityBreakdown {
            fieldScores = Map.copyOf(fieldScores);
        }

        @Override
        public String toString() {
            return String.format("SimilarityBreakdown{fields=%s, score=%.4f}", fieldScores, score);
        }
    }
}
