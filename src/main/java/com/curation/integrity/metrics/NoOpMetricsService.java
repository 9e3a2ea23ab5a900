package com.curation.integrity.metrics;

import com.curation.integrity.check.FailureKind;
import com.curation.integrity.rules.DefectCode;

import java.time.Duration;

/**
 * Metrics service that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordCheckDuration(String checkName, Duration duration) {
    }

    @Override
    public void incrementCheckFailure(FailureKind kind) {
    }

    @Override
    public void incrementDefect(DefectCode code) {
    }

    @Override
    public void incrementRecordsEvaluated(int count) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }
}
