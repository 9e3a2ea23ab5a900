package com.curation.integrity.metrics;

import com.curation.integrity.check.FailureKind;
import com.curation.integrity.rules.DefectCode;

import java.time.Duration;

/**
 * Interface for recording integrity metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordCheckDuration(String checkName, Duration duration);

    void incrementCheckFailure(FailureKind kind);

    void incrementDefect(DefectCode code);

    void incrementRecordsEvaluated(int count);

    void recordSimilarityScore(double score);
}
