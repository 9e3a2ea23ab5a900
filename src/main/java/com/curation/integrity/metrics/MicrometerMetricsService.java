package com.curation.integrity.metrics;

import com.curation.integrity.check.FailureKind;
import com.curation.integrity.rules.DefectCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code integrity.check.duration} - Timer (tag: check)</li>
 *   <li>{@code integrity.check.failures} - Counter (tag: kind)</li>
 *   <li>{@code integrity.quality.defects} - Counter (tag: code)</li>
 *   <li>{@code integrity.records.evaluated} - Counter</li>
 *   <li>{@code integrity.similarity.score} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter recordsEvaluated;
    private final DistributionSummary similarityScoreSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.recordsEvaluated = Counter.builder("integrity.records.evaluated")
                .description("Number of records run through the quality model")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("integrity.similarity.score")
                .description("Distribution of record similarity scores")
                .register(registry);
    }

    @Override
    public void recordCheckDuration(String checkName, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(checkName, k ->
                Timer.builder("integrity.check.duration")
                        .description("Duration of individual consistency checks")
                        .tag("check", checkName)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementCheckFailure(FailureKind kind) {
        Counter counter = counterCache.computeIfAbsent("failure:" + kind.name(), k ->
                Counter.builder("integrity.check.failures")
                        .description("Number of consistency check failures")
                        .tag("kind", kind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementDefect(DefectCode code) {
        Counter counter = counterCache.computeIfAbsent("defect:" + code.getWireValue(), k ->
                Counter.builder("integrity.quality.defects")
                        .description("Number of field defects annotated by the quality model")
                        .tag("code", code.getWireValue())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRecordsEvaluated(int count) {
        recordsEvaluated.increment(count);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }
}
