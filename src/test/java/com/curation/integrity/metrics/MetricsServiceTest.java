package com.curation.integrity.metrics;

import com.curation.integrity.check.FailureKind;
import com.curation.integrity.rules.DefectCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            MetricsService noOp = NoOpMetricsService.INSTANCE;

            assertDoesNotThrow(() -> {
                noOp.recordCheckDuration("duplicate-id", Duration.ofMillis(5));
                noOp.incrementCheckFailure(FailureKind.ORIGIN);
                noOp.incrementDefect(DefectCode.YEAR_FORMAT);
                noOp.incrementRecordsEvaluated(3);
                noOp.recordSimilarityScore(0.85);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record check duration per check")
        void checkDuration() {
            metrics.recordCheckDuration("duplicate-id", Duration.ofMillis(150));
            metrics.recordCheckDuration("duplicate-id", Duration.ofMillis(250));
            metrics.recordCheckDuration("origin-integrity", Duration.ofMillis(10));

            Timer timer = registry.find("integrity.check.duration").tag("check", "duplicate-id").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
        }

        @Test
        @DisplayName("Should count failures by kind")
        void failures() {
            metrics.incrementCheckFailure(FailureKind.ORIGIN);
            metrics.incrementCheckFailure(FailureKind.ORIGIN);
            metrics.incrementCheckFailure(FailureKind.DUPLICATE_ID);

            Counter origin = registry.find("integrity.check.failures").tag("kind", "ORIGIN").counter();
            assertNotNull(origin);
            assertEquals(2.0, origin.count());
        }

        @Test
        @DisplayName("Should count defects by wire code")
        void defects() {
            metrics.incrementDefect(DefectCode.MOSTLY_ALL_CAPS);

            Counter counter = registry.find("integrity.quality.defects").tag("code", "mostly-all-caps").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should count evaluated records and summarize similarity scores")
        void recordsAndScores() {
            metrics.incrementRecordsEvaluated(4);
            metrics.recordSimilarityScore(0.5);
            metrics.recordSimilarityScore(1.0);

            assertEquals(4.0, registry.get("integrity.records.evaluated").counter().count());
            DistributionSummary summary = registry.get("integrity.similarity.score").summary();
            assertEquals(2, summary.count());
            assertEquals(0.75, summary.mean(), 1e-9);
        }
    }
}
